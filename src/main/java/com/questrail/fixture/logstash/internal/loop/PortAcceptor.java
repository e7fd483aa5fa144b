package com.questrail.fixture.logstash.internal.loop;

import com.questrail.fixture.api.FixtureBindException;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

/**
 * PortAcceptor
 * -----------------------------------------------------------------------------
 * Listening socket of the service, bound to the wildcard address.
 *
 * <p>The port is bound in the constructor, so the resolved port is known before
 * the event loop starts. NIO binds and listens in one step: peers connecting
 * before the loop runs wait in the backlog and are accepted once it does.</p>
 */
public final class PortAcceptor implements Closeable
{
    private final ServerSocketChannel channel;
    private final int port;

    /**
     * @param requestedPort port to bind; {@code 0} for an OS-assigned port
     * @throws FixtureBindException if the port cannot be bound
     */
    public PortAcceptor(int requestedPort)
    {
        ServerSocketChannel ch = null;
        try {
            ch = ServerSocketChannel.open();
            ch.bind(new InetSocketAddress(requestedPort));
            ch.configureBlocking(false);
            this.port = ((InetSocketAddress) ch.getLocalAddress()).getPort();
        } catch (IOException e) {
            FixtureBindException failure = new FixtureBindException(requestedPort, e);
            if (ch != null) {
                try {
                    ch.close();
                } catch (IOException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
            throw failure;
        }
        this.channel = ch;
    }

    public int port()
    {
        return port;
    }

    SelectionKey register(Selector selector) throws ClosedChannelException
    {
        return channel.register(selector, SelectionKey.OP_ACCEPT);
    }

    /**
     * Accepts a pending connection without blocking.
     *
     * @return the new connection, configured non-blocking; {@code null} if none is pending
     */
    SocketChannel accept() throws IOException
    {
        SocketChannel accepted = channel.accept();
        if (accepted != null) {
            accepted.configureBlocking(false);
        }
        return accepted;
    }

    public boolean isOpen()
    {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException
    {
        channel.close();
    }
}
