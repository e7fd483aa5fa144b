package com.questrail.fixture.logstash.internal.loop;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.Pipe;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;

/**
 * ShutdownSignal
 * -----------------------------------------------------------------------------
 * Channel through which a controlling thread interrupts the event loop's
 * readiness wait.
 *
 * <p>The read end of a {@link Pipe} is registered with the loop's selector like
 * any connection. {@link #signal()} writes a single sentinel byte into the write
 * end, which makes the read end ready and wakes the blocked {@code select}. The
 * loop then calls {@link #consume()} and exits.</p>
 *
 * <p>{@link #signal()} may be called from any thread; {@link #consume()} only from
 * the loop thread.</p>
 */
public final class ShutdownSignal implements Closeable
{
    static final byte SENTINEL = 0;

    private final Pipe pipe;

    public ShutdownSignal() throws IOException
    {
        this.pipe = Pipe.open();
        pipe.source().configureBlocking(false);
    }

    SelectionKey register(Selector selector) throws ClosedChannelException
    {
        return pipe.source().register(selector, SelectionKey.OP_READ);
    }

    /**
     * Sends the sentinel byte.
     */
    public synchronized void signal() throws IOException
    {
        ByteBuffer sentinel = ByteBuffer.wrap(new byte[] {SENTINEL});
        while (sentinel.hasRemaining()) {
            pipe.sink().write(sentinel);
        }
    }

    /**
     * Reads the sentinel byte.
     *
     * @throws IOException if the byte read is not the sentinel
     */
    void consume() throws IOException
    {
        ByteBuffer received = ByteBuffer.allocate(1);
        int read = pipe.source().read(received);
        if (read != 1 || received.get(0) != SENTINEL) {
            throw new IOException("Unexpected shutdown signal content (read " + read + " bytes)");
        }
    }

    /**
     * Closes the read end. Called by the loop on exit.
     */
    void closeSource() throws IOException
    {
        pipe.source().close();
    }

    @Override
    public void close() throws IOException
    {
        try {
            pipe.sink().close();
        } finally {
            pipe.source().close();
        }
    }
}
