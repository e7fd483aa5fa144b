package com.questrail.fixture.logstash.internal.loop;

import com.questrail.fixture.logstash.codec.ConnectionDecodeException;
import com.questrail.fixture.logstash.codec.DelimitedFrameDecoder;
import com.questrail.fixture.logstash.codec.JsonRecordDecoder;
import com.questrail.fixture.logstash.config.LogstashServiceConfig;
import com.questrail.fixture.logstash.observability.LogstashConnectionEvent;
import com.questrail.fixture.logstash.observability.LogstashConnectionEvent.CloseReason;
import com.questrail.fixture.logstash.observability.LogstashDecodeFailureEvent;
import com.questrail.fixture.logstash.observability.LogstashErrorEvent;
import com.questrail.fixture.logstash.observability.LogstashObservabilitySink;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.channels.Channel;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogstashEventLoop
 * =============================================================================
 * Single-threaded reactor serving every connection of a fake Logstash service.
 *
 * <h2>Threading Model</h2>
 * One dedicated thread performs all socket I/O, frame decoding and record
 * delivery. Each iteration blocks in {@link Selector#select(long)} over:
 * <ul>
 *   <li>the listening socket ({@link PortAcceptor})</li>
 *   <li>the read end of the {@link ShutdownSignal}</li>
 *   <li>every open {@link JsonLinesConnection}</li>
 * </ul>
 * The wait is bounded by the configured wake interval so the thread never
 * blocks indefinitely, even without traffic.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>listening socket ready → accept every pending connection and register
 *       it with a fresh decoder</li>
 *   <li>connection ready → read one chunk and deliver the records it completes</li>
 *   <li>shutdown signal ready → finish the other ready keys of this round,
 *       consume the sentinel and exit</li>
 * </ul>
 *
 * <h2>Connection isolation</h2>
 * A decode failure or unexpected fault while serving a connection closes and
 * deregisters that connection only. The loop keeps serving the others. Only a
 * failure of the selector itself ends the loop.
 *
 * <h2>Exit</h2>
 * However the loop exits, every channel registered with the selector is closed,
 * followed by the selector.
 *
 * <h2>Ownership</h2>
 * The loop does not reference the service that owns it. It delivers records
 * into the {@link Consumer} handed to it and reports through the
 * {@link LogstashObservabilitySink}; the owner terminates it explicitly through
 * the {@link ShutdownSignal}.
 */
public final class LogstashEventLoop
{
    private final PortAcceptor acceptor;
    private final ShutdownSignal shutdownSignal;
    private final Consumer<Map<String, Object>> recordSink;
    private final LogstashObservabilitySink observabilitySink;

    private final byte[] delimiter;
    private final Charset charset;
    private final JsonRecordDecoder recordDecoder;
    private final ByteBuffer readBuffer;
    private final long wakeIntervalMillis;

    private final Selector selector;
    private final Thread thread;

    private SelectionKey acceptKey;
    private SelectionKey shutdownKey;
    private long connectionCounter;

    public LogstashEventLoop(PortAcceptor acceptor,
                             ShutdownSignal shutdownSignal,
                             LogstashServiceConfig config,
                             Consumer<Map<String, Object>> recordSink,
                             LogstashObservabilitySink observabilitySink) throws IOException
    {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.recordSink = Objects.requireNonNull(recordSink, "recordSink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(config, "config");

        this.delimiter = config.delimiter();
        this.charset = config.charset();
        this.recordDecoder = new JsonRecordDecoder(charset);
        this.readBuffer = ByteBuffer.allocate(config.readChunkSize());
        this.wakeIntervalMillis = Math.max(1, config.wakeInterval().toMillis());

        this.selector = Selector.open();
        this.thread = new Thread(this::run, "fake-logstash-" + acceptor.port());
        this.thread.setDaemon(true);
    }

    /**
     * Registers the listening socket and the shutdown signal, then starts the
     * loop thread. Must be called at most once.
     */
    public void start() throws IOException
    {
        acceptKey = acceptor.register(selector);
        shutdownKey = shutdownSignal.register(selector);
        thread.start();
    }

    /**
     * @return whether the loop thread is executing
     */
    public boolean isAlive()
    {
        return thread.isAlive();
    }

    /**
     * Waits up to {@code timeout} for the loop thread to exit.
     *
     * @return {@code true} if the thread exited
     */
    public boolean join(Duration timeout) throws InterruptedException
    {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    /**
     * Releases the selector of a loop that was never started.
     */
    public void discard() throws IOException
    {
        if (thread.getState() != Thread.State.NEW) {
            throw new IllegalStateException("Loop was started; stop it through its shutdown signal");
        }
        selector.close();
    }

    // -------------------------------------------------------------------------
    // Loop thread
    // -------------------------------------------------------------------------

    private void run()
    {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            observabilitySink.onError(new LogstashErrorEvent(
                Instant.now(), null, "Event loop terminated unexpectedly", e));
        } finally {
            closeAll();
        }
    }

    private void doRun() throws IOException
    {
        while (true) {
            selector.select(wakeIntervalMillis);

            boolean shutdownRequested = false;
            Iterator<SelectionKey> it = selector.selectedKeys().iterator();
            while (it.hasNext()) {
                SelectionKey key = it.next();
                it.remove();

                if (!key.isValid()) {
                    continue;
                }
                if (key == shutdownKey) {
                    shutdownRequested = true;
                } else if (key == acceptKey) {
                    acceptPending();
                } else {
                    serve(key);
                }
            }

            if (shutdownRequested) {
                shutdownSignal.consume();
                return;
            }
        }
    }

    private void acceptPending()
    {
        while (true) {
            SocketChannel socketChannel;
            try {
                socketChannel = acceptor.accept();
            } catch (IOException e) {
                observabilitySink.onError(new LogstashErrorEvent(
                    Instant.now(), null, "Failed accepting connection", e));
                return;
            }
            if (socketChannel == null) {
                return;
            }
            register(socketChannel);
        }
    }

    private void register(SocketChannel socketChannel)
    {
        String id = Long.toString(++connectionCounter);
        SocketAddress remoteAddress = null;
        try {
            remoteAddress = socketChannel.getRemoteAddress();
            JsonLinesConnection connection = new JsonLinesConnection(
                id, socketChannel, remoteAddress, new DelimitedFrameDecoder(delimiter), recordDecoder);
            socketChannel.register(selector, SelectionKey.OP_READ, connection);
        } catch (IOException e) {
            observabilitySink.onError(new LogstashErrorEvent(
                Instant.now(), id, "Failed registering connection", e));
            closeChannel(socketChannel, id);
            return;
        }
        observabilitySink.onConnectionAccepted(new LogstashConnectionEvent(
            Instant.now(), id, remoteAddress, null));
    }

    private void serve(SelectionKey key)
    {
        JsonLinesConnection connection = (JsonLinesConnection) key.attachment();
        try {
            if (connection.readChunk(readBuffer, recordSink) == JsonLinesConnection.ReadResult.END_OF_STREAM) {
                close(key, connection, CloseReason.PEER_CLOSED);
            }
        } catch (ConnectionDecodeException e) {
            observabilitySink.onDecodeFailure(new LogstashDecodeFailureEvent(
                Instant.now(), connection.id(), charset, e));
            close(key, connection, CloseReason.DECODE_FAILURE);
        } catch (IOException | RuntimeException e) {
            observabilitySink.onError(new LogstashErrorEvent(
                Instant.now(), connection.id(), "Unknown error occurred, closing connection", e));
            close(key, connection, CloseReason.ERROR);
        }
    }

    private void close(SelectionKey key, JsonLinesConnection connection, CloseReason reason)
    {
        key.cancel();
        closeChannel(connection.channel(), connection.id());
        observabilitySink.onConnectionClosed(new LogstashConnectionEvent(
            Instant.now(), connection.id(), connection.remoteAddress(), reason));
    }

    private void closeAll()
    {
        List<SelectionKey> keys;
        try {
            keys = new ArrayList<>(selector.keys());
        } catch (ClosedSelectorException e) {
            keys = List.of();
        }

        for (SelectionKey key : keys) {
            if (key.attachment() instanceof JsonLinesConnection connection) {
                close(key, connection, CloseReason.SERVICE_STOPPED);
            }
        }

        closeResource(acceptor::close);
        closeResource(shutdownSignal::closeSource);
        closeResource(selector::close);
    }

    private void closeChannel(Channel channel, String connectionId)
    {
        try {
            channel.close();
        } catch (IOException e) {
            observabilitySink.onError(new LogstashErrorEvent(
                Instant.now(), connectionId, "Failed closing connection", e));
        }
    }

    private void closeResource(IoAction action)
    {
        try {
            action.run();
        } catch (IOException e) {
            observabilitySink.onError(new LogstashErrorEvent(
                Instant.now(), null, "Failed releasing event loop resource", e));
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
