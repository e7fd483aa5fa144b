package com.questrail.fixture.logstash.transport;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * RecordSender
 * -----------------------------------------------------------------------------
 * Minimal port for shipping records to a {@code json_lines} endpoint, such as a
 * {@code FakeLogstashService} or a real Logstash {@code tcp} input.
 *
 * <p>Each record is written as one frame: its JSON encoding followed by the
 * delimiter. Records sent through one sender arrive in send order.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface RecordSender extends Closeable
{
    /**
     * Opens the connection. Blocks until it is established.
     *
     * @throws IOException if the endpoint cannot be reached
     */
    void connect() throws IOException;

    /**
     * Sends one record as a single frame.
     *
     * @param record JSON-serializable record
     */
    void send(Map<String, ?> record);

    /**
     * Writes bytes exactly as given, without encoding or delimiter.
     *
     * <p>Intended for tests that need control over frame boundaries or want to
     * send malformed data.</p>
     */
    void sendRaw(byte[] bytes);

    /**
     * Flushes pending writes and closes the connection.
     */
    @Override
    void close() throws IOException;
}
