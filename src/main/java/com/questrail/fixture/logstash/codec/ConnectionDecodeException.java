package com.questrail.fixture.logstash.codec;

/**
 * Indicates that a frame received on a connection could not be turned into a
 * record.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not valid in the configured charset</li>
 *   <li>Text that is not valid JSON (including an empty frame)</li>
 *   <li>A JSON value that is not an object</li>
 * </ul>
 *
 * The failure is scoped to the connection that sent the frame.
 */
public final class ConnectionDecodeException extends RuntimeException
{
    private final byte[] frame;

    public ConnectionDecodeException(String message, byte[] frame) {
        super(message);
        this.frame = frame.clone();
    }

    public ConnectionDecodeException(String message, byte[] frame, Throwable cause) {
        super(message, cause);
        this.frame = frame.clone();
    }

    /**
     * @return the raw bytes of the offending frame, without delimiter
     */
    public byte[] frame() {
        return frame.clone();
    }
}
