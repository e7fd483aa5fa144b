package com.questrail.fixture.logstash.observability;

import com.questrail.fixture.logstash.codec.ConnectionDecodeException;

import java.nio.charset.Charset;
import java.time.Instant;

/**
 * Record describing a frame that could not be decoded.
 *
 * @param charset charset the service decodes frames with
 */
public record LogstashDecodeFailureEvent(
    Instant timestamp,
    String connectionId,
    Charset charset,
    ConnectionDecodeException cause
) {
    /**
     * @return the offending frame in the service's charset, malformed input replaced
     */
    public String frameText() {
        return new String(cause.frame(), charset);
    }
}
