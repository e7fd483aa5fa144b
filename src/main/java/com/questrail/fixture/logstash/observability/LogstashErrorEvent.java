package com.questrail.fixture.logstash.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the fake Logstash service.
 *
 * @param connectionId connection being served; {@code null} for loop-level errors
 */
public record LogstashErrorEvent(
    Instant timestamp,
    String connectionId,
    String message,
    Throwable cause
) {
}
