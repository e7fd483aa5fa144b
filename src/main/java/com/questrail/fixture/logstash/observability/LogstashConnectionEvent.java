package com.questrail.fixture.logstash.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record describing a connection lifecycle step.
 *
 * @param remoteAddress peer address; {@code null} if it could not be determined
 * @param reason        why the connection was closed; {@code null} for accepts
 */
public record LogstashConnectionEvent(
    Instant timestamp,
    String connectionId,
    SocketAddress remoteAddress,
    CloseReason reason
) {
    public enum CloseReason {
        PEER_CLOSED,
        DECODE_FAILURE,
        ERROR,
        SERVICE_STOPPED
    }
}
