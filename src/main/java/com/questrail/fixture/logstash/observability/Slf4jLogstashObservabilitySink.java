package com.questrail.fixture.logstash.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Implementation of LogstashObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLogstashObservabilitySink implements LogstashObservabilitySink {
    private final Logger log;

    public Slf4jLogstashObservabilitySink() {
        this(LoggerFactory.getLogger(Slf4jLogstashObservabilitySink.class));
    }

    public Slf4jLogstashObservabilitySink(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void onConnectionAccepted(LogstashConnectionEvent event) {
        log.debug("Connection {} accepted from {}", event.connectionId(), event.remoteAddress());
    }

    @Override
    public void onConnectionClosed(LogstashConnectionEvent event) {
        log.debug("Connection {} closed: {}", event.connectionId(), event.reason());
    }

    @Override
    public void onDecodeFailure(LogstashDecodeFailureEvent event) {
        log.warn("Failed decoding json, closing connection {}. Data received: {}",
            event.connectionId(), event.frameText(), event.cause());
    }

    @Override
    public void onError(LogstashErrorEvent event) {
        if (event.connectionId() == null) {
            log.error("Fake Logstash error: {}", event.message(), event.cause());
        } else {
            log.error("Fake Logstash error on connection {}: {}",
                event.connectionId(), event.message(), event.cause());
        }
    }
}
