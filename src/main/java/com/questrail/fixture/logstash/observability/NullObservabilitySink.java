package com.questrail.fixture.logstash.observability;

/**
 * No-op implementation of LogstashObservabilitySink.
 */
public final class NullObservabilitySink implements LogstashObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionAccepted(LogstashConnectionEvent event) {}

    @Override
    public void onConnectionClosed(LogstashConnectionEvent event) {}

    @Override
    public void onDecodeFailure(LogstashDecodeFailureEvent event) {}

    @Override
    public void onError(LogstashErrorEvent event) {}
}
