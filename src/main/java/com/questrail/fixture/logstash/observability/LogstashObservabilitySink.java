package com.questrail.fixture.logstash.observability;

/**
 * Receives observability events from a fake Logstash service.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks are delivered on the service's event loop thread. They must not
 * block and must not throw.</p>
 */
public interface LogstashObservabilitySink {
    /**
     * Called when a connection was accepted and registered.
     * @param event the connection details
     */
    void onConnectionAccepted(LogstashConnectionEvent event);

    /**
     * Called when a connection was closed, for whatever reason.
     * @param event the connection details
     */
    void onConnectionClosed(LogstashConnectionEvent event);

    /**
     * Called when a frame could not be decoded. The connection is closed right after.
     * @param event the failure details
     */
    void onDecodeFailure(LogstashDecodeFailureEvent event);

    /**
     * Called when an unexpected error occurs while serving a connection or running the loop.
     * @param event the error event
     */
    void onError(LogstashErrorEvent event);
}
