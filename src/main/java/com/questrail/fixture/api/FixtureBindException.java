package com.questrail.fixture.api;

/**
 * Indicates that a fixture could not bind the port it was asked to listen on.
 *
 * <p>Raised at construction time. The fixture holds no resources afterwards.</p>
 */
public final class FixtureBindException extends FixtureException
{
    private final int port;

    public FixtureBindException(int port, Throwable cause) {
        super("Failed binding port " + port, cause);
        this.port = port;
    }

    /**
     * @return the port that was requested
     */
    public int port() {
        return port;
    }
}
