package com.questrail.fixture.api;

import java.time.Duration;

/**
 * Indicates that a fixture's background worker did not terminate within its
 * stop timeout.
 *
 * <p>This is never retried: a worker that ignores the shutdown signal is
 * stuck.</p>
 */
public final class ShutdownTimeoutException extends FixtureException
{
    public ShutdownTimeoutException(String fixtureName, Duration timeout) {
        super("Failed stopping " + fixtureName + " within " + timeout.toMillis() + " ms");
    }
}
