package com.questrail.fixture.api;

/**
 * Base type for failures raised by fixtures themselves (as opposed to
 * assertion failures raised on behalf of the test).
 */
public class FixtureException extends RuntimeException
{
    public FixtureException(String message) {
        super(message);
    }

    public FixtureException(String message, Throwable cause) {
        super(message, cause);
    }
}
