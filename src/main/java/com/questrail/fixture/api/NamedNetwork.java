package com.questrail.fixture.api;

import java.util.Objects;

/**
 * {@link NetworkHandle} identified by name only.
 */
record NamedNetwork(String name) implements NetworkHandle
{
    NamedNetwork {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("network name must not be blank");
        }
    }
}
