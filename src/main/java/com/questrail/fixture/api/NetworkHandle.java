package com.questrail.fixture.api;

/**
 * NetworkHandle
 * -----------------------------------------------------------------------------
 * Opaque reference to an isolated network (for example a container network)
 * that fixtures may be attached to.
 *
 * <p>The handle carries no behavior. Container-backed fixtures resolve it
 * against their runtime; socket-backed fixtures ignore it.</p>
 */
public interface NetworkHandle
{
    /**
     * @return name of the network, as known to the runtime that owns it
     */
    String name();

    /**
     * Creates a handle for a network known by name only.
     */
    static NetworkHandle named(String name)
    {
        return new NamedNetwork(name);
    }
}
