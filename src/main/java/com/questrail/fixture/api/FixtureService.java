package com.questrail.fixture.api;

import java.util.List;
import java.util.Objects;

/**
 * FixtureService
 * -----------------------------------------------------------------------------
 * {@code FixtureService} is the lifecycle contract shared by every test fixture,
 * whether it is backed by containers managed by an external runtime or by a
 * socket served from inside the test JVM.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   construct  → resources reserved (ports bound, containers created)
 *   start()    → fixture becomes usable
 *   stop()     → fixture released; terminal for socket-backed fixtures
 * </pre>
 *
 * <h2>Networks</h2>
 * Fixtures may be attached to isolated networks (for example a container
 * network) via {@link #connect(NetworkHandle)}. The returned aliases are the host
 * names other members of that network use to reach the fixture. Fixtures that
 * are not part of the network fabric still answer with an alias that resolves
 * from inside the network.
 *
 * <h2>Resource handling</h2>
 * Every fixture is {@link AutoCloseable}; closing it is equivalent to
 * {@link #stop()}, so fixtures compose with try-with-resources:
 *
 * <pre>
 *   try (FakeLogstashService logstash = FixtureService.started(new FakeLogstashService())) {
 *       ...
 *   }
 * </pre>
 *
 * This interface makes no guarantees about thread safety beyond what each
 * implementation documents.
 */
public interface FixtureService extends AutoCloseable
{
    /**
     * Makes the fixture usable.
     *
     * @throws IllegalStateException if the fixture cannot be started from its
     *                               current lifecycle state
     */
    void start();

    /**
     * Releases the fixture. Stopping a fixture that is not running is a no-op.
     */
    void stop();

    /**
     * Reports whether the fixture is currently running.
     */
    boolean isAlive();

    /**
     * Attaches the fixture to a network.
     *
     * @param network network to attach to (must not be {@code null})
     * @return host aliases under which the fixture is reachable from that network
     */
    List<String> connect(NetworkHandle network);

    /**
     * Detaches the fixture from a network.
     *
     * @param network network to detach from (must not be {@code null})
     */
    void disconnect(NetworkHandle network);

    /**
     * Equivalent to {@link #stop()}.
     */
    @Override
    default void close()
    {
        stop();
    }

    /**
     * Starts {@code service} and returns it.
     *
     * @param service fixture to start
     * @param <S>     concrete fixture type
     * @return the started fixture
     */
    static <S extends FixtureService> S started(S service)
    {
        Objects.requireNonNull(service, "service");
        service.start();
        return service;
    }
}
