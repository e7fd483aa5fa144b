package com.questrail.fixture.logstash;

import com.questrail.fixture.api.FixtureException;
import com.questrail.fixture.api.FixtureService;
import com.questrail.fixture.api.NetworkHandle;
import com.questrail.fixture.api.ServiceState;
import com.questrail.fixture.api.ShutdownTimeoutException;
import com.questrail.fixture.logstash.config.LogstashServiceConfig;
import com.questrail.fixture.logstash.internal.loop.LogstashEventLoop;
import com.questrail.fixture.logstash.internal.loop.PortAcceptor;
import com.questrail.fixture.logstash.internal.loop.ShutdownSignal;
import com.questrail.fixture.logstash.observability.LogstashObservabilitySink;
import com.questrail.fixture.logstash.observability.Slf4jLogstashObservabilitySink;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FakeLogstashService
 * =============================================================================
 * A fake logging service that closely resembles Logstash with a {@code tcp}
 * input and the {@code json_lines} codec.
 *
 * <p>The service accepts any number of TCP connections, splits each stream into
 * delimiter-terminated frames, decodes every frame as a JSON object and appends
 * it to its {@link LogRecordStore}. Tests then assert on what was "logged".</p>
 *
 * <h2>Example</h2>
 * <pre>
 *   try (FakeLogstashService logstash = FixtureService.started(new FakeLogstashService())) {
 *       try (Socket socket = new Socket(logstash.localHost(), logstash.port())) {
 *           socket.getOutputStream().write("{\"level\":\"ERROR\",\"message\":\"x\"}\n".getBytes(UTF_8));
 *       }
 *       logstash.store().awaitRecords(1, Duration.ofSeconds(1));
 *       logstash.stop();
 *       logstash.assertHasAtLeast("ERROR");
 *   }
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   new FakeLogstashService(...)  → port bound (CONSTRUCTED)
 *   start()                       → event loop thread running (STARTED)
 *   stop()                        → loop signalled and joined, sockets closed (STOPPED)
 *   close()                       → stop(), or release the port if never started (STOPPED)
 * </pre>
 * {@link ServiceState#STOPPED} is terminal; create a new instance to serve again.
 *
 * <h2>Addressing</h2>
 * {@link #localHost()} and {@link #containerHost()} both reach {@link #port()}:
 * the first from the local machine, the second from inside containers. The
 * service is not part of any container network, so {@link #connect(NetworkHandle)}
 * only reports the container host alias.
 *
 * <h2>Threading</h2>
 * Exactly one background thread performs socket I/O, decoding and appends. The
 * controlling thread calls {@link #start()} and {@link #stop()} and reads the
 * store. Only {@link #stop()} blocks, for at most the configured stop timeout.
 */
public final class FakeLogstashService implements FixtureService
{
    private final LogstashServiceConfig config;
    private final LogRecordStore store;
    private final PortAcceptor acceptor;
    private final ShutdownSignal shutdownSignal;
    private final LogstashEventLoop loop;

    private final Object lifecycleLock = new Object();
    private ServiceState state = ServiceState.CONSTRUCTED;

    /**
     * Creates a service on an OS-assigned port, logging through SLF4J.
     */
    public FakeLogstashService()
    {
        this(LogstashServiceConfig.defaults());
    }

    /**
     * Creates a service on {@code port} ({@code 0} for an OS-assigned port),
     * logging through SLF4J.
     */
    public FakeLogstashService(int port)
    {
        this(LogstashServiceConfig.builder().withPort(port).build());
    }

    public FakeLogstashService(LogstashServiceConfig config)
    {
        this(config, new Slf4jLogstashObservabilitySink());
    }

    /**
     * Creates the service and binds its port.
     *
     * @param config            service configuration
     * @param observabilitySink receives connection and error events from the loop thread
     * @throws com.questrail.fixture.api.FixtureBindException if the port is unavailable
     */
    public FakeLogstashService(LogstashServiceConfig config, LogstashObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.store = new LogRecordStore();
        this.acceptor = new PortAcceptor(config.port());

        ShutdownSignal signal = null;
        try {
            signal = new ShutdownSignal();
            this.loop = new LogstashEventLoop(acceptor, signal, config, store::append, observabilitySink);
        } catch (IOException e) {
            FixtureException failure = new FixtureException("Failed creating event loop", e);
            release(acceptor, failure);
            if (signal != null) {
                release(signal, failure);
            }
            throw failure;
        }
        this.shutdownSignal = signal;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Starts the event loop thread.
     *
     * @throws IllegalStateException if the service was already started or stopped
     */
    @Override
    public void start()
    {
        synchronized (lifecycleLock) {
            if (state != ServiceState.CONSTRUCTED) {
                throw new IllegalStateException("Cannot start " + getClass().getSimpleName() + " in state " + state);
            }
            try {
                loop.start();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed registering listener", e);
            }
            state = ServiceState.STARTED;
        }
    }

    /**
     * Stops the service.
     *
     * <p>If the loop is running, a sentinel byte is sent on the shutdown signal and
     * the loop thread is joined for up to the configured stop timeout. The loop
     * closes every socket it owns on its way out. Stopping a service whose loop is
     * not running does nothing; a service that was never started can still be
     * started afterwards.</p>
     *
     * @throws ShutdownTimeoutException if the loop did not exit in time
     */
    @Override
    public void stop()
    {
        synchronized (lifecycleLock) {
            if (state != ServiceState.STARTED) {
                return;
            }
            stopLoop();
            state = ServiceState.STOPPED;
        }
    }

    /**
     * Stops a started service like {@link #stop()}. A service that was never
     * started releases its port instead and becomes {@link ServiceState#STOPPED}.
     */
    @Override
    public void close()
    {
        synchronized (lifecycleLock) {
            if (state == ServiceState.CONSTRUCTED) {
                state = ServiceState.STOPPED;
                releaseUnstarted();
                return;
            }
        }
        stop();
    }

    private void stopLoop()
    {
        if (loop.isAlive()) {
            try {
                shutdownSignal.signal();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed signalling shutdown", e);
            }

            boolean exited;
            try {
                exited = loop.join(config.stopTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FixtureException("Interrupted while stopping " + getClass().getSimpleName(), e);
            }
            if (!exited) {
                throw new ShutdownTimeoutException(getClass().getSimpleName(), config.stopTimeout());
            }
        }

        try {
            shutdownSignal.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed closing shutdown signal", e);
        }
    }

    private void releaseUnstarted()
    {
        FixtureException failure = new FixtureException("Failed releasing " + getClass().getSimpleName());
        release(loop::discard, failure);
        release(acceptor, failure);
        release(shutdownSignal, failure);
        if (failure.getSuppressed().length > 0) {
            throw failure;
        }
    }

    private static void release(Closeable resource, FixtureException failure)
    {
        try {
            resource.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * @return whether the event loop thread is executing
     */
    @Override
    public boolean isAlive()
    {
        return loop.isAlive();
    }

    public ServiceState state()
    {
        synchronized (lifecycleLock) {
            return state;
        }
    }

    /**
     * Does nothing besides reporting the alias containers use to reach this service.
     */
    @Override
    public List<String> connect(NetworkHandle network)
    {
        Objects.requireNonNull(network, "network");
        return List.of(config.containerHost());
    }

    /**
     * Does nothing.
     */
    @Override
    public void disconnect(NetworkHandle network)
    {
        Objects.requireNonNull(network, "network");
    }

    // -------------------------------------------------------------------------
    // Addressing
    // -------------------------------------------------------------------------

    public int port()
    {
        return acceptor.port();
    }

    public String localHost()
    {
        return config.localHost();
    }

    public String containerHost()
    {
        return config.containerHost();
    }

    public LogstashServiceConfig config()
    {
        return config;
    }

    // -------------------------------------------------------------------------
    // Records
    // -------------------------------------------------------------------------

    public LogRecordStore store()
    {
        return store;
    }

    /**
     * @return the live, mutable list of every record received, in arrival order
     */
    public List<Map<String, Object>> records()
    {
        return store.records();
    }

    /**
     * @see LogRecordStore#filter(String)
     */
    public Iterable<Map<String, Object>> filter(String levelName)
    {
        return store.filter(levelName);
    }

    /**
     * @see LogRecordStore#assertHasAtLeast(String)
     */
    public void assertHasAtLeast(String levelName)
    {
        store.assertHasAtLeast(levelName);
    }

    /**
     * @see LogRecordStore#assertNoneAtLeast(String)
     */
    public void assertNoneAtLeast(String levelName)
    {
        store.assertNoneAtLeast(levelName);
    }

    /**
     * @see LogRecordStore#awaitRecords(int, Duration)
     */
    public boolean awaitRecords(int count, Duration timeout) throws InterruptedException
    {
        return store.awaitRecords(count, timeout);
    }
}
