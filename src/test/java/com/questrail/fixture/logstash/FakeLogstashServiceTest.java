package com.questrail.fixture.logstash;

import com.questrail.fixture.api.FixtureBindException;
import com.questrail.fixture.api.FixtureService;
import com.questrail.fixture.api.NetworkHandle;
import com.questrail.fixture.api.ServiceState;
import com.questrail.fixture.api.ShutdownTimeoutException;
import com.questrail.fixture.logstash.config.LogstashServiceConfig;
import com.questrail.fixture.logstash.observability.LogstashConnectionEvent;
import com.questrail.fixture.logstash.observability.LogstashConnectionEvent.CloseReason;
import com.questrail.fixture.logstash.observability.LogstashDecodeFailureEvent;
import com.questrail.fixture.logstash.observability.LogstashErrorEvent;
import com.questrail.fixture.logstash.observability.LogstashObservabilitySink;
import com.questrail.fixture.logstash.observability.RecordingObservabilitySink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FakeLogstashServiceTest
 * -----------------------------------------------------------------------------
 * End-to-end tests over real loopback sockets.
 *
 * Records are awaited before the service is stopped: once stopped, the store is
 * final and assertions are deterministic.
 */
class FakeLogstashServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private RecordingObservabilitySink sink;
    private FakeLogstashService service;

    private static LogstashServiceConfig.Builder fastConfig() {
        return LogstashServiceConfig.builder()
            .withWakeInterval(Duration.ofMillis(100))
            .withStopTimeout(Duration.ofSeconds(2));
    }

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        service = new FakeLogstashService(fastConfig().build(), sink);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private Socket connect() throws IOException {
        return new Socket(service.localHost(), service.port());
    }

    private static void write(Socket socket, String data) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void awaitCondition(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void portIsResolvedAtConstruction() {
        assertTrue(service.port() > 0);
        assertEquals(ServiceState.CONSTRUCTED, service.state());
        assertFalse(service.isAlive());
    }

    @Test
    void errorRecordIsRecorded() throws Exception {
        service.start();
        assertTrue(service.isAlive());

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"ERROR\",\"message\":\"x\"}\n");
            assertTrue(service.awaitRecords(1, TIMEOUT));
        }
        service.stop();

        assertEquals(1, service.records().size());
        Map<String, Object> record = service.records().get(0);
        assertEquals("ERROR", record.get("level"));
        assertEquals("x", record.get("message"));
        service.assertHasAtLeast("ERROR");
        assertThrows(AssertionError.class, () -> service.assertNoneAtLeast("ERROR"));
    }

    @Test
    void framesWrittenTogetherArriveInOrder() throws Exception {
        service.start();

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\"}\n{\"level\":\"WARNING\"}\n");
            assertTrue(service.awaitRecords(2, TIMEOUT));
        }
        service.stop();

        assertEquals(List.of(Map.of("level", "INFO"), Map.of("level", "WARNING")), service.records());
        service.assertNoneAtLeast("ERROR");
        service.assertHasAtLeast("WARNING");
    }

    @Test
    void frameSplitAcrossWritesIsReassembled() throws Exception {
        service.start();

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"CRIT");
            Thread.sleep(20);
            write(socket, "ICAL\",\"mess");
            Thread.sleep(20);
            write(socket, "age\":\"split\"}\n{\"level\":");
            Thread.sleep(20);
            write(socket, "\"DEBUG\"}\n");
            assertTrue(service.awaitRecords(2, TIMEOUT));
        }
        service.stop();

        assertEquals(Map.of("level", "CRITICAL", "message", "split"), service.records().get(0));
        assertEquals(Map.of("level", "DEBUG"), service.records().get(1));
    }

    @Test
    void recordsLargerThanReadChunkAreReassembled() throws Exception {
        service.start();
        String message = "y".repeat(10_000);

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\",\"message\":\"" + message + "\"}\n");
            assertTrue(service.awaitRecords(1, TIMEOUT));
        }
        service.stop();

        assertEquals(message, service.records().get(0).get("message"));
    }

    @Test
    void malformedFrameClosesOnlyItsConnection() throws Exception {
        service.start();

        try (Socket healthy = connect(); Socket broken = connect()) {
            write(broken, "{\"a\":1}\nnot json\n{\"a\":2}\n");
            assertTrue(service.awaitRecords(1, TIMEOUT));
            awaitCondition(() -> !sink.getDecodeFailures().isEmpty(), "decode failure");

            write(healthy, "{\"b\":1}\n");
            write(healthy, "{\"b\":2}\n");
            assertTrue(service.awaitRecords(3, TIMEOUT));

            InputStream in = broken.getInputStream();
            broken.setSoTimeout((int) TIMEOUT.toMillis());
            assertClosedByPeer(in);
        }
        service.stop();

        assertEquals(List.of(Map.of("a", 1), Map.of("b", 1), Map.of("b", 2)), service.records());

        List<LogstashDecodeFailureEvent> failures = sink.getDecodeFailures();
        assertEquals(1, failures.size());
        assertEquals("not json", failures.get(0).frameText());
        assertTrue(sink.getClosedConnections().stream()
            .anyMatch(e -> e.reason() == CloseReason.DECODE_FAILURE));
    }

    private static void assertClosedByPeer(InputStream in) {
        try {
            assertEquals(-1, in.read());
        } catch (IOException e) {
            // Connection reset: the service closed with unread data pending.
        }
    }

    @Test
    void decodeFailureReportsFrameInConfiguredCharset() throws Exception {
        service.close();
        service = new FakeLogstashService(fastConfig().withCharset(StandardCharsets.ISO_8859_1).build(), sink);
        service.start();

        try (Socket socket = connect()) {
            OutputStream out = socket.getOutputStream();
            out.write(new byte[] {'{', '"', 'm', '"', ':', (byte) 0xE9, '}', '\n'});
            out.flush();
            awaitCondition(() -> !sink.getDecodeFailures().isEmpty(), "decode failure");
        }
        service.stop();

        LogstashDecodeFailureEvent failure = sink.getDecodeFailures().get(0);
        assertEquals(StandardCharsets.ISO_8859_1, failure.charset());
        assertEquals("{\"m\":\u00e9}", failure.frameText());
    }

    @Test
    void customDelimiterSeparatesFrames() throws Exception {
        service.close();
        service = new FakeLogstashService(fastConfig().withDelimiter(new byte[] {'|', '|'}).build(), sink);
        service.start();

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\"}|");
            Thread.sleep(20);
            write(socket, "|{\"level\":\"ERROR\"}||");
            assertTrue(service.awaitRecords(2, TIMEOUT));
        }
        service.stop();

        assertEquals(List.of(Map.of("level", "INFO"), Map.of("level", "ERROR")), service.records());
    }

    @Test
    void connectionOpenedBeforeStartIsServedOnceStarted() throws Exception {
        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\",\"message\":\"early\"}\n");

            service.start();

            assertTrue(service.awaitRecords(1, TIMEOUT));
        }
        service.stop();

        assertEquals("early", service.records().get(0).get("message"));
    }

    @Test
    void peerCloseIsNotAnError() throws Exception {
        service.start();

        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\"}\n");
        }
        awaitCondition(() -> sink.getClosedConnections().stream()
            .anyMatch(e -> e.reason() == CloseReason.PEER_CLOSED), "peer close");
        service.stop();

        assertEquals(1, service.records().size());
        assertFalse(sink.hasEventOfType(LogstashErrorEvent.class));
        assertFalse(sink.hasEventOfType(LogstashDecodeFailureEvent.class));
    }

    @Test
    void stopTerminatesLoopAndClosesListener() throws Exception {
        service.start();
        int port = service.port();

        service.stop();

        assertFalse(service.isAlive());
        assertEquals(ServiceState.STOPPED, service.state());
        assertThrows(IOException.class, () -> new Socket(service.localHost(), port).close());
    }

    @Test
    void stopClosesConnectionsStillOpen() throws Exception {
        service.start();

        try (Socket socket = connect()) {
            awaitCondition(() -> sink.hasEventOfType(LogstashConnectionEvent.class), "accept");

            service.stop();

            socket.setSoTimeout((int) TIMEOUT.toMillis());
            assertEquals(-1, socket.getInputStream().read());
        }
        assertTrue(sink.getClosedConnections().stream()
            .anyMatch(e -> e.reason() == CloseReason.SERVICE_STOPPED));
    }

    @Test
    void secondStopIsNoop() {
        service.start();
        service.stop();

        assertTimeoutPreemptively(Duration.ofMillis(500), () -> service.stop());
        assertEquals(ServiceState.STOPPED, service.state());
    }

    @Test
    void stopBeforeStartLeavesServiceUsable() throws Exception {
        int port = service.port();

        service.stop();

        assertEquals(ServiceState.CONSTRUCTED, service.state());
        service.start();
        assertEquals(port, service.port());
        try (Socket socket = connect()) {
            write(socket, "{\"level\":\"INFO\",\"message\":\"after stop\"}\n");
            assertTrue(service.awaitRecords(1, TIMEOUT));
        }
        service.stop();

        assertEquals("after stop", service.records().get(0).get("message"));
    }

    @Test
    void closeWithoutStartReleasesPort() {
        int port = service.port();

        service.close();

        assertEquals(ServiceState.STOPPED, service.state());
        assertThrows(IllegalStateException.class, () -> service.start());
        FakeLogstashService rebound = new FakeLogstashService(fastConfig().withPort(port).build(), sink);
        try {
            assertEquals(port, rebound.port());
        } finally {
            rebound.close();
        }
    }

    @Test
    void serviceIsNotRestartable() {
        service.start();
        assertThrows(IllegalStateException.class, () -> service.start());

        service.stop();
        assertThrows(IllegalStateException.class, () -> service.start());
    }

    @Test
    void occupiedPortFailsToBind() {
        FixtureBindException e = assertThrows(FixtureBindException.class,
            () -> new FakeLogstashService(fastConfig().withPort(service.port()).build(), sink));

        assertEquals(service.port(), e.port());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void connectReportsContainerHostAndDisconnectDoesNothing() {
        NetworkHandle network = NetworkHandle.named("fixture-net");

        assertEquals(List.of(LogstashServiceConfig.DEFAULT_CONTAINER_HOST), service.connect(network));
        service.disconnect(network);

        assertEquals("localhost", service.localHost());
        assertEquals(LogstashServiceConfig.DEFAULT_CONTAINER_HOST, service.containerHost());
    }

    @Test
    void containerHostIsConfigurable() {
        FakeLogstashService custom = new FakeLogstashService(
            fastConfig().withContainerHost("172.17.0.1").build(), sink);
        try {
            assertEquals(List.of("172.17.0.1"), custom.connect(NetworkHandle.named("bridge")));
        } finally {
            custom.close();
        }
    }

    @Test
    void closingStopsTheService() throws Exception {
        FakeLogstashService closed;
        try (FakeLogstashService running = FixtureService.started(new FakeLogstashService(fastConfig().build(), sink))) {
            closed = running;
            assertTrue(running.isAlive());
        }

        assertFalse(closed.isAlive());
        assertEquals(ServiceState.STOPPED, closed.state());
    }

    @Test
    void stuckLoopFailsToStopWithinTimeout() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        LogstashObservabilitySink blockingSink = new LogstashObservabilitySink() {
            @Override
            public void onConnectionAccepted(LogstashConnectionEvent event) {
                blocked.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void onConnectionClosed(LogstashConnectionEvent event) {}

            @Override
            public void onDecodeFailure(LogstashDecodeFailureEvent event) {}

            @Override
            public void onError(LogstashErrorEvent event) {}
        };

        FakeLogstashService stuck = new FakeLogstashService(
            fastConfig().withStopTimeout(Duration.ofMillis(200)).build(), blockingSink);
        stuck.start();

        try (Socket socket = new Socket(stuck.localHost(), stuck.port())) {
            assertTrue(blocked.await(5, TimeUnit.SECONDS));

            assertThrows(ShutdownTimeoutException.class, stuck::stop);
            assertTrue(stuck.isAlive());
        } finally {
            release.countDown();
        }

        // The sentinel from the timed-out stop is still pending, so the loop exits on its own.
        awaitCondition(() -> !stuck.isAlive(), "loop exit");
        stuck.stop();
        assertFalse(stuck.isAlive());
        assertEquals(ServiceState.STOPPED, stuck.state());
    }
}
