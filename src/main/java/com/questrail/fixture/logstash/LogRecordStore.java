package com.questrail.fixture.logstash;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * LogRecordStore
 * =============================================================================
 * Ordered log of every record received by a fake Logstash service, with the
 * query and assertion helpers tests use to inspect it.
 *
 * <h2>Ownership</h2>
 * Records are appended only by the service's event loop thread, in arrival
 * order. The list returned by {@link #records()} is the live store: tests may
 * read, clear or edit it at any time. It is a {@link CopyOnWriteArrayList}, so
 * iterating it while the loop appends never fails; an iteration simply sees the
 * records present when it began.
 *
 * <h2>Determinism</h2>
 * While the service runs, the store may grow between two reads. Assertions that
 * must see every record sent should run after the service is stopped, or after
 * {@link #awaitRecords(int, Duration)} confirmed delivery.
 *
 * <h2>Levels</h2>
 * Thresholds and record levels are resolved by {@link LogSeverity}.
 */
public final class LogRecordStore
{
    private final List<Map<String, Object>> records = new CopyOnWriteArrayList<>();
    private final Object arrival = new Object();

    /**
     * @return the live, mutable record list
     */
    public List<Map<String, Object>> records()
    {
        return records;
    }

    /**
     * Appends a record and wakes threads waiting in {@link #awaitRecords(int, Duration)}.
     */
    void append(Map<String, Object> record)
    {
        records.add(Objects.requireNonNull(record, "record"));
        synchronized (arrival) {
            arrival.notifyAll();
        }
    }

    /**
     * Records at or above a level, in store order.
     *
     * <p>The result is lazy and restartable: every iteration re-reads the store.</p>
     *
     * @param levelName threshold level name, case-insensitive
     */
    public Iterable<Map<String, Object>> filter(String levelName)
    {
        return filter(LogSeverity.of(levelName));
    }

    /**
     * Records whose severity is at or above {@code threshold}, in store order.
     */
    public Iterable<Map<String, Object>> filter(int threshold)
    {
        return () -> records.stream()
            .filter(record -> severityOf(record) >= threshold)
            .iterator();
    }

    /**
     * Asserts that at least one record at or above the level was received.
     *
     * @throws AssertionError if no such record exists
     */
    public void assertHasAtLeast(String levelName)
    {
        assertHasAtLeast(LogSeverity.of(levelName));
    }

    public void assertHasAtLeast(int threshold)
    {
        if (!filter(threshold).iterator().hasNext()) {
            throw new AssertionError("No logs of level " + LogSeverity.nameOf(threshold)
                + " or above were received.");
        }
    }

    /**
     * Asserts that no record at or above the level was received.
     *
     * @throws AssertionError naming the first offending record's level and message
     */
    public void assertNoneAtLeast(String levelName)
    {
        assertNoneAtLeast(LogSeverity.of(levelName));
    }

    public void assertNoneAtLeast(int threshold)
    {
        Iterator<Map<String, Object>> matching = filter(threshold).iterator();
        if (matching.hasNext()) {
            Map<String, Object> record = matching.next();
            throw new AssertionError("A log level " + record.get("level") + " was received. Message: "
                + record.get("message"));
        }
    }

    /**
     * Waits until the store holds at least {@code count} records.
     *
     * @return {@code true} if the count was reached, {@code false} on timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitRecords(int count, Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (arrival) {
            while (records.size() < count) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(arrival, remaining);
            }
        }
        return true;
    }

    private static int severityOf(Map<String, Object> record)
    {
        return LogSeverity.ofRecordLevel(record.get("level"));
    }
}
