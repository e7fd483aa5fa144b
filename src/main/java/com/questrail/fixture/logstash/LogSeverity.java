package com.questrail.fixture.logstash;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * LogSeverity
 * -----------------------------------------------------------------------------
 * Maps log level names to the numeric severities used for threshold
 * comparisons.
 *
 * <p>The table is the one used by Python's {@code logging} module, which is
 * what most {@code json_lines} senders emit:</p>
 *
 * <pre>
 *   CRITICAL, FATAL  50
 *   ERROR            40
 *   WARNING, WARN    30
 *   INFO             20
 *   DEBUG            10
 *   NOTSET            0
 * </pre>
 *
 * <h2>Record levels</h2>
 * A record's {@code level} field is resolved by {@link #ofRecordLevel(Object)}:
 * a known name (case-insensitive) maps through the table, a number is used
 * as-is, and anything else (missing, {@code null}, unknown name, other JSON
 * types) resolves to {@link #NOTSET}. Such records therefore only match a
 * {@code NOTSET} threshold.
 *
 * <h2>Thresholds</h2>
 * A threshold given by name must be a known name; {@link #of(String)} rejects
 * anything else.
 */
public final class LogSeverity
{
    public static final int CRITICAL = 50;
    public static final int ERROR = 40;
    public static final int WARNING = 30;
    public static final int INFO = 20;
    public static final int DEBUG = 10;
    public static final int NOTSET = 0;

    private static final Map<String, Integer> BY_NAME = Map.of(
        "CRITICAL", CRITICAL,
        "FATAL", CRITICAL,
        "ERROR", ERROR,
        "WARNING", WARNING,
        "WARN", WARNING,
        "INFO", INFO,
        "DEBUG", DEBUG,
        "NOTSET", NOTSET
    );

    private LogSeverity() {}

    /**
     * Resolves a threshold level name.
     *
     * @param levelName level name, case-insensitive
     * @return numeric severity
     * @throws IllegalArgumentException if the name is not a known level
     */
    public static int of(String levelName)
    {
        Objects.requireNonNull(levelName, "levelName");
        Integer severity = BY_NAME.get(levelName.trim().toUpperCase(Locale.ROOT));
        if (severity == null) {
            throw new IllegalArgumentException("Unknown log level: " + levelName);
        }
        return severity;
    }

    /**
     * Resolves the value of a record's {@code level} field.
     *
     * @param level raw JSON-decoded value; may be {@code null}
     * @return numeric severity, {@link #NOTSET} if the value is not recognized;
     *         numbers outside the {@code int} range are clamped to it
     */
    public static int ofRecordLevel(Object level)
    {
        if (level instanceof String name) {
            return BY_NAME.getOrDefault(name.trim().toUpperCase(Locale.ROOT), NOTSET);
        }
        if (level instanceof Number number) {
            // Narrowing from double saturates at the int bounds.
            return (int) number.doubleValue();
        }
        return NOTSET;
    }

    /**
     * Returns the canonical name of a severity, as used in assertion messages:
     * the table name for a known severity, {@code "Level n"} otherwise.
     */
    public static String nameOf(int severity)
    {
        switch (severity) {
            case CRITICAL:
                return "CRITICAL";
            case ERROR:
                return "ERROR";
            case WARNING:
                return "WARNING";
            case INFO:
                return "INFO";
            case DEBUG:
                return "DEBUG";
            case NOTSET:
                return "NOTSET";
            default:
                return "Level " + severity;
        }
    }
}
