package io.relayq.config.type;

import ch.qos.logback.classic.Level;

import java.util.Locale;

/**
 * Broker verbosity. Ordered by {@link #getRank()}: FAIL &lt; WARN &lt; INFO &lt; DBUG.
 * Only filters diagnostic output; protocol decisions never depend on it.
 */
public enum LogLevel {
    FAIL(1, Level.ERROR),
    WARN(2, Level.WARN),
    INFO(3, Level.INFO),
    DBUG(4, Level.DEBUG);

    private final int rank;
    private final Level logbackLevel;

    LogLevel(final int rank, final Level logbackLevel) {
        this.rank = rank;
        this.logbackLevel = logbackLevel;
    }

    public int getRank() {
        return rank;
    }

    public Level toLogbackLevel() {
        return logbackLevel;
    }

    public boolean isAtLeast(final LogLevel other) {
        return rank >= other.rank;
    }

    /**
     * Case-insensitive parse of {@code fail | warn | info | dbug}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static LogLevel parse(final String value) {
        if (value == null) throw new IllegalArgumentException("log level must not be null");

        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fail" -> FAIL;
            case "warn" -> WARN;
            case "info" -> INFO;
            case "dbug" -> DBUG;
            default -> throw new IllegalArgumentException(value + " is not a valid log level, expected one of [fail | warn | info | dbug]");
        };
    }
}
