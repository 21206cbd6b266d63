package io.relayq.config.type;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class LogLevelTest {

    @Test
    void ranksAreTotallyOrdered() {
        assertTrue(LogLevel.DBUG.isAtLeast(LogLevel.INFO));
        assertTrue(LogLevel.INFO.isAtLeast(LogLevel.WARN));
        assertTrue(LogLevel.WARN.isAtLeast(LogLevel.FAIL));
        assertTrue(LogLevel.WARN.isAtLeast(LogLevel.WARN));
        assertFalse(LogLevel.FAIL.isAtLeast(LogLevel.WARN));
        assertEquals(1, LogLevel.FAIL.getRank());
        assertEquals(4, LogLevel.DBUG.getRank());
    }

    @Test
    void parsesCaseInsensitively() {
        assertEquals(LogLevel.FAIL, LogLevel.parse("FAIL"));
        assertEquals(LogLevel.DBUG, LogLevel.parse(" dbug "));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("debug"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(null));
    }

    @Test
    void mapsOntoLogbackLevels() {
        assertEquals(Level.ERROR, LogLevel.FAIL.toLogbackLevel());
        assertEquals(Level.DEBUG, LogLevel.DBUG.toLogbackLevel());
    }
}
