package com.clawcron.common.logging;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @ParameterizedTest
    @CsvSource({ "off, SILENT", "fatal, ERROR", "WARNING, WARN", " debug , DEBUG", "trace, TRACE" })
    void normalize_aliases(String input, LogLevel expected) {
        assertEquals(expected, LogLevel.normalize(input));
    }

    @Test
    void normalize_unknownFallsBack() {
        assertEquals(LogLevel.INFO, LogLevel.normalize("loud"));
        assertEquals(LogLevel.WARN, LogLevel.normalize(null, LogLevel.WARN));
    }

    @Test
    void isEnabledFor() {
        assertTrue(LogLevel.ERROR.isEnabledFor(LogLevel.INFO));
        assertTrue(LogLevel.INFO.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.DEBUG.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.ERROR.isEnabledFor(LogLevel.SILENT));
    }

    @Test
    void toSlf4jLevel() {
        assertEquals("OFF", LogLevel.SILENT.toSlf4jLevel());
        assertEquals("WARN", LogLevel.WARN.toSlf4jLevel());
    }

    @Test
    void subsystemLogger_formatsMetaInOrder() {
        SubsystemLogger logger = SubsystemLogger.create("cron").child("exec");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("jobId", "j1");
        meta.put("status", "ok");

        assertEquals("cron/exec", logger.getSubsystem());
        assertEquals("[cron/exec] job finished {jobId=j1, status=ok}", logger.formatMessage("job finished", meta));
        assertEquals("[cron/exec] idle", logger.formatMessage("idle", null));
    }
}
