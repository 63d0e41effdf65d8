package com.clawcron.gateway.cron;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionsTest {

    private static final long JAN_1_2024 = 1704067200000L; // 2024-01-01T00:00:00Z
    private static final long HOUR = 3_600_000L;

    private final CronExpressions expressions = CronExpressions.unix();

    @Test
    void nextOccurrence_dailyInUtc() {
        assertEquals(JAN_1_2024 + 9 * HOUR, expressions.nextOccurrence("0 9 * * *", "UTC", JAN_1_2024));
    }

    @Test
    void nextOccurrence_isStrictlyAfter() {
        long nine = JAN_1_2024 + 9 * HOUR;
        assertEquals(nine + 24 * HOUR, expressions.nextOccurrence("0 9 * * *", "UTC", nine));
        assertEquals(nine, expressions.nextOccurrence("0 9 * * *", "UTC", nine - 1));
    }

    @Test
    void nextOccurrence_honorsTimeZone() {
        // 09:00 in New York (UTC-5 in January)
        assertEquals(JAN_1_2024 + 14 * HOUR,
                expressions.nextOccurrence("0 9 * * *", "America/New_York", JAN_1_2024));
    }

    @Test
    void nextOccurrence_stepExpression() {
        long start = JAN_1_2024 + 60_000L;
        assertEquals(JAN_1_2024 + 5 * 60_000L, expressions.nextOccurrence("*/5 * * * *", "UTC", start));
    }

    @Test
    void validate_rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> expressions.validate("not a cron", null));
        assertThrows(IllegalArgumentException.class, () -> expressions.validate("61 * * * *", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> expressions.validate("0 9 * * *", "Nowhere/Land"));
        assertThrows(IllegalArgumentException.class, () -> expressions.validate(" ", "UTC"));
        assertDoesNotThrow(() -> expressions.validate("30 8 * * 1-5", "Europe/Berlin"));
    }
}
