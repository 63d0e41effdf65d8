package com.clawcron.common.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemEventsTest {

    @AfterEach
    void tearDown() {
        SystemEvents.resetForTest();
    }

    @Test
    void mainSessionKey_defaultAndAgentScoped() {
        assertEquals("main", SystemEvents.mainSessionKey(null));
        assertEquals("main", SystemEvents.mainSessionKey("  "));
        assertEquals("agent:ops:main", SystemEvents.mainSessionKey("Ops"));
    }

    @Test
    void enqueueAndDrain() {
        SystemEvents.enqueue("first", "main");
        SystemEvents.enqueue("second", "main");

        assertTrue(SystemEvents.hasEvents("main"));
        assertEquals(List.of("first", "second"), SystemEvents.drain("main"));
        assertFalse(SystemEvents.hasEvents("main"));
        assertTrue(SystemEvents.drain("main").isEmpty());
    }

    @Test
    void enqueue_dropsBlankAndConsecutiveDuplicates() {
        SystemEvents.enqueue("  ", "main");
        SystemEvents.enqueue("ping", "main");
        SystemEvents.enqueue("ping", "main");
        SystemEvents.enqueue("pong", "main");
        SystemEvents.enqueue("ping", "main");

        assertEquals(List.of("ping", "pong", "ping"), SystemEvents.peek("main"));
    }

    @Test
    void enqueue_evictsOldestPastCap() {
        for (int i = 0; i < 25; i++) {
            SystemEvents.enqueue("event " + i, "main");
        }

        List<String> events = SystemEvents.peek("main");
        assertEquals(20, events.size());
        assertEquals("event 5", events.get(0));
        assertEquals("event 24", events.get(19));
    }

    @Test
    void sessionsAreIsolated() {
        SystemEvents.enqueue("for ops", "agent:ops:main");

        assertFalse(SystemEvents.hasEvents("main"));
        assertEquals(List.of("for ops"), SystemEvents.drain("agent:ops:main"));
    }

    @Test
    void blankSessionKey_rejected() {
        assertThrows(IllegalArgumentException.class, () -> SystemEvents.enqueue("x", " "));
    }
}
