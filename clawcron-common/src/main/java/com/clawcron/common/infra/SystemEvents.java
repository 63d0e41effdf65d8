package com.clawcron.common.infra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Lightweight in-memory queue for human-readable system events that the main
 * session picks up on its next heartbeat. Events are session-scoped and
 * ephemeral (not persisted).
 */
public final class SystemEvents {

    private SystemEvents() {
    }

    public static final String MAIN_SESSION_KEY = "main";
    private static final int MAX_EVENTS = 20;

    public record Event(String text, long ts) {
    }

    private static class SessionQueue {
        final List<Event> queue = new ArrayList<>();
        String lastText;
    }

    private static final Map<String, SessionQueue> queues = new ConcurrentHashMap<>();

    /**
     * Session key of an agent's main session; {@code main} for the default
     * agent.
     */
    public static String mainSessionKey(String agentId) {
        String trimmed = agentId != null ? agentId.trim() : "";
        if (trimmed.isEmpty()) {
            return MAIN_SESSION_KEY;
        }
        return "agent:" + trimmed.toLowerCase() + ":" + MAIN_SESSION_KEY;
    }

    /**
     * Enqueue a system event for a session. Blank text and consecutive
     * duplicates are dropped; the oldest event is evicted past the cap.
     */
    public static void enqueue(String text, String sessionKey) {
        String key = requireSessionKey(sessionKey);
        SessionQueue entry = queues.computeIfAbsent(key, k -> new SessionQueue());

        synchronized (entry) {
            String cleaned = text != null ? text.trim() : "";
            if (cleaned.isEmpty() || cleaned.equals(entry.lastText)) {
                return;
            }
            entry.lastText = cleaned;
            entry.queue.add(new Event(cleaned, System.currentTimeMillis()));
            if (entry.queue.size() > MAX_EVENTS) {
                entry.queue.remove(0);
            }
        }
    }

    /**
     * Drain all event texts for a session, removing them from the queue.
     */
    public static List<String> drain(String sessionKey) {
        String key = requireSessionKey(sessionKey);
        SessionQueue entry = queues.remove(key);
        if (entry == null) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            List<String> out = entry.queue.stream().map(Event::text).collect(Collectors.toList());
            entry.queue.clear();
            entry.lastText = null;
            return out;
        }
    }

    /**
     * Peek at current event texts without draining.
     */
    public static List<String> peek(String sessionKey) {
        SessionQueue entry = queues.get(requireSessionKey(sessionKey));
        if (entry == null) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            return entry.queue.stream().map(Event::text).collect(Collectors.toList());
        }
    }

    public static boolean hasEvents(String sessionKey) {
        SessionQueue entry = queues.get(requireSessionKey(sessionKey));
        return entry != null && !entry.queue.isEmpty();
    }

    /**
     * Clear all queues (for testing).
     */
    public static void resetForTest() {
        queues.clear();
    }

    private static String requireSessionKey(String key) {
        String trimmed = key != null ? key.trim() : "";
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("system events require a sessionKey");
        }
        return trimmed;
    }
}
