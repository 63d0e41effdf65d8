package com.clawcron.gateway.cron;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cron job input normalization. Coerces raw request maps into well-typed
 * create/patch objects. Defaults that depend on other fields are applied by
 * {@link CronService}, so typed callers get them too.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    /**
     * Normalize a raw schedule map: auto-detect kind, fold {@code at} into
     * {@code atMs}, accept duration strings for {@code everyMs}.
     */
    public static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);

        Long atMs = null;
        Object atMsRaw = schedule.get("atMs");
        Object atRaw = schedule.get("at");
        if (atMsRaw instanceof Number n) {
            atMs = n.longValue();
        } else if (atMsRaw instanceof String s) {
            atMs = CronParse.parseAbsoluteTimeMs(s);
            if (atMs == null)
                throw new CronErrors.ValidationError("invalid schedule.atMs: " + s);
        } else if (atRaw instanceof String s && !s.isBlank()) {
            atMs = CronParse.parseAbsoluteTimeMs(s);
            if (atMs == null)
                throw new CronErrors.ValidationError("invalid schedule.at: " + s);
        }
        next.remove("at");
        if (atMs != null) {
            next.put("atMs", atMs);
        }

        if (schedule.get("everyMs") instanceof String s) {
            Long everyMs = CronParse.parseDurationMs(s);
            if (everyMs == null)
                throw new CronErrors.ValidationError("invalid schedule.everyMs: " + s);
            next.put("everyMs", everyMs);
        }

        if (!(schedule.get("kind") instanceof String)) {
            if (atMs != null) {
                next.put("kind", "at");
            } else if (next.get("everyMs") instanceof Number) {
                next.put("kind", "every");
            } else if (schedule.get("expr") instanceof String) {
                next.put("kind", "cron");
            }
        }
        return next;
    }

    /**
     * Normalize a raw payload map: auto-detect kind from text/message.
     */
    public static Map<String, Object> coercePayload(Map<String, Object> payload) {
        Map<String, Object> next = new LinkedHashMap<>(payload);
        if (!(payload.get("kind") instanceof String)) {
            if (payload.get("message") instanceof String) {
                next.put("kind", "agentTurn");
            } else if (payload.get("text") instanceof String) {
                next.put("kind", "systemEvent");
            }
        }
        return next;
    }

    /**
     * Normalize delivery config (mode aliases, channel/to trimming).
     */
    public static Map<String, Object> coerceDelivery(Map<String, Object> delivery) {
        Map<String, Object> next = new LinkedHashMap<>(delivery);

        if (delivery.get("mode") instanceof String mode) {
            String normalized = mode.trim().toLowerCase();
            next.put("mode", "deliver".equals(normalized) ? "announce" : normalized);
        }
        if (delivery.get("channel") instanceof String ch) {
            String trimmed = ch.trim().toLowerCase();
            if (trimmed.isEmpty())
                next.remove("channel");
            else
                next.put("channel", trimmed);
        }
        if (delivery.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }
        return next;
    }

    /**
     * Normalize a raw create request into a {@link CronTypes.CronJobCreate}.
     *
     * @throws CronErrors.ValidationError if a field has the wrong shape
     */
    public static CronTypes.CronJobCreate normalizeCreate(Map<String, Object> raw) {
        if (raw == null)
            throw new CronErrors.ValidationError("job is required");
        return convert(coerceAll(unwrapJob(raw)), CronTypes.CronJobCreate.class);
    }

    /**
     * Normalize a raw patch. No defaults are applied.
     *
     * @throws CronErrors.ValidationError if a field has the wrong shape
     */
    public static CronTypes.CronJobPatch normalizePatch(Map<String, Object> raw) {
        if (raw == null)
            throw new CronErrors.ValidationError("patch is required");
        return convert(coerceAll(unwrapJob(raw)), CronTypes.CronJobPatch.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> coerceAll(Map<String, Object> next) {
        if (next.get("schedule") instanceof Map<?, ?> sched) {
            next.put("schedule", coerceSchedule((Map<String, Object>) sched));
        }
        if (next.get("payload") instanceof Map<?, ?> payload) {
            next.put("payload", coercePayload((Map<String, Object>) payload));
        }
        if (next.get("delivery") instanceof Map<?, ?> del) {
            next.put("delivery", coerceDelivery((Map<String, Object>) del));
        }
        return next;
    }

    private static <T> T convert(Map<String, Object> map, Class<T> type) {
        try {
            return CronJson.MAPPER.convertValue(map, type);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e;
            throw new CronErrors.ValidationError("invalid job: " + cause.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }
}
