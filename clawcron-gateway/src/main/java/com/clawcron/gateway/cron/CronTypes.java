package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cron job model: schedule variants, typed payloads, isolation/delivery
 * options, run state, and the create/patch DTOs.
 *
 * <p>
 * Schedules and payloads are tagged unions: the {@code kind} field selects
 * which of the remaining fields are meaningful.
 * </p>
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY, CRON;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "at" -> AT;
                case "every" -> EVERY;
                case "cron" -> CRON;
                default -> throw new IllegalArgumentException("unknown schedule kind: " + key);
            };
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronSchedule {
        private ScheduleKind kind;
        /** Epoch ms for "at" schedules. */
        private Long atMs;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Grid origin for "every" schedules; defaults to the job's creation time. */
        private Long anchorMs;
        /** Five-field cron expression for "cron" schedules (e.g. "0 9 * * 1-5"). */
        private String expr;
        /** IANA time zone for "cron" schedules; local zone when absent. */
        private String tz;

        public static CronSchedule at(long atMs) {
            return CronSchedule.builder().kind(ScheduleKind.AT).atMs(atMs).build();
        }

        public static CronSchedule every(long everyMs) {
            return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).build();
        }

        public static CronSchedule cron(String expr, String tz) {
            return CronSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz(tz).build();
        }
    }

    // =========================================================================
    // Session/wake modes
    // =========================================================================

    public enum SessionTarget {
        MAIN, ISOLATED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "main" -> MAIN;
                case "isolated" -> ISOLATED;
                default -> throw new IllegalArgumentException("unknown session target: " + key);
            };
        }
    }

    public enum WakeMode {
        NEXT_HEARTBEAT, NOW;

        @JsonValue
        public String key() {
            return name().toLowerCase().replace('_', '-');
        }

        @JsonCreator
        public static WakeMode fromKey(String key) {
            if ("now".equalsIgnoreCase(key))
                return NOW;
            return NEXT_HEARTBEAT;
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT, AGENT_TURN;

        @JsonValue
        public String key() {
            return this == SYSTEM_EVENT ? "systemEvent" : "agentTurn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if (key == null)
                return null;
            if ("agentTurn".equalsIgnoreCase(key))
                return AGENT_TURN;
            if ("systemEvent".equalsIgnoreCase(key))
                return SYSTEM_EVENT;
            throw new IllegalArgumentException("unknown payload kind: " + key);
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronPayload {
        private PayloadKind kind;
        /** systemEvent text. */
        private String text;
        /** agentTurn message. */
        private String message;
        private Integer timeoutSeconds;
        private Boolean deliver;
        private String provider;
        private String to;

        public static CronPayload systemEvent(String text) {
            return CronPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text(text).build();
        }

        public static CronPayload agentTurn(String message) {
            return CronPayload.builder().kind(PayloadKind.AGENT_TURN).message(message).build();
        }
    }

    // =========================================================================
    // Isolation / delivery
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronIsolation {
        /** Prefix of the summary line posted back to the main session. */
        private String postToMainPrefix;
    }

    public enum DeliveryMode {
        NONE, ANNOUNCE;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static DeliveryMode fromKey(String key) {
            if ("announce".equalsIgnoreCase(key) || "deliver".equalsIgnoreCase(key))
                return ANNOUNCE;
            return NONE;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronDelivery {
        private DeliveryMode mode;
        private String channel;
        private String to;
    }

    // =========================================================================
    // Run outcome
    // =========================================================================

    public enum RunStatus {
        RAN, SKIPPED, ERROR;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        /**
         * Collaborators report {@code ok}/{@code ran}, {@code skipped} or
         * {@code error}; anything unrecognized counts as an error.
         */
        @JsonCreator
        public static RunStatus fromKey(String key) {
            if (key == null)
                return ERROR;
            return switch (key.trim().toLowerCase()) {
                case "ok", "ran" -> RAN;
                case "skipped" -> SKIPPED;
                default -> ERROR;
            };
        }
    }

    public enum TriggerReason {
        DUE, FORCE;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static TriggerReason fromKey(String key) {
            if ("due".equalsIgnoreCase(key))
                return DUE;
            if (key == null || "force".equalsIgnoreCase(key))
                return FORCE;
            throw new IllegalArgumentException("unknown run mode: " + key);
        }
    }

    // =========================================================================
    // Job state
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronJobState {
        private Long nextRunAtMs;
        private Long lastRunAtMs;
        private RunStatus lastStatus;
        private String lastError;
        private Long lastDurationMs;
        /** Set while a run is in flight; never persisted. */
        @JsonIgnore
        private Long runningAtMs;
    }

    // =========================================================================
    // Job
    // =========================================================================

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronJob {
        private String id;
        private String agentId;
        private String name;
        private String description;
        private boolean enabled;
        private Boolean deleteAfterRun;
        private long createdAtMs;
        private long updatedAtMs;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronIsolation isolation;
        private CronDelivery delivery;
        private CronJobState state;
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CronJobCreate {
        private String agentId;
        private String name;
        private String description;
        /** Null means enabled. */
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronIsolation isolation;
        private CronDelivery delivery;
    }

    /**
     * Partial update; null fields are left unchanged.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CronJobPatch {
        private String agentId;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronIsolation isolation;
        private CronDelivery delivery;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CronStoreFile {
        @Builder.Default
        private int version = 1;
        private List<CronJob> jobs;
    }
}
