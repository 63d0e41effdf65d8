package com.clawcron.common.config;

import lombok.Data;

/**
 * Root configuration type, read from {@code clawcron.json}.
 */
@Data
public class ClawCronConfig {

    /** Default agent id for jobs that do not name one. */
    private String agentId;

    /** Cron/scheduling settings. */
    private CronConfig cron;

    /** Main-session heartbeat settings. */
    private HeartbeatConfig heartbeat;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        /** Service-wide kill switch for automatic firing. */
        private boolean enabled = true;
        /** Store file path; {@code ~} is expanded. Null means the state dir default. */
        private String store;
        /** Cap of the per-job run log ring. */
        private int maxRunLogEntries = 200;
    }

    @Data
    public static class HeartbeatConfig {
        private long everyMs = 30 * 60_000L;
    }

    @Data
    public static class LoggingConfig {
        /** silent | error | warn | info | debug | trace */
        private String level = "info";
    }
}
