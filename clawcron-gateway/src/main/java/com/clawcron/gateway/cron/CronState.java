package com.clawcron.gateway.cron;

import com.clawcron.common.logging.SubsystemLogger;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Cron service dependencies, collaborator interfaces, events and result
 * types.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Collaborators
    // =========================================================================

    /**
     * Delivers a system event into the host's event queue for an agent's main
     * session.
     */
    @FunctionalInterface
    public interface SystemEventSink {
        void enqueue(String text, String agentId);
    }

    /**
     * Main-session turn driver.
     */
    public interface HeartbeatDriver {
        /** Ask for a heartbeat soon; returns immediately. */
        void requestHeartbeatNow(String reason);

        /** Run one heartbeat turn and wait for it. */
        HeartbeatRunResult runHeartbeatOnce(String reason) throws Exception;
    }

    public record HeartbeatRunResult(RunStatus status, String reason) {
    }

    /**
     * Isolated execution driver. Runs an agent turn in a session of its own.
     */
    @FunctionalInterface
    public interface IsolatedAgentRunner {
        IsolatedRunResult run(IsolatedAgentRequest request) throws Exception;
    }

    /**
     * Everything the isolated runner needs: the job (with its full payload),
     * the message, and the resolved delivery plan passed through untouched.
     */
    public record IsolatedAgentRequest(CronJob job, String message, CronDeliveryResolver.DeliveryPlan delivery) {
    }

    /**
     * @param status  {@code ok}, {@code skipped} or {@code error}
     * @param summary short outcome text, posted back to the main session
     * @param error   failure detail when status is {@code error}
     */
    public record IsolatedRunResult(String status, String summary, String error) {
        public static IsolatedRunResult ok(String summary) {
            return new IsolatedRunResult("ok", summary, null);
        }

        public static IsolatedRunResult skipped(String reason) {
            return new IsolatedRunResult("skipped", null, reason);
        }
    }

    // =========================================================================
    // Event types
    // =========================================================================

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronEvent {
        private String jobId;
        /** "added" | "updated" | "removed" | "started" | "finished" */
        private String action;
        private Long runAtMs;
        private Long durationMs;
        private RunStatus status;
        private String error;
        private String summary;
        private Long nextRunAtMs;
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies for cron service initialization.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private Path storePath;
        /** Directory of per-job run log files; defaults to {@code <store dir>/runs}. */
        private Path runLogDir;
        @Builder.Default
        private boolean cronEnabled = true;
        @Builder.Default
        private LongSupplier nowMs = System::currentTimeMillis;
        @Builder.Default
        private SubsystemLogger log = SubsystemLogger.create("cron");
        private SystemEventSink systemEvents;
        private HeartbeatDriver heartbeat;
        private IsolatedAgentRunner isolatedRunner;
        @Builder.Default
        private CronExpressions expressions = CronExpressions.unix();
        @Builder.Default
        private int maxRunLogEntries = CronRunLog.DEFAULT_MAX_ENTRIES;
        private String defaultAgentId;
        private Consumer<CronEvent> onEvent;
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /** Result of a run request. */
    public sealed interface CronRunResult {
        boolean ran();
    }

    public record CronRan(CronRunLogEntry entry) implements CronRunResult {
        @Override
        public boolean ran() {
            return true;
        }
    }

    public record CronNotDue(String reason) implements CronRunResult {
        @Override
        public boolean ran() {
            return false;
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    public record CronLastError(String jobId, Long atMs, String error) {
    }

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronStatusSummary {
        /** Kill switch state. */
        private boolean enabled;
        private String storePath;
        private int total;
        private int enabledJobs;
        private Long nextDueMs;
        private List<String> running;
        private CronLastError lastError;
    }
}
