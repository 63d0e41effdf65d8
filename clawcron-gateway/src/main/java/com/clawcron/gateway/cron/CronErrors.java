package com.clawcron.gateway.cron;

/**
 * Cron service error taxonomy.
 */
public final class CronErrors {

    private CronErrors() {
    }

    /**
     * Base of every cron failure surfaced to callers.
     */
    public static class CronError extends RuntimeException {
        public CronError(String message) {
            super(message);
        }

        public CronError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Malformed job, schedule or payload; raised before any mutation. */
    public static class ValidationError extends CronError {
        public ValidationError(String message) {
            super(message);
        }
    }

    /** Unknown job id. */
    public static class NotFoundError extends CronError {
        private final String jobId;

        public NotFoundError(String jobId) {
            super("unknown cron job id: " + jobId);
            this.jobId = jobId;
        }

        public String getJobId() {
            return jobId;
        }
    }

    /** The store could not be written; the triggering mutation was not applied. */
    public static class StoreIOError extends CronError {
        public StoreIOError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The store file exists but does not hold a well-formed job list. */
    public static class StoreCorrupt extends CronError {
        public StoreCorrupt(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Payload dispatch failed or timed out. Recorded in the run log, never
     * thrown out of a run.
     */
    public static class ExecutionError extends CronError {
        public ExecutionError(String message) {
            super(message);
        }

        public ExecutionError(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
