package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronSchedule;

/**
 * Due-time computation for the three schedule kinds.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * Next run of a job that is being created, re-enabled or rescheduled,
     * relative to {@code nowMs}. Null when the job is disabled or its schedule
     * cannot produce a future instant.
     */
    public static Long computeInitialNextRunAtMs(CronJob job, long nowMs, CronExpressions expressions) {
        return computeInitial(job, nowMs, expressions, true);
    }

    /**
     * Like {@link #computeInitialNextRunAtMs} for a schedule that was just
     * replaced: an AT job that fired for its old instant may fire again.
     */
    public static Long computeForNewSchedule(CronJob job, long nowMs, CronExpressions expressions) {
        return computeInitial(job, nowMs, expressions, false);
    }

    private static Long computeInitial(CronJob job, long nowMs, CronExpressions expressions, boolean atFiredIsTerminal) {
        if (!job.isEnabled() || job.getSchedule() == null) {
            return null;
        }
        CronSchedule schedule = job.getSchedule();
        return switch (schedule.getKind()) {
            case AT -> {
                if (atFiredIsTerminal && hasFired(job))
                    yield null;
                yield schedule.getAtMs() > nowMs ? schedule.getAtMs() : null;
            }
            case EVERY -> {
                long anchor = schedule.getAnchorMs() != null ? schedule.getAnchorMs() : job.getCreatedAtMs();
                if (nowMs < anchor)
                    yield anchor;
                yield nextBoundaryAfter(anchor, schedule.getEveryMs(), nowMs);
            }
            case CRON -> expressions.nextOccurrence(schedule.getExpr(), schedule.getTz(), nowMs);
        };
    }

    /**
     * Next run of a job that has just run, derived from the due instant it ran
     * for rather than from {@code nowMs}:
     * <ul>
     * <li>AT: terminal, always null.</li>
     * <li>EVERY: {@code previous + everyMs}; after a pause, the first grid
     * boundary strictly after {@code nowMs}. Missed ticks are not replayed.</li>
     * <li>CRON: first occurrence after the previous due instant, but never at
     * or before {@code nowMs}.</li>
     * </ul>
     * A forced run ahead of the due instant keeps the pending due instant.
     */
    public static Long computeNextRunAfterRun(CronJob job, Long previousNextRunAtMs, long nowMs,
            CronExpressions expressions) {
        if (!job.isEnabled() || job.getSchedule() == null) {
            return null;
        }
        CronSchedule schedule = job.getSchedule();
        return switch (schedule.getKind()) {
            case AT -> null;
            case EVERY -> {
                long base = previousNextRunAtMs != null ? previousNextRunAtMs : nowMs;
                if (base > nowMs)
                    yield base;
                yield nextBoundaryAfter(base, schedule.getEveryMs(), nowMs);
            }
            case CRON -> {
                if (previousNextRunAtMs != null && previousNextRunAtMs > nowMs)
                    yield previousNextRunAtMs;
                long after = previousNextRunAtMs != null ? Math.max(previousNextRunAtMs, nowMs) : nowMs;
                yield expressions.nextOccurrence(schedule.getExpr(), schedule.getTz(), after);
            }
        };
    }

    /**
     * Smallest {@code origin + k * everyMs} (k >= 1) strictly greater than
     * {@code nowMs}, or null when that instant does not fit in a long.
     */
    static Long nextBoundaryAfter(long origin, long everyMs, long nowMs) {
        try {
            if (nowMs < origin) {
                return Math.addExact(origin, everyMs);
            }
            long steps = Math.subtractExact(nowMs, origin) / everyMs + 1;
            return Math.addExact(origin, Math.multiplyExact(steps, everyMs));
        } catch (ArithmeticException e) {
            return null;
        }
    }

    static boolean hasFired(CronJob job) {
        return job.getState() != null && job.getState().getLastRunAtMs() != null;
    }
}
