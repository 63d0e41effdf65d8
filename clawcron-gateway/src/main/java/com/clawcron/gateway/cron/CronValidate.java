package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.clawcron.gateway.cron.CronTypes.PayloadKind;
import com.clawcron.gateway.cron.CronTypes.SessionTarget;

/**
 * Structural checks shared by job creation, patching and store loading.
 * Calendar expressions are checked separately against the configured
 * evaluator.
 */
final class CronValidate {

    /** 100 years. Longer intervals are rejected so due instants stay well inside a long. */
    static final long MAX_EVERY_MS = 100L * 365 * 24 * 60 * 60 * 1000;

    private CronValidate() {
    }

    /**
     * @throws CronErrors.ValidationError if the schedule lacks its kind or the
     *                                    field that kind needs
     */
    static void checkSchedule(CronSchedule schedule) {
        if (schedule == null || schedule.getKind() == null) {
            throw new CronErrors.ValidationError("schedule.kind is required (at | every | cron)");
        }
        switch (schedule.getKind()) {
            case AT -> {
                if (schedule.getAtMs() == null || schedule.getAtMs() <= 0)
                    throw new CronErrors.ValidationError("schedule.atMs must be a positive epoch ms");
            }
            case EVERY -> {
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0)
                    throw new CronErrors.ValidationError("schedule.everyMs must be positive");
                if (schedule.getEveryMs() > MAX_EVERY_MS)
                    throw new CronErrors.ValidationError("schedule.everyMs must not exceed " + MAX_EVERY_MS);
                if (schedule.getAnchorMs() != null && schedule.getAnchorMs() < 0)
                    throw new CronErrors.ValidationError("schedule.anchorMs must not be negative");
            }
            case CRON -> {
                if (schedule.getExpr() == null || schedule.getExpr().isBlank())
                    throw new CronErrors.ValidationError("schedule.expr is required");
            }
        }
    }

    /**
     * @throws CronErrors.ValidationError if the payload lacks its kind or the
     *                                    text/message that kind carries
     */
    static void checkPayload(CronPayload payload) {
        if (payload == null || payload.getKind() == null) {
            throw new CronErrors.ValidationError("payload.kind is required (systemEvent | agentTurn)");
        }
        switch (payload.getKind()) {
            case SYSTEM_EVENT -> {
                if (payload.getText() == null || payload.getText().isBlank())
                    throw new CronErrors.ValidationError("payload.text is required");
            }
            case AGENT_TURN -> {
                if (payload.getMessage() == null || payload.getMessage().isBlank())
                    throw new CronErrors.ValidationError("payload.message is required");
                if (payload.getTimeoutSeconds() != null && payload.getTimeoutSeconds() <= 0)
                    throw new CronErrors.ValidationError("payload.timeoutSeconds must be positive");
            }
        }
    }

    /**
     * Target used when none is given: agent turns run isolated, system events
     * go to the main session.
     */
    static SessionTarget defaultTarget(CronPayload payload) {
        return payload != null && payload.getKind() == PayloadKind.AGENT_TURN
                ? SessionTarget.ISOLATED
                : SessionTarget.MAIN;
    }

    static void checkTarget(SessionTarget target, CronPayload payload) {
        if (target == null) {
            throw new CronErrors.ValidationError("sessionTarget is required (main | isolated)");
        }
        if (target == SessionTarget.ISOLATED && payload.getKind() != PayloadKind.AGENT_TURN) {
            throw new CronErrors.ValidationError("isolated jobs require payload.kind=agentTurn");
        }
    }
}
