package com.clawcron.gateway.runtime;

import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.gateway.cron.CronState.HeartbeatDriver;
import com.clawcron.gateway.cron.CronState.HeartbeatRunResult;
import com.clawcron.gateway.cron.CronTypes.RunStatus;

/**
 * Exposes the main-session {@link HeartbeatRunner} to the cron service.
 */
public class HeartbeatBridge implements HeartbeatDriver {

    private final HeartbeatRunner runner;

    public HeartbeatBridge(HeartbeatRunner runner) {
        this.runner = runner;
    }

    @Override
    public void requestHeartbeatNow(String reason) {
        runner.requestNow(reason);
    }

    @Override
    public HeartbeatRunResult runHeartbeatOnce(String reason) {
        HeartbeatRunner.HeartbeatResult result = runner.runOnce(reason);
        return new HeartbeatRunResult(RunStatus.fromKey(result.status()), result.reason());
    }
}
