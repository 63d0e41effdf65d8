package com.clawcron.common.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatRunnerTest {

    private HeartbeatRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
    }

    @Test
    void startAndStop() {
        runner = new HeartbeatRunner(60_000, reason -> HeartbeatRunner.HeartbeatResult.ran());
        assertFalse(runner.isRunning());
        runner.start();
        assertTrue(runner.isRunning());
        runner.stop();
        assertFalse(runner.isRunning());
    }

    @Test
    void requestNow_runsAsynchronouslyWithReason() throws Exception {
        var latch = new CountDownLatch(1);
        var seenReason = new AtomicReference<String>();

        runner = new HeartbeatRunner(60_000, reason -> {
            seenReason.set(reason);
            latch.countDown();
            return HeartbeatRunner.HeartbeatResult.ran();
        });

        runner.requestNow("cron:abc");

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals("cron:abc", seenReason.get());
    }

    @Test
    void runOnce_returnsActionResult() {
        runner = new HeartbeatRunner(60_000, reason -> HeartbeatRunner.HeartbeatResult.skipped("quiet-hours"));

        HeartbeatRunner.HeartbeatResult result = runner.runOnce("test");

        assertEquals("skipped", result.status());
        assertEquals("quiet-hours", result.reason());
    }

    @Test
    void runOnce_nullResultMeansRan() {
        runner = new HeartbeatRunner(60_000, reason -> null);
        assertEquals("ran", runner.runOnce("test").status());
    }

    @Test
    void runOnce_actionFailure_reportedAsSkipped() {
        var calls = new AtomicInteger();
        runner = new HeartbeatRunner(60_000, reason -> {
            calls.incrementAndGet();
            throw new IllegalStateException("model offline");
        });

        HeartbeatRunner.HeartbeatResult result = runner.runOnce("test");

        assertEquals(1, calls.get());
        assertEquals("skipped", result.status());
        assertEquals("model offline", result.reason());
    }

    @Test
    void minimumInterval_enforced() {
        runner = new HeartbeatRunner(100, reason -> null);
        assertEquals(1000, runner.getIntervalMs());
    }
}
