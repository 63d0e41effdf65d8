package com.clawcron.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main-session heartbeat driver. Periodically invokes a heartbeat action, and
 * lets callers request an immediate heartbeat or run one synchronously.
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    /**
     * One heartbeat turn of the main session.
     */
    @FunctionalInterface
    public interface HeartbeatAction {
        HeartbeatResult run(String reason) throws Exception;
    }

    /**
     * Outcome of a heartbeat: {@code ran} or {@code skipped} (with a reason).
     */
    public record HeartbeatResult(String status, String reason) {
        public static HeartbeatResult ran() {
            return new HeartbeatResult("ran", null);
        }

        public static HeartbeatResult skipped(String reason) {
            return new HeartbeatResult("skipped", reason);
        }
    }

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean wakePending = new AtomicBoolean(false);
    private final Object turnLock = new Object();
    private final long intervalMs;
    private final HeartbeatAction action;
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param intervalMs interval between heartbeats in milliseconds (minimum 1s)
     * @param action     action to invoke on each heartbeat
     */
    public HeartbeatRunner(long intervalMs, HeartbeatAction action) {
        this.intervalMs = Math.max(1000, intervalMs);
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-runner");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Heartbeat runner already running");
            return;
        }
        scheduleNext();
        log.info("Heartbeat runner started (interval: {}ms)", intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.info("Heartbeat runner stopped");
    }

    /**
     * Request a heartbeat as soon as possible. Requests made while one is
     * already pending coalesce into that one.
     */
    public void requestNow(String reason) {
        if (!wakePending.compareAndSet(false, true)) {
            return;
        }
        scheduler.execute(() -> {
            wakePending.set(false);
            runOnce(reason);
        });
    }

    /**
     * Run one heartbeat on the caller's thread. Turns never overlap.
     */
    public HeartbeatResult runOnce(String reason) {
        synchronized (turnLock) {
            try {
                HeartbeatResult result = action.run(reason);
                return result != null ? result : HeartbeatResult.ran();
            } catch (Exception e) {
                log.error("Heartbeat action failed ({}): {}", reason, e.getMessage(), e);
                return HeartbeatResult.skipped(ErrorUtils.formatErrorMessage(e));
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce("interval");
        if (running.get()) {
            scheduleNext();
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
