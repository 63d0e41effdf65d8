package com.clawcron.gateway.cron;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single outstanding timer, armed to the soonest due instant. Delays are
 * capped so the injected clock is re-read at least once a minute.
 */
@Slf4j
class CronTimer implements AutoCloseable {

    static final long MAX_DELAY_MS = 60_000L;

    private final ScheduledExecutorService scheduler;
    private final Runnable onFire;
    private ScheduledFuture<?> pending;
    private Long armedForMs;

    CronTimer(Runnable onFire) {
        this.onFire = onFire;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Replace any pending firing with one at {@code dueAtMs}.
     */
    synchronized void arm(long dueAtMs, long nowMs) {
        cancelPending();
        long delay = Math.min(Math.max(0L, dueAtMs - nowMs), MAX_DELAY_MS);
        armedForMs = dueAtMs;
        pending = scheduler.schedule(this::fire, delay, TimeUnit.MILLISECONDS);
        log.debug("cron timer armed for {} (in {}ms)", dueAtMs, delay);
    }

    synchronized void disarm() {
        cancelPending();
        armedForMs = null;
    }

    synchronized Long getArmedForMs() {
        return armedForMs;
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire() {
        synchronized (this) {
            pending = null;
            armedForMs = null;
        }
        try {
            onFire.run();
        } catch (RuntimeException e) {
            log.error("cron timer tick failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        disarm();
        scheduler.shutdownNow();
    }
}
