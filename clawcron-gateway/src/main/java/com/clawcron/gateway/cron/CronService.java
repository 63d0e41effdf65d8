package com.clawcron.gateway.cron;

import com.clawcron.common.infra.ErrorUtils;
import com.clawcron.common.logging.SubsystemLogger;
import com.clawcron.gateway.cron.CronState.CronEvent;
import com.clawcron.gateway.cron.CronState.CronLastError;
import com.clawcron.gateway.cron.CronState.CronNotDue;
import com.clawcron.gateway.cron.CronState.CronRan;
import com.clawcron.gateway.cron.CronState.CronRunResult;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.cron.CronState.CronStatusSummary;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronJobCreate;
import com.clawcron.gateway.cron.CronTypes.CronJobPatch;
import com.clawcron.gateway.cron.CronTypes.CronJobState;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.ScheduleKind;
import com.clawcron.gateway.cron.CronTypes.TriggerReason;
import com.clawcron.gateway.cron.CronTypes.WakeMode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages cron jobs: CRUD, persistence, due detection and execution.
 *
 * <p>
 * Locking: every mutation of a job (add, update, remove, run) holds that job's
 * lock for the whole mutate-execute-reschedule-persist sequence, so an update
 * issued during a run is applied only after the run has been rescheduled and
 * saved. {@code storeLock} guards the in-memory job list and the store file
 * and is only ever taken after a job lock, never before. Jobs with different
 * ids run concurrently.
 * </p>
 *
 * <p>
 * The in-memory list always equals what was last saved: mutations are made on
 * copies and swapped in only after {@link CronStore#save} succeeds.
 * </p>
 */
public class CronService implements AutoCloseable {

    private final CronServiceDeps deps;
    private final SubsystemLogger log;
    private final CronStore store;
    private final CronRunLog runLog;
    private final CronExecutor executor;
    private final CronTimer timer;
    private final ExecutorService workers;
    private final ExecutorService isolatedPool;

    private final Map<String, ReentrantLock> jobLocks = new ConcurrentHashMap<>();
    private final Set<String> queuedDueRuns = ConcurrentHashMap.newKeySet();
    private final ReentrantLock storeLock = new ReentrantLock();

    /** Guarded by storeLock; null until first loaded. */
    private List<CronJob> jobs;
    private volatile boolean started;
    private volatile boolean stopped;

    public CronService(CronServiceDeps deps) {
        this.deps = Objects.requireNonNull(deps, "deps");
        Objects.requireNonNull(deps.getStorePath(), "storePath");
        this.log = deps.getLog();
        this.store = new CronStore(deps.getStorePath());
        Path runDir = deps.getRunLogDir() != null
                ? deps.getRunLogDir()
                : deps.getStorePath().toAbsolutePath().getParent().resolve("runs");
        this.runLog = new CronRunLog(runDir, deps.getMaxRunLogEntries());
        this.workers = Executors.newCachedThreadPool(daemonThreads("cron-worker"));
        this.isolatedPool = Executors.newCachedThreadPool(daemonThreads("cron-isolated"));
        this.executor = new CronExecutor(deps, isolatedPool);
        this.timer = new CronTimer(this::onTimer);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load the store, fill in missing due instants and arm the timer.
     *
     * @throws CronErrors.StoreCorrupt if the store cannot be parsed; nothing is
     *                                 armed and the file is left untouched
     */
    public void start() {
        storeLock.lock();
        try {
            ensureLoaded();
            repairNextRuns();
            stopped = false;
            started = true;
        } finally {
            storeLock.unlock();
        }
        if (!deps.isCronEnabled()) {
            log.info("cron: automatic firing disabled", Map.of("storePath", store.getStorePath()));
            return;
        }
        armTimer();
        log.info("cron: started", Map.of(
                "jobs", jobsSnapshotSize(),
                "nextWakeAtMs", String.valueOf(timer.getArmedForMs())));
    }

    /**
     * Disarm the timer. In-flight runs complete; nothing new is fired.
     */
    public void stop() {
        stopped = true;
        timer.disarm();
        log.info("cron: stopped");
    }

    @Override
    public void close() {
        stop();
        timer.close();
        workers.shutdown();
        isolatedPool.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        isolatedPool.shutdownNow();
    }

    // =========================================================================
    // Operations
    // =========================================================================

    /**
     * Validate and create a job.
     *
     * @throws CronErrors.ValidationError for an empty name or a malformed
     *                                    schedule/payload
     * @throws CronErrors.StoreIOError    if the store could not be written
     */
    public CronJob add(CronJobCreate input) {
        if (input == null) {
            throw new CronErrors.ValidationError("job is required");
        }
        long now = now();
        CronPayload payload = input.getPayload();
        CronJob job = CronJob.builder()
                .id(UUID.randomUUID().toString())
                .agentId(blankToNull(input.getAgentId()) != null ? input.getAgentId().trim() : deps.getDefaultAgentId())
                .name(input.getName() != null ? input.getName().trim() : null)
                .description(blankToNull(input.getDescription()))
                .enabled(input.getEnabled() == null || input.getEnabled())
                .deleteAfterRun(input.getDeleteAfterRun())
                .createdAtMs(now)
                .updatedAtMs(now)
                .schedule(input.getSchedule())
                .sessionTarget(input.getSessionTarget() != null ? input.getSessionTarget() : CronValidate.defaultTarget(payload))
                .wakeMode(input.getWakeMode() != null ? input.getWakeMode() : WakeMode.NEXT_HEARTBEAT)
                .payload(payload)
                .isolation(input.getIsolation())
                .delivery(input.getDelivery())
                .state(new CronJobState())
                .build();
        validate(job);
        job = CronJson.copy(job);
        job.getState().setNextRunAtMs(initialNextRun(job, now, false));

        ReentrantLock lock = lockFor(job.getId());
        lock.lock();
        try {
            storeLock.lock();
            try {
                ensureLoaded();
                List<CronJob> next = new ArrayList<>(jobs);
                next.add(job);
                commit(next);
            } finally {
                storeLock.unlock();
            }
        } finally {
            lock.unlock();
        }
        log.info("cron job added", Map.of("jobId", job.getId(), "name", job.getName(),
                "nextRunAtMs", String.valueOf(job.getState().getNextRunAtMs())));
        emit(CronEvent.builder().jobId(job.getId()).action("added")
                .nextRunAtMs(job.getState().getNextRunAtMs()).build());
        armTimer();
        return CronJson.copy(job);
    }

    /**
     * Merge {@code patch} into a job. Waits for any in-flight run of the same
     * job to finish and be rescheduled first.
     *
     * @throws CronErrors.NotFoundError   for an unknown id
     * @throws CronErrors.ValidationError if the patched job is malformed
     * @throws CronErrors.StoreIOError    if the store could not be written
     */
    public CronJob update(String id, CronJobPatch patch) {
        if (patch == null) {
            throw new CronErrors.ValidationError("patch is required");
        }
        CronJob updated;
        ReentrantLock lock = lockForExisting(id);
        lock.lock();
        try {
            storeLock.lock();
            try {
                ensureLoaded();
                CronJob current = findLocked(id, lock);
                updated = CronJson.copy(current);
                boolean scheduleChanged = applyPatch(updated, patch);
                validate(updated);

                long now = now();
                Long nextRunAtMs;
                if (!updated.isEnabled()) {
                    nextRunAtMs = null;
                } else if (scheduleChanged) {
                    nextRunAtMs = initialNextRun(updated, now, true);
                } else if (!current.isEnabled() || updated.getState().getNextRunAtMs() == null) {
                    nextRunAtMs = initialNextRun(updated, now, false);
                } else {
                    nextRunAtMs = updated.getState().getNextRunAtMs();
                }
                updated.getState().setNextRunAtMs(nextRunAtMs);
                updated.setUpdatedAtMs(now);

                commit(replace(jobs, updated));
            } finally {
                storeLock.unlock();
            }
        } finally {
            lock.unlock();
        }
        log.info("cron job updated", Map.of("jobId", id, "enabled", updated.isEnabled(),
                "nextRunAtMs", String.valueOf(updated.getState().getNextRunAtMs())));
        emit(CronEvent.builder().jobId(id).action("updated")
                .nextRunAtMs(updated.getState().getNextRunAtMs()).build());
        armTimer();
        return CronJson.copy(updated);
    }

    /**
     * Delete a job and its run log.
     *
     * @throws CronErrors.NotFoundError for an unknown id
     */
    public void remove(String id) {
        ReentrantLock lock = lockForExisting(id);
        lock.lock();
        try {
            storeLock.lock();
            try {
                ensureLoaded();
                findLocked(id, lock);
                List<CronJob> next = new ArrayList<>(jobs);
                next.removeIf(j -> j.getId().equals(id));
                commit(next);
            } finally {
                storeLock.unlock();
            }
            runLog.discard(id);
            jobLocks.remove(id, lock);
        } finally {
            lock.unlock();
        }
        log.info("cron job removed", Map.of("jobId", id));
        emit(CronEvent.builder().jobId(id).action("removed").build());
        armTimer();
    }

    /**
     * Snapshot of jobs ordered by next due instant (unscheduled jobs last).
     */
    public List<CronJob> list(boolean includeDisabled) {
        storeLock.lock();
        try {
            ensureLoaded();
            return jobs.stream()
                    .filter(j -> includeDisabled || j.isEnabled())
                    .sorted(Comparator.comparing((CronJob j) -> j.getState().getNextRunAtMs(),
                            Comparator.nullsLast(Comparator.naturalOrder())))
                    .map(CronJson::copy)
                    .toList();
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Snapshot of a single job.
     */
    public CronJob get(String id) {
        storeLock.lock();
        try {
            ensureLoaded();
            return CronJson.copy(find(id));
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Run a job. {@link TriggerReason#DUE} runs only an enabled job whose due
     * instant has passed, and only while automatic firing is on;
     * {@link TriggerReason#FORCE} always runs.
     *
     * <p>
     * A run appends exactly one run log entry. Dispatch failures are recorded,
     * not thrown. The job is rescheduled from its {@code enabled} flag as it
     * stands after the run.
     * </p>
     *
     * @throws CronErrors.NotFoundError for an unknown id
     * @throws CronErrors.StoreIOError  if the post-run state could not be saved;
     *                                  the run log entry is still recorded
     */
    public CronRunResult run(String id, TriggerReason reason) {
        TriggerReason trigger = reason != null ? reason : TriggerReason.FORCE;
        ReentrantLock lock = lockForExisting(id);
        lock.lock();
        try {
            CronJob snapshot;
            Long previousNextRunAtMs;
            long startedAtMs;

            storeLock.lock();
            try {
                ensureLoaded();
                CronJob current = findLocked(id, lock);
                startedAtMs = now();
                if (trigger == TriggerReason.DUE) {
                    if (!deps.isCronEnabled()) {
                        return new CronNotDue("cron-disabled");
                    }
                    Long next = current.getState().getNextRunAtMs();
                    if (!current.isEnabled() || next == null || next > startedAtMs) {
                        return new CronNotDue("not-due");
                    }
                }
                previousNextRunAtMs = current.getState().getNextRunAtMs();
                current.getState().setRunningAtMs(startedAtMs);
                snapshot = CronJson.copy(current);
            } finally {
                storeLock.unlock();
            }

            try {
                log.info("cron job started", Map.of("jobId", id, "trigger", trigger.key()));
                emit(CronEvent.builder().jobId(id).action("started").runAtMs(startedAtMs).build());

                CronExecutor.Outcome outcome = executor.execute(snapshot);
                long finishedAtMs = now();

                CronRunLogEntry entry = finishRun(id, snapshot, trigger, outcome, previousNextRunAtMs,
                        startedAtMs, finishedAtMs);
                return new CronRan(entry);
            } finally {
                clearRunning(id);
            }
        } finally {
            lock.unlock();
            armTimer();
        }
    }

    /**
     * Most recent run log entries of a job, newest first. Unknown or removed
     * jobs have none.
     */
    public List<CronRunLogEntry> runs(String id, int limit) {
        return runLog.read(id, limit);
    }

    /**
     * Aggregate counts for diagnostics.
     */
    public CronStatusSummary status() {
        storeLock.lock();
        try {
            ensureLoaded();
            Long nextDue = null;
            int enabled = 0;
            CronLastError lastError = null;
            List<String> running = new ArrayList<>();
            for (CronJob job : jobs) {
                CronJobState state = job.getState();
                if (job.isEnabled()) {
                    enabled++;
                    if (state.getNextRunAtMs() != null
                            && (nextDue == null || state.getNextRunAtMs() < nextDue)) {
                        nextDue = state.getNextRunAtMs();
                    }
                }
                if (state.getRunningAtMs() != null) {
                    running.add(job.getId());
                }
                if (state.getLastStatus() == RunStatus.ERROR && state.getLastRunAtMs() != null
                        && (lastError == null || state.getLastRunAtMs() > lastError.atMs())) {
                    lastError = new CronLastError(job.getId(), state.getLastRunAtMs(), state.getLastError());
                }
            }
            return CronStatusSummary.builder()
                    .enabled(deps.isCronEnabled())
                    .storePath(store.getStorePath().toString())
                    .total(jobs.size())
                    .enabledJobs(enabled)
                    .nextDueMs(nextDue)
                    .running(running)
                    .lastError(lastError)
                    .build();
        } finally {
            storeLock.unlock();
        }
    }

    public boolean isCronEnabled() {
        return deps.isCronEnabled();
    }

    // =========================================================================
    // Timer
    // =========================================================================

    /**
     * Timer callback: queue every due job on the worker pool, then rearm.
     */
    void onTimer() {
        if (stopped || !started || !deps.isCronEnabled()) {
            return;
        }
        List<String> due = new ArrayList<>();
        storeLock.lock();
        try {
            long now = now();
            for (CronJob job : jobs) {
                Long next = job.getState().getNextRunAtMs();
                if (job.isEnabled() && next != null && next <= now
                        && job.getState().getRunningAtMs() == null
                        && !queuedDueRuns.contains(job.getId())) {
                    due.add(job.getId());
                }
            }
        } finally {
            storeLock.unlock();
        }
        for (String id : due) {
            queuedDueRuns.add(id);
            workers.execute(() -> {
                try {
                    run(id, TriggerReason.DUE);
                } catch (CronErrors.CronError e) {
                    log.error("cron due run failed", Map.of("jobId", id, "error", e.getMessage()));
                } finally {
                    queuedDueRuns.remove(id);
                    armTimer();
                }
            });
        }
        if (!due.isEmpty()) {
            log.debug("cron timer fired", Map.of("due", due.size()));
        }
        armTimer();
    }

    /**
     * Arm the timer to the soonest due instant among jobs not already queued or
     * running.
     */
    void armTimer() {
        if (stopped || !started || !deps.isCronEnabled()) {
            return;
        }
        Long soonest = null;
        storeLock.lock();
        try {
            if (jobs == null) {
                return;
            }
            for (CronJob job : jobs) {
                Long next = job.getState().getNextRunAtMs();
                if (!job.isEnabled() || next == null || job.getState().getRunningAtMs() != null
                        || queuedDueRuns.contains(job.getId())) {
                    continue;
                }
                if (soonest == null || next < soonest) {
                    soonest = next;
                }
            }
        } finally {
            storeLock.unlock();
        }
        if (soonest == null) {
            timer.disarm();
        } else {
            timer.arm(soonest, now());
        }
    }

    Long getArmedForMs() {
        return timer.getArmedForMs();
    }

    int jobLockCount() {
        return jobLocks.size();
    }

    // =========================================================================
    // Internals
    // =========================================================================

    /**
     * Record the outcome, reschedule from the job's current state and persist.
     * Caller holds the job lock.
     */
    private CronRunLogEntry finishRun(String id, CronJob snapshot, TriggerReason trigger,
            CronExecutor.Outcome outcome, Long previousNextRunAtMs, long startedAtMs, long finishedAtMs) {
        CronRunLogEntry entry;
        boolean deleteJob;
        storeLock.lock();
        try {
            CronJob current = find(id);
            CronJob updated = CronJson.copy(current);
            updated.getState().setRunningAtMs(null);

            CronJobState state = updated.getState();
            state.setLastRunAtMs(startedAtMs);
            state.setLastStatus(outcome.status());
            state.setLastError(outcome.status() == RunStatus.ERROR ? outcome.error() : null);
            state.setLastDurationMs(finishedAtMs - startedAtMs);
            state.setNextRunAtMs(nextRunAfter(updated, previousNextRunAtMs, finishedAtMs));
            updated.setUpdatedAtMs(finishedAtMs);

            deleteJob = updated.getSchedule().getKind() == ScheduleKind.AT
                    && Boolean.TRUE.equals(updated.getDeleteAfterRun())
                    && outcome.status() == RunStatus.RAN;

            entry = CronRunLogEntry.builder()
                    .jobId(id)
                    .jobName(snapshot.getName())
                    .startedAtMs(startedAtMs)
                    .finishedAtMs(finishedAtMs)
                    .durationMs(finishedAtMs - startedAtMs)
                    .status(outcome.status())
                    .summary(outcome.summary())
                    .error(outcome.error())
                    .triggerReason(trigger)
                    .nextRunAtMs(deleteJob ? null : state.getNextRunAtMs())
                    .build();
            runLog.append(entry);

            if (deleteJob) {
                List<CronJob> next = new ArrayList<>(jobs);
                next.removeIf(j -> j.getId().equals(id));
                commit(next);
            } else {
                commit(replace(jobs, updated));
            }
        } finally {
            storeLock.unlock();
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("jobId", id);
        meta.put("status", outcome.status().key());
        meta.put("durationMs", finishedAtMs - startedAtMs);
        meta.put("nextRunAtMs", String.valueOf(entry.getNextRunAtMs()));
        if (outcome.error() != null) {
            meta.put("error", outcome.error());
        }
        log.info("cron job finished", meta);
        emit(CronEvent.builder().jobId(id).action("finished")
                .runAtMs(startedAtMs)
                .durationMs(finishedAtMs - startedAtMs)
                .status(outcome.status())
                .error(outcome.error())
                .summary(outcome.summary())
                .nextRunAtMs(entry.getNextRunAtMs())
                .build());
        if (deleteJob) {
            log.info("cron job removed after run", Map.of("jobId", id));
            emit(CronEvent.builder().jobId(id).action("removed").build());
        }
        return entry;
    }

    private void clearRunning(String id) {
        storeLock.lock();
        try {
            for (CronJob job : jobs) {
                if (job.getId().equals(id)) {
                    job.getState().setRunningAtMs(null);
                }
            }
        } finally {
            storeLock.unlock();
        }
    }

    /**
     * Fill in due instants of enabled jobs that have none, and clear those of
     * disabled jobs. Runs once at start; a failed save keeps the loaded state.
     */
    private void repairNextRuns() {
        long now = now();
        List<CronJob> next = new ArrayList<>(jobs.size());
        boolean changed = false;
        for (CronJob job : jobs) {
            Long current = job.getState().getNextRunAtMs();
            Long wanted = current;
            if (!job.isEnabled()) {
                wanted = null;
            } else if (current == null) {
                wanted = initialNextRun(job, now, false);
            }
            if (!Objects.equals(current, wanted)) {
                CronJob copy = CronJson.copy(job);
                copy.getState().setNextRunAtMs(wanted);
                next.add(copy);
                changed = true;
            } else {
                next.add(job);
            }
        }
        if (!changed) {
            return;
        }
        try {
            commit(next);
        } catch (CronErrors.StoreIOError e) {
            log.error("cron: failed to persist recomputed schedule", Map.of("error", e.getMessage()));
        }
    }

    private Long initialNextRun(CronJob job, long now, boolean scheduleReplaced) {
        try {
            return scheduleReplaced
                    ? CronSchedules.computeForNewSchedule(job, now, deps.getExpressions())
                    : CronSchedules.computeInitialNextRunAtMs(job, now, deps.getExpressions());
        } catch (IllegalArgumentException e) {
            log.warn("cron: cannot compute next run", Map.of("jobId", String.valueOf(job.getId()),
                    "error", ErrorUtils.formatErrorMessage(e)));
            return null;
        }
    }

    private Long nextRunAfter(CronJob job, Long previousNextRunAtMs, long now) {
        try {
            return CronSchedules.computeNextRunAfterRun(job, previousNextRunAtMs, now, deps.getExpressions());
        } catch (IllegalArgumentException e) {
            log.warn("cron: cannot compute next run", Map.of("jobId", job.getId(),
                    "error", ErrorUtils.formatErrorMessage(e)));
            return null;
        }
    }

    /**
     * Apply non-null patch fields. Same-kind schedule/payload patches merge
     * field by field; a different kind replaces the whole value.
     *
     * @return whether the schedule changed
     */
    private static boolean applyPatch(CronJob job, CronJobPatch patch) {
        if (patch.getName() != null)
            job.setName(patch.getName().trim());
        if (patch.getDescription() != null)
            job.setDescription(blankToNull(patch.getDescription()));
        if (patch.getAgentId() != null)
            job.setAgentId(blankToNull(patch.getAgentId()));
        if (patch.getEnabled() != null)
            job.setEnabled(patch.getEnabled());
        if (patch.getDeleteAfterRun() != null)
            job.setDeleteAfterRun(patch.getDeleteAfterRun());
        if (patch.getSessionTarget() != null)
            job.setSessionTarget(patch.getSessionTarget());
        if (patch.getWakeMode() != null)
            job.setWakeMode(patch.getWakeMode());
        if (patch.getIsolation() != null)
            job.setIsolation(patch.getIsolation());
        if (patch.getDelivery() != null)
            job.setDelivery(patch.getDelivery());
        if (patch.getPayload() != null)
            job.setPayload(mergePayload(job.getPayload(), patch.getPayload()));

        if (patch.getSchedule() == null) {
            return false;
        }
        CronSchedule before = job.getSchedule();
        CronSchedule after = mergeSchedule(before, patch.getSchedule());
        job.setSchedule(after);
        return !Objects.equals(before, after);
    }

    private static CronPayload mergePayload(CronPayload base, CronPayload patch) {
        if (base == null || (patch.getKind() != null && patch.getKind() != base.getKind())) {
            return patch;
        }
        CronPayload.CronPayloadBuilder merged = base.toBuilder();
        if (patch.getText() != null)
            merged.text(patch.getText());
        if (patch.getMessage() != null)
            merged.message(patch.getMessage());
        if (patch.getTimeoutSeconds() != null)
            merged.timeoutSeconds(patch.getTimeoutSeconds());
        if (patch.getDeliver() != null)
            merged.deliver(patch.getDeliver());
        if (patch.getProvider() != null)
            merged.provider(patch.getProvider());
        if (patch.getTo() != null)
            merged.to(patch.getTo());
        return merged.build();
    }

    private static CronSchedule mergeSchedule(CronSchedule base, CronSchedule patch) {
        if (base == null || (patch.getKind() != null && patch.getKind() != base.getKind())) {
            return patch;
        }
        CronSchedule.CronScheduleBuilder merged = base.toBuilder();
        if (patch.getAtMs() != null)
            merged.atMs(patch.getAtMs());
        if (patch.getEveryMs() != null)
            merged.everyMs(patch.getEveryMs());
        if (patch.getAnchorMs() != null)
            merged.anchorMs(patch.getAnchorMs());
        if (patch.getExpr() != null)
            merged.expr(patch.getExpr());
        if (patch.getTz() != null)
            merged.tz(patch.getTz());
        return merged.build();
    }

    private void validate(CronJob job) {
        if (job.getName() == null || job.getName().isBlank()) {
            throw new CronErrors.ValidationError("name is required");
        }
        CronSchedule schedule = job.getSchedule();
        CronValidate.checkSchedule(schedule);
        if (schedule.getKind() == ScheduleKind.CRON) {
            try {
                deps.getExpressions().validate(schedule.getExpr(), schedule.getTz());
            } catch (IllegalArgumentException e) {
                throw new CronErrors.ValidationError("invalid cron schedule: "
                        + ErrorUtils.formatErrorMessage(e));
            }
        }
        CronValidate.checkPayload(job.getPayload());
        CronValidate.checkTarget(job.getSessionTarget(), job.getPayload());
    }

    /** Caller holds storeLock. */
    private void ensureLoaded() {
        if (jobs == null) {
            jobs = store.load();
            log.info("cron store loaded", Map.of("storePath", store.getStorePath(), "jobs", jobs.size()));
        }
    }

    /** Caller holds storeLock. */
    private CronJob find(String id) {
        if (id != null) {
            for (CronJob job : jobs) {
                if (job.getId().equals(id)) {
                    return job;
                }
            }
        }
        throw new CronErrors.NotFoundError(id);
    }

    /**
     * Save, then swap in. Caller holds storeLock.
     */
    private void commit(List<CronJob> next) {
        try {
            store.save(next);
        } catch (CronErrors.StoreIOError e) {
            log.error("cron store save failed", Map.of("error", e.getMessage()));
            throw e;
        }
        jobs = next;
    }

    private static List<CronJob> replace(List<CronJob> list, CronJob job) {
        List<CronJob> next = new ArrayList<>(list.size());
        for (CronJob existing : list) {
            next.add(existing.getId().equals(job.getId()) ? job : existing);
        }
        return next;
    }

    private ReentrantLock lockFor(String id) {
        return jobLocks.computeIfAbsent(id, k -> new ReentrantLock());
    }

    /**
     * Lock of a job that exists now. Unknown ids never get a map entry.
     *
     * @throws CronErrors.NotFoundError for an unknown id
     */
    private ReentrantLock lockForExisting(String id) {
        storeLock.lock();
        try {
            ensureLoaded();
            find(id);
        } finally {
            storeLock.unlock();
        }
        return lockFor(id);
    }

    /**
     * {@link #find} for a caller holding {@code lock}; drops the lock entry if
     * the job was removed while the caller waited for it. Caller holds
     * storeLock.
     */
    private CronJob findLocked(String id, ReentrantLock lock) {
        try {
            return find(id);
        } catch (CronErrors.NotFoundError e) {
            jobLocks.remove(id, lock);
            throw e;
        }
    }

    private int jobsSnapshotSize() {
        storeLock.lock();
        try {
            return jobs != null ? jobs.size() : 0;
        } finally {
            storeLock.unlock();
        }
    }

    private void emit(CronEvent event) {
        if (deps.getOnEvent() == null) {
            return;
        }
        try {
            deps.getOnEvent().accept(event);
        } catch (RuntimeException e) {
            log.warn("cron event listener failed", Map.of("action", event.getAction(),
                    "error", ErrorUtils.formatErrorMessage(e)));
        }
    }

    private long now() {
        return deps.getNowMs().getAsLong();
    }

    private static String blankToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
