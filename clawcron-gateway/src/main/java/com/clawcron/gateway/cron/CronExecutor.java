package com.clawcron.gateway.cron;

import com.clawcron.common.infra.ErrorUtils;
import com.clawcron.common.logging.SubsystemLogger;
import com.clawcron.gateway.cron.CronErrors.ExecutionError;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.cron.CronState.HeartbeatRunResult;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRequest;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.WakeMode;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a job's payload to the matching collaborator and turns the
 * result into a run outcome. Never throws: failures become
 * {@link RunStatus#ERROR} outcomes.
 */
class CronExecutor {

    static final String DEFAULT_POST_PREFIX = "Cron";

    /**
     * What a run produced.
     */
    record Outcome(RunStatus status, String summary, String error) {
        static Outcome ran(String summary) {
            return new Outcome(RunStatus.RAN, summary, null);
        }

        static Outcome failed(String error) {
            return new Outcome(RunStatus.ERROR, null, error);
        }
    }

    private final CronServiceDeps deps;
    private final ExecutorService isolatedPool;
    private final SubsystemLogger log;

    CronExecutor(CronServiceDeps deps, ExecutorService isolatedPool) {
        this.deps = deps;
        this.isolatedPool = isolatedPool;
        this.log = deps.getLog().child("exec");
    }

    Outcome execute(CronJob job) {
        try {
            CronPayload payload = job.getPayload();
            return switch (payload.getKind()) {
                case SYSTEM_EVENT -> runSystemEvent(job, payload);
                case AGENT_TURN -> switch (job.getSessionTarget()) {
                    case MAIN -> runMainTurn(job, payload);
                    case ISOLATED -> runIsolatedTurn(job, payload);
                };
            };
        } catch (ExecutionError e) {
            log.warn("cron job failed", Map.of("jobId", job.getId(), "error", e.getMessage()));
            return Outcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            String error = ErrorUtils.formatErrorMessage(e);
            log.error("cron job dispatch crashed", Map.of("jobId", job.getId(), "error", error));
            return Outcome.failed(error);
        }
    }

    // -----------------------------------------------------------------------
    // systemEvent
    // -----------------------------------------------------------------------

    private Outcome runSystemEvent(CronJob job, CronPayload payload) {
        enqueue(payload.getText(), job);
        if (job.getWakeMode() == WakeMode.NOW) {
            wake(job);
        }
        return Outcome.ran(null);
    }

    // -----------------------------------------------------------------------
    // agentTurn in the main session
    // -----------------------------------------------------------------------

    private Outcome runMainTurn(CronJob job, CronPayload payload) {
        if (deps.getHeartbeat() == null) {
            throw new ExecutionError("main-session heartbeat unavailable");
        }
        enqueue(payload.getMessage(), job);
        HeartbeatRunResult result;
        try {
            result = deps.getHeartbeat().runHeartbeatOnce(reasonFor(job));
        } catch (Exception e) {
            throw new ExecutionError(ErrorUtils.formatErrorMessage(e), e);
        }
        if (result == null || result.status() == null) {
            return Outcome.ran(null);
        }
        return switch (result.status()) {
            case RAN -> Outcome.ran(result.reason());
            case SKIPPED -> new Outcome(RunStatus.SKIPPED, result.reason(), null);
            case ERROR -> Outcome.failed(result.reason() != null ? result.reason() : "heartbeat failed");
        };
    }

    // -----------------------------------------------------------------------
    // agentTurn in an isolated session
    // -----------------------------------------------------------------------

    private Outcome runIsolatedTurn(CronJob job, CronPayload payload) {
        if (deps.getIsolatedRunner() == null) {
            throw new ExecutionError("isolated agent runner unavailable");
        }
        IsolatedAgentRequest request = new IsolatedAgentRequest(
                job, payload.getMessage(), CronDeliveryResolver.resolve(job));

        CompletableFuture<IsolatedRunResult> future = CompletableFuture.supplyAsync(() -> {
            try {
                return deps.getIsolatedRunner().run(request);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, isolatedPool);

        IsolatedRunResult result = await(future, payload.getTimeoutSeconds());
        Outcome outcome = toOutcome(result);
        postToMain(job, outcome);
        return outcome;
    }

    private IsolatedRunResult await(CompletableFuture<IsolatedRunResult> future, Integer timeoutSeconds) {
        try {
            if (timeoutSeconds != null && timeoutSeconds > 0) {
                return future.get(timeoutSeconds, TimeUnit.SECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            // the collaborator keeps running; only the wait ends here
            throw new ExecutionError("timeout", e);
        } catch (ExecutionException e) {
            throw new ExecutionError(ErrorUtils.formatErrorMessage(e), ErrorUtils.unwrap(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionError("interrupted", e);
        }
    }

    private static Outcome toOutcome(IsolatedRunResult result) {
        if (result == null) {
            return Outcome.ran(null);
        }
        RunStatus status = RunStatus.fromKey(result.status());
        if (status == RunStatus.ERROR) {
            String error = result.error() != null ? result.error()
                    : result.summary() != null ? result.summary() : "isolated run failed";
            return new Outcome(RunStatus.ERROR, result.summary(), error);
        }
        if (status == RunStatus.SKIPPED) {
            return new Outcome(RunStatus.SKIPPED, result.summary(), result.error());
        }
        return Outcome.ran(result.summary());
    }

    /**
     * Post a one-line outcome of an isolated run to the main session.
     */
    private void postToMain(CronJob job, Outcome outcome) {
        String prefix = job.getIsolation() != null && job.getIsolation().getPostToMainPrefix() != null
                && !job.getIsolation().getPostToMainPrefix().isBlank()
                        ? job.getIsolation().getPostToMainPrefix().trim()
                        : DEFAULT_POST_PREFIX;
        String line = null;
        if (outcome.status() == RunStatus.ERROR) {
            line = prefix + " (error): " + outcome.error();
        } else if (outcome.status() == RunStatus.RAN && outcome.summary() != null && !outcome.summary().isBlank()) {
            line = prefix + ": " + outcome.summary().trim();
        }
        if (line == null || deps.getSystemEvents() == null) {
            return;
        }
        try {
            deps.getSystemEvents().enqueue(line, job.getAgentId());
            if (job.getWakeMode() == WakeMode.NOW) {
                wake(job);
            }
        } catch (Exception e) {
            log.warn("failed to post isolated summary", Map.of("jobId", job.getId(),
                    "error", ErrorUtils.formatErrorMessage(e)));
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void enqueue(String text, CronJob job) {
        if (deps.getSystemEvents() == null) {
            throw new ExecutionError("system event queue unavailable");
        }
        try {
            deps.getSystemEvents().enqueue(text, job.getAgentId());
        } catch (Exception e) {
            throw new ExecutionError(ErrorUtils.formatErrorMessage(e), e);
        }
    }

    private void wake(CronJob job) {
        if (deps.getHeartbeat() == null) {
            return;
        }
        try {
            deps.getHeartbeat().requestHeartbeatNow(reasonFor(job));
        } catch (Exception e) {
            log.warn("heartbeat wake request failed", Map.of("jobId", job.getId(),
                    "error", ErrorUtils.formatErrorMessage(e)));
        }
    }

    private static String reasonFor(CronJob job) {
        return "cron:" + job.getId();
    }
}
