package com.clawcron.gateway.methods;

import com.clawcron.gateway.cron.CronErrors;
import com.clawcron.gateway.cron.CronJson;
import com.clawcron.gateway.cron.CronNormalize;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.CronNotDue;
import com.clawcron.gateway.cron.CronState.CronRan;
import com.clawcron.gateway.cron.CronState.CronRunResult;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.TriggerReason;
import com.clawcron.gateway.protocol.ProtocolTypes.ErrorCodes;
import com.clawcron.gateway.websocket.GatewayMethodRouter;
import com.clawcron.gateway.websocket.GatewayMethodRouter.MethodError;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * RPC methods for cron job management: cron.list, cron.status, cron.add,
 * cron.update, cron.remove, cron.run, cron.runs.
 */
@Slf4j
public class CronMethodRegistrar {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final int DEFAULT_RUNS_LIMIT = 50;

    private final GatewayMethodRouter methodRouter;
    private final CronService cronService;

    public CronMethodRegistrar(GatewayMethodRouter methodRouter, CronService cronService) {
        this.methodRouter = methodRouter;
        this.cronService = cronService;
    }

    @PostConstruct
    public void registerMethods() {
        methodRouter.registerMethod("cron.list", this::handleCronList);
        methodRouter.registerMethod("cron.status", this::handleCronStatus);
        methodRouter.registerMethod("cron.add", this::handleCronAdd);
        methodRouter.registerMethod("cron.update", this::handleCronUpdate);
        methodRouter.registerMethod("cron.remove", this::handleCronRemove);
        methodRouter.registerMethod("cron.run", this::handleCronRun);
        methodRouter.registerMethod("cron.runs", this::handleCronRuns);
        log.info("Registered 7 cron methods");
    }

    // ========================================
    // Cron Methods
    // ========================================

    private CompletableFuture<Object> handleCronList(JsonNode params) {
        boolean includeDisabled = params != null && params.path("includeDisabled").asBoolean(false);
        return call(() -> {
            List<CronJob> jobs = cronService.list(includeDisabled);
            return Map.of("jobs", jobs);
        });
    }

    private CompletableFuture<Object> handleCronStatus(JsonNode params) {
        return call(cronService::status);
    }

    private CompletableFuture<Object> handleCronAdd(JsonNode params) {
        return call(() -> cronService.add(CronNormalize.normalizeCreate(toMap(params))));
    }

    private CompletableFuture<Object> handleCronUpdate(JsonNode params) {
        return call(() -> {
            String id = requireId(params);
            JsonNode patch = params.get("patch");
            if (patch == null || !patch.isObject()) {
                throw new CronErrors.ValidationError("patch is required");
            }
            return cronService.update(id, CronNormalize.normalizePatch(toMap(patch)));
        });
    }

    private CompletableFuture<Object> handleCronRemove(JsonNode params) {
        return call(() -> {
            String id = requireId(params);
            cronService.remove(id);
            return Map.of("ok", true, "removed", true, "id", id);
        });
    }

    private CompletableFuture<Object> handleCronRun(JsonNode params) {
        return call(() -> {
            String id = requireId(params);
            TriggerReason mode;
            try {
                mode = TriggerReason.fromKey(params.path("mode").isTextual() ? params.get("mode").asText() : null);
            } catch (IllegalArgumentException e) {
                throw new CronErrors.ValidationError(e.getMessage());
            }
            CronRunResult result = cronService.run(id, mode);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ok", true);
            out.put("ran", result.ran());
            if (result instanceof CronRan ran) {
                out.put("entry", ran.entry());
            } else if (result instanceof CronNotDue notDue) {
                out.put("reason", notDue.reason());
            }
            return out;
        });
    }

    private CompletableFuture<Object> handleCronRuns(JsonNode params) {
        return call(() -> {
            String id = requireId(params);
            int limit = params.path("limit").asInt(DEFAULT_RUNS_LIMIT);
            return Map.of("entries", cronService.runs(id, limit));
        });
    }

    // ========================================
    // Helpers
    // ========================================

    /**
     * Run a handler body and map cron failures to protocol error codes.
     */
    private static CompletableFuture<Object> call(Supplier<Object> body) {
        try {
            return CompletableFuture.completedFuture(body.get());
        } catch (CronErrors.ValidationError e) {
            return CompletableFuture.failedFuture(new MethodError(ErrorCodes.INVALID_REQUEST, e.getMessage(), e));
        } catch (CronErrors.NotFoundError e) {
            return CompletableFuture.failedFuture(new MethodError(ErrorCodes.NOT_FOUND, e.getMessage(), e));
        } catch (CronErrors.CronError e) {
            log.warn("cron method failed: {}", e.getMessage());
            return CompletableFuture.failedFuture(new MethodError(ErrorCodes.UNAVAILABLE, e.getMessage(), e));
        }
    }

    private static String requireId(JsonNode params) {
        if (params != null) {
            for (String key : List.of("id", "jobId")) {
                JsonNode node = params.get(key);
                if (node != null && node.isTextual() && !node.asText().isBlank()) {
                    return node.asText().trim();
                }
            }
        }
        throw new CronErrors.ValidationError("id is required");
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CronErrors.ValidationError("params must be an object");
        }
        return CronJson.MAPPER.convertValue(node, MAP_TYPE);
    }
}
