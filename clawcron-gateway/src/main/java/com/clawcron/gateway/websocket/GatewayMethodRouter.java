package com.clawcron.gateway.websocket;

import com.clawcron.common.infra.ErrorUtils;
import com.clawcron.gateway.protocol.ProtocolTypes.ErrorCodes;
import com.clawcron.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes JSON-RPC method calls to registered handlers.
 */
@Slf4j
public class GatewayMethodRouter {

    @FunctionalInterface
    public interface MethodHandler {
        CompletableFuture<Object> handle(JsonNode params);
    }

    /**
     * Failure carrying a protocol error code. Handlers throw (or fail their
     * future with) this to choose the code sent back to the caller.
     */
    public static class MethodError extends RuntimeException {
        private final String code;

        public MethodError(String code, String message) {
            super(message);
            this.code = code;
        }

        public MethodError(String code, String message, Throwable cause) {
            super(message, cause);
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Map<String, MethodHandler> methodHandlers = new ConcurrentHashMap<>();

    /**
     * Register a handler for a JSON-RPC method (expects response).
     */
    public void registerMethod(String method, MethodHandler handler) {
        methodHandlers.put(method, handler);
        log.debug("Registered method handler: {}", method);
    }

    /**
     * Dispatch a JSON-RPC request to the appropriate handler.
     */
    public CompletableFuture<Object> dispatch(String method, JsonNode params) {
        MethodHandler handler = methodHandlers.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(
                    new MethodError(ErrorCodes.NOT_FOUND, "Method not found: " + method));
        }

        try {
            return handler.handle(params);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Dispatch and fold the result into a response frame.
     */
    public CompletableFuture<ResponseFrame> respond(String method, JsonNode params) {
        return dispatch(method, params)
                .thenApply(ResponseFrame::success)
                .exceptionally(ex -> {
                    Throwable cause = ErrorUtils.unwrap(ex);
                    if (cause instanceof MethodError methodError) {
                        log.debug("method {} failed: {} {}", method, methodError.getCode(), cause.getMessage());
                        return ResponseFrame.failure(methodError.getCode(), cause.getMessage());
                    }
                    log.error("method {} failed: {}", method, cause.getMessage(), cause);
                    return ResponseFrame.failure(ErrorCodes.UNAVAILABLE, ErrorUtils.formatErrorMessage(cause));
                });
    }

    /**
     * List registered method names.
     */
    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(methodHandlers.keySet());
    }
}
