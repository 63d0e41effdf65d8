package com.clawcron.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire-level response shapes shared by RPC method handlers.
 */
public final class ProtocolTypes {

    private ProtocolTypes() {
    }

    // ── Error Codes ──────────────────────────────────────────────

    public static final class ErrorCodes {
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String UNAVAILABLE = "UNAVAILABLE";

        private ErrorCodes() {
        }
    }

    // ── Error Shape ──────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorShape {
        private String code;
        private String message;

        public static ErrorShape of(String code, String message) {
            return new ErrorShape(code, message);
        }
    }

    // ── Response ─────────────────────────────────────────────────

    /** {ok, payload?, error?} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseFrame {
        private boolean ok;
        private Object payload;
        private ErrorShape error;

        public static ResponseFrame success(Object payload) {
            return new ResponseFrame(true, payload, null);
        }

        public static ResponseFrame failure(String code, String message) {
            return new ResponseFrame(false, null, ErrorShape.of(code, message));
        }
    }
}
