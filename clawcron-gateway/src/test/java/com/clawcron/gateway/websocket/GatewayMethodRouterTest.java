package com.clawcron.gateway.websocket;

import com.clawcron.gateway.protocol.ProtocolTypes.ErrorCodes;
import com.clawcron.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class GatewayMethodRouterTest {

    private final GatewayMethodRouter router = new GatewayMethodRouter();

    @Test
    void respond_success() {
        router.registerMethod("echo", params -> CompletableFuture.completedFuture(Map.of("value", params.get("v").asText())));

        ResponseFrame frame = router.respond("echo", JsonNodeFactory.instance.objectNode().put("v", "hi")).join();

        assertTrue(frame.isOk());
        assertEquals(Map.of("value", "hi"), frame.getPayload());
        assertNull(frame.getError());
    }

    @Test
    void respond_unknownMethod_notFound() {
        ResponseFrame frame = router.respond("nope", null).join();

        assertFalse(frame.isOk());
        assertEquals(ErrorCodes.NOT_FOUND, frame.getError().getCode());
    }

    @Test
    void respond_methodErrorKeepsCode() {
        router.registerMethod("bad", params -> CompletableFuture.failedFuture(
                new GatewayMethodRouter.MethodError(ErrorCodes.INVALID_REQUEST, "id is required")));

        ResponseFrame frame = router.respond("bad", null).join();

        assertEquals(ErrorCodes.INVALID_REQUEST, frame.getError().getCode());
        assertEquals("id is required", frame.getError().getMessage());
    }

    @Test
    void respond_unexpectedFailure_unavailable() {
        router.registerMethod("throws", params -> {
            throw new IllegalStateException("disk on fire");
        });

        ResponseFrame frame = router.respond("throws", null).join();

        assertEquals(ErrorCodes.UNAVAILABLE, frame.getError().getCode());
        assertEquals("disk on fire", frame.getError().getMessage());
    }

    @Test
    void registeredMethods() {
        router.registerMethod("a", params -> CompletableFuture.completedFuture(null));
        assertEquals(Set.of("a"), router.getRegisteredMethods());
    }
}
