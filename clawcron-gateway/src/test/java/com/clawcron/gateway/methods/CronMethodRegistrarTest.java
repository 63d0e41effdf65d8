package com.clawcron.gateway.methods;

import com.clawcron.gateway.cron.CronJson;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.protocol.ProtocolTypes.ErrorCodes;
import com.clawcron.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.clawcron.gateway.websocket.GatewayMethodRouter;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CronMethodRegistrarTest {

    @TempDir
    Path tempDir;

    private final AtomicLong now = new AtomicLong(1000L);
    private final List<String> enqueued = new CopyOnWriteArrayList<>();
    private CronService cronService;
    private GatewayMethodRouter router;

    @BeforeEach
    void setUp() {
        cronService = new CronService(CronServiceDeps.builder()
                .storePath(tempDir.resolve("jobs.json"))
                .nowMs(now::get)
                .systemEvents((text, agentId) -> enqueued.add(text))
                .build());
        router = new GatewayMethodRouter();
        new CronMethodRegistrar(router, cronService).registerMethods();
    }

    @AfterEach
    void tearDown() {
        cronService.close();
    }

    @Test
    void registersAllCronMethods() {
        assertEquals(Set.of("cron.list", "cron.status", "cron.add", "cron.update", "cron.remove", "cron.run",
                "cron.runs"), router.getRegisteredMethods());
    }

    @Test
    void addListRunRunsRemove() throws Exception {
        JsonNode added = call("cron.add", """
                {"name":"water plants","schedule":{"everyMs":"1s"},"payload":{"text":"water the plants"}}
                """);
        String id = added.get("id").asText();
        assertEquals("every", added.get("schedule").get("kind").asText());
        assertEquals(2000L, added.get("state").get("nextRunAtMs").asLong());

        JsonNode list = call("cron.list", "{}");
        assertEquals(1, list.get("jobs").size());

        JsonNode notDue = call("cron.run", "{\"id\":\"" + id + "\",\"mode\":\"due\"}");
        assertTrue(notDue.get("ok").asBoolean());
        assertFalse(notDue.get("ran").asBoolean());
        assertEquals("not-due", notDue.get("reason").asText());

        JsonNode ran = call("cron.run", "{\"id\":\"" + id + "\"}");
        assertTrue(ran.get("ran").asBoolean());
        assertEquals("force", ran.get("entry").get("triggerReason").asText());
        assertEquals("ran", ran.get("entry").get("status").asText());
        assertEquals(List.of("water the plants"), enqueued);

        JsonNode runs = call("cron.runs", "{\"jobId\":\"" + id + "\",\"limit\":5}");
        assertEquals(1, runs.get("entries").size());

        JsonNode removed = call("cron.remove", "{\"id\":\"" + id + "\"}");
        assertTrue(removed.get("removed").asBoolean());
        assertEquals(0, call("cron.list", "{\"includeDisabled\":true}").get("jobs").size());
    }

    @Test
    void updateDisablesJob() throws Exception {
        String id = call("cron.add", """
                {"name":"n","schedule":{"kind":"every","everyMs":1000},"payload":{"kind":"systemEvent","text":"t"}}
                """).get("id").asText();

        JsonNode updated = call("cron.update", "{\"id\":\"" + id + "\",\"patch\":{\"enabled\":false}}");

        assertFalse(updated.get("enabled").asBoolean());
        assertFalse(updated.get("state").has("nextRunAtMs"));
        assertEquals(0, call("cron.list", "{}").get("jobs").size());
    }

    @Test
    void status() throws Exception {
        JsonNode status = call("cron.status", "{}");

        assertTrue(status.get("enabled").asBoolean());
        assertEquals(0, status.get("total").asInt());
    }

    @Test
    void errorsMapToProtocolCodes() throws Exception {
        assertEquals(ErrorCodes.INVALID_REQUEST, fail("cron.add", "{\"name\":\"\"}"));
        assertEquals(ErrorCodes.INVALID_REQUEST, fail("cron.remove", "{}"));
        assertEquals(ErrorCodes.INVALID_REQUEST, fail("cron.run", "{\"id\":\"x\",\"mode\":\"sometimes\"}"));
        assertEquals(ErrorCodes.INVALID_REQUEST, fail("cron.update", "{\"id\":\"x\"}"));
        assertEquals(ErrorCodes.NOT_FOUND, fail("cron.remove", "{\"id\":\"missing\"}"));
        assertEquals(ErrorCodes.NOT_FOUND, fail("cron.run", "{\"id\":\"missing\"}"));
    }

    private JsonNode call(String method, String params) throws Exception {
        ResponseFrame frame = router.respond(method, CronJson.MAPPER.readTree(params)).join();
        assertTrue(frame.isOk(), () -> method + " failed: " + frame.getError());
        return CronJson.MAPPER.valueToTree(frame.getPayload());
    }

    private String fail(String method, String params) throws Exception {
        ResponseFrame frame = router.respond(method, CronJson.MAPPER.readTree(params)).join();
        assertFalse(frame.isOk(), method + " should fail");
        return frame.getError().getCode();
    }
}
