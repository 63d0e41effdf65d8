package com.clawcron.gateway.runtime;

import com.clawcron.common.config.ConfigService;
import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.gateway.cron.CronState.CronEvent;
import com.clawcron.gateway.cron.CronState.HeartbeatRunResult;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronJobCreate;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class GatewayCronRunnerTest {

    @TempDir
    Path tempDir;

    private GatewayCronRunner runner;
    private HeartbeatRunner heartbeatRunner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.stop();
        }
        if (heartbeatRunner != null) {
            heartbeatRunner.close();
        }
    }

    @Test
    void storeLocationAndDefaultsFromConfig() throws IOException {
        Path config = tempDir.resolve("clawcron.json");
        Files.writeString(config, """
                { "agentId": "ops", "cron": { "store": "%s", "maxRunLogEntries": 5 } }
                """.formatted(tempDir.resolve("custom").resolve("jobs.json").toString().replace("\\", "\\\\")));
        List<String> enqueued = new CopyOnWriteArrayList<>();
        runner = new GatewayCronRunner(configService(config), tempDir.resolve("state"),
                (text, agentId) -> enqueued.add(agentId + ":" + text), null, null);

        runner.start();
        CronJob job = runner.getCronService().add(CronJobCreate.builder().name("n")
                .schedule(CronSchedule.every(60_000)).payload(CronPayload.systemEvent("hello")).build());

        assertTrue(runner.isCronEnabled());
        assertEquals("ops", job.getAgentId());
        assertTrue(Files.exists(tempDir.resolve("custom").resolve("jobs.json")));
        assertEquals(tempDir.resolve("custom").resolve("jobs.json").toString(),
                runner.getCronService().status().getStorePath());

        runner.getCronService().run(job.getId(), null);
        assertEquals(List.of("ops:hello"), enqueued);
        assertTrue(Files.exists(tempDir.resolve("custom").resolve("runs").resolve(job.getId() + ".jsonl")));
    }

    @Test
    void killSwitchFromConfig() throws IOException {
        Path config = tempDir.resolve("clawcron.json");
        Files.writeString(config, "{ \"cron\": { \"enabled\": false } }");

        runner = new GatewayCronRunner(configService(config), tempDir.resolve("state"), null, null, null);
        runner.start();

        assertFalse(runner.isCronEnabled());
        assertFalse(runner.getCronService().status().isEnabled());
        assertEquals(tempDir.resolve("state").resolve("cron").resolve("jobs.json").toAbsolutePath().toString(),
                runner.getCronService().status().getStorePath().toString());
    }

    @Test
    void eventsFanOutToListeners() throws IOException {
        runner = new GatewayCronRunner(configService(tempDir.resolve("missing.json")), tempDir.resolve("state"),
                (text, agentId) -> {
                }, null, request -> IsolatedRunResult.ok("fine"));
        List<String> actions = new CopyOnWriteArrayList<>();
        runner.addListener(event -> actions.add(event.getAction()));
        runner.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });

        CronJob job = runner.getCronService().add(CronJobCreate.builder().name("iso")
                .schedule(CronSchedule.every(60_000)).payload(CronPayload.agentTurn("go")).build());
        runner.getCronService().run(job.getId(), null);

        assertEquals(List.of("added", "started", "finished"), actions);
    }

    @Test
    void heartbeatBridge_mapsRunnerResults() {
        heartbeatRunner = new HeartbeatRunner(60_000, reason -> "cron:x".equals(reason)
                ? HeartbeatRunner.HeartbeatResult.ran()
                : HeartbeatRunner.HeartbeatResult.skipped("busy"));
        HeartbeatBridge bridge = new HeartbeatBridge(heartbeatRunner);

        assertEquals(new HeartbeatRunResult(RunStatus.RAN, null), bridge.runHeartbeatOnce("cron:x"));
        assertEquals(new HeartbeatRunResult(RunStatus.SKIPPED, "busy"), bridge.runHeartbeatOnce("other"));
    }

    @Test
    void onCronEvent_withoutListeners_isNoop() {
        runner = new GatewayCronRunner(configService(tempDir.resolve("missing.json")), tempDir.resolve("state"),
                null, null, null);
        assertDoesNotThrow(() -> runner.onCronEvent(CronEvent.builder().action("added").jobId("j").build()));
    }

    private static ConfigService configService(Path config) {
        return new ConfigService(config, Duration.ofMillis(200), name -> null);
    }
}
