package com.clawcron.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("clawcron.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "agentId": "ops",
                  "cron": {
                    "enabled": false,
                    "store": "/var/lib/clawcron/jobs.json",
                    "maxRunLogEntries": 50
                  },
                  "heartbeat": { "everyMs": 60000 },
                  "logging": {
                    "level": "debug"
                  }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        ClawCronConfig config = service.loadConfig();

        assertEquals("ops", config.getAgentId());
        assertFalse(config.getCron().isEnabled());
        assertEquals("/var/lib/clawcron/jobs.json", config.getCron().getStore());
        assertEquals(50, config.getCron().getMaxRunLogEntries());
        assertEquals(60_000L, config.getHeartbeat().getEveryMs());
        assertEquals("debug", config.getLogging().getLevel());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        ClawCronConfig config = service.loadConfig();

        assertNotNull(config.getCron());
        assertTrue(config.getCron().isEnabled());
        assertEquals(200, config.getCron().getMaxRunLogEntries());
        assertEquals(30 * 60_000L, config.getHeartbeat().getEveryMs());
        assertEquals("info", config.getLogging().getLevel());
    }

    @Test
    void loadConfig_unknownKeysIgnored() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "enabled": true, "futureKnob": 3 }, "somethingElse": {} }
                """);

        ClawCronConfig config = new ConfigService(configPath).loadConfig();

        assertTrue(config.getCron().isEnabled());
    }

    @Test
    void loadConfig_nonPositiveRunLogCap_resetToDefault() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "maxRunLogEntries": 0 } }
                """);

        ClawCronConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(200, config.getCron().getMaxRunLogEntries());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), name -> null);
        assertEquals("fallback", service.substituteEnvVars("${MISSING_VAR:-fallback}"));
    }

    @Test
    void substituteEnvVars_resolvesFromLookup() throws IOException {
        Map<String, String> env = Map.of("CRON_STORE", "/data/jobs.json");
        Files.writeString(configPath, """
                { "cron": { "store": "${CRON_STORE}" } }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), env::get);

        assertEquals("/data/jobs.json", service.loadConfig().getCron().getStore());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "agentId": "a" }
                """);

        ConfigService service = new ConfigService(configPath);
        ClawCronConfig first = service.loadConfig();
        ClawCronConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, "{ \"agentId\": \"a\" }");
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), name -> null);
        assertEquals("a", service.loadConfig().getAgentId());

        Files.writeString(configPath, "{ \"agentId\": \"b\" }");

        assertEquals("a", service.loadConfig().getAgentId());
        assertEquals("b", service.reloadConfig().getAgentId());
    }

    @Test
    void isCronEnabled_skipEnvOverridesConfig() throws IOException {
        Files.writeString(configPath, "{ \"cron\": { \"enabled\": true } }");

        ConfigService skipped = new ConfigService(configPath, Duration.ofMillis(200),
                name -> "CLAWCRON_SKIP_CRON".equals(name) ? "1" : null);
        ConfigService normal = new ConfigService(configPath, Duration.ofMillis(200), name -> null);

        assertFalse(skipped.isCronEnabled());
        assertTrue(normal.isCronEnabled());
    }

    @Test
    void isCronEnabled_followsConfigKillSwitch() throws IOException {
        Files.writeString(configPath, "{ \"cron\": { \"enabled\": false } }");

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), name -> null);

        assertFalse(service.isCronEnabled());
    }
}
