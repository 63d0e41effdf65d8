package com.clawcron.gateway;

import ch.qos.logback.classic.Level;
import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.config.ConfigService;
import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.common.infra.SystemEvents;
import com.clawcron.common.logging.LogLevel;
import com.clawcron.common.logging.SubsystemLogger;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRunner;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronState.SystemEventSink;
import com.clawcron.gateway.methods.CronMethodRegistrar;
import com.clawcron.gateway.runtime.GatewayCronRunner;
import com.clawcron.gateway.runtime.HeartbeatBridge;
import com.clawcron.gateway.websocket.GatewayMethodRouter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring configuration for Gateway beans.
 */
@Slf4j
@Configuration
public class GatewayBeanConfig {

    @Bean
    public Path stateDir() {
        return ConfigPaths.resolveStateDir();
    }

    @Bean
    public ConfigService configService() {
        ConfigService service = new ConfigService(ConfigPaths.resolveConfigPath());
        ClawCronConfig cfg = service.loadConfig();
        LogLevel level = LogLevel.normalize(cfg.getLogging().getLevel(), LogLevel.INFO);
        SubsystemLogger.setMinLevel(level);
        applyLogbackLevel(level);
        return service;
    }

    /**
     * Mirror {@code logging.level} onto the Logback logger that all subsystem
     * loggers descend from.
     */
    static void applyLogbackLevel(LogLevel level) {
        if (LoggerFactory.getLogger(SubsystemLogger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.toSlf4jLevel(), Level.INFO));
        }
    }

    @Bean
    public SystemEventSink systemEventSink() {
        return (text, agentId) -> SystemEvents.enqueue(text, SystemEvents.mainSessionKey(agentId));
    }

    /**
     * Main-session heartbeat. Without a host-provided action, each beat drains
     * the main session's queued events into the log.
     */
    @Bean(initMethod = "start", destroyMethod = "close")
    public HeartbeatRunner heartbeatRunner(ConfigService configService,
            ObjectProvider<HeartbeatRunner.HeartbeatAction> action) {
        ClawCronConfig cfg = configService.loadConfig();
        String sessionKey = SystemEvents.mainSessionKey(cfg.getAgentId());
        HeartbeatRunner.HeartbeatAction fallback = reason -> {
            List<String> events = SystemEvents.drain(sessionKey);
            if (events.isEmpty()) {
                return HeartbeatRunner.HeartbeatResult.skipped("no-events");
            }
            events.forEach(text -> log.info("heartbeat ({}) event: {}", reason, text));
            return HeartbeatRunner.HeartbeatResult.ran();
        };
        return new HeartbeatRunner(cfg.getHeartbeat().getEveryMs(), action.getIfAvailable(() -> fallback));
    }

    @Bean
    public GatewayMethodRouter gatewayMethodRouter() {
        return new GatewayMethodRouter();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public GatewayCronRunner gatewayCronRunner(ConfigService configService,
            Path stateDir,
            SystemEventSink systemEventSink,
            HeartbeatRunner heartbeatRunner,
            ObjectProvider<IsolatedAgentRunner> isolatedRunner) {
        IsolatedAgentRunner runner = isolatedRunner.getIfAvailable(
                () -> request -> IsolatedRunResult.skipped("isolated agent runtime not configured"));
        return new GatewayCronRunner(configService, stateDir, systemEventSink,
                new HeartbeatBridge(heartbeatRunner), runner);
    }

    /** Closed by {@link GatewayCronRunner#stop()}. */
    @Bean(destroyMethod = "")
    public CronService cronService(GatewayCronRunner gatewayCronRunner) {
        return gatewayCronRunner.getCronService();
    }

    @Bean
    public CronMethodRegistrar cronMethodRegistrar(GatewayMethodRouter gatewayMethodRouter, CronService cronService) {
        return new CronMethodRegistrar(gatewayMethodRouter, cronService);
    }
}
