package com.clawcron.gateway.runtime;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.config.ConfigService;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.CronEvent;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.cron.CronState.HeartbeatDriver;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRunner;
import com.clawcron.gateway.cron.CronState.SystemEventSink;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Builds and configures the gateway-level cron service.
 *
 * <p>
 * Bridges between the CronService and the gateway runtime: resolves the store
 * location and kill switch from config, wires the collaborators, and fans cron
 * events out to listeners.
 */
@Slf4j
public class GatewayCronRunner {

    private final CronService cronService;
    private final boolean cronEnabled;
    private final List<Consumer<CronEvent>> listeners = new CopyOnWriteArrayList<>();

    public GatewayCronRunner(ConfigService configService,
            Path stateDir,
            SystemEventSink systemEvents,
            HeartbeatDriver heartbeat,
            IsolatedAgentRunner isolatedRunner) {
        ClawCronConfig cfg = configService.loadConfig();
        this.cronEnabled = configService.isCronEnabled();

        Path storePath = ConfigPaths.resolveCronStorePath(cfg, stateDir);
        CronServiceDeps deps = CronServiceDeps.builder()
                .storePath(storePath)
                .runLogDir(storePath.toAbsolutePath().getParent().resolve("runs"))
                .cronEnabled(cronEnabled)
                .maxRunLogEntries(cfg.getCron().getMaxRunLogEntries())
                .defaultAgentId(cfg.getAgentId())
                .systemEvents(systemEvents)
                .heartbeat(heartbeat)
                .isolatedRunner(isolatedRunner)
                .onEvent(this::onCronEvent)
                .build();
        this.cronService = new CronService(deps);
    }

    /**
     * Load the store and, unless the kill switch is off, start firing jobs.
     */
    public void start() {
        if (!cronEnabled) {
            log.info("cron: disabled by config or CLAWCRON_SKIP_CRON");
        }
        cronService.start();
    }

    /**
     * Stop the cron service.
     */
    public void stop() {
        cronService.close();
    }

    /**
     * Handle a cron event by passing it to every registered listener.
     */
    public void onCronEvent(CronEvent event) {
        log.debug("cron event: {} {}", event.getAction(), event.getJobId());
        for (Consumer<CronEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("cron event listener failed: {}", e.getMessage());
            }
        }
    }

    public void addListener(Consumer<CronEvent> listener) {
        listeners.add(listener);
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public CronService getCronService() {
        return cronService;
    }
}
