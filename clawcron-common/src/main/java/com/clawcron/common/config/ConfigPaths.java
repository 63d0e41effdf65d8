package com.clawcron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file and cron store.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".clawcron";
    private static final String CONFIG_FILENAME = "clawcron.json";
    private static final String CONFIG_PATH_PROPERTY = "clawcron.config";

    public static final String ENV_STATE_DIR = "CLAWCRON_STATE_DIR";
    public static final String ENV_CONFIG_PATH = "CLAWCRON_CONFIG_PATH";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (cron store, run logs).
     * Can be overridden via CLAWCRON_STATE_DIR. Default: ~/.clawcron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_STATE_DIR);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Config file
    // =========================================================================

    /**
     * Config file path. The {@code clawcron.config} system property wins over
     * CLAWCRON_CONFIG_PATH; otherwise {@code <stateDir>/clawcron.json}.
     */
    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), System.getProperty(CONFIG_PATH_PROPERTY), homeDir());
    }

    public static Path resolveConfigPath(Map<String, String> env, String propertyOverride, String homedir) {
        if (propertyOverride != null && !propertyOverride.isBlank()) {
            return resolveUserPath(propertyOverride.trim(), homedir);
        }
        String override = envTrimmed(env, ENV_CONFIG_PATH);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveStateDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    // =========================================================================
    // Cron store
    // =========================================================================

    /**
     * Resolve the cron store file from {@code cron.store}, defaulting to
     * {@code <stateDir>/cron/jobs.json}.
     */
    public static Path resolveCronStorePath(ClawCronConfig config, Path stateDir) {
        String configured = config != null && config.getCron() != null ? config.getCron().getStore() : null;
        if (configured != null && !configured.isBlank()) {
            return resolveUserPath(configured.trim(), homeDir());
        }
        return stateDir.resolve("cron").resolve("jobs.json");
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Expand a leading {@code ~} and normalize to an absolute path.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String path = input;
        if (path.equals("~")) {
            path = homedir;
        } else if (path.startsWith("~/") || path.startsWith("~\\")) {
            path = homedir + path.substring(1);
        }
        return Path.of(path).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
