package com.assistants.common.config;

import com.assistants.common.logging.LogLevel;
import com.assistants.common.logging.SubsystemLogger;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the project configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    /** Shortest lock TTL accepted; the lease is refreshed every ttl/2. */
    static final long MIN_LOCK_TTL_MS = 1000;
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AssistantsConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Config service for the project rooted at {@code cwd}.
     */
    public static ConfigService forProject(Path cwd) {
        return new ConfigService(ConfigPaths.resolveConfigPath(cwd));
    }

    /**
     * Load config with caching.
     */
    public AssistantsConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AssistantsConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private AssistantsConfig doLoadConfig() {
        AssistantsConfig config;
        if (!Files.exists(configPath)) {
            log.debug("Config file not found: {}, using defaults", configPath);
            config = applyDefaults(new AssistantsConfig());
        } else {
            try {
                String raw = Files.readString(configPath);
                raw = substituteEnvVars(raw);
                config = applyDefaults(objectMapper.readValue(raw, AssistantsConfig.class));
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = applyDefaults(new AssistantsConfig());
            }
        }
        SubsystemLogger.setMinimumLevel(LogLevel.normalize(config.getLogging().getLevel()));
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields and clamp out-of-range
     * scheduler values.
     */
    AssistantsConfig applyDefaults(AssistantsConfig config) {
        if (config.getScheduler() == null) {
            config.setScheduler(new AssistantsConfig.SchedulerConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new AssistantsConfig.LoggingConfig());
        }

        AssistantsConfig.SchedulerConfig scheduler = config.getScheduler();
        AssistantsConfig.SchedulerConfig defaults = new AssistantsConfig.SchedulerConfig();
        if (scheduler.getHeartbeatIntervalMs() < 1000) {
            log.warn("scheduler.heartbeatIntervalMs={} is below 1000ms, using 1000ms",
                    scheduler.getHeartbeatIntervalMs());
            scheduler.setHeartbeatIntervalMs(1000);
        }
        if (scheduler.getLockTtlMs() <= 0) {
            log.warn("scheduler.lockTtlMs={} must be positive, using {}ms",
                    scheduler.getLockTtlMs(), defaults.getLockTtlMs());
            scheduler.setLockTtlMs(defaults.getLockTtlMs());
        } else if (scheduler.getLockTtlMs() < MIN_LOCK_TTL_MS) {
            log.warn("scheduler.lockTtlMs={} is below {}ms, using {}ms",
                    scheduler.getLockTtlMs(), MIN_LOCK_TTL_MS, MIN_LOCK_TTL_MS);
            scheduler.setLockTtlMs(MIN_LOCK_TTL_MS);
        }
        if (scheduler.getDefaultTimezone() != null && scheduler.getDefaultTimezone().isBlank()) {
            scheduler.setDefaultTimezone(null);
        }
        return config;
    }
}
