package com.assistants.common.config;

import com.assistants.common.logging.LogLevel;
import com.assistants.common.logging.SubsystemLogger;
import org.junit.jupiter.api.AfterEach;
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
        configPath = tempDir.resolve("config.json");
    }

    @AfterEach
    void tearDown() {
        SubsystemLogger.setMinimumLevel(LogLevel.TRACE);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "scheduler": {
                    "enabled": false,
                    "heartbeatIntervalMs": 5000,
                    "lockTtlMs": 60000,
                    "defaultTimezone": "Europe/Berlin",
                    "claimGlobalSchedules": false
                  },
                  "logging": {
                    "level": "debug"
                  },
                  "somethingElse": { "ignored": true }
                }
                """;
        Files.writeString(configPath, json);

        AssistantsConfig config = new ConfigService(configPath).loadConfig();

        AssistantsConfig.SchedulerConfig scheduler = config.getScheduler();
        assertFalse(scheduler.isEnabled());
        assertEquals(5000, scheduler.getHeartbeatIntervalMs());
        assertEquals(60_000, scheduler.getLockTtlMs());
        assertEquals("Europe/Berlin", scheduler.getDefaultTimezone());
        assertFalse(scheduler.isClaimGlobalSchedules());
        assertEquals("debug", config.getLogging().getLevel());
        assertEquals(LogLevel.DEBUG, SubsystemLogger.getMinimumLevel());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        AssistantsConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getScheduler());
        assertTrue(config.getScheduler().isEnabled());
        assertEquals(30_000, config.getScheduler().getHeartbeatIntervalMs());
        assertEquals(600_000, config.getScheduler().getLockTtlMs());
        assertNull(config.getScheduler().getDefaultTimezone());
        assertTrue(config.getScheduler().isClaimGlobalSchedules());
        assertEquals("info", config.getLogging().getLevel());
    }

    @Test
    void loadConfig_corruptFile_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        AssistantsConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getScheduler());
        assertTrue(config.getScheduler().isEnabled());
    }

    @Test
    void loadConfig_clampsOutOfRangeSchedulerValues() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "heartbeatIntervalMs": 10, "lockTtlMs": -5, "defaultTimezone": "  " } }
                """);

        AssistantsConfig.SchedulerConfig scheduler = new ConfigService(configPath).loadConfig().getScheduler();

        assertEquals(1000, scheduler.getHeartbeatIntervalMs());
        assertEquals(600_000, scheduler.getLockTtlMs());
        assertNull(scheduler.getDefaultTimezone());
    }

    @Test
    void loadConfig_tinyLockTtl_isRaisedToMinimum() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "lockTtlMs": 50 } }
                """);

        AssistantsConfig.SchedulerConfig scheduler = new ConfigService(configPath).loadConfig().getScheduler();

        assertEquals(ConfigService.MIN_LOCK_TTL_MS, scheduler.getLockTtlMs());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), Map.of());
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_usesEnvAndDefaults() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), Map.of("TZ_NAME", "Asia/Tokyo"));

        assertEquals("Asia/Tokyo", service.substituteEnvVars("${TZ_NAME}"));
        assertEquals("fallback", service.substituteEnvVars("${MISSING:-fallback}"));
        assertEquals("", service.substituteEnvVars("${MISSING}"));
    }

    @Test
    void loadConfig_substitutesEnvVarsBeforeParsing() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "defaultTimezone": "${SCHED_TZ:-UTC}" } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), Map.of("SCHED_TZ", "America/Chicago"));

        assertEquals("America/Chicago", service.loadConfig().getScheduler().getDefaultTimezone());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "heartbeatIntervalMs": 5000 } }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), Map.of());
        AssistantsConfig first = service.loadConfig();
        AssistantsConfig second = service.loadConfig();
        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "heartbeatIntervalMs": 5000 } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), Map.of());
        assertEquals(5000, service.loadConfig().getScheduler().getHeartbeatIntervalMs());

        Files.writeString(configPath, """
                { "scheduler": { "heartbeatIntervalMs": 7000 } }
                """);
        assertEquals(5000, service.loadConfig().getScheduler().getHeartbeatIntervalMs());
        assertEquals(7000, service.reloadConfig().getScheduler().getHeartbeatIntervalMs());
    }

    @Test
    void forProject_resolvesConfigUnderProjectDir() {
        ConfigService service = ConfigService.forProject(tempDir);
        assertEquals(tempDir.resolve(".assistants").resolve("config.json"), service.getConfigPath());
    }
}
