package com.hive.config;

import com.hive.engine.EngineSettings;
import com.hive.engine.ExecutionMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HiveConfigTest {

    @Test
    void fromEnv_onlyBudget_usesDefaults() {
        HiveConfig config = HiveConfig.fromEnv(Map.of("HIVE_STEP_BUDGET", "250"));

        assertEquals(250, config.getStepBudget());
        assertEquals(0, config.getNodeTimeoutSeconds());
        assertEquals(ExecutionMode.LIVE, config.getExecutionMode());
        assertEquals("graphs", config.getGraphDir());
        assertEquals("hive:graph", config.getGraphKeyPrefix());
        assertEquals(HiveConfig.STORE_MEMORY, config.getSnapshotStore());
        assertFalse(config.isRedisSnapshotStore());
        assertEquals("hive:snapshot", config.getSnapshotKeyPrefix());
        assertEquals("localhost", config.getCacheHost());
        assertEquals(6379, config.getCachePort());
        assertEquals(4, config.getRunThreads());
    }

    @Test
    void fromEnv_readsEveryVariable() {
        Map<String, String> env = new HashMap<>();
        env.put("HIVE_STEP_BUDGET", "40");
        env.put("HIVE_NODE_TIMEOUT_SECONDS", "30");
        env.put("HIVE_RETRY_INITIAL_INTERVAL_MS", "200");
        env.put("HIVE_RETRY_BACKOFF_COEFFICIENT", "1.5");
        env.put("HIVE_RETRY_MAX_INTERVAL_MS", "5000");
        env.put("HIVE_EXECUTION_MODE", "MOCK");
        env.put("HIVE_GRAPH_DIR", " /etc/hive/graphs ");
        env.put("HIVE_SNAPSHOT_STORE", "Redis");
        env.put("HIVE_SNAPSHOT_KEY_PREFIX", "prod:hive:snap");
        env.put("HIVE_SNAPSHOT_TTL_SECONDS", "86400");
        env.put("HIVE_CACHE_HOST", "redis.internal");
        env.put("HIVE_CACHE_PORT", "6380");
        env.put("HIVE_RUN_THREADS", "16");

        HiveConfig config = HiveConfig.fromEnv(env);

        assertEquals(ExecutionMode.MOCK, config.getExecutionMode());
        assertEquals("/etc/hive/graphs", config.getGraphDir());
        assertTrue(config.isRedisSnapshotStore());
        assertEquals("prod:hive:snap", config.getSnapshotKeyPrefix());
        assertEquals(86400, config.getSnapshotTtlSeconds());
        assertEquals("redis.internal", config.getCacheHost());
        assertEquals(6380, config.getCachePort());
        assertEquals(16, config.getRunThreads());

        EngineSettings settings = config.toEngineSettings();
        assertEquals(40, settings.getStepBudget());
        assertEquals(Duration.ofSeconds(30), settings.getNodeTimeout());
        assertEquals(ExecutionMode.MOCK, settings.getMode());
        assertEquals(200, settings.getRetryPolicy().delayAfterAttempt(1));
        assertEquals(300, settings.getRetryPolicy().delayAfterAttempt(2));
        assertEquals(5000, settings.getRetryPolicy().getMaxIntervalMs());
    }

    @Test
    void fromEnv_missingOrInvalidBudget_isRejected() {
        assertThrows(IllegalStateException.class, () -> HiveConfig.fromEnv(Map.of()));
        assertThrows(IllegalStateException.class, () -> HiveConfig.fromEnv(Map.of("HIVE_STEP_BUDGET", "lots")));
        assertThrows(IllegalStateException.class, () -> HiveConfig.fromEnv(Map.of("HIVE_STEP_BUDGET", "0")));
    }

    @Test
    void fromEnv_unknownSnapshotStore_isRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> HiveConfig.fromEnv(Map.of("HIVE_STEP_BUDGET", "10", "HIVE_SNAPSHOT_STORE", "postgres")));
        assertTrue(e.getMessage().contains("HIVE_SNAPSHOT_STORE"));
    }

    @Test
    void fromEnv_malformedOptionalNumbers_fallBackToDefaults() {
        HiveConfig config = HiveConfig.fromEnv(Map.of(
                "HIVE_STEP_BUDGET", "10",
                "HIVE_CACHE_PORT", "not-a-port",
                "HIVE_NODE_TIMEOUT_SECONDS", "-5"));

        assertEquals(6379, config.getCachePort());
        assertEquals(0, config.getNodeTimeoutSeconds());
        assertNull(config.toEngineSettings().getNodeTimeout());
    }
}
