package com.hive.config;

import com.hive.engine.EngineSettings;
import com.hive.engine.ExecutionMode;
import com.hive.engine.RetryPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the graph executor.
 * <p>
 * Engine: HIVE_STEP_BUDGET (required), HIVE_NODE_TIMEOUT_SECONDS, HIVE_RETRY_INITIAL_INTERVAL_MS,
 * HIVE_RETRY_BACKOFF_COEFFICIENT, HIVE_RETRY_MAX_INTERVAL_MS, HIVE_EXECUTION_MODE ({@code live} | {@code mock}).
 * <p>
 * Graphs: HIVE_GRAPH_DIR, HIVE_GRAPH_KEY_PREFIX. Snapshots: HIVE_SNAPSHOT_STORE ({@code memory} | {@code redis}),
 * HIVE_SNAPSHOT_KEY_PREFIX, HIVE_SNAPSHOT_TTL_SECONDS. Cache: HIVE_CACHE_HOST, HIVE_CACHE_PORT.
 * Runner: HIVE_RUN_THREADS.
 */
public final class HiveConfig {

    static final String ENV_STEP_BUDGET = "HIVE_STEP_BUDGET";
    static final String ENV_NODE_TIMEOUT_SECONDS = "HIVE_NODE_TIMEOUT_SECONDS";
    static final String ENV_RETRY_INITIAL_INTERVAL_MS = "HIVE_RETRY_INITIAL_INTERVAL_MS";
    static final String ENV_RETRY_BACKOFF_COEFFICIENT = "HIVE_RETRY_BACKOFF_COEFFICIENT";
    static final String ENV_RETRY_MAX_INTERVAL_MS = "HIVE_RETRY_MAX_INTERVAL_MS";
    static final String ENV_EXECUTION_MODE = "HIVE_EXECUTION_MODE";
    static final String ENV_GRAPH_DIR = "HIVE_GRAPH_DIR";
    static final String ENV_GRAPH_KEY_PREFIX = "HIVE_GRAPH_KEY_PREFIX";
    static final String ENV_SNAPSHOT_STORE = "HIVE_SNAPSHOT_STORE";
    static final String ENV_SNAPSHOT_KEY_PREFIX = "HIVE_SNAPSHOT_KEY_PREFIX";
    static final String ENV_SNAPSHOT_TTL_SECONDS = "HIVE_SNAPSHOT_TTL_SECONDS";
    static final String ENV_CACHE_HOST = "HIVE_CACHE_HOST";
    static final String ENV_CACHE_PORT = "HIVE_CACHE_PORT";
    static final String ENV_RUN_THREADS = "HIVE_RUN_THREADS";

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";

    private static final String DEFAULT_GRAPH_DIR = "graphs";
    private static final String DEFAULT_GRAPH_KEY_PREFIX = "hive:graph";
    private static final String DEFAULT_SNAPSHOT_KEY_PREFIX = "hive:snapshot";
    private static final double DEFAULT_BACKOFF_COEFFICIENT = 2.0;
    private static final int DEFAULT_RUN_THREADS = 4;

    private final int stepBudget;
    private final int nodeTimeoutSeconds;
    private final long retryInitialIntervalMs;
    private final double retryBackoffCoefficient;
    private final long retryMaxIntervalMs;
    private final ExecutionMode executionMode;
    private final String graphDir;
    private final String graphKeyPrefix;
    private final String snapshotStore;
    private final String snapshotKeyPrefix;
    private final int snapshotTtlSeconds;
    private final String cacheHost;
    private final int cachePort;
    private final int runThreads;

    private HiveConfig(Builder b) {
        this.stepBudget = b.stepBudget;
        this.nodeTimeoutSeconds = b.nodeTimeoutSeconds;
        this.retryInitialIntervalMs = b.retryInitialIntervalMs;
        this.retryBackoffCoefficient = b.retryBackoffCoefficient;
        this.retryMaxIntervalMs = b.retryMaxIntervalMs;
        this.executionMode = b.executionMode;
        this.graphDir = b.graphDir;
        this.graphKeyPrefix = b.graphKeyPrefix;
        this.snapshotStore = b.snapshotStore;
        this.snapshotKeyPrefix = b.snapshotKeyPrefix;
        this.snapshotTtlSeconds = b.snapshotTtlSeconds;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.runThreads = b.runThreads;
    }

    /** Maximum node visits per run. */
    public int getStepBudget() {
        return stepBudget;
    }

    /** Default per-invocation timeout for model/tool calls; 0 means none. */
    public int getNodeTimeoutSeconds() {
        return nodeTimeoutSeconds;
    }

    public long getRetryInitialIntervalMs() {
        return retryInitialIntervalMs;
    }

    public double getRetryBackoffCoefficient() {
        return retryBackoffCoefficient;
    }

    public long getRetryMaxIntervalMs() {
        return retryMaxIntervalMs;
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    /** Directory holding {@code <name>.json} graph files. Default {@code graphs}. */
    public String getGraphDir() {
        return graphDir;
    }

    /** Redis key prefix for cached graph JSON. Default {@code hive:graph}. */
    public String getGraphKeyPrefix() {
        return graphKeyPrefix;
    }

    /** {@value #STORE_MEMORY} or {@value #STORE_REDIS}. */
    public String getSnapshotStore() {
        return snapshotStore;
    }

    /** Redis key prefix for paused-run snapshots. Default {@code hive:snapshot}. */
    public String getSnapshotKeyPrefix() {
        return snapshotKeyPrefix;
    }

    /** Expiry of stored snapshots; 0 keeps them until resumed. */
    public int getSnapshotTtlSeconds() {
        return snapshotTtlSeconds;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Threads available to asynchronous runs. */
    public int getRunThreads() {
        return runThreads;
    }

    public boolean isRedisSnapshotStore() {
        return STORE_REDIS.equals(snapshotStore);
    }

    /** Engine settings derived from this configuration. */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder(stepBudget)
                .nodeTimeout(nodeTimeoutSeconds > 0 ? Duration.ofSeconds(nodeTimeoutSeconds) : null)
                .retryPolicy(new RetryPolicy(retryInitialIntervalMs, retryBackoffCoefficient, retryMaxIntervalMs, null))
                .mode(executionMode)
                .build();
    }

    public static HiveConfig fromEnvironment() {
        return fromEnv(System.getenv());
    }

    /**
     * @throws IllegalStateException when HIVE_STEP_BUDGET is missing or not a positive integer
     */
    public static HiveConfig fromEnv(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String budget = env.get(ENV_STEP_BUDGET);
        int stepBudget = parseInt(budget, -1);
        if (stepBudget <= 0) {
            throw new IllegalStateException(ENV_STEP_BUDGET + " must be set to a positive integer, got '" + budget + "'");
        }
        String store = getEnv(env, ENV_SNAPSHOT_STORE, STORE_MEMORY).toLowerCase(Locale.ROOT);
        if (!STORE_MEMORY.equals(store) && !STORE_REDIS.equals(store)) {
            throw new IllegalStateException(ENV_SNAPSHOT_STORE + " must be '" + STORE_MEMORY + "' or '" + STORE_REDIS
                    + "', got '" + store + "'");
        }
        return builder(stepBudget)
                .nodeTimeoutSeconds(parseInt(env.get(ENV_NODE_TIMEOUT_SECONDS), 0))
                .retryInitialIntervalMs(parseLong(env.get(ENV_RETRY_INITIAL_INTERVAL_MS), 0L))
                .retryBackoffCoefficient(parseDouble(env.get(ENV_RETRY_BACKOFF_COEFFICIENT), DEFAULT_BACKOFF_COEFFICIENT))
                .retryMaxIntervalMs(parseLong(env.get(ENV_RETRY_MAX_INTERVAL_MS), 0L))
                .executionMode(ExecutionMode.fromValue(env.get(ENV_EXECUTION_MODE)))
                .graphDir(getEnv(env, ENV_GRAPH_DIR, DEFAULT_GRAPH_DIR))
                .graphKeyPrefix(getEnv(env, ENV_GRAPH_KEY_PREFIX, DEFAULT_GRAPH_KEY_PREFIX))
                .snapshotStore(store)
                .snapshotKeyPrefix(getEnv(env, ENV_SNAPSHOT_KEY_PREFIX, DEFAULT_SNAPSHOT_KEY_PREFIX))
                .snapshotTtlSeconds(parseInt(env.get(ENV_SNAPSHOT_TTL_SECONDS), 0))
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.get(ENV_CACHE_PORT), 6379))
                .runThreads(parseInt(env.get(ENV_RUN_THREADS), DEFAULT_RUN_THREADS))
                .build();
    }

    public static Builder builder(int stepBudget) {
        return new Builder(stepBudget);
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private final int stepBudget;
        private int nodeTimeoutSeconds;
        private long retryInitialIntervalMs;
        private double retryBackoffCoefficient = DEFAULT_BACKOFF_COEFFICIENT;
        private long retryMaxIntervalMs;
        private ExecutionMode executionMode = ExecutionMode.LIVE;
        private String graphDir = DEFAULT_GRAPH_DIR;
        private String graphKeyPrefix = DEFAULT_GRAPH_KEY_PREFIX;
        private String snapshotStore = STORE_MEMORY;
        private String snapshotKeyPrefix = DEFAULT_SNAPSHOT_KEY_PREFIX;
        private int snapshotTtlSeconds;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private int runThreads = DEFAULT_RUN_THREADS;

        private Builder(int stepBudget) {
            if (stepBudget <= 0) {
                throw new IllegalArgumentException("stepBudget must be positive, got " + stepBudget);
            }
            this.stepBudget = stepBudget;
        }

        public Builder nodeTimeoutSeconds(int nodeTimeoutSeconds) {
            this.nodeTimeoutSeconds = Math.max(0, nodeTimeoutSeconds);
            return this;
        }

        public Builder retryInitialIntervalMs(long retryInitialIntervalMs) {
            this.retryInitialIntervalMs = Math.max(0L, retryInitialIntervalMs);
            return this;
        }

        public Builder retryBackoffCoefficient(double retryBackoffCoefficient) {
            this.retryBackoffCoefficient = Math.max(1.0, retryBackoffCoefficient);
            return this;
        }

        public Builder retryMaxIntervalMs(long retryMaxIntervalMs) {
            this.retryMaxIntervalMs = retryMaxIntervalMs;
            return this;
        }

        public Builder executionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode != null ? executionMode : ExecutionMode.LIVE;
            return this;
        }

        public Builder graphDir(String graphDir) {
            this.graphDir = graphDir != null ? graphDir : DEFAULT_GRAPH_DIR;
            return this;
        }

        public Builder graphKeyPrefix(String graphKeyPrefix) {
            this.graphKeyPrefix = graphKeyPrefix != null ? graphKeyPrefix : DEFAULT_GRAPH_KEY_PREFIX;
            return this;
        }

        public Builder snapshotStore(String snapshotStore) {
            this.snapshotStore = snapshotStore != null ? snapshotStore : STORE_MEMORY;
            return this;
        }

        public Builder snapshotKeyPrefix(String snapshotKeyPrefix) {
            this.snapshotKeyPrefix = snapshotKeyPrefix != null ? snapshotKeyPrefix : DEFAULT_SNAPSHOT_KEY_PREFIX;
            return this;
        }

        public Builder snapshotTtlSeconds(int snapshotTtlSeconds) {
            this.snapshotTtlSeconds = Math.max(0, snapshotTtlSeconds);
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder runThreads(int runThreads) {
            this.runThreads = Math.max(1, runThreads);
            return this;
        }

        public HiveConfig build() {
            return new HiveConfig(this);
        }
    }
}
