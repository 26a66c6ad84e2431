package com.hive.runtime;

import com.hive.config.HiveConfig;
import com.hive.config.RedisGraphSource;
import com.hive.config.RedisSnapshotStore;
import com.hive.context.InMemorySnapshotStore;
import com.hive.context.SnapshotStore;
import com.hive.engine.EngineSettings;
import com.hive.engine.ExecutionEngine;
import com.hive.features.metrics.MetricsListener;
import com.hive.graph.load.GraphLoader;
import com.hive.graph.load.GraphSource;
import com.hive.plugin.ModelCapability;
import com.hive.plugin.ToolRegistry;
import com.hive.plugin.credential.CredentialRequirements;
import com.hive.plugin.credential.CredentialSpec;
import com.hive.plugin.credential.CredentialStore;
import com.hive.plugin.credential.EnvCredentialStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Wires a {@link HiveRuntime} from {@link HiveConfig}: engine settings, the snapshot store
 * ({@code memory} or Redis), graph loading (Redis cache then {@code <graphDir>/<name>.json}), credentials from the
 * environment and the metrics listener.
 */
public final class HiveBootstrap {

    private static final Logger log = LoggerFactory.getLogger(HiveBootstrap.class);

    private final HiveConfig config;
    private ModelCapability model = ModelCapability.unavailable();
    private ToolRegistry tools = ToolRegistry.empty();
    private final List<CredentialSpec> credentialSpecs = new ArrayList<>();
    private CredentialStore credentialStore;
    private MeterRegistry meterRegistry;

    private HiveBootstrap(HiveConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static HiveBootstrap forConfig(HiveConfig config) {
        return new HiveBootstrap(config);
    }

    /** Bootstrap over {@link HiveConfig#fromEnvironment()}. */
    public static HiveBootstrap fromEnvironment() {
        log.info("Bootstrap: loading configuration from environment");
        return new HiveBootstrap(HiveConfig.fromEnvironment());
    }

    public HiveBootstrap modelCapability(ModelCapability model) {
        this.model = Objects.requireNonNull(model, "model");
        return this;
    }

    public HiveBootstrap tools(ToolRegistry tools) {
        this.tools = Objects.requireNonNull(tools, "tools");
        return this;
    }

    public HiveBootstrap credentials(Collection<CredentialSpec> specs) {
        credentialSpecs.addAll(specs);
        return this;
    }

    /** Overrides the environment-backed store. */
    public HiveBootstrap credentialStore(CredentialStore store) {
        this.credentialStore = Objects.requireNonNull(store, "store");
        return this;
    }

    /** Registry for engine meters; the shared simple registry when unset. */
    public HiveBootstrap meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    public HiveRuntime initialize() {
        EngineSettings settings = config.toEngineSettings();
        log.info("Bootstrap: stepBudget={}, nodeTimeout={}, mode={}, snapshotStore={}, graphDir={}",
                settings.getStepBudget(), settings.getNodeTimeout(), settings.getMode(), config.getSnapshotStore(),
                Path.of(config.getGraphDir()).toAbsolutePath());

        MetricsListener metrics = meterRegistry != null ? new MetricsListener(meterRegistry) : new MetricsListener();
        CredentialStore store = credentialStore != null ? credentialStore : EnvCredentialStore.fromSystemEnv(credentialSpecs);
        ExecutionEngine engine = ExecutionEngine.builder(settings)
                .modelCapability(model)
                .toolCapability(tools)
                .credentials(store, new CredentialRequirements(credentialSpecs))
                .listener(metrics)
                .build();
        if (tools.getToolIds().isEmpty()) {
            log.warn("Bootstrap: no tools registered; tool nodes will fail with NOT_FOUND");
        } else {
            log.info("Bootstrap: registered tools {}", tools.getToolIds());
        }

        SnapshotStore snapshots;
        GraphSource graphSource;
        AutoCloseable graphConnection = null;
        if (config.isRedisSnapshotStore()) {
            snapshots = new RedisSnapshotStore(config);
            RedisGraphSource redisGraphs = new RedisGraphSource(config);
            graphSource = redisGraphs;
            graphConnection = redisGraphs;
        } else {
            snapshots = new InMemorySnapshotStore();
            graphSource = GraphSource.empty();
        }
        GraphLoader loader = new GraphLoader(graphSource, Path.of(config.getGraphDir()), config.getGraphKeyPrefix());
        WorkflowRunner runner = new WorkflowRunner(engine, snapshots, config.getRunThreads());
        log.info("Bootstrap: runner ready with {} async thread(s)", config.getRunThreads());
        return new HiveRuntime(config, loader, runner, metrics.getRegistry(), graphConnection);
    }
}
