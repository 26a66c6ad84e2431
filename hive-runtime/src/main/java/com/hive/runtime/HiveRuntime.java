package com.hive.runtime;

import com.hive.config.HiveConfig;
import com.hive.graph.load.GraphLoader;
import com.hive.graph.model.GraphDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What {@link HiveBootstrap} builds: configuration, graph loading, the runner and the meter registry the
 * engine reports to. Closing it closes the runner and any cache connection.
 */
public final class HiveRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HiveRuntime.class);

    private final HiveConfig config;
    private final GraphLoader graphLoader;
    private final WorkflowRunner runner;
    private final MeterRegistry meterRegistry;
    private final AutoCloseable graphSourceConnection;

    HiveRuntime(HiveConfig config, GraphLoader graphLoader, WorkflowRunner runner, MeterRegistry meterRegistry,
                AutoCloseable graphSourceConnection) {
        this.config = config;
        this.graphLoader = graphLoader;
        this.runner = runner;
        this.meterRegistry = meterRegistry;
        this.graphSourceConnection = graphSourceConnection;
    }

    public HiveConfig getConfig() {
        return config;
    }

    public GraphLoader getGraphLoader() {
        return graphLoader;
    }

    public WorkflowRunner getRunner() {
        return runner;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Loads a graph by name and version (cache first, then the graph directory). */
    public GraphDefinition loadGraph(String name, String version) {
        return graphLoader.loadGraph(name, version);
    }

    @Override
    public void close() {
        runner.close();
        if (graphSourceConnection != null) {
            try {
                graphSourceConnection.close();
            } catch (Exception e) {
                log.warn("Failed to close graph source: {}", e.getMessage(), e);
            }
        }
    }
}
