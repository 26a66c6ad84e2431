package com.hive.features.metrics;

import com.hive.engine.ExecutionListener;
import com.hive.engine.RunResult;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Listener that records node and run meters:
 * <ul>
 *   <li>{@code hive.node.executions} counter per node, kind and final status</li>
 *   <li>{@code hive.node.attempts.failed} counter per node and error kind</li>
 *   <li>{@code hive.node.duration} timer per node and kind, retries included</li>
 *   <li>{@code hive.run.started} and {@code hive.run.completed} counters per graph</li>
 * </ul>
 * Tags stay low-cardinality: run ids are never used as tags.
 * The no-arg constructor shares one lazily created {@link SimpleMeterRegistry} (CAS, no locks).
 */
public final class MetricsListener implements ExecutionListener {

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    private final MeterRegistry registry;

    public MetricsListener() {
        this(sharedRegistry());
    }

    public MetricsListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Returns the shared registry, creating it on first call. At most one is ever created. */
    static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onRunStarted(String runId, GraphDefinition graph, boolean resumed) {
        registry.counter("hive.run.started",
                "graph", nullToUnknown(graph.getName()),
                "resumed", String.valueOf(resumed)
        ).increment();
    }

    @Override
    public void onAttemptFailed(String runId, NodeSpec node, int attempt, NodeOutcome outcome) {
        registry.counter("hive.node.attempts.failed",
                "node", nullToUnknown(node.getId()),
                "errorKind", outcome.getErrorKind() != null ? outcome.getErrorKind().name() : "unknown"
        ).increment();
    }

    @Override
    public void onNodeCompleted(String runId, NodeSpec node, NodeOutcome outcome, int attempts, Duration elapsed) {
        String nodeId = nullToUnknown(node.getId());
        String kind = node.getType().toValue();
        registry.counter("hive.node.executions",
                "node", nodeId,
                "kind", kind,
                "status", outcome.getStatus().toValue()
        ).increment();
        Timer.builder("hive.node.duration")
                .tag("node", nodeId)
                .tag("kind", kind)
                .register(registry)
                .record(elapsed != null ? elapsed : Duration.ZERO);
    }

    @Override
    public void onRunFinished(RunResult result) {
        registry.counter("hive.run.completed",
                "graph", nullToUnknown(result.getGraphName()),
                "status", result.getStatus().name(),
                "mode", result.getMode().name()
        ).increment();
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
