package com.hive.engine.node;

import com.hive.engine.CancellationToken;
import com.hive.graph.model.Goal;
import com.hive.graph.model.NodeSpec;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a handler sees for one attempt. {@code inputs} and {@code context} are immutable snapshots taken
 * once per node visit, so every retry of the visit observes the same state.
 */
public final class NodeInput {

    private final String runId;
    private final NodeSpec node;
    private final Map<String, Object> inputs;
    private final Map<String, Object> context;
    private final Goal goal;
    private final CancellationToken cancellationToken;
    private final Duration timeout;
    private final int attempt;
    private final int invocation;

    public NodeInput(String runId, NodeSpec node, Map<String, Object> inputs, Map<String, Object> context, Goal goal,
                     CancellationToken cancellationToken, Duration timeout) {
        this(runId, node, inputs, context, goal, cancellationToken, timeout, 1, 1);
    }

    private NodeInput(String runId, NodeSpec node, Map<String, Object> inputs, Map<String, Object> context, Goal goal,
                      CancellationToken cancellationToken, Duration timeout, int attempt, int invocation) {
        this.runId = runId;
        this.node = Objects.requireNonNull(node, "node");
        this.inputs = inputs != null ? inputs : Map.of();
        this.context = context != null ? context : Map.of();
        this.goal = goal;
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.none();
        this.timeout = timeout;
        this.attempt = attempt;
        this.invocation = invocation;
    }

    /** Same snapshot, different attempt counters. */
    public NodeInput forAttempt(int attempt, int invocation) {
        return new NodeInput(runId, node, inputs, context, goal, cancellationToken, timeout, attempt, invocation);
    }

    public String getRunId() {
        return runId;
    }

    public NodeSpec getNode() {
        return node;
    }

    /** Context values at the node's input keys, in declaration order. */
    public Map<String, Object> getInputs() {
        return inputs;
    }

    /** Full context as of the start of this visit. */
    public Map<String, Object> getContext() {
        return context;
    }

    public Goal getGoal() {
        return goal;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /** Per-invocation timeout, or null for none. */
    public Duration getTimeout() {
        return timeout;
    }

    /** 1-based attempt within this visit. */
    public int getAttempt() {
        return attempt;
    }

    /** 1-based count of attempts of this node across the whole run (visits and retries). */
    public int getInvocation() {
        return invocation;
    }
}
