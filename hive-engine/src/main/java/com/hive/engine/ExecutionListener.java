package com.hive.engine;

import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeSpec;

import java.time.Duration;

/**
 * Observer of run progress (metrics, audit, debugging). All methods default to no-ops.
 * Listeners are observers only: an exception thrown here is logged and the run continues.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {
    };

    default void onRunStarted(String runId, GraphDefinition graph, boolean resumed) {
    }

    default void onNodeStarted(String runId, NodeSpec node, int step) {
    }

    default void onAttemptFailed(String runId, NodeSpec node, int attempt, NodeOutcome outcome) {
    }

    default void onNodeCompleted(String runId, NodeSpec node, NodeOutcome outcome, int attempts, Duration elapsed) {
    }

    default void onRunFinished(RunResult result) {
    }
}
