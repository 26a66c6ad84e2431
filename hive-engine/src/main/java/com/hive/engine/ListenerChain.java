package com.hive.engine;

import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans events out to registered listeners; a failing listener is logged and skipped.
 */
final class ListenerChain implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(ListenerChain.class);

    private final List<ExecutionListener> listeners;

    ListenerChain(List<ExecutionListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    private void each(String event, Consumer<ExecutionListener> call) {
        for (ExecutionListener l : listeners) {
            try {
                call.accept(l);
            } catch (Throwable t) {
                log.warn("Execution listener {} failed on {} (observer-only); continuing", l.getClass().getName(), event, t);
            }
        }
    }

    @Override
    public void onRunStarted(String runId, GraphDefinition graph, boolean resumed) {
        each("runStarted", l -> l.onRunStarted(runId, graph, resumed));
    }

    @Override
    public void onNodeStarted(String runId, NodeSpec node, int step) {
        each("nodeStarted", l -> l.onNodeStarted(runId, node, step));
    }

    @Override
    public void onAttemptFailed(String runId, NodeSpec node, int attempt, NodeOutcome outcome) {
        each("attemptFailed", l -> l.onAttemptFailed(runId, node, attempt, outcome));
    }

    @Override
    public void onNodeCompleted(String runId, NodeSpec node, NodeOutcome outcome, int attempts, Duration elapsed) {
        each("nodeCompleted", l -> l.onNodeCompleted(runId, node, outcome, attempts, elapsed));
    }

    @Override
    public void onRunFinished(RunResult result) {
        each("runFinished", l -> l.onRunFinished(result));
    }
}
