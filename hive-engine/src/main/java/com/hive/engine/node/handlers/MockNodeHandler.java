package com.hive.engine.node.handlers;

import com.hive.engine.mock.MockOutcomes;
import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeKind;

import java.util.Objects;
import java.util.Set;

/**
 * Replaces MODEL and TOOL handlers in mock mode: returns a canned outcome and makes no external call.
 */
public final class MockNodeHandler implements NodeHandler {

    private final MockOutcomes outcomes;

    public MockNodeHandler(MockOutcomes outcomes) {
        this.outcomes = Objects.requireNonNull(outcomes, "outcomes");
    }

    @Override
    public Set<NodeKind> supportedTypes() {
        return Set.of(NodeKind.MODEL, NodeKind.TOOL);
    }

    @Override
    public NodeOutcome handle(NodeInput input) {
        return outcomes.outcomeFor(input.getNode(), input.getInvocation());
    }
}
