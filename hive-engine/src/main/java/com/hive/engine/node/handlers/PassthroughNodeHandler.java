package com.hive.engine.node.handlers;

import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeKind;

import java.util.Map;
import java.util.Set;

/** TERMINAL_PASS nodes: identity, no computation. */
public final class PassthroughNodeHandler implements NodeHandler {

    @Override
    public Set<NodeKind> supportedTypes() {
        return Set.of(NodeKind.TERMINAL_PASS);
    }

    @Override
    public NodeOutcome handle(NodeInput input) {
        return NodeOutcome.success(Map.of());
    }
}
