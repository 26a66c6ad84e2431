package com.hive.engine.node;

import com.hive.graph.model.NodeKind;

import java.util.Set;

/**
 * Executes one attempt of nodes of the supported kinds. Handlers may throw; the {@link NodeInvoker} turns
 * anything thrown into a classified failure outcome.
 */
public interface NodeHandler {

    Set<NodeKind> supportedTypes();

    NodeOutcome handle(NodeInput input);
}
