package com.hive.engine.node;

import com.hive.engine.ErrorKind;
import com.hive.graph.model.NodeKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps node kinds to handlers. Later handlers in the list replace earlier ones for the same kind,
 * which is how new or substitute strategies are plugged in.
 */
public final class NodeHandlerRegistry {

    private final Map<NodeKind, NodeHandler> handlers = new EnumMap<>(NodeKind.class);
    private final NodeHandler unsupported = new UnsupportedKindHandler();

    public NodeHandlerRegistry(List<NodeHandler> handlerList) {
        for (NodeHandler handler : handlerList) {
            for (NodeKind type : handler.supportedTypes()) {
                handlers.put(type, handler);
            }
        }
    }

    public NodeHandler forType(NodeKind type) {
        if (type == null) {
            return unsupported;
        }
        return handlers.getOrDefault(type, unsupported);
    }

    private static final class UnsupportedKindHandler implements NodeHandler {
        @Override
        public Set<NodeKind> supportedTypes() {
            return Set.of();
        }

        @Override
        public NodeOutcome handle(NodeInput input) {
            return NodeOutcome.failure(ErrorKind.STRUCTURAL,
                    "No handler for node type " + input.getNode().getType().toValue());
        }
    }
}
