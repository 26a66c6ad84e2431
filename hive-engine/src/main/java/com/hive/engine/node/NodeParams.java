package com.hive.engine.node;

import com.hive.graph.model.NodeSpec;

import java.util.List;
import java.util.Map;

/**
 * Reads typed parameters from a node's params map.
 */
public final class NodeParams {

    private NodeParams() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> paramMap(NodeSpec node, String key) {
        Object v = node.getParams().get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    public static List<?> paramList(NodeSpec node, String key) {
        Object v = node.getParams().get(key);
        return v instanceof List<?> list ? list : List.of();
    }
}
