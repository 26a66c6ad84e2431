package com.hive.engine.mock;

import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source of deterministic outcomes for MODEL and TOOL nodes in mock mode.
 */
@FunctionalInterface
public interface MockOutcomes {

    /**
     * @param invocation 1-based count of attempts of this node in the run, retries included
     */
    NodeOutcome outcomeFor(NodeSpec node, int invocation);

    /** Success producing {@code "mock:<nodeId>:<key>"} for every output key. */
    static MockOutcomes canned() {
        return (node, invocation) -> cannedSuccess(node);
    }

    static NodeOutcome cannedSuccess(NodeSpec node) {
        Map<String, Object> produced = new LinkedHashMap<>();
        for (String key : node.getOutputKeys()) {
            produced.put(key, "mock:" + node.getId() + ":" + key);
        }
        return NodeOutcome.success(produced);
    }
}
