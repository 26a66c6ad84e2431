package com.hive.engine.node;

import com.hive.engine.ErrorKind;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.CapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs exactly one attempt of a node through the handler for its kind and reports a structured outcome.
 * Nothing thrown by a handler escapes: capability errors keep their classification, cancellation becomes
 * {@link ErrorKind#CANCELLED}, anything else is {@link ErrorKind#UPSTREAM_FAILURE}.
 * Successful outcomes are restricted to the node's output keys; model and tool nodes must produce all of them.
 */
public final class NodeInvoker {

    private static final Logger log = LoggerFactory.getLogger(NodeInvoker.class);

    private final NodeHandlerRegistry registry;

    public NodeInvoker(NodeHandlerRegistry registry) {
        this.registry = registry;
    }

    public NodeOutcome invoke(NodeInput input) {
        NodeSpec node = input.getNode();
        NodeOutcome outcome;
        try {
            outcome = registry.forType(node.getType()).handle(input);
        } catch (CapabilityException e) {
            outcome = NodeOutcome.failure(ErrorKind.fromCapability(e.getKind()), e.getMessage());
        } catch (CancellationException e) {
            outcome = NodeOutcome.failure(ErrorKind.CANCELLED, e.getMessage() != null ? e.getMessage() : "Cancelled");
        } catch (RuntimeException e) {
            log.debug("Node {} handler threw", node.getId(), e);
            outcome = NodeOutcome.failure(ErrorKind.UPSTREAM_FAILURE,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (outcome == null) {
            return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT, "Handler returned no outcome for node " + node.getId());
        }
        return outcome.isSuccess() ? enforceOutputKeys(node, outcome) : outcome;
    }

    private static NodeOutcome enforceOutputKeys(NodeSpec node, NodeOutcome outcome) {
        Map<String, Object> produced = outcome.getProduced();
        Map<String, Object> declared = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String key : node.getOutputKeys()) {
            if (produced.containsKey(key)) {
                declared.put(key, produced.get(key));
            } else {
                missing.add(key);
            }
        }
        if (declared.size() < produced.size()) {
            log.debug("Node {} produced undeclared keys; dropping {}", node.getId(),
                    produced.keySet().stream().filter(k -> !node.getOutputKeys().contains(k)).toList());
        }
        boolean external = node.getType() == NodeKind.MODEL || node.getType() == NodeKind.TOOL;
        if (external && !missing.isEmpty()) {
            return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT,
                    "Node " + node.getId() + " did not produce output keys " + missing);
        }
        return declared.size() == produced.size() ? outcome : NodeOutcome.success(declared);
    }
}
