package com.hive.engine.node.handlers;

import com.hive.engine.ErrorKind;
import com.hive.engine.node.CapabilityCalls;
import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.engine.node.NodeParams;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.CapabilityErrorKind;
import com.hive.plugin.ToolCapability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * TOOL nodes: calls the node's single tool with arguments drawn from context.
 * <p>
 * Arguments are the input subset, renamed through {@code params.argNames} ({@code {contextKey: argName}}) and
 * layered over constant {@code params.args}. A map result is read by output key; any other result fills a single
 * output key. A map carrying an {@code error} string (the convention of API-wrapping tools) is a failure,
 * classified by its optional {@code errorKind}.
 */
public final class ToolNodeHandler implements NodeHandler {

    static final String PARAM_ARG_NAMES = "argNames";
    static final String PARAM_ARGS = "args";

    private final ToolCapability tools;

    public ToolNodeHandler(ToolCapability tools) {
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    @Override
    public Set<NodeKind> supportedTypes() {
        return Set.of(NodeKind.TOOL);
    }

    @Override
    public NodeOutcome handle(NodeInput input) {
        NodeSpec node = input.getNode();
        if (node.getToolRefs().isEmpty()) {
            return NodeOutcome.failure(ErrorKind.INVALID_ARGS, "Tool node " + node.getId() + " declares no tool ref");
        }
        String toolId = node.getToolRefs().get(0);
        Object result = CapabilityCalls.await(tools.call(toolId, arguments(node, input.getInputs())),
                input.getTimeout(), input.getCancellationToken());
        return map(node, toolId, result);
    }

    static Map<String, Object> arguments(NodeSpec node, Map<String, Object> inputs) {
        Map<String, Object> args = new LinkedHashMap<>(NodeParams.paramMap(node, PARAM_ARGS));
        Map<String, Object> rename = NodeParams.paramMap(node, PARAM_ARG_NAMES);
        for (Map.Entry<String, Object> e : inputs.entrySet()) {
            Object alias = rename.get(e.getKey());
            args.put(alias != null ? alias.toString() : e.getKey(), e.getValue());
        }
        return args;
    }

    private static NodeOutcome map(NodeSpec node, String toolId, Object result) {
        List<String> outputKeys = node.getOutputKeys();
        if (result instanceof Map<?, ?> map) {
            if (map.get("error") instanceof String error && outputKeys.stream().noneMatch(map::containsKey)) {
                Object kind = map.get("errorKind");
                return NodeOutcome.failure(ErrorKind.fromCapability(CapabilityErrorKind.fromValue(kind != null ? kind.toString() : null)),
                        toolId + ": " + error);
            }
            Map<String, Object> produced = new LinkedHashMap<>();
            for (String key : outputKeys) {
                if (map.containsKey(key)) produced.put(key, map.get(key));
            }
            if (produced.isEmpty() && outputKeys.size() == 1) {
                produced.put(outputKeys.get(0), result);
            }
            return NodeOutcome.success(produced);
        }
        if (outputKeys.isEmpty()) {
            return NodeOutcome.success(Map.of());
        }
        if (outputKeys.size() == 1) {
            Map<String, Object> produced = new LinkedHashMap<>();
            produced.put(outputKeys.get(0), result);
            return NodeOutcome.success(produced);
        }
        return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT,
                "Tool " + toolId + " returned a non-map result for " + outputKeys.size() + " output keys");
    }
}
