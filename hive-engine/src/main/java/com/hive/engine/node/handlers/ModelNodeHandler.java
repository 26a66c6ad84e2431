package com.hive.engine.node.handlers;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hive.engine.ErrorKind;
import com.hive.engine.node.CapabilityCalls;
import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.ModelCapability;
import com.hive.plugin.ModelRequest;
import com.hive.plugin.ModelResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * MODEL nodes: sends instructions, the input subset and tool refs to the model capability and maps the response
 * onto the output keys. Structured responses are read by key; a single output key takes the text; several keys
 * require the text to be a JSON object. Empty text never counts as output.
 */
public final class ModelNodeHandler implements NodeHandler {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ModelCapability model;

    public ModelNodeHandler(ModelCapability model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public Set<NodeKind> supportedTypes() {
        return Set.of(NodeKind.MODEL);
    }

    @Override
    public NodeOutcome handle(NodeInput input) {
        NodeSpec node = input.getNode();
        ModelRequest request = new ModelRequest(node.getId(), node.getInstructions(), input.getInputs(),
                node.getToolRefs(), node.getOutputKeys(), input.getGoal(), input.getCancellationToken()::isCancelled);
        ModelResponse response = CapabilityCalls.await(model.complete(request), input.getTimeout(), input.getCancellationToken());
        if (response == null) {
            return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT, "Model returned no response");
        }
        return map(node.getOutputKeys(), response);
    }

    private static NodeOutcome map(List<String> outputKeys, ModelResponse response) {
        if (outputKeys.isEmpty()) {
            return NodeOutcome.success(Map.of());
        }
        if (response.hasStructured()) {
            return NodeOutcome.success(pick(outputKeys, response.getStructured()));
        }
        String text = response.getText();
        if (text == null || text.isBlank()) {
            return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT, "Model returned empty text for output keys " + outputKeys);
        }
        if (outputKeys.size() == 1) {
            return NodeOutcome.success(Map.of(outputKeys.get(0), text));
        }
        try {
            return NodeOutcome.success(pick(outputKeys, MAPPER.readValue(text, MAP_TYPE)));
        } catch (Exception e) {
            return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT, "Model text is not a JSON object: " + e.getMessage());
        }
    }

    private static Map<String, Object> pick(List<String> keys, Map<String, Object> source) {
        Map<String, Object> produced = new LinkedHashMap<>();
        for (String key : keys) {
            if (source.containsKey(key)) produced.put(key, source.get(key));
        }
        return produced;
    }
}
