package com.hive.plugin;

import com.hive.graph.model.Goal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Request handed to the model capability for one attempt of a {@code model} node.
 * {@code inputs} is the context subset at the node's input keys.
 */
public final class ModelRequest {

    private static final BooleanSupplier NEVER = () -> false;

    private final String nodeId;
    private final String instructions;
    private final Map<String, Object> inputs;
    private final List<String> toolRefs;
    private final List<String> outputKeys;
    private final Goal goal;
    private final BooleanSupplier cancellationRequested;

    public ModelRequest(String nodeId, String instructions, Map<String, Object> inputs, List<String> toolRefs,
                        List<String> outputKeys, Goal goal, BooleanSupplier cancellationRequested) {
        this.nodeId = nodeId;
        this.instructions = instructions;
        this.inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        this.toolRefs = toolRefs != null ? List.copyOf(toolRefs) : List.of();
        this.outputKeys = outputKeys != null ? List.copyOf(outputKeys) : List.of();
        this.goal = goal;
        this.cancellationRequested = cancellationRequested != null ? cancellationRequested : NEVER;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getInstructions() {
        return instructions;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public List<String> getToolRefs() {
        return toolRefs;
    }

    /** Keys the node expects back; lets a capability shape structured output. */
    public List<String> getOutputKeys() {
        return outputKeys;
    }

    public Goal getGoal() {
        return goal;
    }

    /** Long-running capabilities should poll this and stop early when it turns true. */
    public boolean isCancellationRequested() {
        return cancellationRequested.getAsBoolean();
    }
}
