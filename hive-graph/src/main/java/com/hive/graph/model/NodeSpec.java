package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable node of a workflow graph. The {@link #getType() type} selects the execution strategy;
 * {@code inputKeys} must be present in context before invocation and {@code outputKeys} are populated on success.
 * Output keys may only repeat input keys when {@link #isOverwritesInputs()} is set explicitly.
 */
public final class NodeSpec {

    private final String id;
    private final NodeKind type;
    private final List<String> inputKeys;
    private final List<String> outputKeys;
    private final boolean overwritesInputs;
    private final String instructions;
    private final List<String> toolRefs;
    private final int maxRetries;
    private final Integer timeoutSeconds;
    private final Map<String, Object> params;

    @JsonCreator
    public NodeSpec(
            @JsonProperty("id") String id,
            @JsonProperty("type") NodeKind type,
            @JsonProperty("inputKeys") List<String> inputKeys,
            @JsonProperty("outputKeys") List<String> outputKeys,
            @JsonProperty("overwritesInputs") Boolean overwritesInputs,
            @JsonProperty("instructions") String instructions,
            @JsonProperty("toolRefs") List<String> toolRefs,
            @JsonProperty("maxRetries") Integer maxRetries,
            @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
            @JsonProperty("params") Map<String, Object> params) {
        this.id = id;
        this.type = type != null ? type : NodeKind.UNKNOWN;
        this.inputKeys = orderedDistinct(inputKeys);
        this.outputKeys = orderedDistinct(outputKeys);
        this.overwritesInputs = Boolean.TRUE.equals(overwritesInputs);
        this.instructions = instructions;
        this.toolRefs = orderedDistinct(toolRefs);
        this.maxRetries = maxRetries != null ? maxRetries : 0;
        this.timeoutSeconds = timeoutSeconds;
        this.params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
    }

    /** Convenience for nodes without instructions, tools, timeout or params. */
    public static NodeSpec of(String id, NodeKind type, List<String> inputKeys, List<String> outputKeys) {
        return new NodeSpec(id, type, inputKeys, outputKeys, null, null, null, null, null, null);
    }

    private static List<String> orderedDistinct(List<String> keys) {
        if (keys == null || keys.isEmpty()) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        for (String k : keys) {
            if (k != null) seen.add(k);
        }
        return List.copyOf(seen);
    }

    public String getId() {
        return id;
    }

    /** Never null; {@link NodeKind#UNKNOWN} when the definition named an unsupported type. */
    public NodeKind getType() {
        return type;
    }

    public List<String> getInputKeys() {
        return inputKeys;
    }

    public List<String> getOutputKeys() {
        return outputKeys;
    }

    public boolean isOverwritesInputs() {
        return overwritesInputs;
    }

    public String getInstructions() {
        return instructions;
    }

    public List<String> getToolRefs() {
        return toolRefs;
    }

    /** Additional attempts after the first failure. */
    public int getMaxRetries() {
        return maxRetries;
    }

    /** Per-invocation timeout override in seconds, or null to use the engine default. */
    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeSpec that = (NodeSpec) o;
        return overwritesInputs == that.overwritesInputs
                && maxRetries == that.maxRetries
                && Objects.equals(id, that.id)
                && type == that.type
                && Objects.equals(inputKeys, that.inputKeys)
                && Objects.equals(outputKeys, that.outputKeys)
                && Objects.equals(instructions, that.instructions)
                && Objects.equals(toolRefs, that.toolRefs)
                && Objects.equals(timeoutSeconds, that.timeoutSeconds)
                && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, inputKeys, outputKeys, overwritesInputs, instructions, toolRefs,
                maxRetries, timeoutSeconds, params);
    }

    @Override
    public String toString() {
        return "NodeSpec{id='" + id + "', type=" + type + "}";
    }
}
