package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution strategy of a graph node. JSON uses the lower-case dashed name ({@code model}, {@code tool},
 * {@code conditional}, {@code terminal-pass}); unknown values deserialize as {@link #UNKNOWN} so that
 * {@code validate()} can report them instead of failing the parse.
 *
 * @see NodeSpec#getType()
 */
public enum NodeKind {
    /** Delegates to the external model capability with the node's instructions and input subset. */
    MODEL("model"),
    /** Invokes exactly one declared external tool with arguments drawn from context. */
    TOOL("tool"),
    /** Pure function of context to a produced mapping; no external call. */
    CONDITIONAL("conditional"),
    /** Identity passthrough marking a graph endpoint. */
    TERMINAL_PASS("terminal-pass"),
    /** Used when the definition contains an unknown type string. */
    UNKNOWN("unknown");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (NodeKind k : values()) {
            if (k != UNKNOWN && k.value.equals(normalized)) return k;
        }
        return UNKNOWN;
    }

    /** True for kinds that make one external call per attempt. */
    public boolean isExternal() {
        return this == MODEL || this == TOOL;
    }
}
