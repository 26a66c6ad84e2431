package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When an edge may be taken. JSON uses {@code always}, {@code on_success}, {@code on_failure}, {@code predicate};
 * unknown values deserialize as {@link #UNKNOWN} and are reported by validation.
 */
public enum EdgeCondition {
    ALWAYS("always"),
    ON_SUCCESS("on_success"),
    ON_FAILURE("on_failure"),
    /** Matches when the edge's predicate expression is truthy against context plus outcome. */
    PREDICATE("predicate"),
    UNKNOWN("unknown");

    private final String value;

    EdgeCondition(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static EdgeCondition fromValue(String value) {
        if (value == null || value.isBlank()) return ALWAYS;
        String normalized = value.trim().toLowerCase().replace('-', '_');
        for (EdgeCondition c : values()) {
            if (c != UNKNOWN && c.value.equals(normalized)) return c;
        }
        return UNKNOWN;
    }
}
