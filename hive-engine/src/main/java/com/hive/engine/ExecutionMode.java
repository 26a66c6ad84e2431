package com.hive.engine;

/**
 * LIVE calls the model and tool capabilities. MOCK substitutes canned outcomes for model and tool nodes
 * and marks every result as mock so it cannot be mistaken for a real run.
 */
public enum ExecutionMode {
    LIVE,
    MOCK;

    public static ExecutionMode fromValue(String value) {
        if (value == null || value.isBlank()) return LIVE;
        return "mock".equalsIgnoreCase(value.trim()) ? MOCK : LIVE;
    }
}
