package com.hive.graph.validation;

/** Classification of graph definition defects reported by {@link GraphValidator}. */
public enum StructuralErrorCode {
    BLANK_NODE_ID,
    DUPLICATE_NODE_ID,
    UNKNOWN_NODE_TYPE,
    NEGATIVE_MAX_RETRIES,
    MISSING_ENTRY_POINT,
    UNKNOWN_ENTRY_POINT,
    DANGLING_EDGE_SOURCE,
    DANGLING_EDGE_TARGET,
    DUPLICATE_EDGE_ID,
    UNKNOWN_EDGE_CONDITION,
    KEY_OVERLAP,
    UNKNOWN_PAUSE_NODE,
    UNKNOWN_TERMINAL_NODE,
    MISSING_PREDICATE,
    UNEXPECTED_PREDICATE,
    INVALID_PREDICATE,
    INVALID_TOOL_REFS,
    RETRYING_CONDITIONAL,
    INVALID_CONDITIONAL_RULES
}
