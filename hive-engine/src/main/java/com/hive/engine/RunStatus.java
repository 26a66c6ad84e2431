package com.hive.engine;

/**
 * Run state machine. {@link #PAUSED} is a suspension point with a defined resumption target; the rest are terminal.
 */
public enum RunStatus {
    RUNNING,
    PAUSED,
    SUCCEEDED,
    FAILED,
    /** Step ceiling reached; distinct from FAILED so callers can tell a looping graph from a broken one. */
    BUDGET_EXCEEDED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == BUDGET_EXCEEDED;
    }
}
