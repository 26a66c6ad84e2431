package com.hive.engine;

import com.hive.plugin.CapabilityErrorKind;

/**
 * Terminal or per-attempt error classification carried by node outcomes and run results.
 */
public enum ErrorKind {
    TIMEOUT,
    AUTH_FAILURE,
    RATE_LIMITED,
    UPSTREAM_FAILURE,
    INVALID_ARGS,
    NOT_FOUND,
    /** Node ran but did not produce its declared output keys in a usable form. */
    INVALID_OUTPUT,
    MISSING_KEY,
    MISSING_CREDENTIAL,
    NO_MATCHING_EDGE,
    BUDGET_EXCEEDED,
    /** Graph failed validation, or referenced a node that does not exist. */
    STRUCTURAL,
    CANCELLED;

    public static ErrorKind fromCapability(CapabilityErrorKind kind) {
        if (kind == null) return UPSTREAM_FAILURE;
        return switch (kind) {
            case AUTH -> AUTH_FAILURE;
            case NOT_FOUND -> NOT_FOUND;
            case RATE_LIMITED -> RATE_LIMITED;
            case INVALID_ARGS -> INVALID_ARGS;
            case TIMEOUT -> TIMEOUT;
            case UPSTREAM_FAILURE -> UPSTREAM_FAILURE;
        };
    }

    /** Precondition and control kinds are never retried, whatever the retry policy says. */
    public boolean isAlwaysFinal() {
        return this == MISSING_KEY || this == MISSING_CREDENTIAL || this == CANCELLED || this == STRUCTURAL;
    }
}
