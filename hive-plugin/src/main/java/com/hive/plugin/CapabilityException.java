package com.hive.plugin;

import java.util.Objects;

/**
 * Failure reported by a model or tool capability. Implementations complete their future exceptionally with this
 * (or throw it) so the node invoker can classify the outcome.
 */
public class CapabilityException extends RuntimeException {

    private final CapabilityErrorKind kind;

    public CapabilityException(CapabilityErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CapabilityException(CapabilityErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /** Builds the exception for a failed HTTP response; non-error statuses are treated as upstream failures. */
    public static CapabilityException forHttpStatus(int status, String message) {
        CapabilityErrorKind kind = CapabilityErrorKind.fromHttpStatus(status);
        return new CapabilityException(kind != null ? kind : CapabilityErrorKind.UPSTREAM_FAILURE,
                message + " (HTTP " + status + ")");
    }

    public CapabilityErrorKind getKind() {
        return kind;
    }
}
