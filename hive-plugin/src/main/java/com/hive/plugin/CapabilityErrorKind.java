package com.hive.plugin;

/**
 * Classified failure of an external model or tool call.
 */
public enum CapabilityErrorKind {
    AUTH,
    NOT_FOUND,
    RATE_LIMITED,
    INVALID_ARGS,
    UPSTREAM_FAILURE,
    TIMEOUT;

    /**
     * Classifies an HTTP status from a wrapped API: 401/403 auth, 404 not found, 429 rate limited,
     * 400/422 invalid arguments, 408/504 timeout, any other status from 400 up is an upstream failure.
     *
     * @return the kind, or null for non-error statuses
     */
    public static CapabilityErrorKind fromHttpStatus(int status) {
        return switch (status) {
            case 401, 403 -> AUTH;
            case 404 -> NOT_FOUND;
            case 429 -> RATE_LIMITED;
            case 400, 422 -> INVALID_ARGS;
            case 408, 504 -> TIMEOUT;
            default -> status >= 400 ? UPSTREAM_FAILURE : null;
        };
    }

    /** Lenient parse used for tool error payloads; unknown values are upstream failures. */
    public static CapabilityErrorKind fromValue(String value) {
        if (value == null || value.isBlank()) return UPSTREAM_FAILURE;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (CapabilityErrorKind k : values()) {
            if (k.name().equals(normalized)) return k;
        }
        return UPSTREAM_FAILURE;
    }
}
