package com.hive.engine.node;

import com.hive.engine.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one invocation attempt. Failures carry a classified kind and message; successes carry
 * {@code produced}, the values to commit at the node's output keys.
 */
public final class NodeOutcome {

    public enum Status {
        SUCCESS("success"),
        FAILURE("failure");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        /** Lower-case form used in predicate scopes ({@code outcome.status == 'failure'}). */
        public String toValue() {
            return value;
        }
    }

    private final Status status;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final Map<String, Object> produced;

    private NodeOutcome(Status status, ErrorKind errorKind, String errorMessage, Map<String, Object> produced) {
        this.status = status;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.produced = produced;
    }

    public static NodeOutcome success(Map<String, ?> produced) {
        return new NodeOutcome(Status.SUCCESS, null, null,
                produced != null ? Collections.unmodifiableMap(new LinkedHashMap<>(produced)) : Map.of());
    }

    public static NodeOutcome failure(ErrorKind kind, String message) {
        return new NodeOutcome(Status.FAILURE, Objects.requireNonNull(kind, "kind"), message, Map.of());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Null on success. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /** Empty on failure. */
    public Map<String, Object> getProduced() {
        return produced;
    }

    /** View used as the {@code outcome} entry of a predicate scope. */
    public Map<String, Object> toScope() {
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("status", status.toValue());
        scope.put("errorKind", errorKind != null ? errorKind.name() : null);
        scope.put("errorMessage", errorMessage);
        scope.put("produced", produced);
        return scope;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeOutcome that = (NodeOutcome) o;
        return status == that.status && errorKind == that.errorKind
                && Objects.equals(errorMessage, that.errorMessage) && Objects.equals(produced, that.produced);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, errorKind, errorMessage, produced);
    }

    @Override
    public String toString() {
        return isSuccess() ? "success" + produced.keySet() : "failure(" + errorKind + ": " + errorMessage + ")";
    }
}
