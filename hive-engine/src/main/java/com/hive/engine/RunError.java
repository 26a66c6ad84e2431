package com.hive.engine;

import java.util.List;
import java.util.Objects;

/**
 * Terminal error of a run: kind, message, the node it happened at (when any) and, for
 * {@link ErrorKind#MISSING_KEY}, every missing key.
 */
public final class RunError {

    private final ErrorKind kind;
    private final String message;
    private final String nodeId;
    private final List<String> missingKeys;

    public RunError(ErrorKind kind, String message, String nodeId, List<String> missingKeys) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.nodeId = nodeId;
        this.missingKeys = missingKeys != null ? List.copyOf(missingKeys) : List.of();
    }

    public static RunError of(ErrorKind kind, String message, String nodeId) {
        return new RunError(kind, message, nodeId, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public String getNodeId() {
        return nodeId;
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunError runError = (RunError) o;
        return kind == runError.kind && Objects.equals(message, runError.message)
                && Objects.equals(nodeId, runError.nodeId) && Objects.equals(missingKeys, runError.missingKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, nodeId, missingKeys);
    }

    @Override
    public String toString() {
        return kind + (nodeId != null ? " at " + nodeId : "") + ": " + message;
    }
}
