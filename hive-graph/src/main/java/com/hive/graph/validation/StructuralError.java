package com.hive.graph.validation;

import java.util.Objects;

/**
 * One defect in a graph definition. {@code subject} is the offending node id, edge id or field name.
 */
public final class StructuralError {

    private final StructuralErrorCode code;
    private final String subject;
    private final String message;

    public StructuralError(StructuralErrorCode code, String subject, String message) {
        this.code = Objects.requireNonNull(code, "code");
        this.subject = subject;
        this.message = message;
    }

    public StructuralErrorCode getCode() {
        return code;
    }

    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructuralError that = (StructuralError) o;
        return code == that.code && Objects.equals(subject, that.subject) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, subject, message);
    }

    @Override
    public String toString() {
        return code + "(" + subject + "): " + message;
    }
}
