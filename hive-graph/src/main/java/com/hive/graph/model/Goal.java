package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Goal a workflow is driven toward. The executor never evaluates success criteria or constraints;
 * they are carried to model requests and exposed to external evaluators.
 */
public final class Goal {

    private final String id;
    private final String description;
    private final List<String> successCriteria;
    private final List<String> constraints;

    @JsonCreator
    public Goal(
            @JsonProperty("id") String id,
            @JsonProperty("description") String description,
            @JsonProperty("successCriteria") List<String> successCriteria,
            @JsonProperty("constraints") List<String> constraints) {
        this.id = id;
        this.description = description;
        this.successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
        this.constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    /** A goal known only by reference (no description or criteria). */
    public static Goal ofRef(String goalRef) {
        return new Goal(goalRef, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getSuccessCriteria() {
        return successCriteria;
    }

    public List<String> getConstraints() {
        return constraints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Goal goal = (Goal) o;
        return Objects.equals(id, goal.id) && Objects.equals(description, goal.description)
                && Objects.equals(successCriteria, goal.successCriteria)
                && Objects.equals(constraints, goal.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, successCriteria, constraints);
    }
}
