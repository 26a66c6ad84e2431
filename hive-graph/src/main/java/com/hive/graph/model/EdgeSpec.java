package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable directed transition between two nodes. Among edges sharing a source, lower
 * {@link #getPriority() priority} is evaluated first; ties keep declaration order.
 */
public final class EdgeSpec {

    private final String id;
    private final String source;
    private final String target;
    private final EdgeCondition condition;
    private final String predicate;
    private final int priority;

    @JsonCreator
    public EdgeSpec(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("condition") EdgeCondition condition,
            @JsonProperty("predicate") String predicate,
            @JsonProperty("priority") Integer priority) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.condition = condition != null ? condition : EdgeCondition.ALWAYS;
        this.predicate = predicate;
        this.priority = priority != null ? priority : 0;
    }

    public static EdgeSpec of(String id, String source, String target, EdgeCondition condition) {
        return new EdgeSpec(id, source, target, condition, null, null);
    }

    public static EdgeSpec predicate(String id, String source, String target, String expression, int priority) {
        return new EdgeSpec(id, source, target, EdgeCondition.PREDICATE, expression, priority);
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public EdgeCondition getCondition() {
        return condition;
    }

    /** Boolean expression; only meaningful when condition is {@link EdgeCondition#PREDICATE}. */
    public String getPredicate() {
        return predicate;
    }

    public int getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeSpec edgeSpec = (EdgeSpec) o;
        return priority == edgeSpec.priority
                && Objects.equals(id, edgeSpec.id)
                && Objects.equals(source, edgeSpec.source)
                && Objects.equals(target, edgeSpec.target)
                && condition == edgeSpec.condition
                && Objects.equals(predicate, edgeSpec.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, target, condition, predicate, priority);
    }

    @Override
    public String toString() {
        return "EdgeSpec{" + id + ": " + source + " -> " + target + " [" + condition.toValue() + "]}";
    }
}
