package com.hive.graph.expression;

import java.util.Map;

/**
 * Parsed predicate. Evaluation is a pure function of the scope map and never throws for missing paths
 * (they resolve to null).
 */
@FunctionalInterface
public interface PredicateExpression {

    /** Evaluates to the raw value (Boolean for logic and comparisons, the resolved value for paths and literals). */
    Object evaluate(Map<String, ?> scope);

    /** Evaluates and applies {@link Truthiness#isTruthy(Object)}. */
    default boolean test(Map<String, ?> scope) {
        return Truthiness.isTruthy(evaluate(scope));
    }
}
