package com.hive.graph.expression;

/**
 * Thrown when a predicate expression cannot be parsed. Carries the offending expression and the
 * character offset where parsing stopped.
 */
public final class PredicateSyntaxException extends RuntimeException {

    private final String expression;
    private final int position;

    public PredicateSyntaxException(String expression, int position, String message) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
