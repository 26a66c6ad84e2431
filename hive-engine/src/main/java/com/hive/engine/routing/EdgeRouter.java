package com.hive.engine.routing;

import com.hive.engine.node.NodeOutcome;
import com.hive.graph.expression.PredicateExpression;
import com.hive.graph.expression.PredicateParser;
import com.hive.graph.expression.PredicateSyntaxException;
import com.hive.graph.model.EdgeSpec;
import com.hive.graph.model.GraphDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the single next node after a visit. Outgoing edges are evaluated by ascending priority, ties in
 * declaration order; the first match wins. Predicates see the context plus an {@code outcome} entry
 * ({@code status}, {@code errorKind}, {@code errorMessage}, {@code produced}) which shadows any context key
 * of that name. Stateless apart from a parsed-expression cache, so one router serves all runs.
 */
public final class EdgeRouter {

    private static final Logger log = LoggerFactory.getLogger(EdgeRouter.class);

    public static final String OUTCOME_KEY = "outcome";

    private final Map<String, PredicateExpression> parsed = new ConcurrentHashMap<>();

    /** Target node id of the selected edge, or empty when no edge matches. */
    public Optional<String> select(GraphDefinition graph, String sourceId, NodeOutcome outcome, Map<String, Object> context) {
        return selectEdge(graph, sourceId, outcome, context).map(EdgeSpec::getTarget);
    }

    public Optional<EdgeSpec> selectEdge(GraphDefinition graph, String sourceId, NodeOutcome outcome,
                                         Map<String, Object> context) {
        Map<String, Object> scope = null;
        for (EdgeSpec edge : graph.outgoingEdges(sourceId)) {
            boolean matches = switch (edge.getCondition()) {
                case ALWAYS -> true;
                case ON_SUCCESS -> outcome.isSuccess();
                case ON_FAILURE -> !outcome.isSuccess();
                case PREDICATE -> {
                    if (scope == null) scope = buildScope(outcome, context);
                    yield evaluate(edge, scope);
                }
                case UNKNOWN -> false;
            };
            if (matches) {
                log.debug("Edge {} selected: {} -> {}", edge.getId(), sourceId, edge.getTarget());
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }

    private boolean evaluate(EdgeSpec edge, Map<String, Object> scope) {
        String expr = edge.getPredicate();
        if (expr == null || expr.isBlank()) return false;
        try {
            return parsed.computeIfAbsent(expr, PredicateParser::parse).test(scope);
        } catch (PredicateSyntaxException e) {
            log.warn("Edge {} predicate does not parse; treating as no match: {}", edge.getId(), e.getMessage());
            return false;
        }
    }

    static Map<String, Object> buildScope(NodeOutcome outcome, Map<String, Object> context) {
        Map<String, Object> scope = new LinkedHashMap<>(context);
        scope.put(OUTCOME_KEY, outcome.toScope());
        return scope;
    }
}
