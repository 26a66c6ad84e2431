package com.hive.engine.node.handlers;

import com.hive.engine.ErrorKind;
import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.engine.node.NodeParams;
import com.hive.graph.expression.PredicateExpression;
import com.hive.graph.expression.PredicateParser;
import com.hive.graph.expression.PredicateSyntaxException;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.graph.validation.GraphValidator;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CONDITIONAL nodes: a pure function of context. {@code params.rules} is evaluated in order
 * ({@code [{when: expr, produce: {...}}]}), the first truthy rule's mapping is produced, else
 * {@code params.otherwise}. No external call is made.
 */
public final class ConditionalNodeHandler implements NodeHandler {

    private final Map<String, PredicateExpression> parsed = new ConcurrentHashMap<>();

    @Override
    public Set<NodeKind> supportedTypes() {
        return Set.of(NodeKind.CONDITIONAL);
    }

    @Override
    public NodeOutcome handle(NodeInput input) {
        NodeSpec node = input.getNode();
        List<?> rules = NodeParams.paramList(node, GraphValidator.PARAM_RULES);
        for (Object r : rules) {
            if (!(r instanceof Map<?, ?> rule) || !(rule.get("when") instanceof String when)) {
                return NodeOutcome.failure(ErrorKind.INVALID_ARGS, "Malformed rule in conditional node " + node.getId());
            }
            PredicateExpression expr;
            try {
                expr = parsed.computeIfAbsent(when, PredicateParser::parse);
            } catch (PredicateSyntaxException e) {
                return NodeOutcome.failure(ErrorKind.INVALID_ARGS, e.getMessage());
            }
            if (expr.test(input.getContext())) {
                return NodeOutcome.success(produceOf(rule.get("produce")));
            }
        }
        Object otherwise = node.getParams().get(GraphValidator.PARAM_OTHERWISE);
        if (otherwise instanceof Map<?, ?>) {
            return NodeOutcome.success(produceOf(otherwise));
        }
        return NodeOutcome.failure(ErrorKind.INVALID_OUTPUT, "No rule matched in conditional node " + node.getId()
                + " and no '" + GraphValidator.PARAM_OTHERWISE + "' mapping is declared");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> produceOf(Object produce) {
        return produce instanceof Map ? (Map<String, Object>) produce : Map.of();
    }
}
