package com.hive.graph.validation;

import com.hive.graph.expression.PredicateParser;
import com.hive.graph.expression.PredicateSyntaxException;
import com.hive.graph.model.EdgeCondition;
import com.hive.graph.model.EdgeSpec;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run once before any execution. All defects are collected and returned; nothing is thrown.
 * Cycles are not reported: they are bounded at run time by the step budget.
 */
public final class GraphValidator {

    /** Param holding conditional rules: list of {@code {when: expr, produce: {...}}}. */
    public static final String PARAM_RULES = "rules";
    /** Param holding the conditional fallback mapping. */
    public static final String PARAM_OTHERWISE = "otherwise";

    private GraphValidator() {
    }

    /**
     * Validates the graph.
     *
     * @return defects in discovery order; empty when the graph may be executed
     */
    public static List<StructuralError> validate(GraphDefinition graph) {
        List<StructuralError> errors = new ArrayList<>();
        if (graph == null) {
            errors.add(new StructuralError(StructuralErrorCode.MISSING_ENTRY_POINT, null, "Graph is null"));
            return errors;
        }
        Set<String> nodeIds = new HashSet<>();
        for (NodeSpec node : graph.getNodes()) {
            checkNode(node, nodeIds, errors);
        }

        String entry = graph.getEntryPoint();
        if (entry == null || entry.isBlank()) {
            errors.add(new StructuralError(StructuralErrorCode.MISSING_ENTRY_POINT, "entryPoint",
                    "Entry point is not set"));
        } else if (!nodeIds.contains(entry)) {
            errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_ENTRY_POINT, entry,
                    "Entry point '" + entry + "' is not a node"));
        }

        Set<String> edgeIds = new HashSet<>();
        for (EdgeSpec edge : graph.getEdges()) {
            checkEdge(edge, nodeIds, edgeIds, errors);
        }

        for (String id : graph.getPauseNodes()) {
            if (!nodeIds.contains(id)) {
                errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_PAUSE_NODE, id,
                        "Pause node '" + id + "' is not a node"));
            }
        }
        for (String id : graph.getTerminalNodes()) {
            if (!nodeIds.contains(id)) {
                errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_TERMINAL_NODE, id,
                        "Terminal node '" + id + "' is not a node"));
            }
        }
        return errors;
    }

    private static void checkNode(NodeSpec node, Set<String> nodeIds, List<StructuralError> errors) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            errors.add(new StructuralError(StructuralErrorCode.BLANK_NODE_ID, null, "Node id is blank"));
            return;
        }
        if (!nodeIds.add(id)) {
            errors.add(new StructuralError(StructuralErrorCode.DUPLICATE_NODE_ID, id, "Duplicate node id '" + id + "'"));
        }
        if (node.getType() == NodeKind.UNKNOWN) {
            errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_NODE_TYPE, id, "Node '" + id + "' has an unknown type"));
        }
        if (node.getMaxRetries() < 0) {
            errors.add(new StructuralError(StructuralErrorCode.NEGATIVE_MAX_RETRIES, id,
                    "Node '" + id + "' has negative maxRetries " + node.getMaxRetries()));
        }
        if (!node.isOverwritesInputs()) {
            List<String> overlap = node.getOutputKeys().stream()
                    .filter(node.getInputKeys()::contains)
                    .toList();
            if (!overlap.isEmpty()) {
                errors.add(new StructuralError(StructuralErrorCode.KEY_OVERLAP, id,
                        "Node '" + id + "' outputs input keys " + overlap + " without overwritesInputs"));
            }
        }
        if (node.getType() == NodeKind.TOOL && node.getToolRefs().size() != 1) {
            errors.add(new StructuralError(StructuralErrorCode.INVALID_TOOL_REFS, id,
                    "Tool node '" + id + "' must declare exactly one tool ref, found " + node.getToolRefs().size()));
        }
        if (node.getType() == NodeKind.CONDITIONAL) {
            if (node.getMaxRetries() > 0) {
                errors.add(new StructuralError(StructuralErrorCode.RETRYING_CONDITIONAL, id,
                        "Conditional node '" + id + "' must declare maxRetries 0"));
            }
            checkRules(node, errors);
        }
    }

    private static void checkRules(NodeSpec node, List<StructuralError> errors) {
        Object rules = node.getParams().get(PARAM_RULES);
        Object otherwise = node.getParams().get(PARAM_OTHERWISE);
        if (otherwise != null && !(otherwise instanceof Map)) {
            errors.add(new StructuralError(StructuralErrorCode.INVALID_CONDITIONAL_RULES, node.getId(),
                    "'" + PARAM_OTHERWISE + "' must be a mapping"));
        }
        if (rules == null) return;
        if (!(rules instanceof List<?> list)) {
            errors.add(new StructuralError(StructuralErrorCode.INVALID_CONDITIONAL_RULES, node.getId(),
                    "'" + PARAM_RULES + "' must be a list"));
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            Object rule = list.get(i);
            if (!(rule instanceof Map<?, ?> m) || !(m.get("when") instanceof String when)
                    || !(m.get("produce") instanceof Map)) {
                errors.add(new StructuralError(StructuralErrorCode.INVALID_CONDITIONAL_RULES, node.getId(),
                        "Rule " + i + " must have a string 'when' and a mapping 'produce'"));
                continue;
            }
            try {
                PredicateParser.parse(when);
            } catch (PredicateSyntaxException e) {
                errors.add(new StructuralError(StructuralErrorCode.INVALID_CONDITIONAL_RULES, node.getId(),
                        "Rule " + i + ": " + e.getMessage()));
            }
        }
    }

    private static void checkEdge(EdgeSpec edge, Set<String> nodeIds, Set<String> edgeIds, List<StructuralError> errors) {
        String subject = edge.getId() != null ? edge.getId() : edge.getSource() + "->" + edge.getTarget();
        if (edge.getId() != null && !edgeIds.add(edge.getId())) {
            errors.add(new StructuralError(StructuralErrorCode.DUPLICATE_EDGE_ID, subject, "Duplicate edge id '" + subject + "'"));
        }
        if (!nodeIds.contains(edge.getSource())) {
            errors.add(new StructuralError(StructuralErrorCode.DANGLING_EDGE_SOURCE, subject,
                    "Edge '" + subject + "' source '" + edge.getSource() + "' is not a node"));
        }
        if (!nodeIds.contains(edge.getTarget())) {
            errors.add(new StructuralError(StructuralErrorCode.DANGLING_EDGE_TARGET, subject,
                    "Edge '" + subject + "' target '" + edge.getTarget() + "' is not a node"));
        }
        boolean hasExpr = edge.getPredicate() != null && !edge.getPredicate().isBlank();
        switch (edge.getCondition()) {
            case PREDICATE -> {
                if (!hasExpr) {
                    errors.add(new StructuralError(StructuralErrorCode.MISSING_PREDICATE, subject,
                            "Edge '" + subject + "' has condition predicate but no expression"));
                } else {
                    try {
                        PredicateParser.parse(edge.getPredicate());
                    } catch (PredicateSyntaxException e) {
                        errors.add(new StructuralError(StructuralErrorCode.INVALID_PREDICATE, subject, e.getMessage()));
                    }
                }
            }
            case UNKNOWN -> errors.add(new StructuralError(StructuralErrorCode.UNKNOWN_EDGE_CONDITION, subject,
                    "Edge '" + subject + "' has an unknown condition"));
            default -> {
                if (hasExpr) {
                    errors.add(new StructuralError(StructuralErrorCode.UNEXPECTED_PREDICATE, subject,
                            "Edge '" + subject + "' has an expression but condition " + edge.getCondition().toValue()));
                }
            }
        }
    }

    /** True when {@link #validate} finds nothing. */
    public static boolean isValid(GraphDefinition graph) {
        return validate(graph).isEmpty();
    }
}
