package com.hive.graph.validation;

import com.hive.graph.model.EdgeCondition;
import com.hive.graph.model.EdgeSpec;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphValidatorTest {

    private static List<StructuralErrorCode> codes(GraphDefinition graph) {
        return GraphValidator.validate(graph).stream().map(StructuralError::getCode).toList();
    }

    @Test
    void validate_acceptsCyclicGraph() {
        GraphDefinition graph = GraphDefinition.builder("loop", "1")
                .node(NodeSpec.of("a", NodeKind.TERMINAL_PASS, null, null))
                .node(NodeSpec.of("b", NodeKind.TERMINAL_PASS, null, null))
                .edge(EdgeSpec.of("ab", "a", "b", EdgeCondition.ALWAYS))
                .edge(EdgeSpec.of("ba", "b", "a", EdgeCondition.ALWAYS))
                .entryPoint("a")
                .build();

        assertTrue(GraphValidator.validate(graph).isEmpty());
        assertTrue(GraphValidator.isValid(graph));
    }

    @Test
    void validate_reportsEveryDefectInsteadOfStoppingAtFirst() {
        GraphDefinition graph = GraphDefinition.builder("bad", "1")
                .node(NodeSpec.of("a", NodeKind.MODEL, List.of("x"), List.of("x")))
                .node(NodeSpec.of("a", NodeKind.TERMINAL_PASS, null, null))
                .edge(EdgeSpec.of("e1", "a", "ghost", EdgeCondition.ALWAYS))
                .edge(EdgeSpec.of("e2", "nowhere", "a", EdgeCondition.ON_SUCCESS))
                .entryPoint("missing")
                .pauseNode("p")
                .terminalNode("t")
                .build();

        List<StructuralErrorCode> codes = codes(graph);

        assertTrue(codes.contains(StructuralErrorCode.KEY_OVERLAP));
        assertTrue(codes.contains(StructuralErrorCode.DUPLICATE_NODE_ID));
        assertTrue(codes.contains(StructuralErrorCode.DANGLING_EDGE_TARGET));
        assertTrue(codes.contains(StructuralErrorCode.DANGLING_EDGE_SOURCE));
        assertTrue(codes.contains(StructuralErrorCode.UNKNOWN_ENTRY_POINT));
        assertTrue(codes.contains(StructuralErrorCode.UNKNOWN_PAUSE_NODE));
        assertTrue(codes.contains(StructuralErrorCode.UNKNOWN_TERMINAL_NODE));
    }

    @Test
    void validate_allowsOverlapWhenOverwriteDeclared() {
        NodeSpec refine = new NodeSpec("refine", NodeKind.MODEL, List.of("draft"), List.of("draft"), true,
                "Improve the draft", null, 1, null, null);
        GraphDefinition graph = GraphDefinition.builder("g", "1").node(refine).entryPoint("refine").build();

        assertTrue(GraphValidator.validate(graph).isEmpty());
    }

    @Test
    void validate_missingEntryPoint() {
        GraphDefinition graph = GraphDefinition.builder("g", "1")
                .node(NodeSpec.of("a", NodeKind.TERMINAL_PASS, null, null))
                .build();

        assertEquals(List.of(StructuralErrorCode.MISSING_ENTRY_POINT), codes(graph));
    }

    @Test
    void validate_checksPredicateEdges() {
        GraphDefinition graph = GraphDefinition.builder("g", "1")
                .node(NodeSpec.of("a", NodeKind.TERMINAL_PASS, null, null))
                .edge(new EdgeSpec("noexpr", "a", "a", EdgeCondition.PREDICATE, null, null))
                .edge(new EdgeSpec("broken", "a", "a", EdgeCondition.PREDICATE, "x ==", null))
                .edge(new EdgeSpec("stray", "a", "a", EdgeCondition.ALWAYS, "x == 1", null))
                .edge(new EdgeSpec("weird", "a", "a", EdgeCondition.UNKNOWN, null, null))
                .entryPoint("a")
                .build();

        assertEquals(List.of(
                StructuralErrorCode.MISSING_PREDICATE,
                StructuralErrorCode.INVALID_PREDICATE,
                StructuralErrorCode.UNEXPECTED_PREDICATE,
                StructuralErrorCode.UNKNOWN_EDGE_CONDITION), codes(graph));
    }

    @Test
    void validate_checksNodeKindSpecificRules() {
        NodeSpec tool = new NodeSpec("t", NodeKind.TOOL, null, List.of("r"), null, null, List.of("a", "b"), null, null, null);
        NodeSpec cond = new NodeSpec("c", NodeKind.CONDITIONAL, null, List.of("q"), null, null, null, 2, null,
                Map.of("rules", List.of(Map.of("when", "((", "produce", Map.of("q", 1)), "not-a-rule")));
        NodeSpec negative = new NodeSpec("n", NodeKind.UNKNOWN, null, null, null, null, null, -1, null, null);
        GraphDefinition graph = GraphDefinition.builder("g", "1")
                .node(tool).node(cond).node(negative)
                .entryPoint("t")
                .build();

        List<StructuralErrorCode> codes = codes(graph);

        assertEquals(List.of(
                StructuralErrorCode.INVALID_TOOL_REFS,
                StructuralErrorCode.RETRYING_CONDITIONAL,
                StructuralErrorCode.INVALID_CONDITIONAL_RULES,
                StructuralErrorCode.INVALID_CONDITIONAL_RULES,
                StructuralErrorCode.UNKNOWN_NODE_TYPE,
                StructuralErrorCode.NEGATIVE_MAX_RETRIES), codes);
    }

    @Test
    void validate_duplicateEdgeIdsAndBlankNodeIds() {
        GraphDefinition graph = GraphDefinition.builder("g", "1")
                .node(NodeSpec.of("a", NodeKind.TERMINAL_PASS, null, null))
                .node(NodeSpec.of(" ", NodeKind.TERMINAL_PASS, null, null))
                .edge(EdgeSpec.of("e", "a", "a", EdgeCondition.ALWAYS))
                .edge(EdgeSpec.of("e", "a", "a", EdgeCondition.ON_FAILURE))
                .entryPoint("a")
                .build();

        assertEquals(List.of(StructuralErrorCode.BLANK_NODE_ID, StructuralErrorCode.DUPLICATE_EDGE_ID), codes(graph));
    }
}
