package com.hive.engine.mock;

import com.hive.engine.ErrorKind;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes scripted per node id and indexed by invocation: the n-th attempt of a node gets the n-th scripted
 * outcome and the last one repeats. Unscripted nodes fall back to {@link MockOutcomes#canned()}.
 * Immutable once built, so a script can drive several runs.
 */
public final class ScriptedMockOutcomes implements MockOutcomes {

    private final Map<String, List<NodeOutcome>> script;

    private ScriptedMockOutcomes(Map<String, List<NodeOutcome>> script) {
        Map<String, List<NodeOutcome>> copy = new LinkedHashMap<>();
        script.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.script = Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeOutcome outcomeFor(NodeSpec node, int invocation) {
        List<NodeOutcome> outcomes = script.get(node.getId());
        if (outcomes == null || outcomes.isEmpty()) {
            return MockOutcomes.cannedSuccess(node);
        }
        int index = Math.min(Math.max(invocation, 1), outcomes.size()) - 1;
        return outcomes.get(index);
    }

    public static final class Builder {
        private final Map<String, List<NodeOutcome>> script = new LinkedHashMap<>();

        private Builder() {
        }

        /** Appends outcomes for consecutive invocations of {@code nodeId}. */
        public Builder node(String nodeId, NodeOutcome... outcomes) {
            script.computeIfAbsent(nodeId, k -> new ArrayList<>()).addAll(Arrays.asList(outcomes));
            return this;
        }

        public Builder succeed(String nodeId, Map<String, ?> produced) {
            return node(nodeId, NodeOutcome.success(produced));
        }

        public Builder fail(String nodeId, ErrorKind kind, String message) {
            return node(nodeId, NodeOutcome.failure(kind, message));
        }

        public ScriptedMockOutcomes build() {
            return new ScriptedMockOutcomes(script);
        }
    }
}
