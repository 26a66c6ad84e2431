package com.hive.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable workflow graph: nodes, conditioned edges, entry point, pause and terminal node sets.
 * One instance per workflow version; safe to share across concurrent runs.
 * Cycles are allowed. Call {@code GraphValidator.validate} before running.
 */
public final class GraphDefinition {

    private final String name;
    private final String version;
    private final Goal goal;
    private final List<NodeSpec> nodes;
    private final List<EdgeSpec> edges;
    private final String entryPoint;
    private final Set<String> pauseNodes;
    private final Set<String> terminalNodes;
    private final List<String> outputKeys;

    private final Map<String, NodeSpec> nodeIndex;
    private final Map<String, List<EdgeSpec>> outgoing;

    @JsonCreator
    public GraphDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("goal") Goal goal,
            @JsonProperty("nodes") List<NodeSpec> nodes,
            @JsonProperty("edges") List<EdgeSpec> edges,
            @JsonProperty("entryPoint") String entryPoint,
            @JsonProperty("pauseNodes") List<String> pauseNodes,
            @JsonProperty("terminalNodes") List<String> terminalNodes,
            @JsonProperty("outputKeys") List<String> outputKeys) {
        this.name = name;
        this.version = version;
        this.goal = goal;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.entryPoint = entryPoint;
        this.pauseNodes = orderedSet(pauseNodes);
        this.terminalNodes = orderedSet(terminalNodes);
        this.outputKeys = outputKeys != null ? List.copyOf(outputKeys) : List.of();

        Map<String, NodeSpec> index = new LinkedHashMap<>();
        for (NodeSpec n : this.nodes) {
            if (n.getId() != null) index.putIfAbsent(n.getId(), n);
        }
        this.nodeIndex = Collections.unmodifiableMap(index);

        Map<String, List<EdgeSpec>> bySource = new LinkedHashMap<>();
        for (EdgeSpec e : this.edges) {
            bySource.computeIfAbsent(e.getSource(), k -> new ArrayList<>()).add(e);
        }
        Map<String, List<EdgeSpec>> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, List<EdgeSpec>> en : bySource.entrySet()) {
            List<EdgeSpec> list = new ArrayList<>(en.getValue());
            // List.sort is stable: equal priorities keep declaration order
            list.sort(Comparator.comparingInt(EdgeSpec::getPriority));
            sorted.put(en.getKey(), List.copyOf(list));
        }
        this.outgoing = Collections.unmodifiableMap(sorted);
    }

    private static Set<String> orderedSet(List<String> ids) {
        if (ids == null || ids.isEmpty()) return Set.of();
        Set<String> set = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null) set.add(id);
        }
        return Collections.unmodifiableSet(set);
    }

    public static Builder builder(String name, String version) {
        return new Builder(name, version);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Goal getGoal() {
        return goal;
    }

    public List<NodeSpec> getNodes() {
        return nodes;
    }

    public List<EdgeSpec> getEdges() {
        return edges;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public Set<String> getPauseNodes() {
        return pauseNodes;
    }

    public Set<String> getTerminalNodes() {
        return terminalNodes;
    }

    /** Keys exposed as run output; empty means the whole final context. */
    public List<String> getOutputKeys() {
        return outputKeys;
    }

    /** Node by id (first declaration wins when ids repeat), or null. */
    public NodeSpec getNode(String nodeId) {
        return nodeId == null ? null : nodeIndex.get(nodeId);
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodeIndex.containsKey(nodeId);
    }

    /** Outgoing edges of {@code sourceId} in evaluation order (priority ascending, then declaration order). */
    public List<EdgeSpec> outgoingEdges(String sourceId) {
        List<EdgeSpec> list = outgoing.get(sourceId);
        return list != null ? list : List.of();
    }

    public boolean isPauseNode(String nodeId) {
        return pauseNodes.contains(nodeId);
    }

    public boolean isTerminalNode(String nodeId) {
        return terminalNodes.contains(nodeId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphDefinition that = (GraphDefinition) o;
        return Objects.equals(name, that.name)
                && Objects.equals(version, that.version)
                && Objects.equals(goal, that.goal)
                && Objects.equals(nodes, that.nodes)
                && Objects.equals(edges, that.edges)
                && Objects.equals(entryPoint, that.entryPoint)
                && Objects.equals(pauseNodes, that.pauseNodes)
                && Objects.equals(terminalNodes, that.terminalNodes)
                && Objects.equals(outputKeys, that.outputKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, goal, nodes, edges, entryPoint, pauseNodes, terminalNodes, outputKeys);
    }

    @Override
    public String toString() {
        return "GraphDefinition{" + name + "@" + version + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }

    /** Assembles a graph in code; mostly used by tests and programmatic callers. */
    public static final class Builder {
        private final String name;
        private final String version;
        private Goal goal;
        private final List<NodeSpec> nodes = new ArrayList<>();
        private final List<EdgeSpec> edges = new ArrayList<>();
        private String entryPoint;
        private final List<String> pauseNodes = new ArrayList<>();
        private final List<String> terminalNodes = new ArrayList<>();
        private final List<String> outputKeys = new ArrayList<>();

        private Builder(String name, String version) {
            this.name = name;
            this.version = version;
        }

        public Builder goal(Goal goal) {
            this.goal = goal;
            return this;
        }

        public Builder node(NodeSpec node) {
            nodes.add(node);
            return this;
        }

        public Builder edge(EdgeSpec edge) {
            edges.add(edge);
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder pauseNode(String nodeId) {
            pauseNodes.add(nodeId);
            return this;
        }

        public Builder terminalNode(String nodeId) {
            terminalNodes.add(nodeId);
            return this;
        }

        public Builder outputKey(String key) {
            outputKeys.add(key);
            return this;
        }

        public GraphDefinition build() {
            return new GraphDefinition(name, version, goal, nodes, edges, entryPoint, pauseNodes, terminalNodes, outputKeys);
        }
    }
}
