package com.hive.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable state of a paused run: where it paused, the full context and the counters needed to continue
 * exactly as if it had never stopped. Persisted only while paused, keyed by {@link #getRunId() run id},
 * and consumed once by resume.
 */
public final class SessionSnapshot {

    public static final int FORMAT_VERSION = 1;

    private final int formatVersion;
    private final String runId;
    private final String graphName;
    private final String graphVersion;
    private final String goalRef;
    private final String pausedAt;
    private final Map<String, Object> context;
    private final int stepsExecuted;
    private final List<String> visitedNodes;
    private final Map<String, Integer> nodeInvocations;

    @JsonCreator
    public SessionSnapshot(
            @JsonProperty("formatVersion") Integer formatVersion,
            @JsonProperty("runId") String runId,
            @JsonProperty("graphName") String graphName,
            @JsonProperty("graphVersion") String graphVersion,
            @JsonProperty("goalRef") String goalRef,
            @JsonProperty("pausedAt") String pausedAt,
            @JsonProperty("context") Map<String, Object> context,
            @JsonProperty("stepsExecuted") Integer stepsExecuted,
            @JsonProperty("visitedNodes") List<String> visitedNodes,
            @JsonProperty("nodeInvocations") Map<String, Integer> nodeInvocations) {
        this.formatVersion = formatVersion != null ? formatVersion : FORMAT_VERSION;
        this.runId = runId;
        this.graphName = graphName;
        this.graphVersion = graphVersion;
        this.goalRef = goalRef;
        this.pausedAt = Objects.requireNonNull(pausedAt, "pausedAt");
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
        this.stepsExecuted = stepsExecuted != null ? stepsExecuted : 0;
        this.visitedNodes = visitedNodes != null ? List.copyOf(visitedNodes) : List.of();
        this.nodeInvocations = nodeInvocations != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeInvocations))
                : Map.of();
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public String getRunId() {
        return runId;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getGraphVersion() {
        return graphVersion;
    }

    public String getGoalRef() {
        return goalRef;
    }

    /** Node id the run suspended before; resume continues here. */
    public String getPausedAt() {
        return pausedAt;
    }

    /** Full context at the moment of pause. */
    public Map<String, Object> getContext() {
        return context;
    }

    public int getStepsExecuted() {
        return stepsExecuted;
    }

    /** Node ids invoked so far, in order. */
    public List<String> getVisitedNodes() {
        return visitedNodes;
    }

    /** Attempt ordinal bookkeeping per node id, carried so scripted outcomes continue where they left off. */
    public Map<String, Integer> getNodeInvocations() {
        return nodeInvocations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionSnapshot that = (SessionSnapshot) o;
        return formatVersion == that.formatVersion
                && stepsExecuted == that.stepsExecuted
                && Objects.equals(runId, that.runId)
                && Objects.equals(graphName, that.graphName)
                && Objects.equals(graphVersion, that.graphVersion)
                && Objects.equals(goalRef, that.goalRef)
                && Objects.equals(pausedAt, that.pausedAt)
                && Objects.equals(context, that.context)
                && Objects.equals(visitedNodes, that.visitedNodes)
                && Objects.equals(nodeInvocations, that.nodeInvocations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formatVersion, runId, graphName, graphVersion, goalRef, pausedAt, context,
                stepsExecuted, visitedNodes, nodeInvocations);
    }

    @Override
    public String toString() {
        return "SessionSnapshot{runId=" + runId + ", graph=" + graphName + "@" + graphVersion
                + ", pausedAt=" + pausedAt + ", steps=" + stepsExecuted + "}";
    }
}
