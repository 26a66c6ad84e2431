package com.hive.graph.load;

/**
 * Builds the cache key for a graph definition.
 * Example: {@code hive:graph:support-triage:1.0} for graph {@code support-triage} version {@code 1.0}.
 */
public final class GraphKeyBuilder {

    public static final String DEFAULT_PREFIX = "hive:graph";

    private final String prefix;

    public GraphKeyBuilder(String prefix) {
        this.prefix = prefix != null && !prefix.isBlank() ? prefix.trim() : DEFAULT_PREFIX;
    }

    public GraphKeyBuilder() {
        this(DEFAULT_PREFIX);
    }

    public String cacheKey(String graphName, String version) {
        String g = graphName != null ? graphName : "";
        String v = version != null ? version : "";
        return prefix + ":" + g + ":" + v;
    }
}
