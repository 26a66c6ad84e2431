package com.hive.graph.load;

import com.hive.graph.GraphConfig;
import com.hive.graph.model.GraphDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads graph definitions in order: cache ({@link GraphSource}) then local file {@code <name>.json}
 * in the graph directory. A candidate whose version differs from the requested version is skipped.
 */
public final class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    private final GraphSource graphSource;
    private final Path graphDir;
    private final GraphKeyBuilder keyBuilder;

    /**
     * @param graphSource cache source; null means none
     * @param graphDir    directory for local graph files; null disables file lookup
     * @param keyPrefix   cache key prefix; null = {@link GraphKeyBuilder#DEFAULT_PREFIX}
     */
    public GraphLoader(GraphSource graphSource, Path graphDir, String keyPrefix) {
        this.graphSource = graphSource != null ? graphSource : GraphSource.empty();
        this.graphDir = graphDir;
        this.keyBuilder = new GraphKeyBuilder(keyPrefix);
    }

    /**
     * Loads the graph or fails.
     *
     * @throws IllegalStateException when no source has a matching graph
     */
    public GraphDefinition loadGraph(String graphName, String version) {
        return tryLoad(graphName, version).orElseThrow(() -> new IllegalStateException(
                "No graph definition found for name=" + graphName + " version=" + version
                        + " (cache, " + (graphDir != null ? graphDir.resolve(graphName + ".json") : "no graph dir") + ")"));
    }

    /** One attempt over all sources; empty when nothing parses or versions differ. */
    public Optional<GraphDefinition> tryLoad(String graphName, String version) {
        String key = keyBuilder.cacheKey(graphName, version);
        Optional<String> json = graphSource.getFromCache(key);
        if (json.isPresent()) {
            Optional<GraphDefinition> graph = parse(json.get(), "cache:" + key).filter(g -> versionMatches(g, version, "cache:" + key));
            if (graph.isPresent()) {
                log.info("Graph loaded from cache key={} for name={} version={}", key, graphName, version);
                return graph;
            }
        }

        Optional<String> file = readLocalFile(graphName + ".json");
        if (file.isPresent()) {
            String source = "file:" + graphDir.resolve(graphName + ".json");
            Optional<GraphDefinition> graph = parse(file.get(), source).filter(g -> versionMatches(g, version, source));
            if (graph.isPresent()) {
                log.info("Graph loaded from {} for name={} version={}", source, graphName, version);
                return graph;
            }
        }
        return Optional.empty();
    }

    private static boolean versionMatches(GraphDefinition graph, String requested, String source) {
        if (requested == null || requested.isBlank() || requested.equals(graph.getVersion())) return true;
        log.warn("Skipping graph from {}: requested version {} but found {}", source, requested, graph.getVersion());
        return false;
    }

    private static Optional<GraphDefinition> parse(String json, String source) {
        try {
            return Optional.of(GraphConfig.fromJson(json));
        } catch (Exception e) {
            log.warn("Failed to parse graph definition from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readLocalFile(String fileName) {
        if (graphDir == null) return Optional.empty();
        Path file = graphDir.resolve(fileName);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read graph file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
