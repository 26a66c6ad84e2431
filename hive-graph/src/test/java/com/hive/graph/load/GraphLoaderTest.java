package com.hive.graph.load;

import com.hive.graph.model.GraphDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphLoaderTest {

    private static final String GRAPH_V1 = """
            {"name":"triage","version":"1.0","entryPoint":"a","nodes":[{"id":"a","type":"terminal-pass"}]}
            """;

    @TempDir
    Path graphDir;

    @Test
    void tryLoad_prefersCacheOverFile() throws Exception {
        Files.writeString(graphDir.resolve("triage.json"), GRAPH_V1);
        List<String> requestedKeys = new ArrayList<>();
        GraphSource cache = key -> {
            requestedKeys.add(key);
            return Optional.of(GRAPH_V1.replace("\"a\"", "\"cached\""));
        };
        GraphLoader loader = new GraphLoader(cache, graphDir, "hive:test:graph");

        GraphDefinition graph = loader.loadGraph("triage", "1.0");

        assertEquals("cached", graph.getEntryPoint());
        assertEquals(List.of("hive:test:graph:triage:1.0"), requestedKeys);
    }

    @Test
    void tryLoad_fallsBackToFileWhenCacheEmptyOrUnparsable() throws Exception {
        Files.writeString(graphDir.resolve("triage.json"), GRAPH_V1);
        GraphLoader loader = new GraphLoader(key -> Optional.of("{broken"), graphDir, null);

        Optional<GraphDefinition> graph = loader.tryLoad("triage", "1.0");

        assertTrue(graph.isPresent());
        assertEquals("a", graph.get().getEntryPoint());
    }

    @Test
    void tryLoad_skipsVersionMismatch() throws Exception {
        Files.writeString(graphDir.resolve("triage.json"), GRAPH_V1);
        GraphLoader loader = new GraphLoader(null, graphDir, null);

        assertTrue(loader.tryLoad("triage", "2.0").isEmpty());
        assertThrows(IllegalStateException.class, () -> loader.loadGraph("triage", "2.0"));
    }

    @Test
    void keyBuilder_usesDefaultPrefixWhenBlank() {
        assertEquals("hive:graph:triage:1.0", new GraphKeyBuilder(" ").cacheKey("triage", "1.0"));
        assertEquals("hive:graph::", new GraphKeyBuilder().cacheKey(null, null));
    }
}
