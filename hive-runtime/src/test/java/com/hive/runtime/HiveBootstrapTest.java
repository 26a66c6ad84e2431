package com.hive.runtime;

import com.hive.config.HiveConfig;
import com.hive.engine.RunResult;
import com.hive.engine.RunStatus;
import com.hive.graph.GraphConfig;
import com.hive.graph.model.EdgeCondition;
import com.hive.graph.model.EdgeSpec;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.ToolRegistry;
import com.hive.plugin.credential.CredentialSpec;
import com.hive.plugin.credential.EnvCredentialStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HiveBootstrapTest {

    @TempDir
    Path graphDir;

    private static GraphDefinition lookupGraph() {
        return GraphDefinition.builder("lookup", "2")
                .node(new NodeSpec("search", NodeKind.TOOL, List.of("query"), List.of("hits"), null, null,
                        List.of("search"), 1, null, null))
                .node(NodeSpec.of("done", NodeKind.TERMINAL_PASS, List.of(), List.of()))
                .edge(EdgeSpec.of("e1", "search", "done", EdgeCondition.ON_SUCCESS))
                .entryPoint("search")
                .terminalNode("done")
                .outputKey("hits")
                .build();
    }

    @Test
    void initialize_memoryStore_runsGraphLoadedFromDirectory() throws IOException {
        Files.writeString(graphDir.resolve("lookup.json"), GraphConfig.toJsonPretty(lookupGraph()));
        HiveConfig config = HiveConfig.fromEnv(Map.of(
                "HIVE_STEP_BUDGET", "10",
                "HIVE_GRAPH_DIR", graphDir.toString()));
        CredentialSpec key = new CredentialSpec("search_key", "SEARCH_API_KEY", List.of("search"), true, null);
        SimpleMeterRegistry meters = new SimpleMeterRegistry();

        try (HiveRuntime runtime = HiveBootstrap.forConfig(config)
                .tools(ToolRegistry.builder().register("search", args -> List.of("hit for " + args.get("query"))).build())
                .credentials(List.of(key))
                .credentialStore(new EnvCredentialStore(Map.of("SEARCH_API_KEY", "k"), null, List.of(key)))
                .meterRegistry(meters)
                .initialize()) {

            GraphDefinition graph = runtime.loadGraph("lookup", "2");
            RunResult result = runtime.getRunner().start(graph, null, Map.of("query", "hive"));

            assertEquals(RunStatus.SUCCEEDED, result.getStatus());
            assertEquals(Map.of("hits", List.of("hit for hive")), result.getOutput());
            assertSame(meters, runtime.getMeterRegistry());
            assertEquals(1.0, meters.get("hive.run.completed").tag("status", "SUCCEEDED").counter().count());
        }
    }

    @Test
    void initialize_missingCredential_failsRunBeforeToolCall() throws IOException {
        Files.writeString(graphDir.resolve("lookup.json"), GraphConfig.toJsonPretty(lookupGraph()));
        HiveConfig config = HiveConfig.builder(10).graphDir(graphDir.toString()).build();
        CredentialSpec key = new CredentialSpec("search_key", "SEARCH_API_KEY", List.of("search"), true, null);

        try (HiveRuntime runtime = HiveBootstrap.forConfig(config)
                .tools(ToolRegistry.builder().register("search", args -> List.of()).build())
                .credentials(List.of(key))
                .credentialStore(new EnvCredentialStore(Map.of(), null, List.of(key)))
                .meterRegistry(new SimpleMeterRegistry())
                .initialize()) {

            RunResult result = runtime.getRunner().start(runtime.loadGraph("lookup", "2"), null, Map.of("query", "q"));

            assertEquals(RunStatus.FAILED, result.getStatus());
            assertEquals("MISSING_CREDENTIAL", result.getError().getKind().name());
        }
    }

    @Test
    void loadGraph_wrongVersion_isRejected() throws IOException {
        Files.writeString(graphDir.resolve("lookup.json"), GraphConfig.toJsonPretty(lookupGraph()));
        HiveConfig config = HiveConfig.builder(10).graphDir(graphDir.toString()).build();

        try (HiveRuntime runtime = HiveBootstrap.forConfig(config).meterRegistry(new SimpleMeterRegistry()).initialize()) {
            assertThrows(IllegalStateException.class, () -> runtime.loadGraph("lookup", "3"));
        }
    }
}
