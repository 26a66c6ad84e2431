package com.hive.features.metrics;

import com.hive.engine.EngineSettings;
import com.hive.engine.ErrorKind;
import com.hive.engine.ExecutionEngine;
import com.hive.engine.ExecutionMode;
import com.hive.engine.RunResult;
import com.hive.engine.mock.ScriptedMockOutcomes;
import com.hive.graph.model.EdgeCondition;
import com.hive.graph.model.EdgeSpec;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsListenerTest {

    private static GraphDefinition graph() {
        return GraphDefinition.builder("metered", "1")
                .node(new NodeSpec("fetch", NodeKind.TOOL, List.of(), List.of("page"), null, null,
                        List.of("http"), 2, null, null))
                .node(NodeSpec.of("done", NodeKind.TERMINAL_PASS, List.of(), List.of()))
                .edge(EdgeSpec.of("e1", "fetch", "done", EdgeCondition.ON_SUCCESS))
                .entryPoint("fetch")
                .terminalNode("done")
                .build();
    }

    @Test
    void run_recordsNodeAndRunMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ExecutionEngine engine = ExecutionEngine.builder(EngineSettings.builder(10).mode(ExecutionMode.MOCK).build())
                .mockOutcomes(ScriptedMockOutcomes.builder()
                        .fail("fetch", ErrorKind.RATE_LIMITED, "429")
                        .succeed("fetch", Map.of("page", "<html/>"))
                        .build())
                .listener(new MetricsListener(registry))
                .build();

        RunResult result = engine.execute(graph(), null, Map.of());

        assertTrue(result.isSucceeded());
        assertEquals(1.0, registry.get("hive.node.executions")
                .tags("node", "fetch", "kind", "tool", "status", "success").counter().count());
        assertEquals(1.0, registry.get("hive.node.attempts.failed")
                .tags("node", "fetch", "errorKind", "RATE_LIMITED").counter().count());
        assertEquals(2, registry.get("hive.node.duration").timers().size());
        assertEquals(1.0, registry.get("hive.run.completed")
                .tags("graph", "metered", "status", "SUCCEEDED", "mode", "MOCK").counter().count());
        assertEquals(1.0, registry.get("hive.run.started").tags("resumed", "false").counter().count());
    }

    @Test
    void sharedRegistry_isCreatedOnce() {
        assertSame(MetricsListener.sharedRegistry(), new MetricsListener().getRegistry());
    }
}
