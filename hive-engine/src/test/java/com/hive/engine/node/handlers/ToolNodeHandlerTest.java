package com.hive.engine.node.handlers;

import com.hive.engine.CancellationToken;
import com.hive.engine.ErrorKind;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ToolNodeHandlerTest {

    private static NodeInput input(List<String> outputKeys, Map<String, Object> params) {
        NodeSpec node = new NodeSpec("book", NodeKind.TOOL, List.of("when", "who"), outputKeys, null, null,
                List.of("calendar"), null, null, params);
        return new NodeInput("r1", node, Map.of("when", "2024-05-01T10:00", "who", "ana@example.com"), Map.of(), null,
                CancellationToken.none(), null);
    }

    @Test
    void handle_argumentsRenamedAndLayeredOverConstants() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        ToolNodeHandler handler = new ToolNodeHandler(ToolRegistry.builder().register("calendar", args -> {
            seen.set(args);
            return Map.of("bookingId", 42);
        }).build());

        NodeOutcome outcome = handler.handle(input(List.of("bookingId"),
                Map.of("args", Map.of("eventTypeId", 7, "start", "overridden"), "argNames", Map.of("when", "start"))));

        assertEquals(Map.of("bookingId", 42), outcome.getProduced());
        assertEquals(Map.of("eventTypeId", 7, "start", "2024-05-01T10:00", "who", "ana@example.com"), seen.get());
    }

    @Test
    void handle_errorMap_isClassifiedFailure() {
        ToolNodeHandler handler = new ToolNodeHandler(ToolRegistry.builder()
                .register("calendar", args -> Map.of("error", "Invalid API key", "errorKind", "auth"))
                .build());

        NodeOutcome outcome = handler.handle(input(List.of("bookingId"), null));

        assertEquals(ErrorKind.AUTH_FAILURE, outcome.getErrorKind());
        assertEquals("calendar: Invalid API key", outcome.getErrorMessage());
    }

    @Test
    void handle_scalarResultFillsSingleKey() {
        ToolNodeHandler handler = new ToolNodeHandler(ToolRegistry.builder().register("calendar", args -> "ok").build());

        assertEquals(Map.of("status", "ok"), handler.handle(input(List.of("status"), null)).getProduced());
        assertEquals(ErrorKind.INVALID_OUTPUT, handler.handle(input(List.of("a", "b"), null)).getErrorKind());
    }

    @Test
    void handle_mapWithoutDeclaredKey_isWholeResultForSingleKey() {
        ToolNodeHandler handler = new ToolNodeHandler(ToolRegistry.builder()
                .register("calendar", args -> Map.of("slots", List.of("10:00")))
                .build());

        NodeOutcome outcome = handler.handle(input(List.of("availability"), null));

        assertEquals(Map.of("slots", List.of("10:00")), outcome.getProduced().get("availability"));
    }
}
