package com.hive.engine.node.handlers;

import com.hive.engine.CancellationToken;
import com.hive.engine.ErrorKind;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeOutcome;
import com.hive.graph.model.Goal;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import com.hive.plugin.CapabilityErrorKind;
import com.hive.plugin.CapabilityException;
import com.hive.plugin.ModelRequest;
import com.hive.plugin.ModelResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ModelNodeHandlerTest {

    private static NodeInput input(List<String> outputKeys) {
        NodeSpec node = new NodeSpec("summarize", NodeKind.MODEL, List.of("doc"), outputKeys, null,
                "Summarize the document", List.of("search"), null, null, null);
        return new NodeInput("r1", node, Map.of("doc", "long text"), Map.of("doc", "long text", "other", 1),
                new Goal("g1", "Brief the team", null, null), CancellationToken.none(), Duration.ofSeconds(1));
    }

    @Test
    void handle_buildsRequestFromNodeAndInputs() {
        AtomicReference<ModelRequest> seen = new AtomicReference<>();
        ModelNodeHandler handler = new ModelNodeHandler(request -> {
            seen.set(request);
            return CompletableFuture.completedFuture(ModelResponse.text("short"));
        });

        NodeOutcome outcome = handler.handle(input(List.of("summary")));

        assertEquals(Map.of("summary", "short"), outcome.getProduced());
        ModelRequest request = seen.get();
        assertEquals("Summarize the document", request.getInstructions());
        assertEquals(Map.of("doc", "long text"), request.getInputs());
        assertEquals(List.of("search"), request.getToolRefs());
        assertEquals("g1", request.getGoal().getId());
        assertFalse(request.isCancellationRequested());
    }

    @Test
    void handle_jsonTextFillsSeveralKeys() {
        ModelNodeHandler handler = new ModelNodeHandler(request ->
                CompletableFuture.completedFuture(ModelResponse.text("{\"summary\":\"s\",\"score\":3,\"noise\":true}")));

        NodeOutcome outcome = handler.handle(input(List.of("summary", "score")));

        assertEquals(Map.of("summary", "s", "score", 3), outcome.getProduced());
    }

    @Test
    void handle_plainTextForSeveralKeys_isInvalidOutput() {
        ModelNodeHandler handler = new ModelNodeHandler(request ->
                CompletableFuture.completedFuture(ModelResponse.text("not json")));

        NodeOutcome outcome = handler.handle(input(List.of("summary", "score")));

        assertEquals(ErrorKind.INVALID_OUTPUT, outcome.getErrorKind());
    }

    @Test
    void handle_blankTextForSingleKey_isInvalidOutput() {
        ModelNodeHandler blank = new ModelNodeHandler(request ->
                CompletableFuture.completedFuture(ModelResponse.text("  ")));
        ModelNodeHandler missing = new ModelNodeHandler(request ->
                CompletableFuture.completedFuture(ModelResponse.text(null)));

        NodeOutcome blankOutcome = blank.handle(input(List.of("summary")));
        NodeOutcome missingOutcome = missing.handle(input(List.of("summary")));

        assertFalse(blankOutcome.isSuccess());
        assertEquals(ErrorKind.INVALID_OUTPUT, blankOutcome.getErrorKind());
        assertEquals(ErrorKind.INVALID_OUTPUT, missingOutcome.getErrorKind());
        assertTrue(missingOutcome.getProduced().isEmpty());
    }

    @Test
    void handle_capabilityFailure_isThrownForInvokerToClassify() {
        ModelNodeHandler handler = new ModelNodeHandler(request -> CompletableFuture.failedFuture(
                new CapabilityException(CapabilityErrorKind.RATE_LIMITED, "slow down")));

        CapabilityException e = assertThrows(CapabilityException.class, () -> handler.handle(input(List.of("summary"))));
        assertEquals(CapabilityErrorKind.RATE_LIMITED, e.getKind());
    }
}
