package com.hive.engine.node;

import com.hive.engine.CancellationToken;
import com.hive.engine.ErrorKind;
import com.hive.engine.ExecutionListener;
import com.hive.engine.RetryPolicy;
import com.hive.graph.model.NodeKind;
import com.hive.graph.model.NodeSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class NodeExecutorTest {

    private static NodeSpec node(int maxRetries, List<String> outputKeys) {
        return new NodeSpec("n", NodeKind.MODEL, List.of(), outputKeys, null, null, null, maxRetries, null, null);
    }

    private static NodeExecutor executor(Function<NodeInput, NodeOutcome> behaviour, RetryPolicy policy) {
        NodeHandler handler = new NodeHandler() {
            @Override
            public Set<NodeKind> supportedTypes() {
                return Set.of(NodeKind.MODEL);
            }

            @Override
            public NodeOutcome handle(NodeInput input) {
                return behaviour.apply(input);
            }
        };
        return new NodeExecutor(new NodeInvoker(new NodeHandlerRegistry(List.of(handler))), policy);
    }

    private static NodeInput input(NodeSpec node, CancellationToken token) {
        return new NodeInput("run-1", node, Map.of(), Map.of(), null, token, null);
    }

    @Test
    void execute_countsInvocationsAcrossAttempts() {
        List<String> seen = new ArrayList<>();
        NodeExecutor executor = executor(in -> {
            seen.add(in.getAttempt() + "/" + in.getInvocation());
            return NodeOutcome.failure(ErrorKind.UPSTREAM_FAILURE, "down");
        }, RetryPolicy.immediate());
        Map<String, Integer> invocations = new HashMap<>(Map.of("n", 2));

        NodeExecution execution = executor.execute(input(node(2, List.of("x")), CancellationToken.none()),
                invocations, ExecutionListener.NOOP);

        assertEquals(3, execution.attempts());
        assertEquals(List.of("1/3", "2/4", "3/5"), seen);
        assertEquals(5, invocations.get("n"));
        assertEquals(ErrorKind.UPSTREAM_FAILURE, execution.outcome().getErrorKind());
    }

    @Test
    void execute_notifiesEachFailedAttempt() {
        LinkedList<NodeOutcome> script = new LinkedList<>(List.of(
                NodeOutcome.failure(ErrorKind.TIMEOUT, "t1"),
                NodeOutcome.failure(ErrorKind.RATE_LIMITED, "t2"),
                NodeOutcome.success(Map.of("x", 1))));
        List<Integer> failedAttempts = new ArrayList<>();
        NodeExecutor executor = executor(in -> script.removeFirst(), RetryPolicy.immediate());

        NodeExecution execution = executor.execute(input(node(5, List.of("x")), CancellationToken.none()), new HashMap<>(),
                new ExecutionListener() {
                    @Override
                    public void onAttemptFailed(String runId, NodeSpec node, int attempt, NodeOutcome outcome) {
                        failedAttempts.add(attempt);
                    }
                });

        assertTrue(execution.outcome().isSuccess());
        assertEquals(3, execution.attempts());
        assertEquals(List.of(1, 2), failedAttempts);
    }

    @Test
    void execute_cancelledDuringBackoff_stopsWithCancelled() {
        CancellationToken token = CancellationToken.none();
        NodeExecutor executor = executor(in -> {
            token.cancel();
            return NodeOutcome.failure(ErrorKind.UPSTREAM_FAILURE, "down");
        }, RetryPolicy.exponential(10_000, 1.0, 0));

        NodeExecution execution = executor.execute(input(node(3, List.of("x")), token), new HashMap<>(), ExecutionListener.NOOP);

        assertEquals(1, execution.attempts());
        assertEquals(ErrorKind.CANCELLED, execution.outcome().getErrorKind());
    }

    @Test
    void invoke_handlerThrows_isClassifiedNotPropagated() {
        NodeExecutor executor = executor(in -> {
            throw new IllegalStateException("bug in handler");
        }, RetryPolicy.immediate());

        NodeOutcome outcome = executor.execute(input(node(0, List.of("x")), CancellationToken.none()), new HashMap<>(),
                ExecutionListener.NOOP).outcome();

        assertEquals(ErrorKind.UPSTREAM_FAILURE, outcome.getErrorKind());
        assertEquals("bug in handler", outcome.getErrorMessage());
    }

    @Test
    void invoke_dropsUndeclaredKeysAndRejectsMissingOnes() {
        NodeInvoker ok = new NodeInvoker(new NodeHandlerRegistry(List.of(stub(NodeOutcome.success(Map.of("x", 1, "extra", 2))))));
        NodeInvoker partial = new NodeInvoker(new NodeHandlerRegistry(List.of(stub(NodeOutcome.success(Map.of("x", 1))))));

        assertEquals(Map.of("x", 1), ok.invoke(input(node(0, List.of("x")), null)).getProduced());
        assertEquals(ErrorKind.INVALID_OUTPUT, partial.invoke(input(node(0, List.of("x", "y")), null)).getErrorKind());
    }

    @Test
    void invoke_kindWithoutHandler_isStructuralFailure() {
        NodeInvoker invoker = new NodeInvoker(new NodeHandlerRegistry(List.of()));

        NodeOutcome outcome = invoker.invoke(input(node(0, List.of()), null));

        assertEquals(ErrorKind.STRUCTURAL, outcome.getErrorKind());
    }

    private static NodeHandler stub(NodeOutcome outcome) {
        return new NodeHandler() {
            @Override
            public Set<NodeKind> supportedTypes() {
                return Set.of(NodeKind.MODEL);
            }

            @Override
            public NodeOutcome handle(NodeInput input) {
                return outcome;
            }
        };
    }
}
