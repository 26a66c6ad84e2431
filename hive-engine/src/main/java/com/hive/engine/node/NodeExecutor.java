package com.hive.engine.node;

import com.hive.engine.ErrorKind;
import com.hive.engine.ExecutionListener;
import com.hive.engine.RetryPolicy;
import com.hive.graph.model.NodeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Runs a node visit: up to {@code maxRetries + 1} attempts against the same input snapshot, with backoff from the
 * {@link RetryPolicy}. Only the final outcome is returned; failed attempts never reach the context.
 */
public final class NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

    private final NodeInvoker invoker;
    private final RetryPolicy retryPolicy;

    public NodeExecutor(NodeInvoker invoker, RetryPolicy retryPolicy) {
        this.invoker = invoker;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @param invocations per-node attempt counters for the run; updated in place
     * @param listener    notified of each failed attempt
     */
    public NodeExecution execute(NodeInput input, Map<String, Integer> invocations, ExecutionListener listener) {
        NodeSpec node = input.getNode();
        int maxAttempts = Math.max(0, node.getMaxRetries()) + 1;
        long start = System.nanoTime();
        NodeOutcome outcome = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            int invocation = invocations.merge(node.getId(), 1, Integer::sum);
            outcome = invoker.invoke(input.forAttempt(attempt, invocation));
            if (outcome.isSuccess()) {
                if (attempt > 1) {
                    log.info("Node {} succeeded on attempt {}/{}", node.getId(), attempt, maxAttempts);
                }
                break;
            }
            listener.onAttemptFailed(input.getRunId(), node, attempt, outcome);
            if (attempt == maxAttempts) {
                if (maxAttempts > 1) {
                    log.warn("Node {} all {} attempts exhausted; last error {}: {}",
                            node.getId(), maxAttempts, outcome.getErrorKind(), outcome.getErrorMessage());
                }
                break;
            }
            if (!retryPolicy.isRetryable(outcome.getErrorKind())) {
                log.warn("Node {} attempt {}/{} failed with non-retryable {}: {}",
                        node.getId(), attempt, maxAttempts, outcome.getErrorKind(), outcome.getErrorMessage());
                break;
            }
            log.warn("Node {} attempt {}/{} failed with {}: {}",
                    node.getId(), attempt, maxAttempts, outcome.getErrorKind(), outcome.getErrorMessage());
            long sleepMs = retryPolicy.delayAfterAttempt(attempt);
            if (sleepMs > 0) {
                log.info("Node {} backing off {} ms before attempt {}/{}", node.getId(), sleepMs, attempt + 1, maxAttempts);
            }
            if (input.getCancellationToken().await(sleepMs)) {
                outcome = NodeOutcome.failure(ErrorKind.CANCELLED, "Run cancelled during retry backoff");
                break;
            }
        }
        return new NodeExecution(outcome, attempt, Duration.ofNanos(System.nanoTime() - start));
    }
}
