package com.hive.engine.node;

import java.time.Duration;

/**
 * Final outcome of a node visit after retries, with the number of attempts made.
 */
public record NodeExecution(NodeOutcome outcome, int attempts, Duration elapsed) {
}
