package com.hive.context;

import java.util.List;

/**
 * Thrown by {@link ExecutionContext#get(java.util.Collection)} when required keys are absent.
 * Lists every missing key in request order, not just the first.
 */
public final class MissingKeyException extends RuntimeException {

    private final List<String> missingKeys;

    public MissingKeyException(List<String> missingKeys) {
        super("Missing context keys: " + missingKeys);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
