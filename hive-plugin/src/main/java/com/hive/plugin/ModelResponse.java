package com.hive.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model capability result: free text, a structured mapping, or both.
 */
public final class ModelResponse {

    private final String text;
    private final Map<String, Object> structured;

    public ModelResponse(String text, Map<String, Object> structured) {
        this.text = text;
        this.structured = structured != null ? Collections.unmodifiableMap(new LinkedHashMap<>(structured)) : null;
    }

    public static ModelResponse text(String text) {
        return new ModelResponse(text, null);
    }

    public static ModelResponse structured(Map<String, Object> structured) {
        return new ModelResponse(null, structured);
    }

    public String getText() {
        return text;
    }

    /** Structured output, or null when the model only returned text. */
    public Map<String, Object> getStructured() {
        return structured;
    }

    public boolean hasStructured() {
        return structured != null;
    }
}
