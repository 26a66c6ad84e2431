package com.hive.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hive.graph.model.GraphDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of graph definitions.
 * JSON excludes null values when serializing; unknown properties are ignored when reading.
 */
public final class GraphConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphConfig() {
    }

    /**
     * Deserializes a graph definition from a JSON string.
     *
     * @param json the JSON string (e.g. from file or cache)
     * @return the parsed {@link GraphDefinition}
     * @throws UncheckedIOException on parse failure
     */
    public static GraphDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the graph definition to a JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(GraphDefinition graph) {
        try {
            return MAPPER.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Pretty-printed variant of {@link #toJson(GraphDefinition)}. */
    public static String toJsonPretty(GraphDefinition graph) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
