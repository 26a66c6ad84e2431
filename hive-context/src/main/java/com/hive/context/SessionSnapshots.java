package com.hive.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hive.graph.model.GraphDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON codec for {@link SessionSnapshot}. Output is deterministic (properties and map keys sorted, nulls kept)
 * so equal snapshots serialize to identical bytes.
 */
public final class SessionSnapshots {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private SessionSnapshots() {
    }

    /** @throws UncheckedIOException on serialization failure */
    public static String toJson(SessionSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** @throws UncheckedIOException on parse failure */
    public static SessionSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, SessionSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Checks the snapshot was produced by the same graph name and version.
     *
     * @throws SnapshotVersionMismatchException when they differ
     */
    public static void checkCompatible(SessionSnapshot snapshot, GraphDefinition graph) {
        if (!Objects.equals(snapshot.getGraphName(), graph.getName())
                || !Objects.equals(snapshot.getGraphVersion(), graph.getVersion())) {
            throw new SnapshotVersionMismatchException(
                    snapshot.getGraphName() + "@" + snapshot.getGraphVersion(),
                    graph.getName() + "@" + graph.getVersion());
        }
    }
}
