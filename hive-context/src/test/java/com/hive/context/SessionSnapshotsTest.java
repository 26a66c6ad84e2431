package com.hive.context;

import com.hive.graph.model.GraphDefinition;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionSnapshotsTest {

    private static SessionSnapshot snapshot(Map<String, Object> context) {
        return new SessionSnapshot(null, "run-1", "triage", "1.0", "goal-1", "review", context, 3,
                List.of("a", "b", "review"), Map.of("a", 1, "b", 2));
    }

    @Test
    void toJson_isDeterministicRegardlessOfInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("zeta", 1);
        first.put("alpha", Map.of("y", 2, "x", 1));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("alpha", Map.of("x", 1, "y", 2));
        second.put("zeta", 1);

        String a = SessionSnapshots.toJson(snapshot(first));
        String b = SessionSnapshots.toJson(snapshot(second));

        assertEquals(a, b);
        assertTrue(a.indexOf("\"alpha\"") < a.indexOf("\"zeta\""));
    }

    @Test
    void fromJson_restoresContextIncludingNulls() {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("answer", null);
        ctx.put("score", 0.75);
        ctx.put("tags", List.of("a", "b"));
        SessionSnapshot original = snapshot(ctx);

        SessionSnapshot back = SessionSnapshots.fromJson(SessionSnapshots.toJson(original));

        assertEquals(original, back);
        assertTrue(back.getContext().containsKey("answer"));
        assertEquals(SessionSnapshot.FORMAT_VERSION, back.getFormatVersion());
        assertEquals(2, back.getNodeInvocations().get("b"));
    }

    @Test
    void checkCompatible_rejectsDifferentGraphVersion() {
        SessionSnapshot snap = snapshot(Map.of());

        assertDoesNotThrow(() -> SessionSnapshots.checkCompatible(snap, GraphDefinition.builder("triage", "1.0").build()));
        SnapshotVersionMismatchException e = assertThrows(SnapshotVersionMismatchException.class,
                () -> SessionSnapshots.checkCompatible(snap, GraphDefinition.builder("triage", "2.0").build()));
        assertEquals("triage@1.0", e.getSnapshotGraph());
        assertEquals("triage@2.0", e.getProvidedGraph());
    }

    @Test
    void fromJson_malformedThrowsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> SessionSnapshots.fromJson("[]"));
    }
}
