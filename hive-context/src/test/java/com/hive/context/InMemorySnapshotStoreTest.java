package com.hive.context;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySnapshotStoreTest {

    @Test
    void take_claimsSnapshotExactlyOnce() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        SessionSnapshot snap = new SessionSnapshot(null, "run-7", "g", "1", null, "wait", Map.of("k", 1), 1, null, null);
        store.save(snap);

        assertEquals(snap, store.find("run-7").orElseThrow());
        assertEquals(snap, store.take("run-7").orElseThrow());
        assertTrue(store.take("run-7").isEmpty());
        assertFalse(store.delete("run-7"));
        assertEquals(0, store.size());
    }
}
