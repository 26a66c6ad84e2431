package com.hive.config;

import com.hive.context.SessionSnapshot;
import com.hive.context.SessionSnapshots;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RedisSnapshotStoreTest {

    /** In-memory stand-in for the handful of string commands the store issues. */
    private static final class FakeJedis extends Jedis {
        final Map<String, String> values = new HashMap<>();
        final Map<String, Long> ttls = new HashMap<>();

        @Override
        public String set(String key, String value) {
            values.put(key, value);
            ttls.remove(key);
            return "OK";
        }

        @Override
        public String setex(String key, long seconds, String value) {
            values.put(key, value);
            ttls.put(key, seconds);
            return "OK";
        }

        @Override
        public String get(String key) {
            return values.get(key);
        }

        @Override
        public String getDel(String key) {
            ttls.remove(key);
            return values.remove(key);
        }

        @Override
        public long del(String key) {
            ttls.remove(key);
            return values.remove(key) != null ? 1 : 0;
        }

        @Override
        public void close() {
        }
    }

    private static final class FakePool extends JedisPool {
        final FakeJedis jedis = new FakeJedis();

        @Override
        public Jedis getResource() {
            return jedis;
        }
    }

    private static SessionSnapshot snapshot(String runId) {
        return new SessionSnapshot(null, runId, "approval", "3", "ship-it", "review",
                Map.of("topic", "release notes"), 1, List.of("draft"), Map.of("draft", 1));
    }

    @Test
    void snapshotKey_joinsPrefixAndRunId() {
        assertEquals("hive:snapshot:run-42", RedisSnapshotStore.snapshotKey("hive:snapshot", "run-42"));
        assertEquals("hive:snapshot:run-42", RedisSnapshotStore.snapshotKey("hive:snapshot:", "run-42"));
    }

    @Test
    void save_withTtl_usesSetexAndFindReadsBack() {
        FakePool pool = new FakePool();
        RedisSnapshotStore store = new RedisSnapshotStore(pool, "hive:snapshot", 600);

        store.save(snapshot("run-1"));

        assertEquals(600L, pool.jedis.ttls.get("hive:snapshot:run-1"));
        SessionSnapshot found = store.find("run-1").orElseThrow();
        assertEquals("review", found.getPausedAt());
        assertEquals(SessionSnapshots.toJson(snapshot("run-1")), SessionSnapshots.toJson(found));
        assertTrue(store.find("run-1").isPresent());
        assertTrue(store.find("other").isEmpty());
    }

    @Test
    void save_withoutTtl_usesPlainSet() {
        FakePool pool = new FakePool();
        RedisSnapshotStore store = new RedisSnapshotStore(pool, "hive:snapshot", 0);

        store.save(snapshot("run-2"));

        assertTrue(pool.jedis.values.containsKey("hive:snapshot:run-2"));
        assertFalse(pool.jedis.ttls.containsKey("hive:snapshot:run-2"));
    }

    @Test
    void take_claimsSnapshotExactlyOnce() {
        RedisSnapshotStore store = new RedisSnapshotStore(new FakePool(), "hive:snapshot", 0);
        store.save(snapshot("run-3"));

        assertEquals("run-3", store.take("run-3").orElseThrow().getRunId());
        assertTrue(store.take("run-3").isEmpty());
        assertTrue(store.find("run-3").isEmpty());
    }

    @Test
    void take_unreadablePayload_isRestoredBeforeFailing() {
        FakePool pool = new FakePool();
        RedisSnapshotStore store = new RedisSnapshotStore(pool, "hive:snapshot", 300);
        pool.jedis.values.put("hive:snapshot:run-4", "{not json");

        assertThrows(UncheckedIOException.class, () -> store.take("run-4"));

        assertEquals("{not json", pool.jedis.values.get("hive:snapshot:run-4"));
        assertEquals(300L, pool.jedis.ttls.get("hive:snapshot:run-4"));
    }

    @Test
    void delete_reportsWhetherKeyExisted() {
        RedisSnapshotStore store = new RedisSnapshotStore(new FakePool(), "hive:snapshot", 0);
        store.save(snapshot("run-5"));

        assertTrue(store.delete("run-5"));
        assertFalse(store.delete("run-5"));
    }
}
