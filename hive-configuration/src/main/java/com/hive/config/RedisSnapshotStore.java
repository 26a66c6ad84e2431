package com.hive.config;

import com.hive.context.SessionSnapshot;
import com.hive.context.SessionSnapshots;
import com.hive.context.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link SnapshotStore}: one string key per paused run, {@code <prefix>:<runId>}, holding the
 * snapshot JSON. {@link #take} uses GETDEL so two resumers can never claim the same snapshot.
 */
public final class RedisSnapshotStore implements SnapshotStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisSnapshotStore.class);

    private final JedisPool pool;
    private final String keyPrefix;
    private final int ttlSeconds;

    public RedisSnapshotStore(HiveConfig config) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort()),
                config.getSnapshotKeyPrefix(), config.getSnapshotTtlSeconds());
        log.info("RedisSnapshotStore connected to {}:{} (prefix={}, ttl={}s)",
                config.getCacheHost(), config.getCachePort(), keyPrefix, ttlSeconds);
    }

    public RedisSnapshotStore(JedisPool pool, String keyPrefix, int ttlSeconds) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.ttlSeconds = Math.max(0, ttlSeconds);
    }

    /** Redis key for a run's snapshot. */
    static String snapshotKey(String prefix, String runId) {
        String p = prefix.endsWith(":") ? prefix.substring(0, prefix.length() - 1) : prefix;
        return p + ":" + runId;
    }

    @Override
    public void save(SessionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        String runId = Objects.requireNonNull(snapshot.getRunId(), "snapshot.runId");
        String key = snapshotKey(keyPrefix, runId);
        write(key, SessionSnapshots.toJson(snapshot));
        log.debug("Saved snapshot for run {} at {} (key={})", runId, snapshot.getPausedAt(), key);
    }

    @Override
    public Optional<SessionSnapshot> find(String runId) {
        try (var jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(snapshotKey(keyPrefix, runId))).map(SessionSnapshots::fromJson);
        }
    }

    /** An unreadable payload is written back before the parse failure propagates. */
    @Override
    public Optional<SessionSnapshot> take(String runId) {
        String key = snapshotKey(keyPrefix, runId);
        String json;
        try (var jedis = pool.getResource()) {
            json = jedis.getDel(key);
        }
        if (json == null) {
            return Optional.empty();
        }
        SessionSnapshot snapshot;
        try {
            snapshot = SessionSnapshots.fromJson(json);
        } catch (RuntimeException e) {
            log.warn("Snapshot for run {} is unreadable, restoring key {}: {}", runId, key, e.getMessage());
            write(key, json);
            throw e;
        }
        log.debug("Claimed snapshot for run {}", runId);
        return Optional.of(snapshot);
    }

    private void write(String key, String json) {
        try (var jedis = pool.getResource()) {
            if (ttlSeconds > 0) {
                jedis.setex(key, ttlSeconds, json);
            } else {
                jedis.set(key, json);
            }
        }
    }

    @Override
    public boolean delete(String runId) {
        try (var jedis = pool.getResource()) {
            return jedis.del(snapshotKey(keyPrefix, runId)) > 0;
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
