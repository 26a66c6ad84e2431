package com.hive.config;

import com.hive.graph.load.GraphSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link GraphSource}: graph JSON published under {@code <prefix>:<name>:<version>} so every
 * runner instance sees the same definitions.
 */
public final class RedisGraphSource implements GraphSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisGraphSource.class);

    private final JedisPool pool;

    public RedisGraphSource(HiveConfig config) {
        this(Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort());
    }

    public RedisGraphSource(String cacheHost, int cachePort) {
        this.pool = new JedisPool(new JedisPoolConfig(), cacheHost, cachePort);
        log.debug("RedisGraphSource connected to {}:{}", cacheHost, cachePort);
    }

    @Override
    public Optional<String> getFromCache(String key) {
        try (var jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(key));
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
