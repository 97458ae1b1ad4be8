package com.opensensor.querycache.redis;

import com.opensensor.querycache.SizeGuard;
import com.opensensor.querycache.serializer.CacheSerializer;
import com.opensensor.querycache.store.BinaryTieredStore;
import com.opensensor.querycache.store.CacheUnavailableException;
import com.opensensor.querycache.store.StoreHealth;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

/**
 * Redis implementation of the shared tiered store.
 *
 * <p>Values are stored with {@code SET key value PX ttl}, so expiry is entirely delegated to
 * Redis. Pattern deletes walk the keyspace with incremental {@code SCAN} and delete in batches,
 * never with {@code KEYS}, to avoid blocking a shared server.</p>
 *
 * <p><strong>Failure handling:</strong> every Spring {@link DataAccessException} (connection
 * refused, command timeout, protocol error) is rethrown as {@link CacheUnavailableException}.
 * The degradation layer above decides what the caller sees.</p>
 *
 * <p><strong>Statistics:</strong> {@link #healthCheck()} combines {@code INFO} (version, memory,
 * keyspace hits and misses) with a {@code SCAN} count of this namespace's keys.</p>
 */
public class RedisTieredStore extends BinaryTieredStore {

    private static final Logger log = LoggerFactory.getLogger(RedisTieredStore.class);

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final int scanBatchSize;

    public RedisTieredStore(
            RedisTemplate<String, byte[]> redisTemplate,
            String namespace,
            CacheSerializer serializer,
            SizeGuard sizeGuard,
            int scanBatchSize) {
        super(namespace, serializer, sizeGuard);
        if (scanBatchSize <= 0) {
            throw new IllegalArgumentException("scanBatchSize must be positive: " + scanBatchSize);
        }
        this.redisTemplate = redisTemplate;
        this.scanBatchSize = scanBatchSize;
        log.info(
                "RedisTieredStore initialized. Namespace: {}, Serializer: {}, Max entry size: {} bytes",
                namespace,
                serializer.getClass().getSimpleName(),
                sizeGuard.getMaxBytes());
    }

    @Override
    protected byte[] read(String qualifiedKey) {
        return translate("GET", qualifiedKey, () -> redisTemplate.opsForValue().get(qualifiedKey));
    }

    @Override
    protected void write(String qualifiedKey, byte[] data, Duration ttl) {
        translate("SET", qualifiedKey, () -> {
            redisTemplate.opsForValue().set(qualifiedKey, data, ttl);
            return null;
        });
    }

    @Override
    protected boolean remove(String qualifiedKey) {
        return Boolean.TRUE.equals(translate("DEL", qualifiedKey, () -> redisTemplate.delete(qualifiedKey)));
    }

    @Override
    protected long removeMatching(String qualifiedPattern) {
        Long deleted = translate("SCAN/DEL", qualifiedPattern, () -> redisTemplate.execute(
                (RedisCallback<Long>) connection -> scanAndDelete(connection, qualifiedPattern)));
        log.debug("Deleted {} keys matching pattern: {}", deleted, qualifiedPattern);
        return deleted == null ? 0 : deleted;
    }

    @Override
    public StoreHealth healthCheck() {
        return translate("INFO", namespacePattern(), () -> redisTemplate.execute(
                (RedisCallback<StoreHealth>) connection -> {
                    Properties info = connection.serverCommands().info();
                    long keyCount = countKeys(connection, namespacePattern());
                    return new StoreHealth(
                            true,
                            keyCount,
                            property(info, "redis_version"),
                            property(info, "used_memory_human"),
                            counter(info, "keyspace_hits"),
                            counter(info, "keyspace_misses"));
                }));
    }

    private long scanAndDelete(RedisConnection connection, String pattern) {
        long deleted = 0;
        List<byte[]> batch = new ArrayList<>(scanBatchSize);
        try (Cursor<byte[]> cursor = connection.keyCommands().scan(scanOptions(pattern))) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= scanBatchSize) {
                    deleted += deleteBatch(connection, batch);
                    batch.clear();
                }
            }
        }
        return deleted + deleteBatch(connection, batch);
    }

    private long deleteBatch(RedisConnection connection, List<byte[]> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long removed = connection.keyCommands().del(keys.toArray(new byte[0][]));
        return removed == null ? 0 : removed;
    }

    private long countKeys(RedisConnection connection, String pattern) {
        long count = 0;
        try (Cursor<byte[]> cursor = connection.keyCommands().scan(scanOptions(pattern))) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return count;
    }

    private ScanOptions scanOptions(String pattern) {
        return ScanOptions.scanOptions().match(pattern).count(scanBatchSize).build();
    }

    private static String property(Properties info, String name) {
        return info == null ? "unknown" : info.getProperty(name, "unknown");
    }

    private static long counter(Properties info, String name) {
        String value = info == null ? null : info.getProperty(name);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Unexpected value for INFO field {}: {}", name, value);
            return 0;
        }
    }

    private static <T> T translate(String command, String target, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis " + command + " failed for " + target, e);
        }
    }
}
