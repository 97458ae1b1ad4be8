package com.opensensor.querycache.caffeine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.opensensor.querycache.SizeGuard;
import com.opensensor.querycache.serializer.CacheSerializer;
import com.opensensor.querycache.store.BinaryTieredStore;
import com.opensensor.querycache.store.StoreHealth;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local tiered store backed by Caffeine.
 *
 * <p>Entries keep the serialized bytes and expire individually after the TTL given on write.
 * Expiry is driven by the supplied {@link Ticker}, which lets tests advance time by hand.</p>
 *
 * <p>Nothing is shared between replicas, so this backend suits single-instance deployments and
 * local development; multi-replica services should use the Redis store.</p>
 */
public class CaffeineTieredStore extends BinaryTieredStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineTieredStore.class);

    private final Cache<String, StoredEntry> cache;

    public CaffeineTieredStore(
            String namespace, CacheSerializer serializer, SizeGuard sizeGuard, long maximumSize) {
        this(namespace, serializer, sizeGuard, maximumSize, Ticker.systemTicker());
    }

    public CaffeineTieredStore(
            String namespace,
            CacheSerializer serializer,
            SizeGuard sizeGuard,
            long maximumSize,
            Ticker ticker) {
        super(namespace, serializer, sizeGuard);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryTtl())
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("CaffeineTieredStore initialized. Namespace: {}, Maximum size: {}", namespace, maximumSize);
    }

    @Override
    protected byte[] read(String qualifiedKey) {
        StoredEntry entry = cache.getIfPresent(qualifiedKey);
        return entry == null ? null : entry.data();
    }

    @Override
    protected void write(String qualifiedKey, byte[] data, Duration ttl) {
        cache.put(qualifiedKey, new StoredEntry(data, ttl.toNanos()));
    }

    @Override
    protected boolean remove(String qualifiedKey) {
        return cache.asMap().remove(qualifiedKey) != null;
    }

    @Override
    protected long removeMatching(String qualifiedPattern) {
        Pattern regex = globToRegex(qualifiedPattern);
        List<String> matches = cache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .toList();
        long removed = 0;
        for (String key : matches) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public StoreHealth healthCheck() {
        cache.cleanUp();
        String prefix = getNamespace() + ":";
        long keyCount = 0;
        long bytes = 0;
        for (var entry : cache.asMap().entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                keyCount++;
                bytes += entry.getValue().data().length;
            }
        }
        CacheStats stats = cache.stats();
        return new StoreHealth(
                true, keyCount, "caffeine", humanReadable(bytes), stats.hitCount(), stats.missCount());
    }

    /**
     * Translates a Redis-style glob ({@code *}, {@code ?}, {@code [...]}, {@code \} escapes) to an
     * anchored regular expression.
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        regex.append(Pattern.quote("\\"));
                    }
                }
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close == -1) {
                        regex.append(Pattern.quote("["));
                    } else {
                        String body = glob.substring(i + 1, close).replace("\\", "\\\\");
                        regex.append('[').append(body).append(']');
                        i = close;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String humanReadable(long bytes) {
        if (bytes < 1024) {
            return bytes + "B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2fK", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2fM", bytes / (1024.0 * 1024.0));
    }

    private record StoredEntry(byte[] data, long ttlNanos) {
    }

    private static final class PerEntryTtl implements Expiry<String, StoredEntry> {

        @Override
        public long expireAfterCreate(String key, StoredEntry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
