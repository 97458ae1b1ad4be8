package com.opensensor.querycache.store;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.SizeGuard;
import com.opensensor.querycache.serializer.CacheSerializer;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Base class for backends that hold serialized bytes.
 *
 * <p>Handles namespacing, serialization and size admission so that backends only deal with
 * fully qualified keys and byte arrays. A value is serialized once; its exact byte length is
 * checked against the {@link SizeGuard} before anything is written.</p>
 */
public abstract class BinaryTieredStore implements TieredStore {

    private static final Logger log = LoggerFactory.getLogger(BinaryTieredStore.class);

    private final String namespace;
    private final CacheSerializer serializer;
    private final SizeGuard sizeGuard;

    protected BinaryTieredStore(String namespace, CacheSerializer serializer, SizeGuard sizeGuard) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        this.namespace = namespace;
        this.serializer = serializer;
        this.sizeGuard = sizeGuard;
    }

    @Override
    public <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef) {
        byte[] data = read(qualify(key.value()));
        if (data == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(serializer.deserialize(data, typeRef));
    }

    @Override
    public boolean set(CacheKey key, Object value, Duration ttl) {
        if (value == null) {
            log.debug("Refusing to cache null value for key: {}", key);
            return false;
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.warn("Refusing to cache key {} with non-positive TTL {}", key, ttl);
            return false;
        }
        byte[] data = serializer.serialize(value);
        if (!sizeGuard.admit(data.length)) {
            log.debug("Admission rejected for key: {} ({} bytes, ceiling {} bytes)",
                    key, data.length, sizeGuard.getMaxBytes());
            return false;
        }
        write(qualify(key.value()), data, ttl);
        return true;
    }

    @Override
    public boolean delete(CacheKey key) {
        return remove(qualify(key.value()));
    }

    @Override
    public long deleteByPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        return removeMatching(qualify(pattern));
    }

    protected String qualify(String relativeKey) {
        return namespace + ":" + relativeKey;
    }

    /** Glob pattern matching every key owned by this store. */
    protected String namespacePattern() {
        return qualify("*");
    }

    public String getNamespace() {
        return namespace;
    }

    /** @return the stored bytes, or null when the key is absent or expired */
    protected abstract byte[] read(String qualifiedKey);

    protected abstract void write(String qualifiedKey, byte[] data, Duration ttl);

    protected abstract boolean remove(String qualifiedKey);

    protected abstract long removeMatching(String qualifiedPattern);
}
