package com.opensensor.querycache.lookup;

import com.opensensor.querycache.CacheKey;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-key de-duplication of cache-miss recomputation inside one process.
 *
 * <p>The first caller for a key runs the loader; callers arriving while it runs wait for the same
 * result instead of hitting the source again. The marker is removed as soon as the load resolves,
 * successfully or not, so a later miss starts a fresh load.</p>
 *
 * <p><strong>Thread Safety:</strong> markers live in a {@link ConcurrentHashMap}; loads for
 * different keys never wait on each other.</p>
 *
 * <p>Every waiter receives the same result instance, and exceptions thrown by the loader reach
 * every waiter as the same instance. Results must therefore be treated as read-only; the call-sites
 * hand out unmodifiable views.</p>
 *
 * @since 1.0.0
 */
public class InFlightLoads {

    private static final Logger log = LoggerFactory.getLogger(InFlightLoads.class);

    private final ConcurrentHashMap<String, Future<Object>> loadingInProgress = new ConcurrentHashMap<>();

    /**
     * Runs {@code loader} for {@code key}, or waits for the load already running for it.
     *
     * @param key the key being loaded
     * @param loader computes the value; runs on the calling thread of the first caller
     * @param <T> the value type
     * @return the loaded value, shared with every concurrent caller for the same key
     * @throws CacheLoadingException if interrupted while waiting, or the loader threw a checked
     *     exception
     */
    @SuppressWarnings("unchecked")
    public <T> T load(CacheKey key, Supplier<T> loader) {
        String id = key.value();
        FutureTask<Object> newTask = new FutureTask<>(loader::get);
        Future<Object> future = loadingInProgress.putIfAbsent(id, newTask);
        if (future == null) {
            future = newTask;
            try {
                newTask.run();
            } finally {
                loadingInProgress.remove(id, newTask);
            }
        } else {
            log.debug("Joining in-flight load for key: {}", key);
        }

        try {
            return (T) future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheLoadingException("Interrupted while waiting for key: " + key, e);
        } catch (ExecutionException e) {
            throw unwrap(key, e);
        }
    }

    /** Number of keys currently being loaded. */
    public int inFlightCount() {
        return loadingInProgress.size();
    }

    private static RuntimeException unwrap(CacheKey key, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CacheLoadingException("Failed to load value for key: " + key, cause);
    }
}
