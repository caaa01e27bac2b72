package warden.core.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Local in-memory cache.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Gets a value, computing and storing it if absent.
     *
     * <p>Concurrent callers for the same key wait for a single computation.
     * If {@code loader} throws, nothing is stored and the exception propagates.
     *
     * @param key    the cache key
     * @param loader computes the value for an absent key
     * @return the cached or computed value
     */
    V get(K key, Function<? super K, ? extends V> loader);

    /**
     * Stores a value unless the key is already present.
     *
     * @return true if the value was stored
     */
    boolean putIfAbsent(K key, V value);

    /**
     * Invalidates (removes) a specific cache entry.
     *
     * @param key the cache key to invalidate
     */
    void invalidate(K key);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the estimated number of entries in the cache.
     */
    long estimatedSize();
}
