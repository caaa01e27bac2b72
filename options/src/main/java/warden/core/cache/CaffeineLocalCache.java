package warden.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Caffeine-backed local cache with an optional write expiry.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * Create a cache that keeps entries until they are invalidated or evicted
     * for size.
     *
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(long maxSize) {
        this(maxSize, Optional.empty());
    }

    /**
     * Create a cache.
     *
     * @param maxSize          the maximum number of entries in the cache
     * @param expireAfterWrite how long entries live after being written, if bounded
     */
    public CaffeineLocalCache(long maxSize, Optional<Duration> expireAfterWrite) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive, got: " + maxSize);
        }
        final var builder = Caffeine.newBuilder().maximumSize(maxSize);
        expireAfterWrite.ifPresent(builder::expireAfterWrite);
        this.cache = builder.build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return cache.get(key, loader);
    }

    @Override
    public boolean putIfAbsent(K key, V value) {
        return cache.asMap().putIfAbsent(key, value) == null;
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
