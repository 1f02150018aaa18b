package eu.virtualparadox.paperrank.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * In-memory store living as long as the process (or the run that created it).
 */
public class CaffeineKeyValueStore<V> implements KeyValueStore<V> {

    private final Cache<String, V> cache;

    public CaffeineKeyValueStore(final long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<V> get(final String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(final String key, final V value) {
        cache.put(key, value);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
