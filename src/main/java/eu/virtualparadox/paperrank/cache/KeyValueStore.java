package eu.virtualparadox.paperrank.cache;

import java.util.Optional;

/**
 * Memoization store for expensive pipeline steps, keyed by a fingerprint
 * (see {@link eu.virtualparadox.paperrank.util.Fingerprints}).
 * Reads are local and never touch the network.
 *
 * @param <V> value type
 */
public interface KeyValueStore<V> {

    Optional<V> get(String key);

    void put(String key, V value);
}
