package com.lrucache.core;

/**
 * Receives every entry evicted for capacity. Called synchronously once the
 * entry has been unlinked, so the cache no longer holds it.
 */
@FunctionalInterface
public interface EvictionListener<K, V> {

    void onEviction(K key, V value);

    static <K, V> EvictionListener<K, V> noop() {
        return (key, value) -> { };
    }
}
