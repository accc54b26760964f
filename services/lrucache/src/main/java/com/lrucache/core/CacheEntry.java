package com.lrucache.core;

/**
 * A key/value pair detached from the cache, handed out for evicted entries
 * and by {@link LruCache#toOrderedSequence()}.
 */
public record CacheEntry<K, V>(K key, V value) {

    @Override
    public String toString() {
        return key + ":" + value;
    }
}
