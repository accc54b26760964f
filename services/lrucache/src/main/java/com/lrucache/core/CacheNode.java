package com.lrucache.core;

public class CacheNode<K, V> {
    final K key;
    V value;
    CacheNode<K, V> older;
    CacheNode<K, V> newer;

    public CacheNode(K key, V value) {
        this.key = key;
        this.value = value;
    }

    CacheEntry<K, V> toEntry() {
        return new CacheEntry<>(key, value);
    }
}
