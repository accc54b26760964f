package com.lrucache.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-capacity cache that evicts the least recently used entry once full.
 *
 * <p>Entries form a chain from {@code head} (least recently used) to
 * {@code tail} (most recently used), with a key index for direct lookup:
 *
 * <pre>
 *   head                                  tail
 *    A  .newer&gt;  B  .newer&gt;  C  .newer&gt;  D
 *    A  &lt;older.  B  &lt;older.  C  &lt;older.  D
 *
 *   evicted &lt;-------------------------- added
 * </pre>
 *
 * <p>{@link #put} and {@link #get} count as use, {@link #peek} does not.
 * Instances are not thread-safe; callers sharing one across threads must
 * guard every call with the same lock.
 */
public class LruCache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(LruCache.class);

    private final int limit;
    private final Map<K, CacheNode<K, V>> index;
    private final EvictionListener<K, V> evictionListener;
    private CacheNode<K, V> head;
    private CacheNode<K, V> tail;
    private int size;
    // bumped on every change to chain order, read by the ordered-sequence iterator
    private int modCount;

    public LruCache(int limit) {
        this(limit, EvictionListener.noop());
    }

    public LruCache(int limit, EvictionListener<K, V> evictionListener) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        this.limit = limit;
        this.evictionListener = Objects.requireNonNull(evictionListener, "evictionListener");
        this.index = new HashMap<>();
    }

    /**
     * Stores {@code value} under {@code key} and marks it most recently used.
     * An existing entry is updated in place and never triggers eviction.
     *
     * @return the entry evicted to make room, or empty if nothing was evicted
     */
    public Optional<CacheEntry<K, V>> put(K key, V value) {
        Objects.requireNonNull(key, "key");

        CacheNode<K, V> existing = index.get(key);
        if (existing != null) {
            existing.value = value;
            moveToTail(existing);
            return Optional.empty();
        }

        CacheNode<K, V> evicted = null;
        if (size == limit) {
            evicted = unlinkHead();
        }
        CacheNode<K, V> node = new CacheNode<>(key, value);
        append(node);
        index.put(key, node);
        size++;

        if (evicted == null) {
            return Optional.empty();
        }
        logger.debug("Evicted {} to make room for {}", evicted.key, key);
        evictionListener.onEviction(evicted.key, evicted.value);
        return Optional.of(evicted.toEntry());
    }

    /**
     * Reads {@code key} and marks it most recently used.
     */
    public Lookup<V> get(K key) {
        CacheNode<K, V> node = index.get(key);
        if (node == null) {
            return Lookup.miss();
        }
        moveToTail(node);
        return Lookup.hit(node.value);
    }

    /**
     * Reads {@code key} without touching its recency.
     */
    public Lookup<V> peek(K key) {
        CacheNode<K, V> node = index.get(key);
        return node == null ? Lookup.miss() : Lookup.hit(node.value);
    }

    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    /**
     * Deletes {@code key}. The eviction listener is not notified.
     */
    public Lookup<V> remove(K key) {
        CacheNode<K, V> node = index.remove(key);
        if (node == null) {
            return Lookup.miss();
        }
        unlink(node);
        size--;
        return Lookup.hit(node.value);
    }

    /**
     * Evicts the least recently used entry right away, notifying the eviction
     * listener as a capacity eviction would.
     */
    public Optional<CacheEntry<K, V>> evictEldest() {
        if (head == null) {
            return Optional.empty();
        }
        CacheNode<K, V> evicted = unlinkHead();
        logger.debug("Evicted eldest entry {}", evicted.key);
        evictionListener.onEviction(evicted.key, evicted.value);
        return Optional.of(evicted.toEntry());
    }

    public void clear() {
        index.clear();
        head = null;
        tail = null;
        size = 0;
        modCount++;
    }

    public int size() {
        return size;
    }

    public int limit() {
        return limit;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Entries from least to most recently used. Every call to
     * {@code iterator()} walks the chain afresh; an iterator fails with
     * {@link ConcurrentModificationException} once the cache is modified or
     * reordered underneath it.
     */
    public Iterable<CacheEntry<K, V>> toOrderedSequence() {
        return OrderedIterator::new;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (CacheNode<K, V> node = head; node != null; node = node.newer) {
            sb.append(node.key).append(':').append(node.value);
            if (node.newer != null) {
                sb.append(" < ");
            }
        }
        return sb.toString();
    }

    private void moveToTail(CacheNode<K, V> node) {
        if (node == tail) {
            return;
        }
        unlink(node);
        append(node);
    }

    private CacheNode<K, V> unlinkHead() {
        CacheNode<K, V> eldest = head;
        if (eldest == tail) {
            // sole entry: both ends go away together
            head = null;
            tail = null;
            modCount++;
        } else {
            unlink(eldest);
        }
        index.remove(eldest.key);
        size--;
        return eldest;
    }

    private void append(CacheNode<K, V> node) {
        node.newer = null;
        node.older = tail;
        if (tail != null) {
            tail.newer = node;
        } else {
            head = node;
        }
        tail = node;
        modCount++;
    }

    private void unlink(CacheNode<K, V> node) {
        if (node.older != null) {
            node.older.newer = node.newer;
        } else {
            head = node.newer;
        }
        if (node.newer != null) {
            node.newer.older = node.older;
        } else {
            tail = node.older;
        }
        node.older = null;
        node.newer = null;
        modCount++;
    }

    private final class OrderedIterator implements Iterator<CacheEntry<K, V>> {
        private final int expectedModCount = modCount;
        private CacheNode<K, V> next = head;

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public CacheEntry<K, V> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (next == null) {
                throw new NoSuchElementException();
            }
            CacheNode<K, V> current = next;
            next = current.newer;
            return current.toEntry();
        }
    }
}
