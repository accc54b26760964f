package com.lrucache.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of reading a key: either a hit carrying the stored value (which may be
 * {@code null}) or a miss. A miss never compares equal to a hit.
 */
public final class Lookup<V> {
    private static final Lookup<?> MISS = new Lookup<>(false, null);

    private final boolean found;
    private final V value;

    private Lookup(boolean found, V value) {
        this.found = found;
        this.value = value;
    }

    public static <V> Lookup<V> hit(V value) {
        return new Lookup<>(true, value);
    }

    @SuppressWarnings("unchecked")
    public static <V> Lookup<V> miss() {
        return (Lookup<V>) MISS;
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @throws NoSuchElementException on a miss
     */
    public V value() {
        if (!found) {
            throw new NoSuchElementException("Key not present in cache");
        }
        return value;
    }

    public V orElse(V other) {
        return found ? value : other;
    }

    /**
     * A hit holding {@code null} maps to an empty optional, same as a miss.
     */
    public Optional<V> toOptional() {
        return found ? Optional.ofNullable(value) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lookup<?> other)) return false;
        return found == other.found && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(found, value);
    }

    @Override
    public String toString() {
        return found ? "Hit[" + value + "]" : "Miss";
    }
}
