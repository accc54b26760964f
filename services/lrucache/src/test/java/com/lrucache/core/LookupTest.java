package com.lrucache.core;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LookupTest {

    @Test
    void testMissHasNoValue() {
        Lookup<String> miss = Lookup.miss();
        assertFalse(miss.isFound());
        assertThrows(NoSuchElementException.class, miss::value);
        assertEquals("fallback", miss.orElse("fallback"));
        assertEquals(Optional.empty(), miss.toOptional());
        assertEquals("Miss", miss.toString());
    }

    @Test
    void testHitCarriesValue() {
        Lookup<String> hit = Lookup.hit("v");
        assertTrue(hit.isFound());
        assertEquals("v", hit.value());
        assertEquals("v", hit.orElse("fallback"));
        assertEquals(Optional.of("v"), hit.toOptional());
        assertEquals(Lookup.hit("v"), hit);
        assertEquals(Lookup.hit("v").hashCode(), hit.hashCode());
    }

    @Test
    void testNullHitIsNotAMiss() {
        Lookup<String> nullHit = Lookup.hit(null);
        assertTrue(nullHit.isFound());
        assertNull(nullHit.value());
        assertNull(nullHit.orElse("fallback"));
        assertNotEquals(Lookup.<String>miss(), nullHit);
    }
}
