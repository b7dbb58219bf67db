// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests of the direct-mapped attribute lookup cache. */
@DisplayName("LookupCache")
class LookupCacheTest {

    final LookupCache cache = new LookupCache();

    final AtomicInteger searches = new AtomicInteger();

    final Map<String, Object> attrs = Map.of("x", 1, "y", 2);

    final Function<String, Object> finder = name -> {
        searches.incrementAndGet();
        return attrs.get(name);
    };

    @Test
    @DisplayName("searches once per version and name")
    void cachesResult() {
        assertEquals(1, cache.lookup(5, "x", finder));
        assertEquals(1, cache.lookup(5, "x", finder));
        assertEquals(1, searches.get());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    @DisplayName("searches again under a new version")
    void newVersion() {
        cache.lookup(5, "x", finder);
        cache.lookup(6, "x", finder);
        assertEquals(2, searches.get());
    }

    @Test
    @DisplayName("caches a name that is not found")
    void negative() {
        assertNull(cache.lookup(7, "absent", finder));
        assertNull(cache.lookup(7, "absent", finder));
        assertEquals(1, searches.get());
    }

    @Test
    @DisplayName("lets a colliding entry displace another")
    void collision() {
        // Same slot: (v ^ h) & MASK equal when v differs by SIZE
        cache.lookup(1, "x", finder);
        cache.lookup(1 + LookupCache.SIZE, "x", finder);
        cache.lookup(1, "x", finder);
        assertEquals(3, searches.get());
    }
}
