// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.kernel;

import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * A cache of the results of attribute lookup along the MRO of a type,
 * keyed by the version tag of the type and the attribute name. A type
 * receives a fresh tag after each modification, so entries made under
 * an old tag are never matched again. Negative results (the name was
 * not found) are cached too, as a {@code null} value.
 * <p>
 * The cache is direct-mapped: each key has exactly one slot, and a new
 * entry simply displaces whatever was there. Entries are immutable, so
 * that threads may race to fill a slot without harm.
 */
public final class LookupCache {

    /** Number of slots: a power of two. */
    public static final int SIZE = 1 << 12;

    private static final int MASK = SIZE - 1;

    private final AtomicReferenceArray<Entry> table =
            new AtomicReferenceArray<>(SIZE);

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    /**
     * One cached lookup.
     *
     * @param version tag of the type when the lookup was made
     * @param name looked up
     * @param value found (or {@code null})
     */
    private record Entry(int version, String name, Object value) {}

    /**
     * Return the cached result of looking up {@code name} in the type
     * with the given version tag, or compute and cache it.
     *
     * @param version valid tag of the type (not zero)
     * @param name to look up
     * @param finder to compute the result when it is not cached
     * @return the value found, or {@code null} if the name is absent
     */
    public Object lookup(int version, String name,
            Function<String, Object> finder) {
        int i = (version ^ name.hashCode()) & MASK;
        Entry e = table.get(i);
        if (e != null && e.version == version && e.name.equals(name)) {
            hits.increment();
            return e.value;
        }
        misses.increment();
        Object value = finder.apply(name);
        table.set(i, new Entry(version, name, value));
        return value;
    }

    /** @return number of lookups answered from the cache */
    public long hits() { return hits.sum(); }

    /** @return number of lookups that had to search the MRO */
    public long misses() { return misses.sum(); }
}
