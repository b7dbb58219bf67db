// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import uk.co.farowl.vsjw.runtime.kernel.LookupCache;
import uk.co.farowl.vsjw.runtime.kernel.MROCalculator;
import uk.co.farowl.vsjw.runtime.watch.Watchable;

/**
 * The Python {@code type} object. A type has a dictionary of attributes
 * and a method resolution order (MRO) along which attributes are looked
 * up.
 * <p>
 * Every type carries a <i>version tag</i>, an integer that is either a
 * valid tag, in which case the type has not been modified since the tag
 * was assigned, or zero, meaning the type is "dirty". Look-up of an
 * attribute assigns a tag (if necessary) and uses it, with the name, as
 * a key into the {@link LookupCache}. Modifying a type (or any of its
 * bases) sets the tag to zero, so that results cached under the old tag
 * are never found again. The same flag serves to aggregate
 * notifications to type watchers: only the first modification after a
 * tag is assigned produces an event.
 * <p>
 * Built-in types are immutable and belong to no interpreter. Types
 * defined by {@link Interpreter#newType(String, PyType...)} (heap
 * types) are mutable, and report modifications to the type watchers of
 * the interpreter that created them.
 */
public final class PyType implements WithClass, Watchable {

    /**
     * The number of version tags a single type may be assigned. After
     * that, look-ups on the type are not cached, and (since the tag
     * stays invalid) its watchers hear no more of its modifications.
     */
    public static final int MAX_VERSIONS_PER_CLASS = 1000;

    /** Source of version tags (0 is never issued). */
    private static final AtomicInteger nextVersionTag =
            new AtomicInteger(1);

    /** Cache of look-ups, shared by all types in the process. */
    private static final LookupCache cache = new LookupCache();

    /** The type object of {@code object}, root of every MRO. */
    public static final PyType OBJECT = new PyType(null, "object",
            new PyType[0], false);

    /** The type object of {@code type}. */
    public static final PyType TYPE = builtin("type");

    /** The interpreter owning a heap type ({@code null} if built-in). */
    private final Interpreter interpreter;

    /** Name of the type. */
    private final String name;

    /** Bases of the type in order of declaration. */
    private final PyType[] bases;

    /** The method resolution order, starting with this type. */
    private final PyType[] mro;

    /** Whether attributes may be set and deleted. */
    private final boolean mutable;

    /** The dictionary of the type. */
    private final Map<String, Object> dict = new LinkedHashMap<>();

    /** Types that name this one as a base (weakly held). */
    private final List<WeakReference<PyType>> subclasses =
            new ArrayList<>();

    /** Valid version tag, or zero if the type has been modified. */
    private int versionTag;

    /** The number of tags so far assigned to this type. */
    private int versionsUsed;

    /** Bit {@code i} set if the type is watched by type watcher i. */
    private int watcherBits;

    /**
     * Create a type and link it into the subclass lists of its bases.
     *
     * @param interpreter owning the type or {@code null}
     * @param name of the type
     * @param bases of the type (empty only for {@code object})
     * @param mutable whether attributes may be set
     */
    private PyType(Interpreter interpreter, String name, PyType[] bases,
            boolean mutable) {
        this.interpreter = interpreter;
        this.name = name;
        this.bases = bases;
        this.mutable = mutable;
        if (bases.length == 0) {
            this.mro = new PyType[] {this};
        } else {
            checkDistinct(name, bases);
            this.mro = MROCalculator.getMRO(this, bases);
            for (PyType b : bases) { b.addSubclass(this); }
        }
    }

    /**
     * Create a built-in (immutable) type.
     *
     * @param name of the type
     * @param bases of the type (if none, {@code object})
     * @return the new type
     */
    static PyType builtin(String name, PyType... bases) {
        return new PyType(null, name, basesOrObject(bases), false);
    }

    /**
     * Create a type defined by a program run by the given interpreter.
     * Its modifications are reported to the type watchers of that
     * interpreter.
     *
     * @param interpreter owning the type
     * @param name of the type
     * @param bases of the type (if none, {@code object})
     * @return the new type
     * @throws TypeError if the bases repeat or have no consistent MRO
     */
    static PyType heap(Interpreter interpreter, String name,
            PyType... bases) throws TypeError {
        return new PyType(interpreter, name, basesOrObject(bases), true);
    }

    private static PyType[] basesOrObject(PyType[] bases) {
        return bases.length == 0 ? new PyType[] {OBJECT} : bases.clone();
    }

    private static void checkDistinct(String name, PyType[] bases) {
        for (int i = 1; i < bases.length; i++) {
            for (int j = 0; j < i; j++) {
                if (bases[i] == bases[j]) {
                    throw new TypeError("duplicate base class %s",
                            bases[i].name);
                }
            }
        }
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the name of the type */
    public String getName() { return name; }

    /** @return the first base, or {@code null} for {@code object} */
    public PyType getBase() { return bases.length == 0 ? null : bases[0]; }

    /** @return a copy of the bases in order of declaration */
    public PyType[] getBases() { return bases.clone(); }

    /** @return a copy of the MRO, starting with this type */
    public PyType[] getMRO() { return mro.clone(); }

    /** @return whether attributes may be set and deleted */
    public boolean isMutable() { return mutable; }

    /** @return the interpreter owning the type, or {@code null} */
    @Override
    public Interpreter getInterpreter() { return interpreter; }

    /** @return an unmodifiable view of the dictionary of the type */
    public Map<String, Object> getDict() {
        return Collections.unmodifiableMap(dict);
    }

    /**
     * Return the live types that name this one as a base.
     *
     * @return the current subclasses
     */
    public List<PyType> getSubclasses() {
        List<PyType> live = new ArrayList<>();
        synchronized (subclasses) {
            Iterator<WeakReference<PyType>> i = subclasses.iterator();
            while (i.hasNext()) {
                PyType t = i.next().get();
                if (t == null) {
                    i.remove();
                } else {
                    live.add(t);
                }
            }
        }
        return live;
    }

    private void addSubclass(PyType sub) {
        synchronized (subclasses) {
            subclasses.add(new WeakReference<>(sub));
        }
    }

    /**
     * Look for a name along the MRO, returning the first entry found,
     * or {@code null} if none is found. The result is cached under the
     * version tag of the type, which is assigned if necessary.
     *
     * @param name to look up
     * @return the value found or {@code null}
     */
    // Compare CPython _PyType_Lookup in typeobject.c
    public Object lookup(String name) {
        if (assignVersionTag()) {
            return cache.lookup(versionTag, name, this::findInMRO);
        }
        return findInMRO(name);
    }

    private Object findInMRO(String name) {
        for (PyType t : mro) {
            Object value = t.dict.get(name);
            if (value != null) { return value; }
        }
        return null;
    }

    /**
     * Get an attribute of the type, in the simplified sense of
     * {@link #lookup(String)} (no descriptors are involved).
     *
     * @param name of the attribute
     * @return the value
     * @throws AttributeError if the name is not found
     */
    public Object getAttribute(String name) throws AttributeError {
        Object value = lookup(name);
        if (value == null) {
            throw new AttributeError(
                    "type object '%s' has no attribute '%s'", this.name,
                    name);
        }
        return value;
    }

    /**
     * Set an attribute in the dictionary of the type, and mark the type
     * (and its subclasses) modified.
     *
     * @param name of the attribute
     * @param value to set (Python {@code None} is allowed,
     *     {@code null} is not)
     * @throws TypeError if the type is immutable
     */
    // Compare CPython type_setattro in typeobject.c
    public void setAttribute(String name, Object value) throws TypeError {
        if (!mutable) {
            throw new TypeError(
                    "cannot set '%s' attribute of immutable type '%s'",
                    name, this.name);
        }
        dict.put(name, Py.noneIfNull(value));
        modified();
    }

    /**
     * Delete an attribute from the dictionary of the type, and mark the
     * type (and its subclasses) modified.
     *
     * @param name of the attribute
     * @throws TypeError if the type is immutable
     * @throws AttributeError if the type has no such attribute
     */
    public void delAttribute(String name)
            throws TypeError, AttributeError {
        if (!mutable) {
            throw new TypeError(
                    "cannot delete '%s' attribute of immutable type '%s'",
                    name, this.name);
        }
        if (dict.remove(name) == null) {
            throw new AttributeError(
                    "type object '%s' has no attribute '%s'", this.name,
                    name);
        }
        modified();
    }

    /**
     * Record that the type has changed in a way that may change the
     * result of a look-up on it or on its subclasses. If the version
     * tag is already invalid, there is nothing to do: nothing can have
     * relied on the state since it last changed. Otherwise the tag is
     * invalidated, every subclass is marked modified in turn, and the
     * watchers of the type are notified.
     * <p>
     * The tag is invalidated before any watcher runs, so that a
     * watcher that looks up an attribute sees the current state.
     */
    // Compare CPython PyType_Modified in typeobject.c
    public void modified() {
        if (versionTag == 0) { return; }
        versionTag = 0;
        for (PyType sub : getSubclasses()) { sub.modified(); }
        if (watcherBits != 0 && interpreter != null) {
            interpreter.watchers().type().notifyModified(this);
        }
    }

    /**
     * Ensure that the type has a valid version tag, assigning one (and
     * to each base, first) if it does not. This fails when the type has
     * been assigned {@link #MAX_VERSIONS_PER_CLASS} tags already, or
     * when a base cannot be assigned one.
     *
     * @return whether the type now has a valid tag
     */
    // Compare CPython assign_version_tag in typeobject.c
    public boolean assignVersionTag() {
        if (versionTag != 0) { return true; }
        if (versionsUsed >= MAX_VERSIONS_PER_CLASS) { return false; }
        for (PyType b : bases) {
            if (!b.assignVersionTag()) { return false; }
        }
        int tag = nextVersionTag.getAndIncrement();
        if (tag <= 0) {
            // The counter has wrapped: tags are no longer unique.
            nextVersionTag.set(Integer.MIN_VALUE);
            return false;
        }
        versionsUsed += 1;
        versionTag = tag;
        return true;
    }

    /** @return whether the type currently has a valid version tag */
    public boolean isVersionValid() { return versionTag != 0; }

    /** @return the version tag (zero if invalid) */
    public int getVersionTag() { return versionTag; }

    @Override
    public int getWatcherBits() { return watcherBits; }

    @Override
    public void setWatcherBits(int bits) { watcherBits = bits; }

    /** @return the process-wide look-up cache */
    static LookupCache lookupCache() { return cache; }

    @Override
    public String toString() {
        return String.format("<class '%s'>", name);
    }
}
