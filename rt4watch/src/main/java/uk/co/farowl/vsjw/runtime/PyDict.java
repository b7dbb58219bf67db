// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import uk.co.farowl.vsjw.runtime.kernel.ObjectIdentity;
import uk.co.farowl.vsjw.runtime.watch.DictEvent;
import uk.co.farowl.vsjw.runtime.watch.Watchable;
import uk.co.farowl.vsjw.support.InterpreterError;

/**
 * The Python {@code dict} object. The Java API is provided directly by
 * the base class implementing {@code Map}, while the Python API has
 * been implemented on top of the Java one.
 * <p>
 * Every change to the content of a {@code dict}, through either API, is
 * reported to the dictionary watchers subscribed to it, after the change
 * has been made. Neither keys nor values may be {@code null}: Python
 * {@code None} is an ordinary value.
 */
public class PyDict extends AbstractMap<Object, Object>
        implements CraftedPyObject, Watchable {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.builtin("dict");

    /** The interpreter whose watchers hear of changes. */
    private final Interpreter interpreter;

    /** Identity of this object. */
    private final long id = ObjectIdentity.next();

    /** The dictionary as a hash map preserving insertion order. */
    private final LinkedHashMap<Object, Object> map =
            new LinkedHashMap<>();

    /** Bit {@code i} set if watched by dictionary watcher i. */
    private int watcherBits;

    /** Set when the run-time has torn the object down. */
    private boolean deallocated;

    /**
     * Create an empty {@code dict}.
     *
     * @param interpreter owning the dictionary
     */
    PyDict(Interpreter interpreter) {
        this.interpreter = Objects.requireNonNull(interpreter);
    }

    /**
     * Create a {@code dict} holding the given entries.
     *
     * @param interpreter owning the dictionary
     * @param entries initial content
     */
    PyDict(Interpreter interpreter, Map<?, ?> entries) {
        this(interpreter);
        for (Map.Entry<?, ?> e : entries.entrySet()) {
            map.put(checkKey(e.getKey()), checkValue(e.getValue()));
        }
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public long getId() { return id; }

    /** @return the interpreter owning this dictionary */
    @Override
    public Interpreter getInterpreter() { return interpreter; }

    @Override
    public int getWatcherBits() { return watcherBits; }

    @Override
    public void setWatcherBits(int bits) { watcherBits = bits; }

    @Override
    public String toString() { return Py.mapRepr(this); }

    // Map interface --------------------------------------------------

    @Override
    public int size() { return map.size(); }

    @Override
    public boolean containsKey(Object key) { return map.containsKey(key); }

    @Override
    public Object get(Object key) { return map.get(key); }

    /**
     * {@inheritDoc}
     * <p>
     * Reports {@link DictEvent#NEW} if the key was absent, or
     * {@link DictEvent#MODIFIED} if it was bound to a different object.
     * Storing the very object already bound to the key changes nothing
     * and reports nothing.
     */
    // Compare CPython insertdict in dictobject.c
    @Override
    public Object put(Object key, Object value) {
        checkLive();
        Object previous = map.put(checkKey(key), checkValue(value));
        if (previous == null) {
            notifyWatchers(DictEvent.NEW, key, value);
        } else if (previous != value) {
            notifyWatchers(DictEvent.MODIFIED, key, value);
        }
        return previous;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Reports {@link DictEvent#NEW} if the key was absent.
     */
    @Override
    public Object putIfAbsent(Object key, Object value) {
        checkLive();
        Object previous = map.putIfAbsent(checkKey(key), checkValue(value));
        if (previous == null) {
            notifyWatchers(DictEvent.NEW, key, value);
        }
        return previous;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Reports {@link DictEvent#DELETED} if the key was present.
     */
    @Override
    public Object remove(Object key) {
        checkLive();
        Object previous = map.remove(key);
        if (previous != null) {
            notifyWatchers(DictEvent.DELETED, key, null);
        }
        return previous;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Has the semantics of Python {@code dict.update}: see
     * {@link #update(Map)}.
     */
    @Override
    public void putAll(Map<?, ?> m) { update(m); }

    /**
     * {@inheritDoc}
     * <p>
     * Reports {@link DictEvent#CLEARED} if the dictionary was not
     * already empty.
     */
    // Compare CPython PyDict_Clear in dictobject.c
    @Override
    public void clear() {
        checkLive();
        if (map.isEmpty()) { return; }
        map.clear();
        notifyWatchers(DictEvent.CLEARED, null, null);
    }

    @Override
    public Set<Entry<Object, Object>> entrySet() {
        return new EntrySetImpl();
    }

    // Python API -----------------------------------------------------

    /**
     * Python {@code d[key]}.
     *
     * @param key to find
     * @return value bound to the key
     * @throws KeyError if the key is not present
     */
    public Object getItem(Object key) throws KeyError {
        Object value = map.get(key);
        if (value == null) { throw new KeyError(key); }
        return value;
    }

    /**
     * Python {@code d[key] = value}.
     *
     * @param key to bind
     * @param value to bind to it
     */
    public void setItem(Object key, Object value) { put(key, value); }

    /**
     * Python {@code del d[key]}.
     *
     * @param key to remove
     * @throws KeyError if the key is not present
     */
    public void delItem(Object key) throws KeyError {
        if (remove(key) == null) { throw new KeyError(key); }
    }

    /**
     * Python {@code d.pop(key)}.
     *
     * @param key to remove
     * @return value that was bound to the key
     * @throws KeyError if the key is not present
     */
    public Object pop(Object key) throws KeyError {
        Object value = remove(key);
        if (value == null) { throw new KeyError(key); }
        return value;
    }

    /**
     * Python {@code d.pop(key, default)}.
     *
     * @param key to remove
     * @param defaultValue to return if the key is not present
     * @return value that was bound to the key, or the default
     */
    public Object pop(Object key, Object defaultValue) {
        Object value = remove(key);
        return value == null ? defaultValue : value;
    }

    /**
     * Python {@code d.popitem()}: remove and return the entry most
     * recently inserted.
     *
     * @return the entry removed
     * @throws KeyError if the dictionary is empty
     */
    public Map.Entry<Object, Object> popItem() throws KeyError {
        checkLive();
        Map.Entry<Object, Object> last = null;
        for (Map.Entry<Object, Object> e : map.entrySet()) { last = e; }
        if (last == null) {
            throw new KeyError(null, "popitem(): dictionary is empty");
        }
        Map.Entry<Object, Object> result =
                new SimpleImmutableEntry<>(last);
        remove(result.getKey());
        return result;
    }

    /**
     * Python {@code d.setdefault(key, default)}.
     *
     * @param key to look up
     * @param defaultValue to bind if the key is absent
     * @return the value now bound to the key
     */
    public Object setDefault(Object key, Object defaultValue) {
        Object previous = putIfAbsent(key, defaultValue);
        return previous == null ? defaultValue : previous;
    }

    /**
     * Python {@code d.update(src)}. When this dictionary is empty and
     * the source is a non-empty {@code dict}, the content is copied
     * wholesale and reported as a single {@link DictEvent#CLONED} event
     * with the source as the key argument. Otherwise the entries are
     * stored one at a time, each reported as by
     * {@link #put(Object, Object)}.
     *
     * @param src of new entries
     */
    // Compare CPython dict_merge in dictobject.c
    public void update(Map<?, ?> src) {
        checkLive();
        if (src instanceof PyDict other && map.isEmpty()
                && !other.isEmpty()) {
            map.putAll(other.map);
            notifyWatchers(DictEvent.CLONED, other, null);
        } else {
            for (Map.Entry<?, ?> e : new LinkedHashMap<>(src).entrySet()) {
                put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * Python {@code d.copy()}. The copy belongs to the same interpreter
     * and is not watched.
     *
     * @return a shallow copy of this dictionary
     */
    public PyDict copy() { return new PyDict(interpreter, map); }

    // Lifecycle ------------------------------------------------------

    /**
     * Tear down the dictionary, as the run-time does when the object is
     * no longer reachable. Watchers receive
     * {@link DictEvent#DEALLOCATED} while the content is still intact.
     * After that, the dictionary is empty, unwatched and must not be
     * modified. Subsequent calls have no effect.
     */
    // Compare CPython dict_dealloc in dictobject.c
    public void dealloc() {
        if (deallocated) { return; }
        notifyWatchers(DictEvent.DEALLOCATED, null, null);
        deallocated = true;
        watcherBits = 0;
        map.clear();
    }

    /** @return whether {@link #dealloc()} has been called */
    public boolean isDeallocated() { return deallocated; }

    // plumbing -------------------------------------------------------

    private void notifyWatchers(DictEvent event, Object key,
            Object value) {
        if (watcherBits != 0) {
            interpreter.watchers().dict().notify(event, this, key, value);
        }
    }

    private void checkLive() {
        if (deallocated) { throw InterpreterError.deallocated("dict", id); }
    }

    private static Object checkKey(Object key) {
        return Objects.requireNonNull(key, "dict key");
    }

    private static Object checkValue(Object value) {
        return Objects.requireNonNull(value, "dict value");
    }

    /**
     * An instance of this class is returned by
     * {@link PyDict#entrySet()}, and provides the view of the entries
     * in the {@code PyDict} mentioned there.
     */
    private class EntrySetImpl
            extends AbstractSet<Entry<Object, Object>> {

        @Override
        public Iterator<Entry<Object, Object>> iterator() {
            return new EntrySetIteratorImpl();
        }

        @Override
        public int size() { return map.size(); }
    }

    /**
     * An instance of this class is returned by
     * {@link EntrySetImpl#iterator()}. It is backed by an iterator on
     * the underlying {@link #map}. Removal through the iterator, and
     * {@code setValue} on an entry it returns, are reported to watchers
     * as if made through the {@code PyDict}.
     */
    private class EntrySetIteratorImpl
            implements Iterator<Entry<Object, Object>> {

        /** Backing iterator on the "real" implementation. */
        private final Iterator<Entry<Object, Object>> mapIterator =
                map.entrySet().iterator();

        /** Key of the last entry returned by {@link #next()}. */
        private Object lastKey;

        @Override
        public boolean hasNext() { return mapIterator.hasNext(); }

        @Override
        public Entry<Object, Object> next() {
            Entry<Object, Object> e = mapIterator.next();
            lastKey = e.getKey();
            return new EntryImpl(e);
        }

        @Override
        public void remove() {
            checkLive();
            mapIterator.remove();
            notifyWatchers(DictEvent.DELETED, lastKey, null);
        }
    }

    /** An entry whose {@code setValue} writes through to the dict. */
    private class EntryImpl extends SimpleEntry<Object, Object> {
        private static final long serialVersionUID = 1L;

        EntryImpl(Entry<Object, Object> e) { super(e); }

        @Override
        public Object setValue(Object value) {
            Object previous = put(getKey(), value);
            super.setValue(value);
            return previous;
        }
    }
}
