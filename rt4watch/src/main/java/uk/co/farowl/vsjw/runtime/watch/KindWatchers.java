// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Unraisable;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The watchers of one kind of object: a {@link WatcherRegistry} and the
 * means to report callbacks that fail. Subclasses add the dispatch
 * methods the mutating code calls, with the argument list specific to
 * the kind.
 *
 * @param <W> the type of callback
 */
public abstract class KindWatchers<W> {

    /** The table of callbacks. */
    protected final WatcherRegistry<W> registry;

    /** Where failures of callbacks are reported. */
    private final UnraisableHook unraisable;

    /**
     * Create an empty set of watchers.
     *
     * @param kind of object watched
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    protected KindWatchers(WatcherKind kind, int capacity,
            UnraisableHook unraisable) {
        this.registry = new WatcherRegistry<>(kind, capacity);
        this.unraisable = unraisable;
    }

    /**
     * Register a watcher.
     *
     * @param watcher to register
     * @return the ID of the watcher
     * @throws WatcherCapacityExceeded if every slot is occupied
     */
    public int addWatcher(W watcher) throws WatcherCapacityExceeded {
        return registry.add(watcher);
    }

    /**
     * Clear a watcher, so that its slot may be re-used.
     *
     * @param id of the watcher to clear
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     */
    public void clearWatcher(int id)
            throws InvalidWatcherId, WatcherNotRegistered {
        registry.clear(id);
    }

    /** @return the registry of these watchers */
    public WatcherRegistry<W> getRegistry() { return registry; }

    /**
     * Report a callback that threw. The exception goes no further.
     *
     * @param e thrown by the callback
     * @param object in connection with which it was called
     * @param msg a Java format string describing the circumstances
     * @param args to insert in the format string
     */
    protected void reportFailure(Exception e, Object object, String msg,
            Object... args) {
        unraisable.handle(
                new Unraisable(e, String.format(msg, args), object));
    }
}
