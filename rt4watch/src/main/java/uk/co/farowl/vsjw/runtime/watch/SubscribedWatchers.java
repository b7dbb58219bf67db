// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Interpreter;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The watchers of a kind of object that records, in a mask of its own,
 * which watcher slots are interested in it. A watcher receives events
 * only for the objects it has been asked to {@link #watch(int, Object)}.
 * Only objects belonging to the same interpreter as these watchers may
 * be watched, since an object dispatches its events to the watchers of
 * its own interpreter.
 *
 * @param <W> the type of callback
 * @param <T> the type of object watched
 */
public abstract class SubscribedWatchers<W, T extends Watchable>
        extends KindWatchers<W> {

    /** The Java class of the watched objects. */
    private final Class<T> watchedClass;

    /** The interpreter whose objects these watchers may watch. */
    private final Interpreter owner;

    /**
     * Create an empty set of watchers.
     *
     * @param owner interpreter whose objects may be watched
     * @param kind of object watched
     * @param watchedClass Java class of the watched objects
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    protected SubscribedWatchers(Interpreter owner, WatcherKind kind,
            Class<T> watchedClass, int capacity,
            UnraisableHook unraisable) {
        super(kind, capacity, unraisable);
        this.owner = owner;
        this.watchedClass = watchedClass;
    }

    /**
     * Subscribe the watcher with the given ID to events on an object.
     * Watching an object already watched by that ID has no effect.
     *
     * @param id of the watcher
     * @param obj to watch
     * @throws WrongKindToWatch if {@code obj} is not of the watched
     *     kind
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     * @throws ForeignObjectToWatch if {@code obj} belongs to another
     *     interpreter
     */
    public void watch(int id, Object obj) throws WrongKindToWatch,
            InvalidWatcherId, WatcherNotRegistered, ForeignObjectToWatch {
        T target = checkKind(obj);
        registry.validate(id);
        checkOwner(id, target);
        beforeWatch(target);
        target.setWatcherBits(target.getWatcherBits() | (1 << id));
    }

    /**
     * Unsubscribe the watcher with the given ID from events on an
     * object. The watcher itself remains registered. Unwatching an
     * object not watched by that ID has no effect.
     *
     * @param id of the watcher
     * @param obj to stop watching
     * @throws WrongKindToWatch if {@code obj} is not of the watched
     *     kind
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     * @throws ForeignObjectToWatch if {@code obj} belongs to another
     *     interpreter
     */
    public void unwatch(int id, Object obj) throws WrongKindToWatch,
            InvalidWatcherId, WatcherNotRegistered, ForeignObjectToWatch {
        T target = checkKind(obj);
        registry.validate(id);
        checkOwner(id, target);
        target.setWatcherBits(target.getWatcherBits() & ~(1 << id));
    }

    /**
     * Action to take on an object before it becomes watched. The default
     * is to do nothing.
     *
     * @param target about to be watched
     */
    protected void beforeWatch(T target) {}

    private T checkKind(Object obj) throws WrongKindToWatch {
        if (watchedClass.isInstance(obj)) {
            return watchedClass.cast(obj);
        }
        throw new WrongKindToWatch(registry.kind());
    }

    // Built-in objects belong to no interpreter and are refused too.
    private void checkOwner(int id, T target) throws ForeignObjectToWatch {
        if (target.getInterpreter() != owner) {
            throw new ForeignObjectToWatch(registry.kind(), id);
        }
    }
}
