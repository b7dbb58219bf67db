// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Interpreter;
import uk.co.farowl.vsjw.runtime.PyType;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The type watchers of an interpreter. A watcher is told when a type it
 * watches is modified, or when a base of that type is modified. Events
 * are aggregated through the version tag of the type: see
 * {@link PyType#modified()}.
 * <p>
 * A type may be assigned at most {@link PyType#MAX_VERSIONS_PER_CLASS}
 * version tags. Once it has used them all, its tag stays invalid, and
 * its watchers hear of no further modifications to it, even if they
 * watch it again. Only a type modified that many times, with a look-up
 * between modifications, reaches this limit.
 */
public final class TypeWatchers
        extends SubscribedWatchers<TypeWatcher, PyType> {

    /**
     * Create an empty set of type watchers.
     *
     * @param owner interpreter whose types may be watched
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    public TypeWatchers(Interpreter owner, int capacity,
            UnraisableHook unraisable) {
        super(owner, WatcherKind.TYPE, PyType.class, capacity,
                unraisable);
    }

    /**
     * {@inheritDoc}
     * <p>
     * A type about to be watched is given a valid version tag, so that
     * its next modification is reported.
     */
    @Override
    protected void beforeWatch(PyType type) {
        type.assignVersionTag();
    }

    /**
     * Call every watcher subscribed to the type, in order of ID.
     *
     * @param type that has been modified
     */
    public void notifyModified(PyType type) {
        int bits = type.getWatcherBits();
        if (bits == 0) { return; }
        WatcherRegistry.Snapshot<TypeWatcher> t = registry.snapshot();
        for (int id = 0; bits != 0; id++, bits >>>= 1) {
            if ((bits & 1) == 0) { continue; }
            TypeWatcher w = t.at(id);
            if (w == null) { continue; }
            try {
                w.typeModified(type);
            } catch (Exception e) {
                reportFailure(e, type,
                        "Exception ignored in type watcher callback #%d"
                                + " for %s",
                        id, type);
            }
        }
    }
}
