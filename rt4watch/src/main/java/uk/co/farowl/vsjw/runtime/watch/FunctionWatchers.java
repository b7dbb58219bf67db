// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyFunction;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The function watchers of an interpreter. Every registered watcher is
 * told of the creation, modification and destruction of every function
 * object.
 */
public final class FunctionWatchers
        extends KindWatchers<FunctionWatcher> {

    /**
     * Create an empty set of function watchers.
     *
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    public FunctionWatchers(int capacity, UnraisableHook unraisable) {
        super(WatcherKind.FUNCTION, capacity, unraisable);
    }

    /**
     * Call every registered watcher, in order of ID, about a function
     * that is still live.
     *
     * @param event what happened
     * @param function it happened to
     * @param newValue the value assigned, or {@code null}
     */
    public void notify(FunctionEvent event, PyFunction function,
            Object newValue) {
        dispatch(event, function, function.getId(), newValue);
    }

    /**
     * Call every registered watcher, in order of ID, about a function
     * that is being destroyed. Only its identity is passed on.
     *
     * @param functionId identity of the function destroyed
     */
    public void notifyDestroyed(long functionId) {
        dispatch(FunctionEvent.DESTROYED, null, functionId, null);
    }

    private void dispatch(FunctionEvent event, PyFunction function,
            long functionId, Object newValue) {
        WatcherRegistry.Snapshot<FunctionWatcher> t = registry.snapshot();
        int bits = t.active;
        for (int id = 0; bits != 0; id++, bits >>>= 1) {
            if ((bits & 1) == 0) { continue; }
            FunctionWatcher w = t.at(id);
            try {
                w.onEvent(event, function, functionId, newValue);
            } catch (Exception e) {
                Object culprit = function != null ? function : functionId;
                reportFailure(e, culprit,
                        "Exception ignored in %s watcher callback for"
                                + " function %#x",
                        event.description, functionId);
            }
        }
    }
}
