// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Interpreter;
import uk.co.farowl.vsjw.runtime.PyDict;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The dictionary watchers of an interpreter. A watcher is told of
 * changes only to the dictionaries it watches.
 */
public final class DictWatchers
        extends SubscribedWatchers<DictWatcher, PyDict> {

    /**
     * Create an empty set of dictionary watchers.
     *
     * @param owner interpreter whose dictionaries may be watched
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    public DictWatchers(Interpreter owner, int capacity,
            UnraisableHook unraisable) {
        super(owner, WatcherKind.DICT, PyDict.class, capacity,
                unraisable);
    }

    /**
     * Call every watcher subscribed to the dictionary, in order of ID.
     * The change must already be visible in {@code dict}.
     *
     * @param event what happened
     * @param dict the dictionary it happened to
     * @param key the key affected, or the source mapping of
     *     {@link DictEvent#CLONED}, or {@code null}
     * @param newValue the value stored, or {@code null}
     */
    public void notify(DictEvent event, PyDict dict, Object key,
            Object newValue) {
        int bits = dict.getWatcherBits();
        if (bits == 0) { return; }
        WatcherRegistry.Snapshot<DictWatcher> t = registry.snapshot();
        for (int id = 0; bits != 0; id++, bits >>>= 1) {
            if ((bits & 1) == 0) { continue; }
            DictWatcher w = t.at(id);
            if (w == null) { continue; }
            try {
                w.onEvent(event, dict, key, newValue);
            } catch (Exception e) {
                reportFailure(e, dict,
                        "Exception ignored in dict watcher #%d callback"
                                + " for %s event",
                        id, event);
            }
        }
    }
}
