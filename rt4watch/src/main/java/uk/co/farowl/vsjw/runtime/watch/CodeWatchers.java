// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyCode;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The code object watchers of an interpreter. Every registered watcher
 * is told of the creation and destruction of every code object.
 */
public final class CodeWatchers extends KindWatchers<CodeWatcher> {

    /**
     * Create an empty set of code watchers.
     *
     * @param capacity of the registry
     * @param unraisable channel for reporting failed callbacks
     */
    public CodeWatchers(int capacity, UnraisableHook unraisable) {
        super(WatcherKind.CODE, capacity, unraisable);
    }

    /**
     * Call every registered watcher, in order of ID.
     *
     * @param event what happened
     * @param code the code object it happened to
     */
    public void notify(CodeEvent event, PyCode code) {
        WatcherRegistry.Snapshot<CodeWatcher> t = registry.snapshot();
        int bits = t.active;
        for (int id = 0; bits != 0; id++, bits >>>= 1) {
            if ((bits & 1) == 0) { continue; }
            CodeWatcher w = t.at(id);
            try {
                w.onEvent(event, code);
            } catch (Exception e) {
                reportFailure(e, code,
                        "Exception ignored in %s watcher callback for %s",
                        event.description, code);
            }
        }
    }
}
