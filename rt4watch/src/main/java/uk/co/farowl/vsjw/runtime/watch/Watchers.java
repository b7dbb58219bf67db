// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Interpreter;
import uk.co.farowl.vsjw.runtime.UnraisableHook;

/**
 * The four sets of watchers belonging to one interpreter. Each kind has
 * its own registry, so that the same ID may designate different
 * watchers of different kinds.
 */
public final class Watchers {

    private final DictWatchers dict;
    private final TypeWatchers type;
    private final CodeWatchers code;
    private final FunctionWatchers function;

    /**
     * Create empty watcher sets with the given capacities.
     *
     * @param owner interpreter whose objects are watched
     * @param limits capacity of each registry
     * @param unraisable channel for reporting failed callbacks
     */
    public Watchers(Interpreter owner, WatcherLimits limits,
            UnraisableHook unraisable) {
        this.dict = new DictWatchers(owner, limits.dict(), unraisable);
        this.type = new TypeWatchers(owner, limits.type(), unraisable);
        this.code = new CodeWatchers(limits.code(), unraisable);
        this.function =
                new FunctionWatchers(limits.function(), unraisable);
    }

    /** @return the dictionary watchers */
    public DictWatchers dict() { return dict; }

    /** @return the type watchers */
    public TypeWatchers type() { return type; }

    /** @return the code object watchers */
    public CodeWatchers code() { return code; }

    /** @return the function watchers */
    public FunctionWatchers function() { return function; }
}
