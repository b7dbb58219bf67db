// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.ValueError;

/**
 * An object offered to {@code watch} or {@code unwatch} is not of the
 * kind the registry watches.
 */
public class WrongKindToWatch extends ValueError {
    private static final long serialVersionUID = 1L;

    /** The kind of watcher concerned. */
    private final WatcherKind kind;

    /**
     * Construct the error for the given kind.
     *
     * @param kind of watcher registry
     */
    public WrongKindToWatch(WatcherKind kind) {
        super("Cannot watch non-%s", kind.objectName);
        this.kind = kind;
    }

    /** @return the kind of object that was expected */
    public WatcherKind getKind() { return kind; }
}
