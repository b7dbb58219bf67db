// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.RuntimeError;

/**
 * Every slot of a watcher registry is occupied. The caller may recover
 * by clearing a watcher it no longer needs.
 */
public class WatcherCapacityExceeded extends RuntimeError {
    private static final long serialVersionUID = 1L;

    /** The kind of watcher concerned. */
    private final WatcherKind kind;

    /**
     * Construct the error for the given kind.
     *
     * @param kind of watcher registry
     */
    public WatcherCapacityExceeded(WatcherKind kind) {
        super("no more %s watcher IDs available", kind.tag);
        this.kind = kind;
    }

    /** @return the kind of watcher registry concerned */
    public WatcherKind getKind() { return kind; }
}
