// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.ValueError;

/**
 * A watcher ID is in range but no watcher occupies that slot, for
 * example after the watcher has been cleared twice. This is a fault in
 * the caller.
 */
public class WatcherNotRegistered extends ValueError {
    private static final long serialVersionUID = 1L;

    /** The kind of watcher concerned. */
    private final WatcherKind kind;

    /** The offending ID. */
    private final int id;

    /**
     * Construct the error for the given kind and ID.
     *
     * @param kind of watcher registry
     * @param id the offending ID
     */
    public WatcherNotRegistered(WatcherKind kind, int id) {
        super("No %s watcher set for ID %d", kind.tag, id);
        this.kind = kind;
        this.id = id;
    }

    /** @return the kind of watcher registry concerned */
    public WatcherKind getKind() { return kind; }

    /** @return the offending ID */
    public int getId() { return id; }
}
