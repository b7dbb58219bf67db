// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.ValueError;

/**
 * An object offered to {@code watch} or {@code unwatch} belongs to a
 * different interpreter from the watchers (or to no interpreter, as a
 * built-in type does). Its events would never reach the watcher named.
 */
public class ForeignObjectToWatch extends ValueError {
    private static final long serialVersionUID = 1L;

    /** The kind of watcher concerned. */
    private final WatcherKind kind;

    /** The ID of the watcher. */
    private final int id;

    /**
     * Construct the error for the given kind and ID.
     *
     * @param kind of watcher registry
     * @param id of the watcher
     */
    public ForeignObjectToWatch(WatcherKind kind, int id) {
        super("Cannot watch %s of another interpreter with %s watcher"
                + " ID %d", kind.objectName, kind.tag, id);
        this.kind = kind;
        this.id = id;
    }

    /** @return the kind of watcher registry concerned */
    public WatcherKind getKind() { return kind; }

    /** @return the ID of the watcher */
    public int getId() { return id; }
}
