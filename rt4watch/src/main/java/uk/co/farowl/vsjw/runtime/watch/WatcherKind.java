// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

/**
 * The kinds of object that may be watched. Each has its own watcher
 * registry, independent of the others.
 */
public enum WatcherKind {
    /** Watchers of {@code dict} objects (subscribed per object). */
    DICT("dict", "dictionary"),
    /** Watchers of {@code type} objects (subscribed per object). */
    TYPE("type", "type"),
    /** Watchers of all {@code code} objects. */
    CODE("code", "code object"),
    /** Watchers of all {@code function} objects. */
    FUNCTION("func", "function");

    /** Short name used in messages about watcher IDs. */
    final String tag;

    /** Name of the watched kind of object, used in messages. */
    final String objectName;

    WatcherKind(String tag, String objectName) {
        this.tag = tag;
        this.objectName = objectName;
    }

    /**
     * The short name used in messages about watcher IDs (for example
     * "dict" in "Invalid dict watcher ID 9").
     *
     * @return short name of the kind
     */
    public String tag() { return tag; }
}
