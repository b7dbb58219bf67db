// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

/** Changes to a {@code dict} reported to a {@link DictWatcher}. */
// Compare CPython PyDict_WatchEvent in dictobject.h
public enum DictEvent {
    /** A key not previously present was inserted. */
    NEW,
    /** The value at an existing key was replaced. */
    MODIFIED,
    /** A key (and its value) was removed. */
    DELETED,
    /** Every entry was removed at once. */
    CLEARED,
    /** The empty dictionary was filled by copying another. */
    CLONED,
    /** The dictionary is being torn down. */
    DEALLOCATED;
}
