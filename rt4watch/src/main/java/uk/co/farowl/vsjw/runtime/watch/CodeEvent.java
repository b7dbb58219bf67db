// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

/** Lifecycle events of a {@code code} object. */
// Compare CPython PyCodeEvent in code.h
public enum CodeEvent {
    /** The object is fully constructed. */
    CREATED("create"),
    /** The object is being torn down. */
    DESTROYED("destroy");

    /** Name used in reports of failed callbacks. */
    final String description;

    CodeEvent(String description) { this.description = description; }
}
