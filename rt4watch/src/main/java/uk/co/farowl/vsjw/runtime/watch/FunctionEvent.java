// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

/** Lifecycle and modification events of a {@code function} object. */
// Compare CPython PyFunction_WatchEvent in funcobject.h
public enum FunctionEvent {
    /** The function is fully constructed. */
    CREATED("create"),
    /** The {@code __code__} attribute was assigned. */
    MODIFIED_CODE("modify code"),
    /** The {@code __defaults__} attribute was assigned. */
    MODIFIED_DEFAULTS("modify defaults"),
    /** The {@code __kwdefaults__} attribute was assigned. */
    MODIFIED_KWDEFAULTS("modify kwdefaults"),
    /** The function is being torn down. */
    DESTROYED("destroy");

    /** Name used in reports of failed callbacks. */
    final String description;

    FunctionEvent(String description) {
        this.description = description;
    }
}
