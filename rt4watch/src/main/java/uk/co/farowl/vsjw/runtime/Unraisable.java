// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/**
 * A report of an exception that could not be raised in the usual way,
 * because there was no caller able to receive it. A watcher callback
 * that throws is the typical source: its exception must not reach the
 * code that mutated the watched object.
 *
 * @param exception that could not be raised
 * @param message describing the circumstances
 * @param object in connection with which it occurred (may be an
 *     identity, where the object itself no longer exists)
 */
// Compare CPython UnraisableHookArgs in sysmodule.c
public record Unraisable(Throwable exception, String message,
        Object object) {

    @Override
    public String toString() {
        return String.format("%s: %s", message, exception);
    }
}
