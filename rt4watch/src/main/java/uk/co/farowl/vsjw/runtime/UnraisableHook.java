// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/**
 * The channel through which an {@link Interpreter} reports exceptions
 * that cannot be raised to a caller. The interpreter installs a hook
 * that logs the report. A client (or a test) may replace it to capture
 * the reports.
 */
// Compare CPython sys.unraisablehook
@FunctionalInterface
public interface UnraisableHook {

    /**
     * Receive a report of an exception that could not be raised.
     *
     * @param unraisable the report
     */
    void handle(Unraisable unraisable);
}
