// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyFunction;

/**
 * Callback notified of the creation, modification and destruction of
 * function objects.
 */
@FunctionalInterface
public interface FunctionWatcher {

    /**
     * Called when any function of the interpreter is created, has its
     * code or defaults assigned, or is destroyed.
     *
     * @param event what happened
     * @param function the function concerned, or {@code null} for
     *     {@link FunctionEvent#DESTROYED}
     * @param functionId identity of the function (see
     *     {@link uk.co.farowl.vsjw.runtime.Py#id(Object)}), the only
     *     information about it after it is destroyed
     * @param newValue the value assigned for a modification, otherwise
     *     {@code null} (also {@code null} when an attribute is assigned
     *     {@code None})
     * @throws Exception to be reported as unraisable
     */
    void onEvent(FunctionEvent event, PyFunction function,
            long functionId, Object newValue) throws Exception;
}
