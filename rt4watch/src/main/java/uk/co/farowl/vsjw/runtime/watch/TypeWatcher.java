// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyType;

/**
 * Callback notified when a watched {@code type} is modified. Several
 * modifications made between look-ups on the type are reported once.
 */
@FunctionalInterface
public interface TypeWatcher {

    /**
     * Called when a watched type (or a type along its MRO) has been
     * modified for the first time since its version tag was last
     * valid.
     *
     * @param type the watched type
     * @throws Exception to be reported as unraisable
     */
    void typeModified(PyType type) throws Exception;
}
