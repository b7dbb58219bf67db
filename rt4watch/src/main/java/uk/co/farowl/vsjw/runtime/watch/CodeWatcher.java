// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyCode;

/** Callback notified of the creation and destruction of code objects. */
@FunctionalInterface
public interface CodeWatcher {

    /**
     * Called when any code object of the interpreter is created or
     * destroyed. After {@link CodeEvent#DESTROYED} the code object must
     * not be retained.
     *
     * @param event what happened
     * @param code the code object concerned
     * @throws Exception to be reported as unraisable
     */
    void onEvent(CodeEvent event, PyCode code) throws Exception;
}
