// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.PyDict;

/** Callback notified of changes to watched {@code dict} objects. */
@FunctionalInterface
public interface DictWatcher {

    /**
     * Called after a change to a watched {@code dict}. The dictionary
     * already reflects the change. The callback may inspect the
     * dictionary but should not modify it.
     *
     * @param event what happened
     * @param dict the dictionary concerned
     * @param key the key affected (for {@link DictEvent#NEW},
     *     {@link DictEvent#MODIFIED} and {@link DictEvent#DELETED}), the
     *     source dictionary (for {@link DictEvent#CLONED}) or
     *     {@code null}
     * @param newValue the value stored (for {@link DictEvent#NEW} and
     *     {@link DictEvent#MODIFIED}) or {@code null}
     * @throws Exception to be reported as unraisable
     */
    void onEvent(DictEvent event, PyDict dict, Object key,
            Object newValue) throws Exception;
}
