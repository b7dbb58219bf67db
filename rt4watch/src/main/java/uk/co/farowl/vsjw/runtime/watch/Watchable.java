// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import uk.co.farowl.vsjw.runtime.Interpreter;

/**
 * An object that carries its own subscription mask: bit {@code i} is
 * set when watcher slot {@code i} of the registry for its kind is
 * interested in the object. The registry is that of the interpreter
 * owning the object, since that is where events are dispatched. The mask belongs to the object. The
 * registry never enumerates watched objects.
 * <p>
 * These methods are public so that the watcher machinery may reach
 * them across packages. They are not intended for client use: a client
 * subscribes through {@link SubscribedWatchers#watch(int, Object)},
 * which validates the slot.
 */
public interface Watchable {

    /**
     * Return the subscription mask.
     *
     * @return bits identifying interested watcher slots
     */
    int getWatcherBits();

    /**
     * Replace the subscription mask.
     *
     * @param bits identifying interested watcher slots
     */
    void setWatcherBits(int bits);

    /**
     * Return the interpreter whose watchers hear of changes to this
     * object.
     *
     * @return the owning interpreter ({@code null} if there is none)
     */
    Interpreter getInterpreter();
}
