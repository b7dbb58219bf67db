// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjw.support.InterpreterError;

/**
 * A fixed-capacity table of watcher callbacks for one kind of object.
 * A watcher is identified by the index of the slot it occupies, and an
 * ID becomes free for re-use when the watcher in it is cleared.
 * <p>
 * Changes to the table ({@link #add(Object)} and {@link #clear(int)})
 * are serialised by synchronising on the registry. Each change
 * publishes a new immutable {@link Snapshot} through a
 * {@code volatile} field, so that dispatch may read the table without
 * taking a lock, and in particular without holding one while it calls
 * a watcher.
 *
 * @param <W> the type of callback stored
 */
public final class WatcherRegistry<W> {

    /** Logger for registry changes. */
    static final Logger logger =
            LoggerFactory.getLogger(WatcherRegistry.class);

    /**
     * The largest capacity of any registry. This is the number of bits
     * in the subscription mask of a watched object.
     */
    public static final int MAX_WATCHERS = 8;

    /** The kind of object watched. */
    private final WatcherKind kind;

    /** The current content of the table. */
    private volatile Snapshot<W> table;

    /**
     * Create an empty registry.
     *
     * @param kind of object watched (used in messages)
     * @param capacity number of slots (at most {@link #MAX_WATCHERS})
     */
    public WatcherRegistry(WatcherKind kind, int capacity) {
        if (capacity < 1 || capacity > MAX_WATCHERS) {
            throw new InterpreterError(
                    "%s watcher capacity %d exceeds mask width %d",
                    kind.tag, capacity, MAX_WATCHERS);
        }
        this.kind = kind;
        this.table = new Snapshot<>(new Object[capacity], 0);
    }

    /** @return the kind of object watched */
    public WatcherKind kind() { return kind; }

    /** @return the number of slots in the registry */
    public int capacity() { return table.slots.length; }

    /**
     * Place a watcher in the lowest-numbered empty slot and return the
     * index of that slot as its ID.
     *
     * @param watcher to register (not {@code null})
     * @return the ID of the new watcher
     * @throws WatcherCapacityExceeded if every slot is occupied
     */
    public synchronized int add(W watcher)
            throws WatcherCapacityExceeded {
        Objects.requireNonNull(watcher, "watcher");
        Object[] slots = table.slots;
        for (int id = 0; id < slots.length; id++) {
            if (slots[id] == null) {
                publish(id, watcher);
                logger.atDebug().setMessage("{} watcher {} added")
                        .addArgument(kind.tag).addArgument(id).log();
                return id;
            }
        }
        throw new WatcherCapacityExceeded(kind);
    }

    /**
     * Empty the slot with the given ID. Objects still subscribed to the
     * slot through their masks simply stop receiving events.
     *
     * @param id of the watcher to clear
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     */
    public synchronized void clear(int id)
            throws InvalidWatcherId, WatcherNotRegistered {
        check(table, id);
        publish(id, null);
        logger.atDebug().setMessage("{} watcher {} cleared")
                .addArgument(kind.tag).addArgument(id).log();
    }

    /**
     * Return the watcher with the given ID.
     *
     * @param id of the watcher
     * @return the watcher
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     */
    public W get(int id) throws InvalidWatcherId, WatcherNotRegistered {
        Snapshot<W> t = table;
        check(t, id);
        return t.at(id);
    }

    /**
     * Check that the ID designates an occupied slot, throwing if it
     * does not.
     *
     * @param id of a watcher
     * @throws InvalidWatcherId if the ID is out of range
     * @throws WatcherNotRegistered if the slot is empty
     */
    public void validate(int id)
            throws InvalidWatcherId, WatcherNotRegistered {
        check(table, id);
    }

    /**
     * Return a mask with bit {@code i} set where slot {@code i} is
     * occupied.
     *
     * @return bits of the occupied slots
     */
    public int activeBits() { return table.active; }

    /**
     * Return the current content of the table for dispatch. The
     * snapshot does not change if watchers are added or cleared during
     * the dispatch.
     *
     * @return the current table
     */
    Snapshot<W> snapshot() { return table; }

    private void check(Snapshot<W> t, int id) {
        if (id < 0 || id >= t.slots.length) {
            throw new InvalidWatcherId(kind, id);
        } else if (t.slots[id] == null) {
            throw new WatcherNotRegistered(kind, id);
        }
    }

    /** Replace one slot and publish a new table (holding the lock). */
    private void publish(int id, W watcher) {
        Object[] slots = Arrays.copyOf(table.slots, table.slots.length);
        slots[id] = watcher;
        int active = table.active;
        active = watcher == null ? active & ~(1 << id)
                : active | (1 << id);
        table = new Snapshot<>(slots, active);
    }

    /**
     * An immutable copy of the registry table.
     *
     * @param <W> the type of callback stored
     */
    static final class Snapshot<W> {

        /** The slots. Not modified after construction. */
        private final Object[] slots;

        /** Bit {@code i} set where {@code slots[i]} is occupied. */
        final int active;

        private Snapshot(Object[] slots, int active) {
            this.slots = slots;
            this.active = active;
        }

        /**
         * Return the watcher in a slot, or {@code null} if the slot is
         * empty or beyond the capacity of the table.
         *
         * @param id of the slot
         * @return the watcher or {@code null}
         */
        @SuppressWarnings("unchecked")
        W at(int id) {
            return id < slots.length ? (W)slots[id] : null;
        }
    }
}
