// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import java.util.Properties;

/**
 * The number of watcher slots available to each kind of object. Every
 * capacity must lie between 1 and {@link WatcherRegistry#MAX_WATCHERS},
 * which is the width of the subscription mask carried by a watched
 * object.
 *
 * @param dict capacity of the {@code dict} watcher registry
 * @param type capacity of the {@code type} watcher registry
 * @param code capacity of the {@code code} watcher registry
 * @param function capacity of the {@code function} watcher registry
 */
public record WatcherLimits(int dict, int type, int code, int function) {

    /** Prefix of the property names read by {@link #fromProperties}. */
    public static final String PROPERTY_PREFIX = "vsjw.watchers.";

    /** Every kind has the full number of slots. */
    public static final WatcherLimits DEFAULT =
            new WatcherLimits(WatcherRegistry.MAX_WATCHERS,
                    WatcherRegistry.MAX_WATCHERS,
                    WatcherRegistry.MAX_WATCHERS,
                    WatcherRegistry.MAX_WATCHERS);

    /**
     * Validate the capacities.
     *
     * @throws IllegalArgumentException if a capacity is out of range
     */
    public WatcherLimits {
        check("dict", dict);
        check("type", type);
        check("code", code);
        check("function", function);
    }

    private static void check(String name, int capacity) {
        if (capacity < 1 || capacity > WatcherRegistry.MAX_WATCHERS) {
            throw new IllegalArgumentException(String.format(
                    "%s watcher capacity %d not in range 1..%d", name,
                    capacity, WatcherRegistry.MAX_WATCHERS));
        }
    }

    /**
     * Return the capacity configured for the given kind.
     *
     * @param kind of watcher
     * @return capacity of that registry
     */
    public int capacity(WatcherKind kind) {
        return switch (kind) {
            case DICT -> dict;
            case TYPE -> type;
            case CODE -> code;
            case FUNCTION -> function;
        };
    }

    /**
     * Read limits from properties named {@code vsjw.watchers.dict},
     * {@code vsjw.watchers.type}, {@code vsjw.watchers.code} and
     * {@code vsjw.watchers.function}. A property that is absent takes
     * the default value.
     *
     * @param props to consult
     * @return limits from the properties
     * @throws IllegalArgumentException if a value is not a number in
     *     range
     */
    public static WatcherLimits fromProperties(Properties props) {
        return new WatcherLimits(read(props, "dict"),
                read(props, "type"), read(props, "code"),
                read(props, "function"));
    }

    /**
     * Read limits from the Java system properties (see
     * {@link #fromProperties(Properties)}).
     *
     * @return limits from the system properties
     */
    public static WatcherLimits fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int read(Properties props, String name) {
        String key = PROPERTY_PREFIX + name;
        String value = props.getProperty(key);
        if (value == null) { return WatcherRegistry.MAX_WATCHERS; }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(String.format(
                    "%s must be an integer, not '%s'", key, value), nfe);
        }
    }
}
