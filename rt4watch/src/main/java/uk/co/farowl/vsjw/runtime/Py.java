// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.util.Map;
import java.util.StringJoiner;

/** Common run-time constants and helpers. */
public class Py {

    private Py() {} // enforce static access

    /** Python {@code None} object. */
    public static final PyNone None = PyNone.INSTANCE;

    /**
     * Return the unique numerical identity of a given Python object.
     * Crafted objects report a serial number issued when they were
     * created. Other Java objects fall back on the identity hash code,
     * which is not guaranteed unique.
     *
     * @param o the object
     * @return the Python {@code id(o)}
     */
    public static long id(Object o) {
        if (o instanceof CraftedPyObject c) { return c.getId(); }
        return System.identityHashCode(o);
    }

    /**
     * Translate a Java {@code null} (used internally for an absent
     * optional attribute) to Python {@code None}.
     *
     * @param o object or {@code null}
     * @return {@code o} or {@code None}
     */
    static Object noneIfNull(Object o) { return o == null ? None : o; }

    /**
     * A simplified {@code repr()}: strings are quoted, anything else
     * gives its {@code toString()}.
     *
     * @param o to represent
     * @return representation
     */
    static String repr(Object o) {
        if (o instanceof String s) { return "'" + s + "'"; }
        return String.valueOf(o);
    }

    /**
     * Represent a map in the manner of a Python {@code dict}.
     *
     * @param map to represent
     * @return representation
     */
    static String mapRepr(Map<?, ?> map) {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (Map.Entry<?, ?> e : map.entrySet()) {
            sj.add(repr(e.getKey()) + ": " + repr(e.getValue()));
        }
        return sj.toString();
    }

    /**
     * The Python type name of an object, for messages. Java types that
     * stand in for Python built-ins are named as Python would.
     *
     * @param o the object
     * @return name of its type
     */
    static String typeName(Object o) {
        if (o instanceof WithClass w) {
            return w.getType().getName();
        } else if (o instanceof String) {
            return "str";
        } else if (o instanceof Integer || o instanceof Long) {
            return "int";
        } else if (o instanceof Boolean) {
            return "bool";
        } else if (o instanceof Object[]) {
            return "tuple";
        } else if (o == null) {
            return "NULL";
        }
        return o.getClass().getSimpleName();
    }
}
