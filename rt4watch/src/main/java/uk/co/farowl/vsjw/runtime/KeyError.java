// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/** The Python {@code KeyError} exception. */
public class KeyError extends LookupError {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code KeyError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.builtin("KeyError", LookupError.TYPE);

    /** The key that was not found (or otherwise at fault). */
    private final transient Object key;

    /**
     * Constructor specifying the key and a message.
     *
     * @param key at fault
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public KeyError(Object key, String msg, Object... args) {
        super(TYPE, msg, args);
        this.key = key;
    }

    /**
     * Constructor specifying the key only, which (as in Python) also
     * forms the message.
     *
     * @param key that was not found
     */
    public KeyError(Object key) {
        this(key, "%s", Py.repr(key));
    }

    /**
     * Return the key that was not found.
     *
     * @return the key at fault
     */
    public Object getKey() { return key; }
}
