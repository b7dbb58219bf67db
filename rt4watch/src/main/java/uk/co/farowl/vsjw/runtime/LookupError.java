// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/** The Python {@code LookupError} exception. */
public class LookupError extends PyException {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code LookupError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.builtin("LookupError", PyException.TYPE);

    /**
     * Constructor for sub-class use specifying {@link #getType()}.
     *
     * @param type of object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected LookupError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public LookupError(String msg, Object... args) {
        this(TYPE, msg, args);
    }
}
