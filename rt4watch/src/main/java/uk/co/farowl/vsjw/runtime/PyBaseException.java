// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/**
 * The Python {@code BaseException} exception, and the Java base of all
 * the Python exceptions this run-time raises. A Java {@code try-catch}
 * intended to catch any Python exception should catch
 * {@code PyBaseException}.
 */
public class PyBaseException extends RuntimeException
        implements WithClass {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code BaseException} exceptions. */
    public static final PyType TYPE = PyType.builtin("BaseException");

    /** Python type of the exception. */
    private final transient PyType type;

    /**
     * Constructor for sub-class use specifying {@link #type}.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected PyBaseException(PyType type, String msg, Object... args) {
        super(args.length == 0 ? msg : String.format(msg, args));
        this.type = type;
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PyBaseException(String msg, Object... args) {
        this(TYPE, msg, args);
    }

    @Override
    public PyType getType() { return type; }

    @Override
    public String toString() {
        String msg = getMessage();
        return msg.isEmpty() ? type.getName()
                : String.format("%s: %s", type.getName(), msg);
    }
}
