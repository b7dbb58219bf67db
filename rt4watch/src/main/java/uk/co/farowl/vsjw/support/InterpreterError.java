// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the run-time system finds itself in a
 * state it should never reach. A Python exception (one that Python code
 * could catch) is not then appropriate. Typical causes are an operation
 * on an object the run-time has already torn down, or a watcher table
 * that has been configured inconsistently with the width of the
 * subscription masks.
 */
public class InterpreterError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for interpreter errors. A caller may convert these into
     * something else on the way up, so we note them as they are raised.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InterpreterError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().setMessage("interpreter error: {}")
                .addArgument(this::getMessage).log();
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the interpreter error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().setMessage("interpreter error: {} (cause {})")
                .addArgument(this::getMessage).addArgument(cause)
                .log();
    }

    /**
     * Create an error reporting use of an object after the run-time has
     * torn it down.
     *
     * @param kind of object (for the message)
     * @param id identity of the object
     * @return an error to throw
     */
    public static InterpreterError deallocated(String kind, long id) {
        return new InterpreterError("%s object %#x used after dealloc",
                kind, id);
    }
}
