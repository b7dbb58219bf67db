// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjw.runtime.watch.WatcherLimits;
import uk.co.farowl.vsjw.runtime.watch.Watchers;

/**
 * The context within which objects are created and watched. An
 * interpreter owns one set of {@link Watchers}: the dictionaries, types,
 * code objects and functions it creates report their events to those
 * watchers only. It also owns the channel through which failures that
 * cannot be raised to any caller (such as an exception in a watcher)
 * are reported: see {@link #writeUnraisable(Unraisable)}.
 */
public class Interpreter {

    /** Logger for the interpreter, including unraisable failures. */
    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    /** The hook used when the client has not set one. */
    private static final UnraisableHook DEFAULT_HOOK =
            u -> logger.atWarn().setMessage("{}")
                    .addArgument(u::message)
                    .setCause(u.exception()).log();

    /** The capacity of each kind of watcher registry. */
    private final WatcherLimits limits;

    /** Watchers of objects created by this interpreter. */
    private final Watchers watchers;

    /** The current destination of unraisable failures. */
    private volatile UnraisableHook unraisableHook = DEFAULT_HOOK;

    /**
     * Create an interpreter with limits read from the system properties
     * {@code vsjw.watchers.*} (see
     * {@link WatcherLimits#fromSystemProperties()}). A kind with no
     * property set has the full number of slots.
     *
     * @throws IllegalArgumentException if a property is not a number in
     *     range
     */
    public Interpreter() { this(WatcherLimits.fromSystemProperties()); }

    /**
     * Create an interpreter with the given limits on the number of
     * watchers of each kind.
     *
     * @param limits on the number of watchers
     */
    public Interpreter(WatcherLimits limits) {
        this.limits = limits;
        this.watchers = new Watchers(this, limits, this::writeUnraisable);
        logger.atDebug().setMessage("interpreter created with {}")
                .addArgument(limits).log();
    }

    /** @return the watchers of objects created by this interpreter */
    public Watchers watchers() { return watchers; }

    /** @return the limits on the number of watchers */
    public WatcherLimits getLimits() { return limits; }

    /**
     * Replace the destination of unraisable failures.
     *
     * @param hook to install, or {@code null} to restore the default
     * @return the hook previously installed
     */
    public UnraisableHook setUnraisableHook(UnraisableHook hook) {
        UnraisableHook previous = unraisableHook;
        unraisableHook = hook == null ? DEFAULT_HOOK : hook;
        return previous;
    }

    /**
     * Report a failure that cannot be raised to any caller. The failure
     * goes to the installed {@link UnraisableHook}. If the hook itself
     * throws, that is logged and otherwise ignored.
     *
     * @param unraisable description of the failure
     */
    // Compare CPython PyErr_WriteUnraisable in errors.c
    public void writeUnraisable(Unraisable unraisable) {
        try {
            unraisableHook.handle(unraisable);
        } catch (RuntimeException e) {
            logger.atError().setMessage("unraisable hook failed on: {}")
                    .addArgument(unraisable).setCause(e).log();
        }
    }

    /**
     * Report a failure that cannot be raised to any caller.
     *
     * @param exception that was caught
     * @param message describing the circumstances
     * @param object in connection with which it happened
     */
    public void writeUnraisable(Throwable exception, String message,
            Object object) {
        writeUnraisable(new Unraisable(exception, message, object));
    }

    /**
     * Create an empty dictionary.
     *
     * @return new {@code dict}
     */
    public PyDict newDict() { return new PyDict(this); }

    /**
     * Create a dictionary holding the given entries. No event is
     * reported for them, since the dictionary cannot yet be watched.
     *
     * @param entries initial content
     * @return new {@code dict}
     */
    public PyDict newDict(Map<?, ?> entries) {
        return new PyDict(this, entries);
    }

    /**
     * Create a (mutable) type, as a class definition would.
     *
     * @param name of the type
     * @param bases of the type (if none, {@code object})
     * @return new {@code type}
     * @throws TypeError if the bases repeat or have no consistent MRO
     */
    public PyType newType(String name, PyType... bases) throws TypeError {
        return PyType.heap(this, name, bases);
    }

    /**
     * Create a code object, reporting its creation to code watchers.
     *
     * @param filename from which the code was compiled
     * @param name of the function or other unit of code
     * @param firstLineNo first source line of the code
     * @return new {@code code}
     */
    public PyCode newCode(String filename, String name, int firstLineNo) {
        return PyCode.newEmpty(this, filename, name, firstLineNo);
    }

    /**
     * Create a function object, reporting its creation to function
     * watchers.
     *
     * @param code of the function
     * @param globals of the function
     * @return new {@code function}
     */
    public PyFunction newFunction(PyCode code, PyDict globals) {
        return PyFunction.create(this, code, globals);
    }
}
