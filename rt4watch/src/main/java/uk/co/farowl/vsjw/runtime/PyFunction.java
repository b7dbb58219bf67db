// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.util.Objects;

import uk.co.farowl.vsjw.runtime.kernel.ObjectIdentity;
import uk.co.farowl.vsjw.runtime.watch.FunctionEvent;
import uk.co.farowl.vsjw.support.InterpreterError;

/**
 * Python {@code function} object as created by a function definition.
 * <p>
 * Creation (through {@link #create(Interpreter, PyCode, PyDict)}),
 * assignment to {@code __code__}, {@code __defaults__} or
 * {@code __kwdefaults__}, and destruction (through {@link #dealloc()})
 * are reported to the function watchers of the interpreter. Assignment
 * may be made through {@link #setAttribute(String, Object)}, as Python
 * code would, or through the setter methods, as the run-time would: in
 * either case it passes through a single point that reports it.
 * <p>
 * A {@code tuple} of positional defaults is represented by an
 * {@code Object[]}, which is not copied and should not be modified after
 * it has been assigned.
 */
public final class PyFunction implements CraftedPyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.builtin("function");

    /** The interpreter whose watchers hear of this object. */
    private final Interpreter interpreter;

    /** Identity of this object. */
    private final long id = ObjectIdentity.next();

    /** The {@code __code__} attribute. Not {@code null}. */
    private PyCode code;

    /** The read-only {@code __globals__} attribute. Not {@code null}. */
    private final PyDict globals;

    /** The (positional) {@code __defaults__} or {@code null}. */
    private Object[] defaults;

    /** The {@code __kwdefaults__} or {@code null}. */
    private PyDict kwdefaults;

    /** The function name ({@code __name__} attribute). */
    private String name;

    /** The function qualified name ({@code __qualname__} attribute). */
    private String qualname;

    /** The {@code __doc__} attribute, can be set to anything. */
    private Object doc = Py.None;

    /** The {@code __module__} attribute, can be set to anything. */
    private Object module;

    /** The {@code __dict__} attribute, created when first needed. */
    private PyDict dict;

    /** Set when the run-time has torn the object down. */
    private boolean deallocated;

    private PyFunction(Interpreter interpreter, PyCode code,
            PyDict globals, Object[] defaults, PyDict kwdefaults) {
        this.interpreter = Objects.requireNonNull(interpreter);
        this.code = Objects.requireNonNull(code, "code");
        this.globals = Objects.requireNonNull(globals, "globals");
        this.name = code.getName();
        this.qualname = code.getQualname();
        this.module = Py.noneIfNull(globals.get("__name__"));
        this.defaults = defaults;
        this.kwdefaults = kwdefaults;
    }

    /**
     * Create a function and report it to the function watchers.
     *
     * @param interpreter owning the function
     * @param code to execute
     * @param globals name space of the function
     * @return the new function
     */
    // Compare CPython PyFunction_NewWithQualName in funcobject.c
    public static PyFunction create(Interpreter interpreter, PyCode code,
            PyDict globals) {
        return create(interpreter, code, globals, null, null);
    }

    /**
     * Create a function with default argument values, and report it to
     * the function watchers.
     *
     * @param interpreter owning the function
     * @param code to execute
     * @param globals name space of the function
     * @param defaults positional defaults or {@code null}
     * @param kwdefaults keyword defaults or {@code null}
     * @return the new function
     */
    public static PyFunction create(Interpreter interpreter, PyCode code,
            PyDict globals, Object[] defaults, PyDict kwdefaults) {
        PyFunction f = new PyFunction(interpreter, code, globals,
                defaults, kwdefaults);
        f.handleEvent(FunctionEvent.CREATED, null);
        return f;
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public long getId() { return id; }

    /** @return the interpreter owning this function */
    public Interpreter getInterpreter() { return interpreter; }

    // attributes ----------------------------------------------------

    /** @return the {@code __code__} object of this function */
    public PyCode getCode() { return code; }

    /**
     * Set the {@code __code__} object of this function.
     *
     * @param code new code object to assign
     */
    // Compare CPython func_set_code in funcobject.c
    public void setCode(PyCode code) {
        checkLive();
        this.code = Objects.requireNonNull(code, "code");
        handleEvent(FunctionEvent.MODIFIED_CODE, code);
    }

    /** @return the positional defaults or {@code null} */
    public Object[] getDefaults() { return defaults; }

    /**
     * Set the positional {@code __defaults__}.
     *
     * @param defaults to set, or {@code null} to remove them
     */
    // Compare CPython PyFunction_SetDefaults in funcobject.c
    public void setDefaults(Object[] defaults) {
        checkLive();
        this.defaults = defaults;
        handleEvent(FunctionEvent.MODIFIED_DEFAULTS, defaults);
    }

    /** @return the keyword defaults or {@code null} */
    public PyDict getKwDefaults() { return kwdefaults; }

    /**
     * Set the {@code __kwdefaults__}.
     *
     * @param kwdefaults to set, or {@code null} to remove them
     */
    // Compare CPython PyFunction_SetKwDefaults in funcobject.c
    public void setKwDefaults(PyDict kwdefaults) {
        checkLive();
        this.kwdefaults = kwdefaults;
        handleEvent(FunctionEvent.MODIFIED_KWDEFAULTS, kwdefaults);
    }

    /** @return the {@code __name__} attribute */
    public String getName() { return name; }

    /** @return the {@code __qualname__} attribute */
    public String getQualname() { return qualname; }

    /** @return the {@code __globals__} attribute */
    public PyDict getGlobals() { return globals; }

    /** @return the {@code __dict__} attribute (created if necessary) */
    public PyDict getDict() {
        if (dict == null) { dict = interpreter.newDict(); }
        return dict;
    }

    /**
     * Get an attribute by name, as Python {@code f.name} would.
     *
     * @param name of the attribute
     * @return its value ({@code None} where Java holds {@code null})
     * @throws AttributeError if there is no such attribute
     */
    public Object getAttribute(String name) throws AttributeError {
        return switch (name) {
            case "__code__" -> code;
            case "__defaults__" -> Py.noneIfNull(defaults);
            case "__kwdefaults__" -> Py.noneIfNull(kwdefaults);
            case "__name__" -> this.name;
            case "__qualname__" -> qualname;
            case "__doc__" -> doc;
            case "__module__" -> module;
            case "__globals__" -> globals;
            case "__dict__" -> getDict();
            default -> {
                Object value = dict == null ? null : dict.get(name);
                if (value == null) { throw noAttribute(name); }
                yield value;
            }
        };
    }

    /**
     * Set an attribute by name, as Python {@code f.name = value} would.
     * Assignments to {@code __code__}, {@code __defaults__} and
     * {@code __kwdefaults__} are checked for type, then handled exactly
     * as the corresponding setter method would handle them.
     *
     * @param name of the attribute
     * @param value to assign ({@code None} where that is allowed)
     * @throws TypeError if the value is of the wrong type
     * @throws AttributeError if the attribute is read-only
     */
    // Compare CPython func_getsetlist and func_memberlist in funcobject.c
    public void setAttribute(String name, Object value)
            throws TypeError, AttributeError {
        Objects.requireNonNull(value, "value");
        switch (name) {
            case "__code__" -> {
                if (!(value instanceof PyCode c)) {
                    throw mustBeSetTo("__code__", "a code object", value);
                }
                setCode(c);
            }
            case "__defaults__" -> {
                if (value == Py.None) {
                    setDefaults(null);
                } else if (value instanceof Object[] d) {
                    setDefaults(d);
                } else {
                    throw mustBeSetTo("__defaults__", "a tuple", value);
                }
            }
            case "__kwdefaults__" -> {
                if (value == Py.None) {
                    setKwDefaults(null);
                } else if (value instanceof PyDict d) {
                    setKwDefaults(d);
                } else {
                    throw mustBeSetTo("__kwdefaults__", "a dict", value);
                }
            }
            case "__name__" -> this.name = asString("__name__", value);
            case "__qualname__" ->
                this.qualname = asString("__qualname__", value);
            case "__doc__" -> this.doc = value;
            case "__module__" -> this.module = value;
            case "__dict__" -> {
                if (!(value instanceof PyDict d)) {
                    throw new TypeError(
                            "__dict__ must be set to a dictionary,"
                                    + " not a '%s'",
                            Py.typeName(value));
                }
                this.dict = d;
            }
            case "__globals__" ->
                throw new AttributeError("readonly attribute");
            default -> getDict().put(name, value);
        }
    }

    /**
     * Delete an attribute by name, as Python {@code del f.name} would.
     * Deleting {@code __defaults__} or {@code __kwdefaults__} is
     * reported as assigning {@code null} to it.
     *
     * @param name of the attribute
     * @throws TypeError if the attribute may not be deleted
     * @throws AttributeError if there is no such attribute
     */
    public void delAttribute(String name)
            throws TypeError, AttributeError {
        switch (name) {
            case "__defaults__" -> setDefaults(null);
            case "__kwdefaults__" -> setKwDefaults(null);
            case "__doc__" -> this.doc = Py.None;
            case "__code__", "__name__", "__qualname__", "__dict__" ->
                throw new TypeError("cannot delete %s attribute", name);
            case "__globals__", "__module__" ->
                throw new AttributeError("readonly attribute");
            default -> {
                if (dict == null || dict.remove(name) == null) {
                    throw noAttribute(name);
                }
            }
        }
    }

    // lifecycle -----------------------------------------------------

    /**
     * Tear down the function, reporting its destruction to the
     * function watchers. Only the identity of the function is passed
     * to them. Subsequent calls have no effect.
     */
    // Compare CPython func_dealloc in funcobject.c
    public void dealloc() {
        if (deallocated) { return; }
        deallocated = true;
        interpreter.watchers().function().notifyDestroyed(id);
    }

    /** @return whether {@link #dealloc()} has been called */
    public boolean isDeallocated() { return deallocated; }

    // plumbing ------------------------------------------------------

    /**
     * The single point through which events on a live function reach
     * the watchers.
     *
     * @param event what happened
     * @param newValue the value assigned, or {@code null}
     */
    // Compare CPython handle_func_event in funcobject.c
    private void handleEvent(FunctionEvent event, Object newValue) {
        interpreter.watchers().function().notify(event, this, newValue);
    }

    private void checkLive() {
        if (deallocated) {
            throw InterpreterError.deallocated("function", id);
        }
    }

    private static String asString(String attr, Object value) {
        if (value instanceof String s) { return s; }
        throw mustBeSetTo(attr, "a string object", value);
    }

    private static TypeError mustBeSetTo(String attr, String kind,
            Object value) {
        return new TypeError("%s must be set to %s, not '%s'", attr, kind,
                Py.typeName(value));
    }

    private AttributeError noAttribute(String name) {
        return new AttributeError(
                "'function' object has no attribute '%s'", name);
    }

    @Override
    // Compare CPython func_repr in funcobject.c
    public String toString() {
        return String.format("<function %.100s at %#x>", qualname, id);
    }
}
