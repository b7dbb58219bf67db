// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import java.util.Objects;

import uk.co.farowl.vsjw.runtime.kernel.ObjectIdentity;
import uk.co.farowl.vsjw.runtime.watch.CodeEvent;

/**
 * The Python {@code code} object, reduced to the attributes that
 * identify it. Code objects are created only through the static
 * factories, which report the creation to the code watchers of the
 * interpreter once the object is complete. {@link #dealloc()} reports
 * the destruction.
 */
// Compare CPython PyCodeObject in codeobject.c
public final class PyCode implements CraftedPyObject {

    /** The Python type {@code code}. */
    public static final PyType TYPE = PyType.builtin("code");

    /** The interpreter whose watchers hear of this object. */
    private final Interpreter interpreter;

    /** Identity of this object. */
    private final long id = ObjectIdentity.next();

    /** Source file from which compiled. */
    private final String filename;
    /** Name of function etc. */
    private final String name;
    /** Fully qualified name of function etc. */
    private final String qualname;
    /** First source line number. */
    private final int firstlineno;

    /** Set when the run-time has torn the object down. */
    private boolean deallocated;

    private PyCode(Interpreter interpreter, String filename, String name,
            String qualname, int firstlineno) {
        this.interpreter = Objects.requireNonNull(interpreter);
        this.filename = filename;
        this.name = Objects.requireNonNull(name, "name");
        this.qualname = qualname == null ? name : qualname;
        this.firstlineno = firstlineno;
    }

    /**
     * Create a code object and report it to the code watchers.
     *
     * @param interpreter owning the code object
     * @param filename source file (or {@code null} if unknown)
     * @param name of function etc.
     * @param qualname qualified name (or {@code null} to use
     *     {@code name})
     * @param firstlineno first source line number
     * @return the new code object
     */
    public static PyCode create(Interpreter interpreter, String filename,
            String name, String qualname, int firstlineno) {
        PyCode code = new PyCode(interpreter, filename, name, qualname,
                firstlineno);
        interpreter.watchers().code().notify(CodeEvent.CREATED, code);
        return code;
    }

    /**
     * Create a code object that does nothing, identified only by file,
     * name and line.
     *
     * @param interpreter owning the code object
     * @param filename source file
     * @param funcname name of the function
     * @param firstlineno first source line number
     * @return the new code object
     */
    // Compare CPython PyCode_NewEmpty in codeobject.c
    public static PyCode newEmpty(Interpreter interpreter,
            String filename, String funcname, int firstlineno) {
        return create(interpreter, filename, funcname, funcname,
                firstlineno);
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public long getId() { return id; }

    /** @return the {@code co_filename} attribute */
    public String getFilename() { return filename; }

    /** @return the {@code co_name} attribute */
    public String getName() { return name; }

    /** @return the {@code co_qualname} attribute */
    public String getQualname() { return qualname; }

    /** @return the {@code co_firstlineno} attribute */
    public int getFirstLineNo() { return firstlineno; }

    /** @return the interpreter owning this code object */
    public Interpreter getInterpreter() { return interpreter; }

    /**
     * Tear down the code object, reporting its destruction to the code
     * watchers while it is still intact. Subsequent calls have no
     * effect.
     */
    // Compare CPython code_dealloc in codeobject.c
    public void dealloc() {
        if (deallocated) { return; }
        deallocated = true;
        interpreter.watchers().code().notify(CodeEvent.DESTROYED, this);
    }

    /** @return whether {@link #dealloc()} has been called */
    public boolean isDeallocated() { return deallocated; }

    @Override
    // Compare CPython code_repr in codeobject.c
    public String toString() {
        int lineno = firstlineno != 0 ? firstlineno : -1;
        String file = filename, q = "\"";
        if (file == null) { file = "???"; q = ""; }
        return String.format(
                "<code object %s at %#x, file %s%s%s, line %d>", name, id,
                q, file, q, lineno);
    }
}
