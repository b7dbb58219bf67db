// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/** The Python {@code None} object. */
public final class PyNone implements WithClass {

    /** The Python type of {@code None}. */
    public static final PyType TYPE = PyType.builtin("NoneType");

    /** The only instance, published as {@link Py#None}. */
    public static final PyNone INSTANCE = new PyNone();

    private PyNone() {}

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public String toString() { return "None"; }
}
