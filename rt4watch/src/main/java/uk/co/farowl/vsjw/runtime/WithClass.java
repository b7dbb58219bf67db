// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/** An object that is able to report its Python type. */
public interface WithClass {

    /**
     * Return the Python type of this object.
     *
     * @return the type object
     */
    PyType getType();
}
