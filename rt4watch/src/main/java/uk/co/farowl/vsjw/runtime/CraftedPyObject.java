// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

/**
 * A Python object implemented in Java specifically for this run-time.
 * Such objects carry a numeric identity assigned when they are created,
 * which remains meaningful (as a token, not a reference) after the
 * run-time has torn the object down.
 */
public interface CraftedPyObject extends WithClass {

    /**
     * The Python {@code id()} of this object. No two objects created in
     * the same process share an identity.
     *
     * @return identity of this object
     */
    long getId();
}
