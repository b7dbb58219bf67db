// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.kernel;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of the numeric identities of crafted objects. An identity is
 * a serial number, never reused in the life of the process, so an
 * event that reports only the identity of a destroyed object cannot be
 * confused with a later object that happens to occupy the same storage.
 */
public final class ObjectIdentity {

    private ObjectIdentity() {} // static members only

    /** Next identity to issue. Zero is never issued. */
    private static final AtomicLong next = new AtomicLong(1L);

    /**
     * Issue a fresh identity.
     *
     * @return the new identity
     */
    public static long next() { return next.getAndIncrement(); }
}
