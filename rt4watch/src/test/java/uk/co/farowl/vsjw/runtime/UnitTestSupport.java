// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.function.Executable;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs. Each test (each instance of the
 * test class) gets a fresh {@link Interpreter}, so that watchers
 * registered by one test are never seen by another.
 */
public class UnitTestSupport {

    /** An interpreter private to the test. */
    protected final Interpreter interp = new Interpreter();

    /**
     * Install an {@link UnraisableCatcher} as the unraisable hook of
     * the interpreter of the test.
     *
     * @return the catcher
     */
    protected UnraisableCatcher catchUnraisable() {
        UnraisableCatcher catcher = new UnraisableCatcher();
        interp.setUnraisableHook(catcher);
        return catcher;
    }

    /**
     * Create a {@code dict} in the interpreter of the test holding the
     * given entries.
     *
     * @param entries initial content
     * @return new {@code dict}
     */
    protected PyDict dict(Map<?, ?> entries) {
        return interp.newDict(entries);
    }

    /**
     * Create a code object in the interpreter of the test, as a test
     * would with {@code code_newempty}.
     *
     * @param funcname name of the function
     * @return new {@code code}
     */
    protected PyCode newCode(String funcname) {
        return interp.newCode("test_watchers", funcname, 0);
    }

    /**
     * Assert that an action raises a Python exception of the given
     * class with exactly the given message.
     *
     * @param <E> type of exception expected
     * @param expected class of exception
     * @param message expected
     * @param action to perform
     * @return the exception for further tests
     */
    public static <E extends PyBaseException> E assertRaises(
            Class<E> expected, String message, Executable action) {
        E e = assertThrows(expected, action);
        assertEquals(message, e.getMessage());
        return e;
    }

    /**
     * An {@link UnraisableHook} that simply keeps what it is given, in
     * the manner of {@code test.support.catch_unraisable_exception}.
     */
    public static class UnraisableCatcher implements UnraisableHook {

        private final List<Unraisable> caught =
                Collections.synchronizedList(new ArrayList<>());

        @Override
        public void handle(Unraisable unraisable) {
            caught.add(unraisable);
        }

        /** @return everything caught so far */
        public List<Unraisable> caught() { return List.copyOf(caught); }

        /**
         * Return the most recent report, failing if there is none.
         *
         * @return the last report
         */
        public Unraisable last() {
            List<Unraisable> c = caught();
            if (c.isEmpty()) {
                throw new AssertionError("no unraisable exception caught");
            }
            return c.get(c.size() - 1);
        }
    }
}
