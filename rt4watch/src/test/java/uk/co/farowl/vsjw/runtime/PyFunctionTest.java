// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.vsjw.support.InterpreterError;

/** Tests of the attributes of {@link PyFunction}. */
@DisplayName("A function")
class PyFunctionTest extends UnitTestSupport {

    final PyDict globals = dict(Map.of("__name__", "mod"));

    final PyFunction f = interp.newFunction(newCode("f"), globals);

    @Test
    @DisplayName("takes its names from the code")
    void names() {
        assertEquals("f", f.getAttribute("__name__"));
        assertEquals("f", f.getAttribute("__qualname__"));
        assertEquals("mod", f.getAttribute("__module__"));
        assertSame(Py.None, f.getAttribute("__doc__"));
        assertSame(globals, f.getAttribute("__globals__"));
        assertEquals(String.format("<function f at %#x>", Py.id(f)),
                f.toString());
    }

    @Test
    @DisplayName("accepts string names only")
    void setNames() {
        f.setAttribute("__qualname__", "C.f");
        assertEquals("C.f", f.getQualname());
        assertRaises(TypeError.class,
                "__name__ must be set to a string object, not 'int'",
                () -> f.setAttribute("__name__", 42));
    }

    @Test
    @DisplayName("checks the type of assigned code and defaults")
    void typeChecks() {
        assertRaises(TypeError.class,
                "__code__ must be set to a code object, not 'str'",
                () -> f.setAttribute("__code__", "print()"));
        assertRaises(TypeError.class,
                "__defaults__ must be set to a tuple, not 'int'",
                () -> f.setAttribute("__defaults__", 1));
        assertRaises(TypeError.class,
                "__kwdefaults__ must be set to a dict, not 'str'",
                () -> f.setAttribute("__kwdefaults__", "x"));
        assertRaises(TypeError.class,
                "__dict__ must be set to a dictionary, not a 'tuple'",
                () -> f.setAttribute("__dict__", new Object[0]));
    }

    @Test
    @DisplayName("keeps other attributes in its __dict__")
    void otherAttributes() {
        f.setAttribute("spam", 1);
        assertEquals(1, f.getAttribute("spam"));
        assertEquals(1, f.getDict().get("spam"));
        f.delAttribute("spam");
        assertRaises(AttributeError.class,
                "'function' object has no attribute 'spam'",
                () -> f.getAttribute("spam"));
    }

    @ParameterizedTest(name = "del f.{0}")
    @DisplayName("refuses to delete essential attributes")
    @ValueSource(strings = {"__code__", "__name__", "__qualname__",
            "__dict__"})
    void cannotDelete(String name) {
        assertRaises(TypeError.class,
                String.format("cannot delete %s attribute", name),
                () -> f.delAttribute(name));
    }

    @Test
    @DisplayName("has read-only __globals__")
    void readonlyGlobals() {
        assertRaises(AttributeError.class, "readonly attribute",
                () -> f.setAttribute("__globals__", globals));
    }

    @Test
    @DisplayName("may have its defaults removed")
    void removeDefaults() {
        f.setDefaults(new Object[] {1, 2});
        assertEquals(2, f.getDefaults().length);
        f.delAttribute("__defaults__");
        assertNull(f.getDefaults());
    }

    @Test
    @DisplayName("may not be modified after dealloc")
    void afterDealloc() {
        f.dealloc();
        assertThrows(InterpreterError.class,
                () -> f.setCode(newCode("g")));
    }
}
