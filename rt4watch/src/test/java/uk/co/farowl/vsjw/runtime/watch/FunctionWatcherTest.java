// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.vsjw.runtime.Py;
import uk.co.farowl.vsjw.runtime.PyCode;
import uk.co.farowl.vsjw.runtime.PyDict;
import uk.co.farowl.vsjw.runtime.PyFunction;
import uk.co.farowl.vsjw.runtime.Unraisable;
import uk.co.farowl.vsjw.runtime.UnitTestSupport;

/**
 * Tests of function watchers, which hear of the creation, modification
 * and destruction of every function in the interpreter.
 */
@DisplayName("A function watcher")
class FunctionWatcherTest extends UnitTestSupport {

    /**
     * One event as a watcher receives it.
     *
     * @param event what happened
     * @param function concerned (or {@code null})
     * @param id of the function
     * @param newValue assigned (or {@code null})
     */
    record Event(FunctionEvent event, PyFunction function, long id,
            Object newValue) {}

    /** A watcher that appends every event to a list. */
    static class Recorder implements FunctionWatcher {
        final List<Event> events = new ArrayList<>();

        @Override
        public void onEvent(FunctionEvent event, PyFunction function,
                long functionId, Object newValue) {
            events.add(new Event(event, function, functionId, newValue));
        }
    }

    final PyDict globals = dict(Map.of("__name__", "__main__"));

    FunctionWatchers watchers() { return interp.watchers().function(); }

    PyFunction myfunc() {
        return interp.newFunction(newCode("myfunc"), globals);
    }

    @Nested
    @DisplayName("receives")
    class Events {

        final Recorder watcher = new Recorder();

        Event event(FunctionEvent e, PyFunction f, Object newValue) {
            return new Event(e, f, Py.id(f), newValue);
        }

        @Test
        @DisplayName("CREATED when a function is made")
        void created() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();
            assertEquals(List.of(event(FunctionEvent.CREATED, f, null)),
                    watcher.events);
        }

        @Test
        @DisplayName("MODIFIED_CODE on f.__code__ = c")
        void modifyCodeAttribute() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();
            PyCode newCode = newCode("other");
            f.setAttribute("__code__", newCode);
            assertTrue(watcher.events.contains(
                    event(FunctionEvent.MODIFIED_CODE, f, newCode)));
            assertSame(newCode, f.getCode());
        }

        @Test
        @DisplayName("MODIFIED_CODE on setCode(c)")
        void modifyCodeSetter() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();
            PyCode newCode = newCode("other");
            f.setCode(newCode);
            assertTrue(watcher.events.contains(
                    event(FunctionEvent.MODIFIED_CODE, f, newCode)));
        }

        @Test
        @DisplayName("MODIFIED_DEFAULTS through both paths")
        void modifyDefaults() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();

            Object[] newDefaults = {123};
            f.setAttribute("__defaults__", newDefaults);
            assertTrue(watcher.events.contains(event(
                    FunctionEvent.MODIFIED_DEFAULTS, f, newDefaults)));

            newDefaults = new Object[] {456};
            f.setDefaults(newDefaults);
            assertTrue(watcher.events.contains(event(
                    FunctionEvent.MODIFIED_DEFAULTS, f, newDefaults)));
        }

        @Test
        @DisplayName("MODIFIED_KWDEFAULTS through both paths")
        void modifyKwDefaults() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();

            PyDict newKwdefaults = dict(Map.of("self", 123));
            f.setAttribute("__kwdefaults__", newKwdefaults);
            assertTrue(watcher.events.contains(event(
                    FunctionEvent.MODIFIED_KWDEFAULTS, f, newKwdefaults)));

            newKwdefaults = dict(Map.of("self", 456));
            f.setKwDefaults(newKwdefaults);
            assertTrue(watcher.events.contains(event(
                    FunctionEvent.MODIFIED_KWDEFAULTS, f, newKwdefaults)));
        }

        @Test
        @DisplayName("a null new value when None is assigned")
        void assignNone() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();
            f.setAttribute("__defaults__", Py.None);
            assertEquals(event(FunctionEvent.MODIFIED_DEFAULTS, f, null),
                    watcher.events.get(1));
            assertSame(Py.None, f.getAttribute("__defaults__"));
        }

        @Test
        @DisplayName("one event per write")
        void oneEventPerWrite() {
            watchers().addWatcher(watcher);
            PyFunction f = myfunc();
            f.setAttribute("__defaults__", new Object[] {1});
            f.setAttribute("__name__", "renamed");
            f.setAttribute("__doc__", "Documented.");
            f.delAttribute("__kwdefaults__");
            assertEquals(3, watcher.events.size());
        }

        @Test
        @DisplayName("DESTROYED with only the identity")
        void destroyed() {
            PyFunction f = myfunc();
            long id = Py.id(f);
            watchers().addWatcher(watcher);
            f.dealloc();
            f.dealloc();
            assertEquals(
                    List.of(new Event(FunctionEvent.DESTROYED, null, id,
                            null)),
                    watcher.events);
        }

        @Test
        @DisplayName("the same events as another watcher")
        void multipleWatchers() {
            Recorder second = new Recorder();
            watchers().addWatcher(watcher);
            watchers().addWatcher(second);
            PyFunction f = myfunc();
            Event e = event(FunctionEvent.CREATED, f, null);
            assertTrue(watcher.events.contains(e));
            assertTrue(second.events.contains(e));
        }
    }

    @Test
    @DisplayName("that fails is reported as unraisable")
    void watcherRaisesError() {
        class MyError extends Exception {
            private static final long serialVersionUID = 1L;

            MyError(String msg) { super(msg); }
        }
        UnraisableCatcher cm = catchUnraisable();
        watchers().addWatcher((event, f, id, v) -> {
            throw new MyError("testing 123");
        });
        PyFunction f = myfunc();
        Unraisable u = cm.last();
        assertSame(f, u.object());
        assertInstanceOf(MyError.class, u.exception());
    }

    @Test
    @DisplayName("that fails on DESTROYED is reported with the ID")
    void watcherRaisesOnDestroy() {
        UnraisableCatcher cm = catchUnraisable();
        PyFunction f = myfunc();
        watchers().addWatcher((event, fn, id, v) -> {
            throw new IllegalStateException("late");
        });
        f.dealloc();
        assertEquals(Py.id(f), cm.last().object());
    }

    @ParameterizedTest(name = "clear_watcher({0})")
    @DisplayName("raises ValueError clearing an out of range ID")
    @ValueSource(ints = {-1, 8})
    void clearOutOfRange(int id) {
        assertRaises(InvalidWatcherId.class,
                "Invalid func watcher ID " + id,
                () -> watchers().clearWatcher(id));
    }

    @Test
    @DisplayName("raises ValueError clearing an unassigned ID")
    void clearUnassigned() {
        assertRaises(WatcherNotRegistered.class,
                "No func watcher set for ID 1",
                () -> watchers().clearWatcher(1));
    }

    @Test
    @DisplayName("raises RuntimeError when there are too many")
    void allocateTooManyWatchers() {
        for (int i = 0; i < WatcherRegistry.MAX_WATCHERS; i++) {
            watchers().addWatcher(new Recorder());
        }
        assertRaises(WatcherCapacityExceeded.class,
                "no more func watcher IDs available",
                () -> watchers().addWatcher(new Recorder()));
    }
}
