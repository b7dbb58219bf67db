// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.vsjw.runtime.PyCode;
import uk.co.farowl.vsjw.runtime.Unraisable;
import uk.co.farowl.vsjw.runtime.UnitTestSupport;
import uk.co.farowl.vsjw.runtime.ValueError;

/**
 * Tests of code object watchers, which hear of the creation and
 * destruction of every code object in the interpreter.
 */
@DisplayName("A code watcher")
class CodeWatcherTest extends UnitTestSupport {

    /** Counts the events it receives. */
    static class Counter implements CodeWatcher {
        int created;
        int destroyed;

        @Override
        public void onEvent(CodeEvent event, PyCode code) {
            switch (event) {
                case CREATED -> created++;
                case DESTROYED -> destroyed++;
            }
        }
    }

    final Counter[] counters = {new Counter(), new Counter()};

    CodeWatchers watchers() { return interp.watchers().code(); }

    void assertEventCounts(int created0, int destroyed0, int created1,
            int destroyed1) {
        assertEquals(created0, counters[0].created);
        assertEquals(destroyed0, counters[0].destroyed);
        assertEquals(created1, counters[1].created);
        assertEquals(destroyed1, counters[1].destroyed);
    }

    @Test
    @DisplayName("receives events while registered")
    void codeObjectEventsDispatched() {
        // all counts are zero before any watchers are registered
        assertEventCounts(0, 0, 0, 0);

        // counts remain zero when a code object is created and
        // destroyed with no watchers registered
        PyCode co1 = newCode("dummy1");
        assertEventCounts(0, 0, 0, 0);
        co1.dealloc();
        assertEventCounts(0, 0, 0, 0);

        // counts are as expected when first watcher is registered
        int wid0 = watchers().addWatcher(counters[0]);
        assertEventCounts(0, 0, 0, 0);
        PyCode co2 = newCode("dummy2");
        assertEventCounts(1, 0, 0, 0);
        co2.dealloc();
        assertEventCounts(1, 1, 0, 0);

        // again with second watcher registered
        int wid1 = watchers().addWatcher(counters[1]);
        assertEventCounts(1, 1, 0, 0);
        PyCode co3 = newCode("dummy3");
        assertEventCounts(2, 1, 1, 0);
        co3.dealloc();
        assertEventCounts(2, 2, 1, 1);
        watchers().clearWatcher(wid1);
        watchers().clearWatcher(wid0);

        // counts remain as they were after both watchers are cleared
        PyCode co4 = newCode("dummy4");
        assertEventCounts(2, 2, 1, 1);
        co4.dealloc();
        assertEventCounts(2, 2, 1, 1);
    }

    @Test
    @DisplayName("receives DESTROYED only once")
    void destroyedOnce() {
        watchers().addWatcher(counters[0]);
        PyCode co = newCode("dummy");
        co.dealloc();
        co.dealloc();
        assertEventCounts(1, 1, 0, 0);
        assertTrue(co.isDeallocated());
    }

    @Test
    @DisplayName("receives the code object complete")
    void createdComplete() {
        List<String> names = new ArrayList<>();
        watchers().addWatcher((event, code) -> names.add(code.getName()));
        newCode("dummy");
        assertEquals(List.of("dummy"), names);
    }

    @Test
    @DisplayName("that fails is reported as unraisable")
    void error() {
        UnraisableCatcher cm = catchUnraisable();
        watchers().addWatcher((event, code) -> {
            throw new ValueError("testing 123");
        });
        watchers().addWatcher(counters[1]);
        PyCode co = newCode("dummy");
        Unraisable u = cm.last();
        assertSame(co, u.object());
        assertEquals("testing 123", u.exception().getMessage());
        // The second watcher still ran
        assertEventCounts(0, 0, 1, 0);
    }

    @ParameterizedTest(name = "clear_watcher({0})")
    @DisplayName("raises ValueError clearing an out of range ID")
    @ValueSource(ints = {-1, 8})
    void clearOutOfRange(int id) {
        assertRaises(InvalidWatcherId.class,
                "Invalid code watcher ID " + id,
                () -> watchers().clearWatcher(id));
    }

    @Test
    @DisplayName("raises ValueError clearing an unassigned ID")
    void clearUnassigned() {
        assertRaises(WatcherNotRegistered.class,
                "No code watcher set for ID 1",
                () -> watchers().clearWatcher(1));
    }

    @Test
    @DisplayName("raises RuntimeError when there are too many")
    void allocateTooManyWatchers() {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < WatcherRegistry.MAX_WATCHERS; i++) {
            ids.add(watchers().addWatcher(counters[0]));
        }
        assertRaises(WatcherCapacityExceeded.class,
                "no more code watcher IDs available",
                () -> watchers().addWatcher(counters[0]));
        // Clearing one makes an ID available again
        watchers().clearWatcher(ids.get(3));
        assertEquals(3, watchers().addWatcher(counters[1]));
    }
}
