// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjw.runtime.Interpreter;
import uk.co.farowl.vsjw.runtime.PyDict;
import uk.co.farowl.vsjw.runtime.Unraisable;

/**
 * This test adds and clears dictionary watchers in some threads while
 * other threads mutate watched dictionaries, and so dispatch events
 * through the same registry. Each mutating thread has a dictionary of
 * its own, watched by one permanent watcher and by every slot the
 * churning threads use.
 * <p>
 * As in other tests of concurrency, the intense processing takes place
 * during {@link #setUpClass()}, and the individual tests are predicates
 * on what was observed.
 */
@DisplayName("When watchers are added and cleared during dispatch")
class WatcherConcurrencyTest {

    /** Logger for the test. */
    static final Logger logger =
            LoggerFactory.getLogger(WatcherConcurrencyTest.class);

    /** Threads that add and clear watchers. */
    static final int CHURNERS = 3;

    /** Threads that mutate dictionaries. */
    static final int MUTATORS = 4;

    /** Operations by each thread. */
    static final int ITERATIONS = 2000;

    static final Interpreter interp = new Interpreter();

    /** Events received by the permanent watcher, per dictionary. */
    static final List<AtomicInteger> counts = new ArrayList<>();

    /** Events received by short-lived watchers (any dictionary). */
    static final AtomicInteger transientCount = new AtomicInteger();

    /** Anything thrown in a thread. */
    static final List<Throwable> thrown =
            Collections.synchronizedList(new ArrayList<>());

    /** Anything reported as unraisable. */
    static final List<Unraisable> unraisable =
            Collections.synchronizedList(new ArrayList<>());

    static final List<PyDict> dicts = new ArrayList<>();

    static int permanentId;

    @BeforeAll
    static void setUpClass() throws InterruptedException {
        interp.setUnraisableHook(unraisable::add);
        DictWatchers watchers = interp.watchers().dict();

        // The permanent watcher counts events per dictionary
        for (int i = 0; i < MUTATORS; i++) {
            counts.add(new AtomicInteger());
            PyDict d = interp.newDict();
            d.put("index", i);
            dicts.add(d);
        }
        permanentId = watchers.addWatcher((event, d, key, value) -> counts
                .get((Integer)d.get("index")).incrementAndGet());

        CyclicBarrier start = new CyclicBarrier(CHURNERS + MUTATORS);
        List<Thread> threads = new ArrayList<>();

        for (int i = 0; i < CHURNERS; i++) {
            threads.add(new Thread(() -> {
                await(start);
                for (int j = 0; j < ITERATIONS; j++) {
                    int id = watchers.addWatcher(
                            (e, d, k, v) -> transientCount.incrementAndGet());
                    watchers.clearWatcher(id);
                }
            }, "churner-" + i));
        }

        for (int i = 0; i < MUTATORS; i++) {
            PyDict d = dicts.get(i);
            // Subscribe to every slot, occupied or not.
            d.setWatcherBits(0xff);
            threads.add(new Thread(() -> {
                await(start);
                for (int j = 0; j < ITERATIONS; j++) {
                    d.put("k", j);
                }
            }, "mutator-" + i));
        }

        for (Thread t : threads) {
            t.setUncaughtExceptionHandler((th, e) -> thrown.add(e));
            t.start();
        }
        for (Thread t : threads) { t.join(10_000); }
        logger.atDebug().setMessage("transient watchers saw {} events")
                .addArgument(transientCount::get).log();
    }

    private static void await(CyclicBarrier barrier) {
        try {
            barrier.await();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("no thread fails")
    void noThreadFails() {
        assertEquals(List.of(), thrown);
        assertEquals(List.of(), unraisable);
    }

    @Test
    @DisplayName("the permanent watcher sees every mutation")
    void permanentWatcherSeesAll() {
        for (AtomicInteger count : counts) {
            // One NEW then ITERATIONS - 1 MODIFIED
            assertEquals(ITERATIONS, count.get());
        }
    }

    @Test
    @DisplayName("only the permanent watcher remains registered")
    void registryConsistent() {
        WatcherRegistry<DictWatcher> r =
                interp.watchers().dict().getRegistry();
        assertEquals(1 << permanentId, r.activeBits());
    }
}
