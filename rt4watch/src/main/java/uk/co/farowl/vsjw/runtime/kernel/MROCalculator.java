// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjw.runtime.kernel;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import uk.co.farowl.vsjw.runtime.PyType;
import uk.co.farowl.vsjw.runtime.TypeError;

/**
 * Calculation of the method resolution order (MRO) of a type from its
 * bases, by the C3 linearisation
 * (https://en.wikipedia.org/wiki/C3_linearization). An instance holds
 * the state of one merge, so that when the merge fails the residue is
 * available to explain why.
 */
public final class MROCalculator {

    /** The MROs of the bases, then the bases themselves, to merge. */
    private final Sequence[] sequences;

    /** How many of the sequences each type appears in (anywhere). */
    private final Map<PyType, int[]> uses;

    private MROCalculator(PyType[] bases) {
        int n = bases.length;
        this.sequences = new Sequence[n + 1];
        this.uses = new IdentityHashMap<>();
        for (int i = 0; i < n; i++) { add(i, bases[i].getMRO()); }
        // The order of declaration is itself a constraint.
        add(n, bases.clone());
    }

    private void add(int i, PyType[] seq) {
        sequences[i] = new Sequence(seq);
        for (PyType t : seq) {
            uses.computeIfAbsent(t, k -> new int[1])[0] += 1;
        }
    }

    /**
     * Compute the MRO of a type, given its bases in order of
     * declaration.
     *
     * @param type under construction (first in the result)
     * @param bases of the type (at least one)
     * @return the MRO
     * @throws TypeError if no consistent order exists
     */
    public static PyType[] getMRO(PyType type, PyType[] bases)
            throws TypeError {
        if (bases.length == 1) {
            // With a single base, prepend type to the MRO of the base.
            PyType[] baseMRO = bases[0].getMRO();
            PyType[] mro = new PyType[baseMRO.length + 1];
            mro[0] = type;
            System.arraycopy(baseMRO, 0, mro, 1, baseMRO.length);
            return mro;
        }

        MROCalculator calc = new MROCalculator(bases);
        List<PyType> merged = calc.merge();
        if (merged == null) {
            StringJoiner sj = new StringJoiner(", ");
            for (PyType t : calc.blocked()) { sj.add(t.getName()); }
            throw new TypeError(NO_CONSISTENT_MRO, sj);
        }
        merged.add(0, type);
        return merged.toArray(new PyType[merged.size()]);
    }

    private static final String NO_CONSISTENT_MRO =
            "Cannot create a consistent method resolution order (MRO)"
                    + " for bases %s";

    /**
     * Merge the sequences.
     *
     * @return the merged order or {@code null} if there is none
     */
    private List<PyType> merge() {
        List<PyType> result = new ArrayList<>();
        while (!allEmpty()) {
            PyType next = null;
            for (int i = 0; i < sequences.length && next == null; i++) {
                next = candidate(i);
            }
            if (next == null) { return null; }
            result.add(next);
            for (Sequence s : sequences) {
                if (s.peek() == next) { s.pop(); }
            }
        }
        return result;
    }

    /**
     * The head of sequence {@code i} is a good candidate if it appears
     * at the head of every sequence that contains it at all.
     *
     * @param i index of the sequence to inspect
     * @return the head of sequence {@code i} or {@code null}
     */
    private PyType candidate(int i) {
        PyType h = sequences[i].peek();
        if (h == null) { return null; }
        int remaining = uses.get(h)[0];
        for (Sequence s : sequences) {
            if (s.peek() == h) { remaining -= 1; }
        }
        return remaining == 0 ? h : null;
    }

    private boolean allEmpty() {
        for (Sequence s : sequences) {
            if (s.peek() != null) { return false; }
        }
        return true;
    }

    /** @return the heads left when the merge failed */
    private List<PyType> blocked() {
        List<PyType> heads = new ArrayList<>();
        for (Sequence s : sequences) {
            PyType h = s.peek();
            if (h != null && !heads.contains(h)) { heads.add(h); }
        }
        return heads;
    }

    /** The unconsumed part of the MRO of one base. */
    private static final class Sequence {
        private final PyType[] mro;
        private int head;

        Sequence(PyType[] mro) { this.mro = mro; }

        /** @return first remaining type or {@code null} when empty */
        PyType peek() { return head < mro.length ? mro[head] : null; }

        /** Discard the first remaining type. */
        void pop() { head++; }
    }
}
