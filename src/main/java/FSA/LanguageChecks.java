package FSA;

import FSA.Model.DeterministicTable;
import FSA.Model.FiniteDFA;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * Decision procedures built on top of the algebra.
 */
public final class LanguageChecks {

    private LanguageChecks() {}

    /**
     * Whether the DFA accepts no word at all.
     */
    public static <I> boolean isEmpty(FiniteDFA<I> dfa) {
        for (IntIterator it = Minimization.reachable(dfa).iterator(); it.hasNext();) {
            if (dfa.isAccepting(it.nextInt())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether every word accepted by {@code first} is accepted by {@code second}.
     */
    public static <I> boolean subsetOf(FiniteDFA<I> first, FiniteDFA<I> second) {
        return isEmpty(ProductConstruction.difference(first, second));
    }

    public static <I> boolean sameLanguage(FiniteDFA<I> first, FiniteDFA<I> second) {
        return subsetOf(first, second) && subsetOf(second, first);
    }

    /**
     * Whether the two DFAs are equal up to a renaming of states: same alphabet, same number of states, and a
     * bijection that maps start to start and preserves acceptance and every transition. Only states reachable
     * from the start take part in the bijection, so an unreachable state makes the check fail.
     */
    public static <I> boolean isomorphic(FiniteDFA<I> first, FiniteDFA<I> second) {
        if (first.size() != second.size()
            || first.getAlphabet().size() != second.getAlphabet().size()
            || !first.getAlphabet().containsAll(second.getAlphabet())) {
            return false;
        }

        final Int2IntMap forward = new Int2IntOpenHashMap();
        final Int2IntMap backward = new Int2IntOpenHashMap();
        forward.defaultReturnValue(DeterministicTable.MISSING);
        backward.defaultReturnValue(DeterministicTable.MISSING);

        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        forward.put(first.getStart(), second.getStart());
        backward.put(second.getStart(), first.getStart());
        pending.enqueue(first.getStart());

        while (!pending.isEmpty()) {
            final int p = pending.dequeueInt();
            final int q = forward.get(p);
            if (first.isAccepting(p) != second.isAccepting(q)) {
                return false;
            }
            for (I a : first.getAlphabet()) {
                final int r1 = first.getSuccessor(p, a);
                final int r2 = second.getSuccessor(q, a);
                if (r1 == DeterministicTable.MISSING || r2 == DeterministicTable.MISSING) {
                    if (r1 != r2) {
                        return false;
                    }
                    continue;
                }
                final int mapped = forward.get(r1);
                if (mapped == DeterministicTable.MISSING) {
                    if (backward.get(r2) != DeterministicTable.MISSING) {
                        return false;
                    }
                    forward.put(r1, r2);
                    backward.put(r2, r1);
                    pending.enqueue(r1);
                } else if (mapped != r2) {
                    return false;
                }
            }
        }
        return forward.size() == first.size();
    }
}
