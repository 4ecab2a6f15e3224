package FSA;

import FSA.Model.FiniteDFA;
import FSA.Model.FiniteNFA;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reversal and trimming of automata.
 */
public final class NFATrim {
    private static final Logger LOGGER = LoggerFactory.getLogger(NFATrim.class);

    private NFATrim() {}

    /**
     * Builds an NFA for the reverse language: every transition q -a-> r becomes r -a-> q, the accepting
     * states become the start set and the start state becomes the only accepting state. States and
     * alphabet are unchanged.
     */
    public static <I> FiniteNFA<I> reverse(FiniteDFA<I> dfa) {
        final FiniteNFA.Builder<I> rNFA = FiniteNFA.builder(dfa.getAlphabet());

        // Accepting are initial states and vice versa
        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            rNFA.addState(q, q == dfa.getStart());
            rNFA.setInitial(q, dfa.isAccepting(q));
        }
        dfa.getTable().forEach((q, a, r) -> rNFA.addTransition(r, a, q));
        return rNFA.build();
    }

    /**
     * Reverses an NFA, epsilon moves included. Start set and accepting set swap.
     */
    public static <I> FiniteNFA<I> reverse(FiniteNFA<I> nfa) {
        final FiniteNFA.Builder<I> rNFA = FiniteNFA.builder(nfa.getAlphabet());
        for (IntIterator it = nfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            rNFA.addState(q, nfa.getStartSet().contains(q));
            rNFA.setInitial(q, nfa.isAccepting(q));
        }
        nfa.getTable().forEach((q, a, r) -> rNFA.addTransition(r, a, q));
        nfa.getTable().forEachEpsilon((q, r) -> rNFA.addEpsilonTransition(r, q));
        return rNFA.build();
    }

    /**
     * Removes every state that is not both reachable from a start state and able to reach an accepting
     * state. The remaining states keep their ids.
     */
    public static <I> FiniteNFA<I> trim(FiniteNFA<I> nfa) {
        final IntSortedSet states = accessibleStates(nfa);
        states.retainAll(accessibleStates(reverse(nfa)));

        final FiniteNFA.Builder<I> out = FiniteNFA.builder(nfa.getAlphabet());
        for (IntIterator it = states.iterator(); it.hasNext();) {
            final int q = it.nextInt();
            out.addState(q, nfa.isAccepting(q));
            out.setInitial(q, nfa.getStartSet().contains(q));
        }
        nfa.getTable().forEach((q, a, r) -> {
            if (states.contains(q) && states.contains(r)) {
                out.addTransition(q, a, r);
            }
        });
        nfa.getTable().forEachEpsilon((q, r) -> {
            if (states.contains(q) && states.contains(r)) {
                out.addEpsilonTransition(q, r);
            }
        });

        if (states.size() < nfa.size()) {
            LOGGER.debug("Trimmed {} states to {}", nfa.size(), states.size());
        }
        return out.build();
    }

    /**
     * States reachable from the start set through symbol or epsilon moves.
     */
    public static <I> IntSortedSet accessibleStates(FiniteNFA<I> nfa) {
        final IntSortedSet visited = new IntRBTreeSet(nfa.getStartSet());
        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        for (IntIterator it = visited.iterator(); it.hasNext();) {
            pending.enqueue(it.nextInt());
        }
        while (!pending.isEmpty()) {
            final int q = pending.dequeueInt();
            final IntSortedSet successors = new IntRBTreeSet(nfa.getTable().getEpsilon(q));
            for (I a : nfa.getAlphabet()) {
                successors.addAll(nfa.getTransitions(q, a));
            }
            for (IntIterator it = successors.iterator(); it.hasNext();) {
                final int r = it.nextInt();
                if (visited.add(r)) {
                    pending.enqueue(r);
                }
            }
        }
        return visited;
    }
}
