package FSA;

import java.util.ArrayDeque;
import java.util.Deque;

import FSA.Model.DeterminizeRecord;
import FSA.Model.FiniteDFA;
import FSA.Model.FiniteNFA;
import FSA.Registry.SubsetRegistry;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction. Only subsets reachable from the epsilon-closed start set are materialized.
 */
public final class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);

    private PowersetDeterminizer() {}

    public static <I> FiniteDFA<I> determinize(FiniteNFA<I> nfa) {
        return determinize(nfa, false);
    }

    /**
     * Converts the NFA into an equivalent complete DFA. DFA state {@code i} stands for the i-th distinct
     * subset discovered; the empty subset, when reachable, becomes a rejecting sink.
     *
     * @param minimize whether to minimize the subset automaton before returning it
     */
    public static <I> FiniteDFA<I> determinize(FiniteNFA<I> nfa, boolean minimize) {
        final FiniteDFA<I> out = doDeterminize(nfa, new SubsetRegistry());
        if (minimize) {
            return Minimization.minimize(out);
        }
        return out;
    }

    static <I> FiniteDFA<I> doDeterminize(FiniteNFA<I> nfa, SubsetRegistry registry) {
        final Alphabet<I> inputs = nfa.getAlphabet();
        final FiniteDFA.Builder<I> out = FiniteDFA.builder(inputs);
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        final IntSortedSet init = nfa.epsilonClosure(nfa.getStartSet());
        final int initOut = registry.put(init);
        out.addState(initOut, nfa.hasAccepting(init));
        out.setStart(initOut);
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            final DeterminizeRecord curr = queue.poll();

            for (I sym : inputs) {
                final IntSortedSet succ = nfa.next(curr.subset(), sym);
                int outSucc = registry.get(succ);
                if (outSucc == SubsetRegistry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = registry.put(succ);
                    out.addState(outSucc, nfa.hasAccepting(succ));
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.dfaState(), sym, outSucc);
            }
        }

        LOGGER.debug("Subset construction: {} NFA states, {} reachable subsets", nfa.size(), registry.size());
        return out.build();
    }
}
