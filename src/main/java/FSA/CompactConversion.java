package FSA;

import java.util.Set;

import FSA.Model.FiniteDFA;
import FSA.Model.FiniteNFA;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIterator;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between this library's automata and AutomataLib's compact automata.
 */
public final class CompactConversion {

    private CompactConversion() {}

    /**
     * Copies the DFA into a {@link CompactDFA} over the same alphabet. States are renumbered densely in
     * ascending order of their ids; undefined transitions stay undefined.
     */
    public static <I> CompactDFA<I> toCompactDFA(FiniteDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        final Int2IntMap index = new Int2IntOpenHashMap(dfa.size());

        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            final int id = out.addState(dfa.isAccepting(q));
            index.put(q, id);
        }
        out.setInitial(index.get(dfa.getStart()), true);
        dfa.getTable().forEach((q, a, r) -> out.setTransition(index.get(q), alphabet.getSymbolIndex(a), index.get(r)));
        return out;
    }

    public static <I> FiniteDFA<I> fromCompactDFA(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final FiniteDFA.Builder<I> out = FiniteDFA.builder(alphabet);
        for (Integer q : dfa.getStates()) {
            out.addState(q, dfa.isAccepting(q));
        }
        final Integer init = dfa.getInitialState();
        if (init != null) {
            out.setStart(init);
        }
        for (Integer q : dfa.getStates()) {
            for (I a : alphabet) {
                final Integer succ = dfa.getSuccessor(q, a);
                if (succ != null) {
                    out.addTransition(q, a, succ);
                }
            }
        }
        return out.build();
    }

    /**
     * Copies an epsilon-free NFA into a {@link CompactNFA}, renumbering states densely.
     *
     * @throws IllegalArgumentException if the NFA has epsilon moves, which {@link CompactNFA} cannot hold
     */
    public static <I> CompactNFA<I> toCompactNFA(FiniteNFA<I> nfa) {
        if (nfa.getTable().hasEpsilon()) {
            throw new IllegalArgumentException("CompactNFA has no epsilon transitions; determinize first");
        }
        final CompactNFA<I> out = new CompactNFA<>(nfa.getAlphabet(), nfa.size());
        final Int2IntMap index = new Int2IntOpenHashMap(nfa.size());

        for (IntIterator it = nfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            final int id = out.addState(nfa.isAccepting(q));
            index.put(q, id);
            out.setInitial(id, nfa.getStartSet().contains(q));
        }
        nfa.getTable().forEach((q, a, r) -> out.addTransition(index.get(q), a, index.get(r)));
        return out;
    }

    public static <I> FiniteNFA<I> fromCompactNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final FiniteNFA.Builder<I> out = FiniteNFA.builder(alphabet);
        final Set<Integer> initialStates = nfa.getInitialStates();
        for (Integer q : nfa.getStates()) {
            out.addState(q, nfa.isAccepting(q));
            out.setInitial(q, initialStates.contains(q));
        }
        for (Integer q : nfa.getStates()) {
            for (I a : alphabet) {
                for (Integer r : nfa.getTransitions(q, a)) {
                    out.addTransition(q, a, r);
                }
            }
        }
        return out.build();
    }
}
