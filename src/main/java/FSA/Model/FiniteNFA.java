package FSA.Model;

import java.util.Collection;
import java.util.Objects;

import FSA.Errors.MalformedAutomatonException;
import FSA.Errors.UnknownSymbolException;
import FSA.NFATrim;
import FSA.PowersetDeterminizer;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;

/**
 * Immutable nondeterministic finite automaton with epsilon moves.
 * <p>
 * Simulation works on sets of states: {@link #epsilonClosure}, {@link #next} and {@link #run} all return
 * fresh sorted sets.
 *
 * @param <I> symbol type
 */
public final class FiniteNFA<I> {
    private final Alphabet<I> alphabet;
    private final IntSortedSet states;
    private final IntSortedSet startSet;
    private final IntSortedSet accepting;
    private final NondeterministicTable<I> table;

    private FiniteNFA(Alphabet<I> alphabet,
                      IntSortedSet states,
                      IntSortedSet startSet,
                      IntSortedSet accepting,
                      NondeterministicTable<I> table) {
        this.alphabet = alphabet;
        this.states = states;
        this.startSet = startSet;
        this.accepting = accepting;
        this.table = table;
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public IntSortedSet getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public IntSortedSet getStartSet() {
        return startSet;
    }

    public IntSortedSet getAccepting() {
        return accepting;
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    public NondeterministicTable<I> getTable() {
        return table;
    }

    public IntSortedSet getTransitions(int state, I symbol) {
        return table.get(state, symbol);
    }

    /**
     * Expands the given set with every state reachable through epsilon moves alone.
     * Each state is expanded at most once, so epsilon cycles terminate.
     */
    public IntSortedSet epsilonClosure(IntCollection from) {
        final IntSortedSet closure = new IntRBTreeSet(from);
        if (!table.hasEpsilon()) {
            return closure;
        }
        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        for (IntIterator it = closure.iterator(); it.hasNext();) {
            pending.enqueue(it.nextInt());
        }
        while (!pending.isEmpty()) {
            final int q = pending.dequeueInt();
            for (IntIterator it = table.getEpsilon(q).iterator(); it.hasNext();) {
                final int r = it.nextInt();
                if (closure.add(r)) {
                    pending.enqueue(r);
                }
            }
        }
        return closure;
    }

    /**
     * One simulation step: the epsilon-closed union of the successors of {@code from} on {@code symbol}.
     *
     * @throws UnknownSymbolException if the symbol is not in the alphabet
     */
    public IntSortedSet next(IntCollection from, I symbol) {
        if (!alphabet.contains(symbol)) {
            throw new UnknownSymbolException(symbol);
        }
        final IntSortedSet successors = new IntRBTreeSet();
        for (IntIterator it = from.iterator(); it.hasNext();) {
            successors.addAll(table.get(it.nextInt(), symbol));
        }
        return epsilonClosure(successors);
    }

    public IntSortedSet run(Iterable<? extends I> word) {
        return run(word, startSet);
    }

    public IntSortedSet run(Iterable<? extends I> word, IntCollection from) {
        IntSortedSet current = epsilonClosure(from);
        for (I symbol : word) {
            current = next(current, symbol);
        }
        return current;
    }

    /**
     * Whether the given set of states contains an accepting state.
     */
    public boolean hasAccepting(IntCollection reached) {
        for (IntIterator it = reached.iterator(); it.hasNext();) {
            if (accepting.contains(it.nextInt())) {
                return true;
            }
        }
        return false;
    }

    public boolean accepts(Iterable<? extends I> word) {
        return hasAccepting(run(word));
    }

    public FiniteDFA<I> determinize() {
        return PowersetDeterminizer.determinize(this);
    }

    public FiniteNFA<I> reverse() {
        return NFATrim.reverse(this);
    }

    @Override
    public String toString() {
        return "FiniteNFA{states=" + states + ", start=" + startSet + ", accepting=" + accepting
               + ", transitions=" + table.size() + "}";
    }

    public static <I> Builder<I> builder(Alphabet<I> alphabet) {
        return new Builder<>(alphabet);
    }

    public static <I> Builder<I> builder(Collection<? extends I> symbols) {
        return new Builder<>(FiniteDFA.alphabetOf(symbols));
    }

    public static final class Builder<I> {
        private final Alphabet<I> alphabet;
        private final IntSortedSet states = new IntRBTreeSet();
        private final IntSortedSet startSet = new IntRBTreeSet();
        private final IntSortedSet accepting = new IntRBTreeSet();
        private final NondeterministicTable.Builder<I> table = NondeterministicTable.builder();

        private Builder(Alphabet<I> alphabet) {
            this.alphabet = FiniteDFA.snapshot(Objects.requireNonNull(alphabet, "alphabet"));
        }

        public Alphabet<I> getAlphabet() {
            return alphabet;
        }

        public Builder<I> addState(int state) {
            states.add(state);
            return this;
        }

        public Builder<I> addState(int state, boolean accept) {
            states.add(state);
            return setAccepting(state, accept);
        }

        public Builder<I> addStates(int... newStates) {
            for (int state : newStates) {
                states.add(state);
            }
            return this;
        }

        public Builder<I> setInitial(int state, boolean initial) {
            if (initial) {
                startSet.add(state);
            } else {
                startSet.remove(state);
            }
            return this;
        }

        public Builder<I> setAccepting(int state, boolean accept) {
            if (accept) {
                accepting.add(state);
            } else {
                accepting.remove(state);
            }
            return this;
        }

        public Builder<I> addTransition(int source, I symbol, int target) {
            table.add(source, symbol, target);
            return this;
        }

        public Builder<I> addEpsilonTransition(int source, int target) {
            table.addEpsilon(source, target);
            return this;
        }

        /**
         * Validates and freezes the automaton.
         *
         * @throws MalformedAutomatonException if start, accepting or transitions refer outside the states or
         * the alphabet
         */
        public FiniteNFA<I> build() {
            if (!states.isEmpty() && states.firstInt() < 0) {
                throw new MalformedAutomatonException("Negative state id: " + states.firstInt());
            }
            for (IntIterator it = startSet.iterator(); it.hasNext();) {
                final int q = it.nextInt();
                if (!states.contains(q)) {
                    throw new MalformedAutomatonException("Start state " + q + " is not a state");
                }
            }
            FiniteDFA.checkSubset(accepting, states);
            table.forEach((source, symbol, target) -> {
                checkEdge(source, target, symbol);
                if (!alphabet.contains(symbol)) {
                    throw new MalformedAutomatonException("Transition symbol " + symbol + " is not in the alphabet");
                }
            });
            table.forEachEpsilon((source, target) -> checkEdge(source, target, "epsilon"));
            return new FiniteNFA<>(alphabet,
                                   IntSortedSets.unmodifiable(new IntRBTreeSet(states)),
                                   IntSortedSets.unmodifiable(new IntRBTreeSet(startSet)),
                                   IntSortedSets.unmodifiable(new IntRBTreeSet(accepting)),
                                   table.build());
        }

        private void checkEdge(int source, int target, Object label) {
            if (!states.contains(source) || !states.contains(target)) {
                throw new MalformedAutomatonException("Transition " + source + " -" + label + "-> " + target
                                                      + " leaves the state set");
            }
        }
    }
}
