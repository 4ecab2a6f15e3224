package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;

import FSA.Completion;
import FSA.Errors.IncompleteTransitionException;
import FSA.Errors.MalformedAutomatonException;
import FSA.Errors.UnknownSymbolException;
import FSA.Minimization;
import FSA.NFATrim;
import FSA.ProductConstruction;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable deterministic finite automaton over an {@link Alphabet}.
 * <p>
 * States are non-negative integers. The transition function may be partial; {@link #run} fails on a
 * hole and {@link Completion#complete} fills the holes with a sink state. Every transforming operation
 * returns a fresh automaton and leaves {@code this} untouched.
 *
 * @param <I> symbol type
 */
public final class FiniteDFA<I> {
    private final Alphabet<I> alphabet;
    private final IntSortedSet states;
    private final int start;
    private final IntSortedSet accepting;
    private final DeterministicTable<I> table;

    private FiniteDFA(Alphabet<I> alphabet,
                      IntSortedSet states,
                      int start,
                      IntSortedSet accepting,
                      DeterministicTable<I> table) {
        this.alphabet = alphabet;
        this.states = states;
        this.start = start;
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

    public int getStart() {
        return start;
    }

    public IntSortedSet getAccepting() {
        return accepting;
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    public DeterministicTable<I> getTable() {
        return table;
    }

    /**
     * @return the target of (state, symbol), or {@link DeterministicTable#MISSING}
     */
    public int getSuccessor(int state, I symbol) {
        return table.get(state, symbol);
    }

    /**
     * Whether every (state, symbol) pair has a transition.
     */
    public boolean isComplete() {
        return table.size() == states.size() * alphabet.size();
    }

    /**
     * Runs the automaton from the start state over the given word.
     *
     * @return the state reached after the last symbol
     * @throws UnknownSymbolException if a symbol is not in the alphabet
     * @throws IncompleteTransitionException if the run hits an undefined transition
     */
    public int run(Iterable<? extends I> word) {
        int current = start;
        for (I symbol : word) {
            if (!alphabet.contains(symbol)) {
                throw new UnknownSymbolException(symbol);
            }
            final int next = table.get(current, symbol);
            if (next == DeterministicTable.MISSING) {
                throw new IncompleteTransitionException(current, symbol);
            }
            current = next;
        }
        return current;
    }

    public boolean accepts(Iterable<? extends I> word) {
        return isAccepting(run(word));
    }

    public FiniteDFA<I> complete() {
        return Completion.complete(this);
    }

    public FiniteDFA<I> complement() {
        return ProductConstruction.complement(this);
    }

    public FiniteDFA<I> union(FiniteDFA<I> other) {
        return ProductConstruction.union(this, other);
    }

    public FiniteDFA<I> intersection(FiniteDFA<I> other) {
        return ProductConstruction.intersection(this, other);
    }

    public FiniteDFA<I> difference(FiniteDFA<I> other) {
        return ProductConstruction.difference(this, other);
    }

    public FiniteDFA<I> minimize() {
        return Minimization.minimize(this);
    }

    public FiniteNFA<I> reverse() {
        return NFATrim.reverse(this);
    }

    @Override
    public String toString() {
        return "FiniteDFA{states=" + states + ", start=" + start + ", accepting=" + accepting
               + ", transitions=" + table.size() + "}";
    }

    public static <I> Builder<I> builder(Alphabet<I> alphabet) {
        return new Builder<>(alphabet);
    }

    /**
     * Builder over an alphabet made of the given symbols; duplicates are dropped, first occurrence wins.
     */
    public static <I> Builder<I> builder(Collection<? extends I> symbols) {
        return new Builder<>(alphabetOf(symbols));
    }

    static <I> Alphabet<I> alphabetOf(Collection<? extends I> symbols) {
        return Alphabets.fromCollection(new ArrayList<I>(new LinkedHashSet<I>(symbols)));
    }

    /**
     * Private snapshot of the symbols, so that a growing alphabet changed by its owner after the builder was
     * created cannot reach the automaton.
     */
    static <I> Alphabet<I> snapshot(Alphabet<I> alphabet) {
        return Alphabets.fromCollection(new ArrayList<I>(alphabet));
    }

    public static final class Builder<I> {
        private final Alphabet<I> alphabet;
        private final IntSortedSet states = new IntRBTreeSet();
        private final IntSortedSet accepting = new IntRBTreeSet();
        private final DeterministicTable.Builder<I> table = DeterministicTable.builder();
        private int start = DeterministicTable.MISSING;
        private boolean hasStart;

        private Builder(Alphabet<I> alphabet) {
            this.alphabet = snapshot(Objects.requireNonNull(alphabet, "alphabet"));
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

        public Builder<I> setStart(int state) {
            this.start = state;
            this.hasStart = true;
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

        public Builder<I> setAccepting(int... acceptingStates) {
            for (int state : acceptingStates) {
                accepting.add(state);
            }
            return this;
        }

        /**
         * @throws MalformedAutomatonException if the target is negative or (source, symbol) already leads to a
         * different target
         */
        public Builder<I> addTransition(int source, I symbol, int target) {
            if (target < 0) {
                throw new MalformedAutomatonException("Negative state id: " + target);
            }
            final int previous = table.put(source, symbol, target);
            if (previous != DeterministicTable.MISSING && previous != target) {
                throw new MalformedAutomatonException("Nondeterministic transition from " + source + " on " + symbol
                                                      + ": " + previous + " and " + target);
            }
            return this;
        }

        /**
         * Validates and freezes the automaton.
         *
         * @throws MalformedAutomatonException if start, accepting or transitions refer outside the states or
         * the alphabet
         */
        public FiniteDFA<I> build() {
            if (!states.isEmpty() && states.firstInt() < 0) {
                throw new MalformedAutomatonException("Negative state id: " + states.firstInt());
            }
            if (!hasStart) {
                throw new MalformedAutomatonException("No start state");
            }
            if (!states.contains(start)) {
                throw new MalformedAutomatonException("Start state " + start + " is not a state");
            }
            checkSubset(accepting, states);
            table.forEach((source, symbol, target) -> {
                if (!states.contains(source) || !states.contains(target)) {
                    throw new MalformedAutomatonException("Transition " + source + " -" + symbol + "-> " + target
                                                          + " leaves the state set");
                }
                if (!alphabet.contains(symbol)) {
                    throw new MalformedAutomatonException("Transition symbol " + symbol + " is not in the alphabet");
                }
            });
            return new FiniteDFA<>(alphabet,
                                   IntSortedSets.unmodifiable(new IntRBTreeSet(states)),
                                   start,
                                   IntSortedSets.unmodifiable(new IntRBTreeSet(accepting)),
                                   table.build());
        }
    }

    static void checkSubset(IntSortedSet accepting, IntSortedSet states) {
        for (IntIterator it = accepting.iterator(); it.hasNext();) {
            final int q = it.nextInt();
            if (!states.contains(q)) {
                throw new MalformedAutomatonException("Accepting state " + q + " is not a state");
            }
        }
    }
}
