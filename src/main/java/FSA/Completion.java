package FSA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.OptionalInt;

import FSA.Model.DeterministicTable;
import FSA.Model.FiniteDFA;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes DFAs total by routing every undefined transition into a sink ("devil") state.
 */
public final class Completion {
    private static final Logger LOGGER = LoggerFactory.getLogger(Completion.class);

    private Completion() {}

    /**
     * Finds a state that loops to itself on every symbol. Only non-accepting states qualify: an accepting
     * self-loop accepts every suffix and must not double as the rejecting sink.
     *
     * @return the lowest such state, if any
     */
    public static <I> OptionalInt findSink(FiniteDFA<I> dfa) {
        states:
        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            if (dfa.isAccepting(q)) {
                continue;
            }
            for (I a : dfa.getAlphabet()) {
                if (dfa.getSuccessor(q, a) != q) {
                    continue states;
                }
            }
            return OptionalInt.of(q);
        }
        return OptionalInt.empty();
    }

    /**
     * Fills every undefined transition with a sink state: an existing one found by {@link #findSink}, or a
     * fresh state from {@link #freshState}. A complete DFA is returned as is.
     */
    public static <I> FiniteDFA<I> complete(FiniteDFA<I> dfa) {
        if (dfa.isComplete()) {
            return dfa;
        }
        return fill(dfa, dfa.getAlphabet());
    }

    /**
     * Completes the DFA over a larger alphabet. Symbols the DFA does not know lead into the sink from every
     * state.
     *
     * @param symbols symbols to add; those already in the alphabet are ignored
     */
    public static <I> FiniteDFA<I> complete(FiniteDFA<I> dfa, Collection<? extends I> symbols) {
        final Alphabet<I> joined = join(dfa.getAlphabet(), symbols);
        if (joined.size() == dfa.getAlphabet().size()) {
            return complete(dfa);
        }
        return fill(dfa, joined);
    }

    private static <I> FiniteDFA<I> fill(FiniteDFA<I> dfa, Alphabet<I> alphabet) {
        final FiniteDFA.Builder<I> out = copyOf(dfa, alphabet);

        // a sink found over the old alphabet gets its loops on added symbols from the fill loop below
        final OptionalInt existing = findSink(dfa);
        final int sink = existing.orElseGet(() -> freshState(dfa.getStates()));
        if (existing.isEmpty()) {
            out.addState(sink);
            LOGGER.debug("Adding sink state {} to a DFA of {} states", sink, dfa.size());
        }

        int filled = 0;
        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            for (I a : alphabet) {
                if (dfa.getSuccessor(q, a) == DeterministicTable.MISSING) {
                    out.addTransition(q, a, sink);
                    filled++;
                }
            }
        }
        if (existing.isEmpty()) {
            for (I a : alphabet) {
                out.addTransition(sink, a, sink);
            }
        }
        LOGGER.debug("Completion filled {} undefined transitions", filled);
        return out.build();
    }

    /**
     * One above the largest state, or the smallest unused id once the largest is {@link Integer#MAX_VALUE}.
     */
    static int freshState(IntSortedSet states) {
        final int last = states.lastInt();
        if (last < Integer.MAX_VALUE) {
            return last + 1;
        }
        int candidate = 0;
        for (IntIterator it = states.iterator(); it.hasNext();) {
            if (it.nextInt() != candidate) {
                break;
            }
            candidate++;
        }
        return candidate;
    }

    /**
     * Copies states, start, acceptance and transitions into a builder over the given alphabet.
     */
    static <I> FiniteDFA.Builder<I> copyOf(FiniteDFA<I> dfa, Alphabet<I> alphabet) {
        final FiniteDFA.Builder<I> out = FiniteDFA.builder(alphabet);
        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            out.addState(q, dfa.isAccepting(q));
        }
        out.setStart(dfa.getStart());
        dfa.getTable().forEach(out::addTransition);
        return out;
    }

    static <I> Alphabet<I> join(Alphabet<I> first, Collection<? extends I> second) {
        boolean grows = false;
        for (I a : second) {
            if (!first.contains(a)) {
                grows = true;
                break;
            }
        }
        if (!grows) {
            return first;
        }
        final LinkedHashSet<I> symbols = new LinkedHashSet<>(first);
        symbols.addAll(second);
        return Alphabets.fromCollection(new ArrayList<>(symbols));
    }
}
