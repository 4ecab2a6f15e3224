package FSA;

import FSA.Errors.IncompatibleAlphabetException;
import FSA.Model.DeterministicTable;
import FSA.Model.FiniteDFA;
import FSA.Model.ProductMode;
import FSA.Registry.PairRegistry;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boolean combinations of DFAs through the synchronized product, and complementation.
 * <p>
 * The product runs both operands side by side over the union of their alphabets, so both must be complete
 * over that union. Use {@link Completion#complete(FiniteDFA, java.util.Collection)} to extend an operand
 * built over a smaller alphabet; {@link #difference} does so on its own.
 */
public final class ProductConstruction {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductConstruction.class);

    /**
     * Decides acceptance of a product state from the acceptance of its two components.
     */
    @FunctionalInterface
    public interface AcceptRule {
        AcceptRule UNION = (inFirst, inSecond) -> inFirst || inSecond;
        AcceptRule INTERSECTION = (inFirst, inSecond) -> inFirst && inSecond;
        AcceptRule SYMMETRIC_DIFFERENCE = (inFirst, inSecond) -> inFirst ^ inSecond;

        boolean accept(boolean inFirst, boolean inSecond);
    }

    private ProductConstruction() {}

    public static <I> FiniteDFA<I> union(FiniteDFA<I> first, FiniteDFA<I> second) {
        return product(first, second, AcceptRule.UNION);
    }

    public static <I> FiniteDFA<I> intersection(FiniteDFA<I> first, FiniteDFA<I> second) {
        return product(first, second, AcceptRule.INTERSECTION);
    }

    public static <I> FiniteDFA<I> symmetricDifference(FiniteDFA<I> first, FiniteDFA<I> second) {
        return product(first, second, AcceptRule.SYMMETRIC_DIFFERENCE);
    }

    /**
     * Words accepted by {@code first} but not by {@code second}. Both operands are completed over the joint
     * alphabet first, so they may be partial or built over different alphabets.
     */
    public static <I> FiniteDFA<I> difference(FiniteDFA<I> first, FiniteDFA<I> second) {
        final FiniteDFA<I> left = Completion.complete(first, second.getAlphabet());
        final FiniteDFA<I> right = Completion.complete(second, first.getAlphabet());
        return intersection(left, complement(right));
    }

    /**
     * Completes the DFA, then swaps accepting and non-accepting states.
     */
    public static <I> FiniteDFA<I> complement(FiniteDFA<I> dfa) {
        final FiniteDFA<I> completed = Completion.complete(dfa);
        final FiniteDFA.Builder<I> out = Completion.copyOf(completed, completed.getAlphabet());
        for (IntIterator it = completed.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            out.setAccepting(q, !completed.isAccepting(q));
        }
        return out.build();
    }

    public static <I> FiniteDFA<I> product(FiniteDFA<I> first, FiniteDFA<I> second, AcceptRule rule) {
        return product(first, second, rule, ProductMode.EAGER);
    }

    /**
     * Synchronized product of two DFAs. States of the result are dense ids from a {@link PairRegistry}; a
     * state is accepting iff {@code rule} accepts the acceptance of its two components.
     *
     * @throws IncompatibleAlphabetException if an operand lacks a transition over the joint alphabet
     */
    public static <I> FiniteDFA<I> product(FiniteDFA<I> first,
                                           FiniteDFA<I> second,
                                           AcceptRule rule,
                                           ProductMode mode) {
        final Alphabet<I> alphabet = Completion.join(first.getAlphabet(), second.getAlphabet());
        checkComplete(first, alphabet, "first");
        checkComplete(second, alphabet, "second");

        final PairRegistry registry = new PairRegistry();
        final FiniteDFA.Builder<I> out = FiniteDFA.builder(alphabet);
        final int start = registry.getOrAdd(first.getStart(), second.getStart());
        out.setStart(start);

        switch (mode) {
            case EAGER -> {
                for (IntIterator it1 = first.getStates().iterator(); it1.hasNext();) {
                    final int q1 = it1.nextInt();
                    for (IntIterator it2 = second.getStates().iterator(); it2.hasNext();) {
                        registry.getOrAdd(q1, it2.nextInt());
                    }
                }
                for (int q = 0; q < registry.size(); q++) {
                    addProductState(first, second, rule, alphabet, registry, out, q);
                }
            }
            case REACHABLE -> {
                final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
                pending.enqueue(start);
                while (!pending.isEmpty()) {
                    final int q = pending.dequeueInt();
                    final int known = registry.size();
                    addProductState(first, second, rule, alphabet, registry, out, q);
                    for (int fresh = known; fresh < registry.size(); fresh++) {
                        pending.enqueue(fresh);
                    }
                }
            }
            default -> throw new IllegalStateException("Unexpected product mode: " + mode);
        }

        LOGGER.debug("{} product of {} x {} states: {} states", mode, first.size(), second.size(), registry.size());
        return out.build();
    }

    private static <I> void addProductState(FiniteDFA<I> first,
                                            FiniteDFA<I> second,
                                            AcceptRule rule,
                                            Alphabet<I> alphabet,
                                            PairRegistry registry,
                                            FiniteDFA.Builder<I> out,
                                            int q) {
        final int q1 = registry.first(q);
        final int q2 = registry.second(q);
        out.addState(q, rule.accept(first.isAccepting(q1), second.isAccepting(q2)));
        for (I a : alphabet) {
            final int r = registry.getOrAdd(first.getSuccessor(q1, a), second.getSuccessor(q2, a));
            out.addTransition(q, a, r);
        }
    }

    private static <I> void checkComplete(FiniteDFA<I> dfa, Alphabet<I> alphabet, String operand) {
        for (IntIterator it = dfa.getStates().iterator(); it.hasNext();) {
            final int q = it.nextInt();
            for (I a : alphabet) {
                if (dfa.getSuccessor(q, a) == DeterministicTable.MISSING) {
                    throw new IncompatibleAlphabetException(
                        "The " + operand + " operand has no transition from state " + q + " on " + a
                        + "; complete both operands over the joint alphabet " + alphabet);
                }
            }
        }
    }
}
