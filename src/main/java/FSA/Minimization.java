package FSA;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import FSA.Model.DeterministicTable;
import FSA.Model.FiniteDFA;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Myhill-Nerode minimization of DFAs by partition refinement.
 * <p>
 * Undefined transitions are kept undefined: a partial DFA minimizes to a partial DFA, and a state with a
 * hole is never merged with a state that has an explicit transition on the same symbol.
 */
public final class Minimization {
    private static final Logger LOGGER = LoggerFactory.getLogger(Minimization.class);

    private Minimization() {}

    /**
     * States reachable from the start state by any sequence of transitions.
     */
    public static <I> IntSortedSet reachable(FiniteDFA<I> dfa) {
        final IntSortedSet visited = new IntRBTreeSet();
        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        visited.add(dfa.getStart());
        pending.enqueue(dfa.getStart());
        while (!pending.isEmpty()) {
            final int q = pending.dequeueInt();
            for (I a : dfa.getAlphabet()) {
                final int r = dfa.getSuccessor(q, a);
                if (r != DeterministicTable.MISSING && visited.add(r)) {
                    pending.enqueue(r);
                }
            }
        }
        return visited;
    }

    /**
     * Returns the minimal DFA accepting the same words. Unreachable states are dropped before refinement;
     * the states of the result are numbered 0..n-1 in breadth-first order from the start state, so
     * minimizing a minimal DFA reproduces it up to that numbering.
     */
    public static <I> FiniteDFA<I> minimize(FiniteDFA<I> dfa) {
        final IntSortedSet reachable = reachable(dfa);

        final ObjectList<IntSortedSet> blocks = new ObjectArrayList<>();
        final Int2IntMap blockOf = new Int2IntOpenHashMap(reachable.size());
        initialPartition(dfa, reachable, blocks, blockOf);

        final Deque<Splitter<I>> pending = new ArrayDeque<>();
        for (int b = 0; b < blocks.size(); b++) {
            pushAll(pending, b, dfa);
        }

        while (!pending.isEmpty()) {
            final Splitter<I> splitter = pending.poll();
            // snapshot, the splitter block itself may be split below
            final IntSortedSet target = new IntRBTreeSet(blocks.get(splitter.block()));
            final int blockCount = blocks.size();
            for (int b = 0; b < blockCount; b++) {
                final IntSortedSet block = blocks.get(b);
                if (block.size() < 2) {
                    continue;
                }
                final IntSortedSet inside = new IntRBTreeSet();
                final IntSortedSet outside = new IntRBTreeSet();
                for (IntIterator it = block.iterator(); it.hasNext();) {
                    final int q = it.nextInt();
                    final int r = dfa.getSuccessor(q, splitter.symbol());
                    if (r != DeterministicTable.MISSING && target.contains(r)) {
                        inside.add(q);
                    } else {
                        outside.add(q);
                    }
                }
                if (!inside.isEmpty() && !outside.isEmpty()) {
                    final int split = blocks.size();
                    blocks.set(b, inside);
                    blocks.add(outside);
                    for (IntIterator it = outside.iterator(); it.hasNext();) {
                        blockOf.put(it.nextInt(), split);
                    }
                    pushAll(pending, b, dfa);
                    pushAll(pending, split, dfa);
                }
            }
        }

        final FiniteDFA<I> minimized = quotient(dfa, blocks, blockOf);
        LOGGER.debug("Minimized {} states ({} reachable) to {}", dfa.size(), reachable.size(), minimized.size());
        return minimized;
    }

    /**
     * Brzozowski's double reversal: determinizing the reverse twice yields the minimal complete DFA.
     */
    public static <I> FiniteDFA<I> brzozowski(FiniteDFA<I> dfa) {
        final FiniteDFA<I> step1 = PowersetDeterminizer.determinize(NFATrim.reverse(dfa));
        LOGGER.debug("Brzozowski step 1: {} states", step1.size());
        return PowersetDeterminizer.determinize(NFATrim.reverse(step1));
    }

    private static <I> void initialPartition(FiniteDFA<I> dfa,
                                             IntSortedSet reachable,
                                             ObjectList<IntSortedSet> blocks,
                                             Int2IntMap blockOf) {
        final IntSortedSet accepting = new IntRBTreeSet();
        final IntSortedSet rejecting = new IntRBTreeSet();
        for (IntIterator it = reachable.iterator(); it.hasNext();) {
            final int q = it.nextInt();
            (dfa.isAccepting(q) ? accepting : rejecting).add(q);
        }
        for (IntSortedSet block : new IntSortedSet[] {accepting, rejecting}) {
            if (block.isEmpty()) {
                continue;
            }
            final int b = blocks.size();
            blocks.add(block);
            for (IntIterator it = block.iterator(); it.hasNext();) {
                blockOf.put(it.nextInt(), b);
            }
        }
    }

    private static <I> void pushAll(Deque<Splitter<I>> pending, int block, FiniteDFA<I> dfa) {
        for (I a : dfa.getAlphabet()) {
            pending.add(new Splitter<>(block, a));
        }
    }

    /**
     * One state per block, transitions taken from any member since all members agree.
     */
    private static <I> FiniteDFA<I> quotient(FiniteDFA<I> dfa, ObjectList<IntSortedSet> blocks, Int2IntMap blockOf) {
        final FiniteDFA.Builder<I> out = FiniteDFA.builder(dfa.getAlphabet());
        final int[] number = new int[blocks.size()];
        Arrays.fill(number, -1);

        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        final int startBlock = blockOf.get(dfa.getStart());
        int next = 0;
        number[startBlock] = next++;
        pending.enqueue(startBlock);
        out.setStart(number[startBlock]);

        while (!pending.isEmpty()) {
            final int b = pending.dequeueInt();
            final int representative = blocks.get(b).firstInt();
            out.addState(number[b], dfa.isAccepting(representative));
            for (I a : dfa.getAlphabet()) {
                final int r = dfa.getSuccessor(representative, a);
                if (r == DeterministicTable.MISSING) {
                    continue;
                }
                final int target = blockOf.get(r);
                if (number[target] < 0) {
                    number[target] = next++;
                    pending.enqueue(target);
                }
                out.addTransition(number[b], a, number[target]);
            }
        }
        return out.build();
    }

    private record Splitter<I>(int block, I symbol) {}
}
