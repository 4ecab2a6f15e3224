package FSA.Model;

import java.util.Map;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

/**
 * Immutable transition relation of an NFA: (state, symbol) to a set of targets, plus epsilon moves
 * (state to a set of targets, consuming no symbol).
 * <p>
 * Epsilon moves live in their own map instead of under a reserved symbol, so they can never be
 * confused with a real alphabet member.
 *
 * @param <I> symbol type
 */
public final class NondeterministicTable<I> {

    @FunctionalInterface
    public interface EpsilonConsumer {
        void accept(int source, int target);
    }

    private final Int2ObjectMap<Map<I, IntSortedSet>> rows;
    private final Int2ObjectMap<IntSortedSet> epsilon;
    private final int size;

    private NondeterministicTable(Int2ObjectMap<Map<I, IntSortedSet>> rows,
                                  Int2ObjectMap<IntSortedSet> epsilon,
                                  int size) {
        this.rows = rows;
        this.epsilon = epsilon;
        this.size = size;
    }

    /**
     * @return targets of (state, symbol); empty if there are none
     */
    public IntSortedSet get(int state, I symbol) {
        final Map<I, IntSortedSet> row = rows.get(state);
        if (row == null) {
            return IntSortedSets.EMPTY_SET;
        }
        final IntSortedSet targets = row.get(symbol);
        return targets == null ? IntSortedSets.EMPTY_SET : targets;
    }

    public IntSortedSet getEpsilon(int state) {
        final IntSortedSet targets = epsilon.get(state);
        return targets == null ? IntSortedSets.EMPTY_SET : targets;
    }

    public boolean hasEpsilon() {
        return !epsilon.isEmpty();
    }

    /**
     * @return number of (state, symbol, target) triples, epsilon moves included
     */
    public int size() {
        return size;
    }

    public void forEach(DeterministicTable.TransitionConsumer<? super I> action) {
        for (Int2ObjectMap.Entry<Map<I, IntSortedSet>> row : Int2ObjectMaps.fastIterable(rows)) {
            final int source = row.getIntKey();
            for (Map.Entry<I, IntSortedSet> entry : row.getValue().entrySet()) {
                for (IntIterator it = entry.getValue().iterator(); it.hasNext();) {
                    action.accept(source, entry.getKey(), it.nextInt());
                }
            }
        }
    }

    public void forEachEpsilon(EpsilonConsumer action) {
        for (Int2ObjectMap.Entry<IntSortedSet> row : Int2ObjectMaps.fastIterable(epsilon)) {
            for (IntIterator it = row.getValue().iterator(); it.hasNext();) {
                action.accept(row.getIntKey(), it.nextInt());
            }
        }
    }

    public static <I> Builder<I> builder() {
        return new Builder<>();
    }

    public static final class Builder<I> {
        private final Int2ObjectMap<Map<I, IntSortedSet>> rows = new Int2ObjectOpenHashMap<>();
        private final Int2ObjectMap<IntSortedSet> epsilon = new Int2ObjectOpenHashMap<>();
        private int size;

        public boolean add(int state, I symbol, int target) {
            final boolean added = rows.computeIfAbsent(state, s -> new Object2ObjectOpenHashMap<>())
                                      .computeIfAbsent(symbol, a -> new IntRBTreeSet())
                                      .add(target);
            if (added) {
                size++;
            }
            return added;
        }

        public boolean addEpsilon(int state, int target) {
            final boolean added = epsilon.computeIfAbsent(state, s -> new IntRBTreeSet()).add(target);
            if (added) {
                size++;
            }
            return added;
        }

        public void forEach(DeterministicTable.TransitionConsumer<? super I> action) {
            for (Int2ObjectMap.Entry<Map<I, IntSortedSet>> row : Int2ObjectMaps.fastIterable(rows)) {
                for (Map.Entry<I, IntSortedSet> entry : row.getValue().entrySet()) {
                    for (IntIterator it = entry.getValue().iterator(); it.hasNext();) {
                        action.accept(row.getIntKey(), entry.getKey(), it.nextInt());
                    }
                }
            }
        }

        public void forEachEpsilon(EpsilonConsumer action) {
            for (Int2ObjectMap.Entry<IntSortedSet> row : Int2ObjectMaps.fastIterable(epsilon)) {
                for (IntIterator it = row.getValue().iterator(); it.hasNext();) {
                    action.accept(row.getIntKey(), it.nextInt());
                }
            }
        }

        public NondeterministicTable<I> build() {
            final Int2ObjectMap<Map<I, IntSortedSet>> rowsCopy = new Int2ObjectOpenHashMap<>(rows.size());
            for (Int2ObjectMap.Entry<Map<I, IntSortedSet>> row : Int2ObjectMaps.fastIterable(rows)) {
                final Map<I, IntSortedSet> rowCopy = new Object2ObjectOpenHashMap<>(row.getValue().size());
                for (Map.Entry<I, IntSortedSet> entry : row.getValue().entrySet()) {
                    rowCopy.put(entry.getKey(), frozen(entry.getValue()));
                }
                rowsCopy.put(row.getIntKey(), rowCopy);
            }
            final Int2ObjectMap<IntSortedSet> epsilonCopy = new Int2ObjectOpenHashMap<>(epsilon.size());
            for (Int2ObjectMap.Entry<IntSortedSet> row : Int2ObjectMaps.fastIterable(epsilon)) {
                epsilonCopy.put(row.getIntKey(), frozen(row.getValue()));
            }
            return new NondeterministicTable<>(rowsCopy, epsilonCopy, size);
        }

        private static IntSortedSet frozen(IntSortedSet targets) {
            return IntSortedSets.unmodifiable(new IntRBTreeSet(targets));
        }
    }
}
