package FSA.Model;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Immutable transition function of a DFA, mapping (state, symbol) to a single target state.
 * Absent entries answer {@link #MISSING}.
 *
 * @param <I> symbol type
 */
public final class DeterministicTable<I> {
    public static final int MISSING = -1;

    @FunctionalInterface
    public interface TransitionConsumer<I> {
        void accept(int source, I symbol, int target);
    }

    private final Int2ObjectMap<Object2IntMap<I>> rows;
    private final int size;

    private DeterministicTable(Int2ObjectMap<Object2IntMap<I>> rows, int size) {
        this.rows = rows;
        this.size = size;
    }

    public int get(int state, I symbol) {
        final Object2IntMap<I> row = rows.get(state);
        return row == null ? MISSING : row.getInt(symbol);
    }

    public boolean contains(int state, I symbol) {
        return get(state, symbol) != MISSING;
    }

    /**
     * @return number of (state, symbol) entries
     */
    public int size() {
        return size;
    }

    public void forEach(TransitionConsumer<? super I> action) {
        for (Int2ObjectMap.Entry<Object2IntMap<I>> row : Int2ObjectMaps.fastIterable(rows)) {
            final int source = row.getIntKey();
            for (Object2IntMap.Entry<I> entry : Object2IntMaps.fastIterable(row.getValue())) {
                action.accept(source, entry.getKey(), entry.getIntValue());
            }
        }
    }

    public static <I> Builder<I> builder() {
        return new Builder<>();
    }

    public static final class Builder<I> {
        private final Int2ObjectMap<Object2IntMap<I>> rows = new Int2ObjectOpenHashMap<>();
        private int size;

        /**
         * @return the previous target of (state, symbol), or {@link #MISSING}
         */
        public int put(int state, I symbol, int target) {
            Object2IntMap<I> row = rows.get(state);
            if (row == null) {
                row = newRow();
                rows.put(state, row);
            }
            if (!row.containsKey(symbol)) {
                size++;
            }
            return row.put(symbol, target);
        }

        public int get(int state, I symbol) {
            final Object2IntMap<I> row = rows.get(state);
            return row == null ? MISSING : row.getInt(symbol);
        }

        public void forEach(TransitionConsumer<? super I> action) {
            for (Int2ObjectMap.Entry<Object2IntMap<I>> row : Int2ObjectMaps.fastIterable(rows)) {
                for (Object2IntMap.Entry<I> entry : Object2IntMaps.fastIterable(row.getValue())) {
                    action.accept(row.getIntKey(), entry.getKey(), entry.getIntValue());
                }
            }
        }

        public DeterministicTable<I> build() {
            // copy so that later puts on this builder cannot leak into the built table
            final Int2ObjectMap<Object2IntMap<I>> copy = new Int2ObjectOpenHashMap<>(rows.size());
            for (Int2ObjectMap.Entry<Object2IntMap<I>> row : Int2ObjectMaps.fastIterable(rows)) {
                final Object2IntMap<I> rowCopy = newRow();
                rowCopy.putAll(row.getValue());
                copy.put(row.getIntKey(), rowCopy);
            }
            return new DeterministicTable<>(copy, size);
        }

        private static <I> Object2IntMap<I> newRow() {
            final Object2IntOpenHashMap<I> row = new Object2IntOpenHashMap<>();
            row.defaultReturnValue(MISSING);
            return row;
        }
    }
}
