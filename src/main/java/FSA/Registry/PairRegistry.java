package FSA.Registry;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Arena of product states. Each pair (q1, q2) is assigned exactly one dense integer id; the id maps back
 * to its pair by array lookup.
 */
public class PairRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<IntIntPair> pair2State;
    private final IntList firsts;
    private final IntList seconds;

    public PairRegistry() {
        this.pair2State = new Object2IntOpenHashMap<>();
        this.pair2State.defaultReturnValue(MISSING_ELEMENT);
        this.firsts = new IntArrayList();
        this.seconds = new IntArrayList();
    }

    public int get(int first, int second) {
        return pair2State.getInt(IntIntImmutablePair.of(first, second));
    }

    /**
     * @return the id of (first, second), allocating the next id if the pair is new
     */
    public int getOrAdd(int first, int second) {
        final IntIntPair pair = IntIntImmutablePair.of(first, second);
        int id = pair2State.getInt(pair);
        if (id == MISSING_ELEMENT) {
            id = firsts.size();
            pair2State.put(pair, id);
            firsts.add(first);
            seconds.add(second);
        }
        return id;
    }

    public int first(int id) {
        return firsts.getInt(id);
    }

    public int second(int id) {
        return seconds.getInt(id);
    }

    public int size() {
        return firsts.size();
    }

    @Override
    public String toString() {
        return "PairRegistry{size=" + size() + "}";
    }
}
