package FSA.Registry;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;

/**
 * Canonical ids for the subsets of NFA states visited by subset construction.
 * <p>
 * A subset is keyed by its sorted member list, so equal subsets always share an id and the id space is
 * independent of how large the NFA's state numbers get. Ids are allocated densely from 0.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<IntList> key2State;
    private final ObjectList<IntSortedSet> subsets;

    public SubsetRegistry() {
        this.key2State = new Object2IntOpenHashMap<>();
        this.key2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.subsets = new ObjectArrayList<>();
    }

    /**
     * @return id of the subset, or {@link #MISSING_ELEMENT} if it was never registered
     */
    public int get(IntSortedSet subset) {
        return key2State.getInt(key(subset));
    }

    /**
     * Registers a new subset under the next free id.
     *
     * @return the allocated id
     * @throws IllegalStateException if the subset is already registered
     */
    public int put(IntSortedSet subset) {
        final int id = subsets.size();
        final int previous = key2State.putIfAbsent(key(subset), id);
        if (previous != MISSING_ELEMENT) {
            throw new IllegalStateException("Subset already registered as " + previous + ": " + subset);
        }
        subsets.add(IntSortedSets.unmodifiable(subset));
        return id;
    }

    public IntSortedSet getSubset(int id) {
        return subsets.get(id);
    }

    public int size() {
        return subsets.size();
    }

    private static IntList key(IntSortedSet subset) {
        return IntLists.unmodifiable(new IntArrayList(subset));
    }

    @Override
    public String toString() {
        return "SubsetRegistry" + subsets;
    }
}
