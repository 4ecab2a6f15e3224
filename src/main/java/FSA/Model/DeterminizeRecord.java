package FSA.Model;

import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * A visited subset of NFA states paired with the DFA state allocated for it.
 */
public record DeterminizeRecord(IntSortedSet subset, int dfaState) {

  @Override
  public String toString() {
    return dfaState + ": " + subset;
  }
}
