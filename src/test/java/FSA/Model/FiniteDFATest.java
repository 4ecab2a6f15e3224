package FSA.Model;

import java.util.List;

import FSA.Errors.IncompleteTransitionException;
import FSA.Errors.MalformedAutomatonException;
import FSA.Errors.UnknownSymbolException;
import FSA.Samples;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.alphabet.impl.GrowingMapAlphabet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Samples.word;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FiniteDFATest {
  private static FiniteDFA.Builder<Character> partialAB() {
    // accepts exactly "ab", no sink
    return FiniteDFA.builder(word("ab"))
        .addStates(0, 1, 2)
        .setStart(0)
        .setAccepting(2)
        .addTransition(0, 'a', 1)
        .addTransition(1, 'b', 2);
  }

  @Test
  void testRun() {
    FiniteDFA<Character> dfa = partialAB().build();
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals(2, dfa.getAlphabet().size());
    Assertions.assertEquals(0, dfa.run(word("")));
    Assertions.assertEquals(1, dfa.run(word("a")));
    Assertions.assertEquals(2, dfa.run(word("ab")));
    Assertions.assertTrue(dfa.accepts(word("ab")));
    Assertions.assertFalse(dfa.accepts(word("a")));
    Assertions.assertFalse(dfa.isComplete());
  }

  @Test
  void testRunFailures() {
    FiniteDFA<Character> dfa = partialAB().build();

    UnknownSymbolException unknown = assertThrows(UnknownSymbolException.class, () -> dfa.run(word("ac")));
    Assertions.assertEquals('c', unknown.getSymbol());

    IncompleteTransitionException hole =
        assertThrows(IncompleteTransitionException.class, () -> dfa.run(word("aa")));
    Assertions.assertEquals(1, hole.getState());
    Assertions.assertEquals('a', hole.getSymbol());

    // a completed DFA never hits a hole
    FiniteDFA<Character> completed = dfa.complete();
    Assertions.assertFalse(completed.accepts(word("aa")));
  }

  @Test
  void testMalformed() {
    assertThrows(MalformedAutomatonException.class,
        () -> FiniteDFA.builder(word("ab")).addStates(0, 1).build()); // no start
    assertThrows(MalformedAutomatonException.class,
        () -> FiniteDFA.builder(word("ab")).addStates(0, 1).setStart(2).build());
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().setAccepting(7).build());
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().addTransition(2, 'a', 9).build());
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().addTransition(9, 'a', 0).build());
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().addTransition(2, 'z', 0).build());
    assertThrows(MalformedAutomatonException.class,
        () -> FiniteDFA.builder(word("ab")).addStates(-1, 0).setStart(0).build());
    // second target for the same (state, symbol)
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().addTransition(0, 'a', 2));
    // repeating an identical transition is fine
    Assertions.assertNotNull(partialAB().addTransition(0, 'a', 1).build());
    assertThrows(MalformedAutomatonException.class,
        () -> partialAB().addTransition(2, 'a', DeterministicTable.MISSING));
  }

  @Test
  void testTableCountsEachEntryOnce() {
    DeterministicTable.Builder<Character> table = DeterministicTable.builder();
    Assertions.assertEquals(DeterministicTable.MISSING, table.put(0, 'a', DeterministicTable.MISSING));
    Assertions.assertEquals(DeterministicTable.MISSING, table.put(0, 'a', 1));
    table.put(0, 'b', 1);
    Assertions.assertEquals(2, table.build().size());
  }

  @Test
  void testAlphabetChangedAfterBuild() {
    GrowingMapAlphabet<Character> alphabet = new GrowingMapAlphabet<>();
    alphabet.addSymbol('a');
    FiniteDFA<Character> loop = FiniteDFA.builder(alphabet)
        .addState(0, true)
        .setStart(0)
        .addTransition(0, 'a', 0)
        .build();
    alphabet.addSymbol('b');

    Assertions.assertEquals(1, loop.getAlphabet().size());
    Assertions.assertTrue(loop.isComplete());
    Assertions.assertTrue(loop.accepts(word("aa")));
    UnknownSymbolException e = assertThrows(UnknownSymbolException.class, () -> loop.run(word("b")));
    Assertions.assertEquals('b', e.getSymbol());
  }

  @Test
  void testDeterminismOfCompleteDFA() {
    FiniteDFA<Character> dfa = Samples.oneString("cat", "catdog");
    Assertions.assertTrue(dfa.isComplete());
    Assertions.assertEquals(dfa.size() * dfa.getAlphabet().size(), dfa.getTable().size());
    for (int q : dfa.getStates()) {
      for (Character a : dfa.getAlphabet()) {
        int r = dfa.getSuccessor(q, a);
        Assertions.assertNotEquals(DeterministicTable.MISSING, r);
        Assertions.assertTrue(dfa.getStates().contains(r));
      }
    }
  }

  @Test
  void testBuilderDoesNotAlias() {
    FiniteDFA.Builder<Character> builder = partialAB();
    FiniteDFA<Character> first = builder.build();
    builder.addState(3).addTransition(2, 'a', 3).setAccepting(3, true);
    FiniteDFA<Character> second = builder.build();

    Assertions.assertEquals(3, first.size());
    Assertions.assertEquals(DeterministicTable.MISSING, first.getSuccessor(2, 'a'));
    Assertions.assertEquals(4, second.size());
    Assertions.assertTrue(second.accepts(word("aba")));
    assertThrows(UnsupportedOperationException.class, () -> first.getStates().add(5));
  }

  @Test
  void testIntegerAlphabet() {
    FiniteDFA<Integer> parity = FiniteDFA.builder(Alphabets.integers(0, 1))
        .addState(0, true)
        .addState(1, false)
        .setStart(0)
        .addTransition(0, 0, 0)
        .addTransition(0, 1, 1)
        .addTransition(1, 0, 1)
        .addTransition(1, 1, 0)
        .build();
    Assertions.assertTrue(parity.isComplete());
    Assertions.assertTrue(parity.accepts(List.of(1, 0, 1)));
    Assertions.assertFalse(parity.accepts(List.of(1, 0, 0)));
  }
}
