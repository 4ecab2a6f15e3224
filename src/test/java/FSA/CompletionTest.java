package FSA;

import java.util.List;
import java.util.OptionalInt;

import FSA.Model.DeterministicTable;
import FSA.Model.FiniteDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Samples.word;

public class CompletionTest {
  @Test
  void testFindSink() {
    FiniteDFA<Character> withDead = FiniteDFA.builder(word("ab"))
        .addStates(0, 1)
        .setStart(0)
        .setAccepting(0)
        .addTransition(0, 'a', 0)
        .addTransition(0, 'b', 1)
        .addTransition(1, 'a', 1)
        .addTransition(1, 'b', 1)
        .build();
    // state 0 is not a self-loop on 'b'; state 1 is
    Assertions.assertEquals(OptionalInt.of(1), Completion.findSink(withDead));

    FiniteDFA<Character> acceptingLoop = FiniteDFA.builder(word("ab"))
        .addStates(0, 1)
        .setStart(0)
        .setAccepting(1)
        .addTransition(0, 'a', 1)
        .addTransition(1, 'a', 1)
        .addTransition(1, 'b', 1)
        .build();
    // an accepting self-loop is not a sink
    Assertions.assertEquals(OptionalInt.empty(), Completion.findSink(acceptingLoop));
  }

  @Test
  void testCompleteAddsSink() {
    FiniteDFA<Character> partial = FiniteDFA.builder(word("ab"))
        .addStates(0, 4)
        .setStart(0)
        .setAccepting(4)
        .addTransition(0, 'a', 4)
        .build();
    FiniteDFA<Character> completed = Completion.complete(partial);

    Assertions.assertTrue(completed.isComplete());
    Assertions.assertEquals(3, completed.size());
    Assertions.assertTrue(completed.getStates().contains(5)); // max + 1
    Assertions.assertFalse(completed.isAccepting(5));
    Assertions.assertEquals(5, completed.getSuccessor(0, 'b'));
    Assertions.assertEquals(5, completed.getSuccessor(5, 'a'));
    Assertions.assertEquals(4, completed.getSuccessor(0, 'a'));

    // the input is untouched
    Assertions.assertFalse(partial.isComplete());
    Assertions.assertEquals(2, partial.size());
    Assertions.assertEquals(DeterministicTable.MISSING, partial.getSuccessor(0, 'b'));
  }

  @Test
  void testCompleteReusesExistingSink() {
    FiniteDFA<Character> partial = FiniteDFA.builder(word("ab"))
        .addStates(0, 1, 2)
        .setStart(0)
        .setAccepting(1)
        .addTransition(0, 'a', 1)
        .addTransition(2, 'a', 2)
        .addTransition(2, 'b', 2)
        .build();
    FiniteDFA<Character> completed = Completion.complete(partial);
    Assertions.assertEquals(3, completed.size());
    Assertions.assertEquals(2, completed.getSuccessor(0, 'b'));
    Assertions.assertEquals(2, completed.getSuccessor(1, 'a'));
  }

  @Test
  void testCompleteIsIdempotent() {
    FiniteDFA<Character> once = Samples.oneString("ab");
    FiniteDFA<Character> twice = Completion.complete(once);
    Assertions.assertSame(once, twice);
    Assertions.assertEquals(4, twice.size());
  }

  @Test
  void testCompleteAtLargestStateId() {
    FiniteDFA<Character> dfa = FiniteDFA.builder(word("ab"))
        .addStates(0, 1, Integer.MAX_VALUE)
        .setStart(0)
        .setAccepting(Integer.MAX_VALUE, true)
        .addTransition(0, 'a', 1)
        .addTransition(1, 'a', Integer.MAX_VALUE)
        .build();
    FiniteDFA<Character> completed = dfa.complete();

    Assertions.assertTrue(completed.isComplete());
    Assertions.assertEquals(4, completed.size());
    // first gap in 0, 1, MAX_VALUE
    Assertions.assertEquals(2, completed.getSuccessor(0, 'b'));
    Assertions.assertTrue(completed.accepts(word("aa")));
    Assertions.assertFalse(completed.accepts(word("ab")));
  }

  @Test
  void testCompleteOverLargerAlphabet() {
    FiniteDFA<Character> ab = Samples.oneString("ab");
    FiniteDFA<Character> extended = Completion.complete(ab, List.of('a', 'b', 'c'));

    Assertions.assertEquals(3, extended.getAlphabet().size());
    Assertions.assertTrue(extended.isComplete());
    Assertions.assertEquals(4, extended.size()); // existing sink reused
    Assertions.assertTrue(extended.accepts(word("ab")));
    Assertions.assertFalse(extended.accepts(word("abc")));
    Assertions.assertFalse(extended.accepts(word("cab")));

    Assertions.assertSame(ab, Completion.complete(ab, List.of('b')));
  }
}
