package FSA;

import FSA.Model.FiniteDFA;
import FSA.Model.FiniteNFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSA.Samples.word;

public class CompactConversionTest {
  @Test
  void testDFARoundTrip() {
    FiniteDFA<Character> dfa = Samples.countAs(3, 2).union(Samples.oneString("ab", Samples.AB));
    CompactDFA<Character> compact = CompactConversion.toCompactDFA(dfa);
    Assertions.assertEquals(dfa.size(), compact.size());

    FiniteDFA<Character> back = CompactConversion.fromCompactDFA(compact);
    Assertions.assertTrue(back.isComplete());
    for (String w : Samples.allWords(Samples.AB, 6)) {
      Assertions.assertEquals(dfa.accepts(word(w)), compact.accepts(word(w)), w);
      Assertions.assertEquals(dfa.accepts(word(w)), back.accepts(word(w)), w);
    }
  }

  @Test
  void testPartialDFAStaysPartial() {
    // sparse ids, no transitions out of 7
    FiniteDFA<Character> dfa = FiniteDFA.builder(word("ab"))
        .addStates(3, 7)
        .setStart(3)
        .setAccepting(7)
        .addTransition(3, 'a', 7)
        .build();
    CompactDFA<Character> compact = CompactConversion.toCompactDFA(dfa);
    Assertions.assertEquals(2, compact.size());
    Assertions.assertNull(compact.getSuccessor(compact.getInitialState(), Character.valueOf('b')));

    FiniteDFA<Character> back = CompactConversion.fromCompactDFA(compact);
    Assertions.assertFalse(back.isComplete());
    Assertions.assertTrue(back.accepts(word("a")));
    Assertions.assertTrue(LanguageChecks.isomorphic(dfa, back));
  }

  @Test
  void testNFARoundTrip() {
    FiniteNFA<Character> nfa = Samples.oneString("ab").reverse();
    CompactNFA<Character> compact = CompactConversion.toCompactNFA(nfa);
    Assertions.assertEquals(nfa.size(), compact.size());
    Assertions.assertEquals(1, compact.getInitialStates().size());

    FiniteNFA<Character> back = CompactConversion.fromCompactNFA(compact);
    for (String w : Samples.allWords(Samples.AB, 4)) {
      Assertions.assertEquals(nfa.accepts(word(w)), back.accepts(word(w)), w);
    }
  }

  @Test
  void testEpsilonNFARejected() {
    FiniteNFA<Character> nfa = FiniteNFA.builder(word("a"))
        .addStates(0, 1)
        .setInitial(0, true)
        .addEpsilonTransition(0, 1)
        .build();
    Assertions.assertThrows(IllegalArgumentException.class, () -> CompactConversion.toCompactNFA(nfa));
  }
}
