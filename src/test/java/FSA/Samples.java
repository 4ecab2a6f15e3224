package FSA;

import java.util.ArrayList;
import java.util.List;

import FSA.Model.FiniteDFA;

/**
 * Small automata shared by the tests.
 */
public class Samples {
    public static final String AB = "ab";

    public static List<Character> word(String str) {
        final List<Character> result = new ArrayList<>(str.length());
        for (char c : str.toCharArray()) {
            result.add(c);
        }
        return result;
    }

    /**
     * DFA accepting exactly {@code str}: a chain 0 -> 1 -> ... -> len, with every other transition
     * going to a trailing sink, so the result is complete over {@code abc}.
     */
    public static FiniteDFA<Character> oneString(String str, String abc) {
        final FiniteDFA.Builder<Character> builder = FiniteDFA.builder(word(abc));
        final int len = str.length();
        for (int i = 0; i <= len; i++) {
            builder.addState(i);
        }
        builder.setStart(0).setAccepting(len, true);
        for (int i = 0; i < len; i++) {
            builder.addTransition(i, str.charAt(i), i + 1);
        }
        return builder.build().complete();
    }

    public static FiniteDFA<Character> oneString(String str) {
        return oneString(str, str);
    }

    /**
     * Every word over {@code abc} of length at most {@code maxLength}, shortest first.
     */
    public static List<String> allWords(String abc, int maxLength) {
        final List<String> result = new ArrayList<>();
        List<String> layer = List.of("");
        result.addAll(layer);
        for (int len = 1; len <= maxLength; len++) {
            final List<String> nextLayer = new ArrayList<>();
            for (String prefix : layer) {
                for (char c : abc.toCharArray()) {
                    nextLayer.add(prefix + c);
                }
            }
            result.addAll(nextLayer);
            layer = nextLayer;
        }
        return result;
    }

    /**
     * Words over {a,b} whose number of a's is divisible by {@code k}; the minimal DFA has k states.
     * Built with {@code copies} redundant copies of each counter state to give minimization work to do.
     */
    public static FiniteDFA<Character> countAs(int k, int copies) {
        final FiniteDFA.Builder<Character> builder = FiniteDFA.builder(word(AB));
        for (int c = 0; c < copies; c++) {
            for (int i = 0; i < k; i++) {
                final int q = c * k + i;
                final int nextCopy = (c + 1) % copies;
                builder.addState(q, i == 0);
                builder.addTransition(q, 'a', nextCopy * k + (i + 1) % k);
                builder.addTransition(q, 'b', nextCopy * k + i);
            }
        }
        return builder.setStart(0).build();
    }
}
