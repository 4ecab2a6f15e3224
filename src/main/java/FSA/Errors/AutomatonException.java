package FSA.Errors;

/**
 * Base class of every failure raised by the automaton algebra.
 * All of them signal a violated precondition; none is transient.
 */
public class AutomatonException extends RuntimeException {
    public AutomatonException(String message) {
        super(message);
    }
}
