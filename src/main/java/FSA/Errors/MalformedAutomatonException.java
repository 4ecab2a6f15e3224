package FSA.Errors;

/**
 * Raised when building an automaton whose start, accepting or transition data refers to states
 * (or symbols) it does not own.
 */
public class MalformedAutomatonException extends AutomatonException {
    public MalformedAutomatonException(String message) {
        super(message);
    }
}
