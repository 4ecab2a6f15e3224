package FSA.Errors;

/**
 * Raised by product construction when an operand is not complete over the joint alphabet.
 */
public class IncompatibleAlphabetException extends AutomatonException {
    public IncompatibleAlphabetException(String message) {
        super(message);
    }
}
