package FSA.Errors;

/**
 * Raised when a run reaches a (state, symbol) pair without a transition.
 * The automaton was never completed; see {@link FSA.Completion#complete}.
 */
public class IncompleteTransitionException extends AutomatonException {
    private final int state;
    private final Object symbol;

    public IncompleteTransitionException(int state, Object symbol) {
        super("No transition from state " + state + " on symbol " + symbol);
        this.state = state;
        this.symbol = symbol;
    }

    public int getState() {
        return state;
    }

    public Object getSymbol() {
        return symbol;
    }
}
