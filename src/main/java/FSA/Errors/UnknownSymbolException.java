package FSA.Errors;

public class UnknownSymbolException extends AutomatonException {
    private final Object symbol;

    public UnknownSymbolException(Object symbol) {
        super("Symbol not in alphabet: " + symbol);
        this.symbol = symbol;
    }

    public Object getSymbol() {
        return symbol;
    }
}
