package software.amazon.dfa;

/**
 * Thrown when a transition names a symbol that is not part of the automaton's alphabet.
 */
public class SymbolNotFoundException extends DfaException {

    private final char symbol;

    public SymbolNotFoundException(final char symbol, final Alphabet alphabet) {
        super(String.format("symbol '%c' is not in the alphabet \"%s\"", symbol, alphabet));
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
