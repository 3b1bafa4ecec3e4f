package software.amazon.dfa;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;

/**
 * The ordered set of input symbols an automaton consumes. A symbol's position in the sequence is its symbol index,
 * which addresses a column of the transition table.
 */
@Immutable
@ThreadSafe
public final class Alphabet {

    public static final int NOT_FOUND = -1;

    private final char[] symbols;

    private Alphabet(final char[] symbols) {
        this.symbols = symbols;
    }

    /**
     * Creates an alphabet from the characters of a string, in order.
     *
     * @param symbols every symbol of the alphabet, each appearing once
     * @return the alphabet
     * @throws IllegalArgumentException if the string is empty or repeats a character
     */
    public static Alphabet of(@Nonnull final String symbols) {
        return of(symbols.toCharArray());
    }

    public static Alphabet of(@Nonnull final char... symbols) {
        if (symbols.length == 0) {
            throw new IllegalArgumentException("alphabet must contain at least one symbol");
        }
        final char[] copy = Arrays.copyOf(symbols, symbols.length);
        for (int i = 1; i < copy.length; i++) {
            for (int j = 0; j < i; j++) {
                if (copy[i] == copy[j]) {
                    throw new IllegalArgumentException(
                            String.format("alphabet contains duplicate symbol '%c' at positions %d and %d",
                                    copy[i], j, i));
                }
            }
        }
        return new Alphabet(copy);
    }

    /**
     * Linear search for a symbol.
     *
     * @param symbol the symbol to look up
     * @return the symbol index, or {@link #NOT_FOUND} if the symbol is not part of the alphabet
     */
    public int indexOf(final char symbol) {
        for (int i = 0; i < symbols.length; i++) {
            if (symbols[i] == symbol) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public boolean contains(final char symbol) {
        return indexOf(symbol) != NOT_FOUND;
    }

    public char symbolAt(final int index) {
        if (index < 0 || index >= symbols.length) {
            throw new IndexOutOfBoundsException("symbol index " + index + " outside [0, " + symbols.length + ")");
        }
        return symbols[index];
    }

    public int size() {
        return symbols.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(symbols, ((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return new String(symbols);
    }
}
