package software.amazon.dfa;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * One entry of the transition function: reading {@code symbol} in state {@code from} moves to state {@code to}.
 */
@Immutable
@ThreadSafe
public final class Transition {
    private final int from;
    private final char symbol;
    private final int to;

    public Transition(final int from, final char symbol, final int to) {
        this.from = from;
        this.symbol = symbol;
        this.to = to;
    }

    public int getFrom() {
        return from;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return from == that.from &&
                symbol == that.symbol &&
                to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, symbol, to);
    }

    @Override
    public String toString() {
        return "δ(" + from + "," + symbol + ")=" + to;
    }
}
