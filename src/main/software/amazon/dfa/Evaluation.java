package software.amazon.dfa;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * An {@link Outcome} together with where the run stopped. The final state is only known when the whole input was
 * consumed; the invalid position and symbol are only known for {@link Outcome#INVALID_SYMBOL}.
 */
@Immutable
@ThreadSafe
public final class Evaluation {

    public static final int NO_POSITION = -1;

    private static final Evaluation INCOMPLETE =
            new Evaluation(Outcome.INCOMPLETE_TABLE, Dfa.NO_STATE, NO_POSITION, '\0');

    private final Outcome outcome;
    private final int finalState;
    private final int invalidPosition;
    private final char invalidSymbol;

    private Evaluation(final Outcome outcome, final int finalState, final int invalidPosition,
                       final char invalidSymbol) {
        this.outcome = outcome;
        this.finalState = finalState;
        this.invalidPosition = invalidPosition;
        this.invalidSymbol = invalidSymbol;
    }

    static Evaluation completed(final int finalState, final boolean accepting) {
        return new Evaluation(accepting ? Outcome.ACCEPTED : Outcome.REJECTED, finalState, NO_POSITION, '\0');
    }

    static Evaluation incompleteTable() {
        return INCOMPLETE;
    }

    static Evaluation invalidSymbol(final int position, final char symbol) {
        return new Evaluation(Outcome.INVALID_SYMBOL, Dfa.NO_STATE, position, symbol);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    /**
     * @return the state the run ended in, or {@link Dfa#NO_STATE} if the run did not consume the whole input
     */
    public int getFinalState() {
        return finalState;
    }

    /**
     * @return offset of the first character outside the alphabet, or {@link #NO_POSITION}
     */
    public int getInvalidPosition() {
        return invalidPosition;
    }

    public char getInvalidSymbol() {
        if (outcome != Outcome.INVALID_SYMBOL) {
            throw new IllegalStateException("no invalid symbol for outcome " + outcome);
        }
        return invalidSymbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Evaluation that = (Evaluation) o;
        return finalState == that.finalState &&
                invalidPosition == that.invalidPosition &&
                invalidSymbol == that.invalidSymbol &&
                outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, finalState, invalidPosition, invalidSymbol);
    }

    @Override
    public String toString() {
        switch (outcome) {
            case ACCEPTED:
            case REJECTED:
                return outcome + " in state " + finalState;
            case INVALID_SYMBOL:
                return outcome + " '" + invalidSymbol + "' at " + invalidPosition;
            default:
                return outcome.toString();
        }
    }
}
