package software.amazon.dfa;

/**
 * Thrown when a transition cell is registered twice on an automaton built without transition overriding.
 */
public class DuplicateTransitionException extends DfaException {

    public DuplicateTransitionException(final int state, final char symbol, final int existing, final int rejected) {
        super(String.format("transition for state %d on '%c' is already set to %d, refusing to replace it with %d",
                state, symbol, existing, rejected));
    }
}
