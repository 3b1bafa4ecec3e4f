package software.amazon.dfa;

/**
 * Thrown when a state identifier falls outside {@code [0, stateCount)}.
 */
public class InvalidStateException extends DfaException {

    private final int state;
    private final int stateCount;

    public InvalidStateException(final String role, final int state, final int stateCount) {
        super(String.format("%s %d is outside the state range [0, %d)", role, state, stateCount));
        this.state = state;
        this.stateCount = stateCount;
    }

    public int getState() {
        return state;
    }

    public int getStateCount() {
        return stateCount;
    }
}
