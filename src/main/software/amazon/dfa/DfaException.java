package software.amazon.dfa;

/**
 * A RuntimeException that indicates an automaton was defined or populated incorrectly.
 */
public class DfaException extends RuntimeException {

    public DfaException(String msg) {
        super(msg);
    }

}
