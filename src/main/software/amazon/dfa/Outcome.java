package software.amazon.dfa;

/**
 * The result of running an automaton against an input string.
 */
public enum Outcome {
    ACCEPTED,            // run ended in an accepting state
    REJECTED,            // run ended in a non-accepting state
    INCOMPLETE_TABLE,    // at least one transition cell was never set, nothing was run
    INVALID_SYMBOL;      // input contains a character outside the alphabet

    /**
     * @return true for the two outcomes that mean the string could not be classified
     */
    public boolean isError() {
        return this == INCOMPLETE_TABLE || this == INVALID_SYMBOL;
    }
}
