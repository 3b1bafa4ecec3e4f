package software.amazon.dfa;

/**
 * Configuration for a Dfa. For descriptions of the options, see Dfa.Builder.
 */
class DfaConfiguration {

    private final boolean transitionOverriding;

    DfaConfiguration(boolean transitionOverriding) {
        this.transitionOverriding = transitionOverriding;
    }

    boolean isTransitionOverriding() {
        return transitionOverriding;
    }
}
