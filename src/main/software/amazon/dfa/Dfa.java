package software.amazon.dfa;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 *  A deterministic finite automaton over single-character symbols.
 *
 *  The alphabet, state count, initial state and accepting states are fixed when the automaton is built. The
 *  transition table starts out empty and is filled one cell at a time with addTransition; until every
 *  (state, symbol) cell has been set at least once, checkString answers {@link Outcome#INCOMPLETE_TABLE} instead of
 *  running.
 *
 *  The automaton is thread safe. The concurrency strategy is:
 *  Multi-thread reads assumed, single-thread update enforced by the write side of a read/write lock on
 *  addTransition/addTransitions/destroy. Evaluations hold the read side, so a transition overwritten after the table
 *  is complete is never observed halfway through a run.
 */
@ThreadSafe
public class Dfa {

    private static final Logger LOG = LoggerFactory.getLogger(Dfa.class);

    /**
     * Marks the absence of a state: an unset transition cell, or a run that did not reach the end of its input.
     */
    public static final int NO_STATE = -1;

    private final DfaConfiguration configuration;

    private final int stateCount;

    private final int initialState;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // The three below are released by destroy(); every access goes through ensureLive() under the lock.
    private Alphabet alphabet;

    private IntSet acceptingStates;

    private TransitionTable table;

    private boolean destroyed = false;

    protected Dfa(final DfaConfiguration configuration, final Alphabet alphabet, final int stateCount,
                  final int initialState, final IntSet acceptingStates) {
        this.configuration = configuration;
        this.alphabet = alphabet;
        this.stateCount = stateCount;
        this.initialState = initialState;
        this.acceptingStates = acceptingStates;
        this.table = new TransitionTable(stateCount, alphabet.size());
        LOG.debug("Built DFA with alphabet \"{}\", {} states, initial state {}, accepting states {}",
                alphabet, stateCount, initialState, acceptingStates);
    }

    /**
     * Find the symbol index of a character.
     *
     * @param symbol the character to look up
     * @return its position in the alphabet, or {@link Alphabet#NOT_FOUND}
     */
    public int symbolIndex(final char symbol) {
        lock.readLock().lock();
        try {
            ensureLive();
            return alphabet.indexOf(symbol);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Set the successor of {@code fromState} on {@code symbol}.
     *
     * The first write to a cell counts towards completing the table. A later write to the same cell replaces the
     * target if the automaton was built with transition overriding (the default), and is rejected otherwise.
     *
     * @param fromState the state the transition leaves
     * @param symbol the symbol read
     * @param toState the state the transition enters
     * @throws InvalidStateException if either state is outside [0, stateCount)
     * @throws SymbolNotFoundException if the symbol is not in the alphabet
     * @throws DuplicateTransitionException if the cell is already set and overriding is disabled
     */
    public void addTransition(final int fromState, final char symbol, final int toState) {
        lock.writeLock().lock();
        try {
            ensureLive();
            final int symbolIndex = validate(fromState, symbol, toState);
            if (!configuration.isTransitionOverriding() && table.isSet(fromState, symbolIndex)) {
                throw new DuplicateTransitionException(fromState, symbol, table.get(fromState, symbolIndex), toState);
            }
            put(fromState, symbolIndex, toState);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Add a batch of transitions. The batch is validated in full before any of it is applied, so either all
     * transitions land in the table or none do, and no reader sees part of the batch.
     *
     * @param transitions the transitions to add, applied in iteration order
     */
    public void addTransitions(@Nonnull final Collection<Transition> transitions) {
        lock.writeLock().lock();
        try {
            ensureLive();
            final int[] symbolIndexes = new int[transitions.size()];
            final IntSet batchCells = new IntOpenHashSet(transitions.size());
            int i = 0;
            for (Transition transition : transitions) {
                final int symbolIndex = validate(transition.getFrom(), transition.getSymbol(), transition.getTo());
                if (!configuration.isTransitionOverriding()) {
                    final int existing = table.get(transition.getFrom(), symbolIndex);
                    if (existing != TransitionTable.UNSET) {
                        throw new DuplicateTransitionException(transition.getFrom(), transition.getSymbol(),
                                existing, transition.getTo());
                    }
                    if (!batchCells.add(transition.getFrom() * alphabet.size() + symbolIndex)) {
                        throw new DuplicateTransitionException(transition.getFrom(), transition.getSymbol(),
                                findTarget(transitions, transition), transition.getTo());
                    }
                }
                symbolIndexes[i++] = symbolIndex;
            }
            i = 0;
            for (Transition transition : transitions) {
                put(transition.getFrom(), symbolIndexes[i++], transition.getTo());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Check whether the automaton accepts a string. Each character of the input is one symbol.
     *
     * @param input the string to run
     * @return {@link Outcome#INCOMPLETE_TABLE} if any transition has never been set, {@link Outcome#INVALID_SYMBOL}
     * at the first character outside the alphabet, otherwise ACCEPTED or REJECTED depending on the state reached
     */
    public Outcome checkString(@Nonnull final CharSequence input) {
        return evaluate(input).getOutcome();
    }

    /**
     * Same as {@link #checkString(CharSequence)}, reporting the final state, or the position of the offending
     * character.
     */
    public Evaluation evaluate(@Nonnull final CharSequence input) {
        lock.readLock().lock();
        try {
            ensureLive();
            if (!table.isComplete()) {
                return Evaluation.incompleteTable();
            }
            int state = initialState;
            final int length = input.length();
            for (int i = 0; i < length; i++) {
                final char c = input.charAt(i);
                final int symbolIndex = alphabet.indexOf(c);
                if (symbolIndex == Alphabet.NOT_FOUND) {
                    return Evaluation.invalidSymbol(i, c);
                }
                state = table.get(state, symbolIndex);
            }
            return Evaluation.completed(state, acceptingStates.contains(state));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Release the alphabet, the accepting states and the transition table. Any later call on this automaton,
     * including a second destroy, throws IllegalStateException.
     */
    public void destroy() {
        lock.writeLock().lock();
        try {
            ensureLive();
            destroyed = true;
            alphabet = null;
            acceptingStates = null;
            table = null;
            LOG.debug("Destroyed DFA with {} states", stateCount);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Look up a single transition.
     *
     * @return the successor state, or {@link #NO_STATE} if that cell has never been set
     */
    public int getTransition(final int state, final char symbol) {
        lock.readLock().lock();
        try {
            ensureLive();
            checkState("state", state);
            final int target = table.get(state, symbolIndexOrThrow(symbol));
            return target == TransitionTable.UNSET ? NO_STATE : target;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isComplete() {
        return getIncompleteCellCount() == 0;
    }

    /**
     * @return how many (state, symbol) cells have never been set
     */
    public int getIncompleteCellCount() {
        lock.readLock().lock();
        try {
            ensureLive();
            return table.getUnsetCells();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Alphabet getAlphabet() {
        lock.readLock().lock();
        try {
            ensureLive();
            return alphabet;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getStateCount() {
        return stateCount;
    }

    public int getInitialState() {
        return initialState;
    }

    /**
     * @return the distinct accepting states in ascending order
     */
    public int[] getAcceptingStates() {
        lock.readLock().lock();
        try {
            ensureLive();
            final int[] states = acceptingStates.toIntArray();
            Arrays.sort(states);
            return states;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isAccepting(final int state) {
        lock.readLock().lock();
        try {
            ensureLive();
            checkState("state", state);
            return acceptingStates.contains(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDestroyed() {
        lock.readLock().lock();
        try {
            return destroyed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Renders the transition table one state per line, e.g. {@code ->*0: 0->0 1->1}. Unset cells print as "-".
     * "->" marks the initial state and "*" accepting ones.
     */
    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            if (destroyed) {
                return "DFA (destroyed)";
            }
            final StringBuilder sb = new StringBuilder();
            sb.append("DFA alphabet=\"").append(alphabet).append("\" states=").append(stateCount)
                    .append(" incomplete=").append(table.getUnsetCells()).append('\n');
            for (int state = 0; state < stateCount; state++) {
                sb.append(state == initialState ? "->" : "  ")
                        .append(acceptingStates.contains(state) ? '*' : ' ')
                        .append(state).append(':');
                for (int symbolIndex = 0; symbolIndex < alphabet.size(); symbolIndex++) {
                    final int target = table.get(state, symbolIndex);
                    sb.append(' ').append(alphabet.symbolAt(symbolIndex)).append("->")
                            .append(target == TransitionTable.UNSET ? "-" : Integer.toString(target));
                }
                sb.append('\n');
            }
            return sb.toString();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void put(final int fromState, final int symbolIndex, final int toState) {
        final int previous = table.put(fromState, symbolIndex, toState);
        if (previous == TransitionTable.UNSET) {
            if (table.isComplete()) {
                LOG.debug("Transition table complete: {} states x {} symbols", stateCount, alphabet.size());
            }
        } else if (previous != toState) {
            LOG.debug("Transition for state {} on '{}' replaced: {} -> {}",
                    fromState, alphabet.symbolAt(symbolIndex), previous, toState);
        }
    }

    private int validate(final int fromState, final char symbol, final int toState) {
        checkState("from state", fromState);
        checkState("to state", toState);
        return symbolIndexOrThrow(symbol);
    }

    private int symbolIndexOrThrow(final char symbol) {
        final int symbolIndex = alphabet.indexOf(symbol);
        if (symbolIndex == Alphabet.NOT_FOUND) {
            throw new SymbolNotFoundException(symbol, alphabet);
        }
        return symbolIndex;
    }

    private void checkState(final String role, final int state) {
        if (state < 0 || state >= stateCount) {
            throw new InvalidStateException(role, state, stateCount);
        }
    }

    // The earlier occurrence of a duplicated cell within a batch.
    private static int findTarget(final Collection<Transition> transitions, final Transition duplicate) {
        for (Transition transition : transitions) {
            if (transition.getFrom() == duplicate.getFrom() && transition.getSymbol() == duplicate.getSymbol()) {
                return transition.getTo();
            }
        }
        return NO_STATE;
    }

    private void ensureLive() {
        if (destroyed) {
            throw new IllegalStateException("DFA has been destroyed");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private Alphabet alphabet;

        private int stateCount = 0;

        private int initialState = NO_STATE;

        private final IntSet acceptingStates = new IntOpenHashSet();

        /**
         * If true, registering a transition for a (state, symbol) cell that is already set replaces the earlier
         * target: the last write wins. When set to false, such a registration is rejected with a
         * DuplicateTransitionException and the table is left unchanged.
         * By default, transition overriding is true.
         */
        private boolean transitionOverriding = true;

        Builder() {}

        public Builder withAlphabet(@Nonnull final Alphabet alphabet) {
            this.alphabet = alphabet;
            return this;
        }

        public Builder withAlphabet(@Nonnull final String symbols) {
            return withAlphabet(Alphabet.of(symbols));
        }

        public Builder withStateCount(final int stateCount) {
            this.stateCount = stateCount;
            return this;
        }

        public Builder withInitialState(final int initialState) {
            this.initialState = initialState;
            return this;
        }

        /**
         * Add accepting states. Repeated states are tolerated.
         */
        public Builder withAcceptingStates(final int... states) {
            for (int state : states) {
                acceptingStates.add(state);
            }
            return this;
        }

        public Builder withAcceptingStates(@Nonnull final Collection<Integer> states) {
            for (Integer state : states) {
                acceptingStates.add(state.intValue());
            }
            return this;
        }

        public Builder withOverridesForDuplicateTransitions(final boolean transitionOverriding) {
            this.transitionOverriding = transitionOverriding;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the alphabet is missing or the state count is not positive
         * @throws InvalidStateException if the initial state or an accepting state is out of range
         */
        public Dfa build() {
            if (alphabet == null) {
                throw new IllegalArgumentException("alphabet must be set");
            }
            if (stateCount <= 0) {
                throw new IllegalArgumentException("stateCount must be positive, was " + stateCount);
            }
            if (initialState < 0 || initialState >= stateCount) {
                throw new InvalidStateException("initial state", initialState, stateCount);
            }
            for (int state : acceptingStates) {
                if (state < 0 || state >= stateCount) {
                    throw new InvalidStateException("accepting state", state, stateCount);
                }
            }
            return new Dfa(buildConfig(), alphabet, stateCount, initialState, new IntOpenHashSet(acceptingStates));
        }

        DfaConfiguration buildConfig() {
            return new DfaConfiguration(transitionOverriding);
        }
    }
}
