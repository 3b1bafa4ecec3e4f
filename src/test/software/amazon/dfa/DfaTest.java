package software.amazon.dfa;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DfaTest {

    /**
     * Binary numbers divisible by three: the state is the value read so far, mod 3.
     */
    static Dfa divisibleByThree() {
        Dfa dfa = Dfa.builder()
                .withAlphabet("01")
                .withStateCount(3)
                .withInitialState(0)
                .withAcceptingStates(0)
                .build();
        dfa.addTransition(0, '0', 0);
        dfa.addTransition(0, '1', 1);
        dfa.addTransition(1, '0', 2);
        dfa.addTransition(1, '1', 0);
        dfa.addTransition(2, '0', 1);
        dfa.addTransition(2, '1', 2);
        return dfa;
    }

    private static Dfa emptyBinary(boolean overriding) {
        return Dfa.builder()
                .withAlphabet("01")
                .withStateCount(3)
                .withInitialState(0)
                .withAcceptingStates(0)
                .withOverridesForDuplicateTransitions(overriding)
                .build();
    }

    @Test
    public void testDivisibleByThree() {
        Dfa dfa = divisibleByThree();
        assertTrue(dfa.isComplete());
        assertEquals(Outcome.ACCEPTED, dfa.checkString("110"));
        assertEquals(Outcome.REJECTED, dfa.checkString("101"));
        assertEquals(Outcome.INVALID_SYMBOL, dfa.checkString("102"));
    }

    @Test
    public void testDivisibleByThreeAgreesWithArithmetic() {
        Dfa dfa = divisibleByThree();
        for (int n = 0; n < 1024; n++) {
            Outcome expected = n % 3 == 0 ? Outcome.ACCEPTED : Outcome.REJECTED;
            assertEquals("n=" + n, expected, dfa.checkString(Integer.toBinaryString(n)));
        }
    }

    @Test
    public void testMissingTransitionRefusesToRun() {
        Dfa dfa = emptyBinary(true);
        dfa.addTransition(0, '0', 0);
        dfa.addTransition(0, '1', 1);
        dfa.addTransition(1, '0', 2);
        dfa.addTransition(1, '1', 0);
        dfa.addTransition(2, '0', 1);

        assertFalse(dfa.isComplete());
        assertEquals(1, dfa.getIncompleteCellCount());
        // "0" never reaches state 2, the run is still refused
        assertEquals(Outcome.INCOMPLETE_TABLE, dfa.checkString("0"));
        assertEquals(Outcome.INCOMPLETE_TABLE, dfa.checkString(""));

        dfa.addTransition(2, '1', 2);
        assertEquals(Outcome.ACCEPTED, dfa.checkString("0"));
    }

    @Test
    public void testIncompleteTableIsReportedBeforeInvalidSymbols() {
        assertEquals(Outcome.INCOMPLETE_TABLE, emptyBinary(true).checkString("abc"));
    }

    @Test
    public void testInvalidSymbolStopsAtFirstOffender() {
        Dfa dfa = divisibleByThree();
        Evaluation evaluation = dfa.evaluate("1x2y");
        assertEquals(Outcome.INVALID_SYMBOL, evaluation.getOutcome());
        assertEquals(1, evaluation.getInvalidPosition());
        assertEquals('x', evaluation.getInvalidSymbol());
        assertEquals(Dfa.NO_STATE, evaluation.getFinalState());

        evaluation = dfa.evaluate("1100 ");
        assertEquals(4, evaluation.getInvalidPosition());
        assertEquals(' ', evaluation.getInvalidSymbol());
    }

    @Test
    public void testEvaluateReportsFinalState() {
        Dfa dfa = divisibleByThree();
        assertEquals(2, dfa.evaluate("101").getFinalState());
        assertEquals(0, dfa.evaluate("110").getFinalState());
        assertTrue(dfa.evaluate("110").isAccepted());
    }

    @Test
    public void testEmptyString() {
        assertEquals(Outcome.ACCEPTED, divisibleByThree().checkString(""));

        Dfa notInitial = Dfa.builder().withAlphabet("a").withStateCount(2).withInitialState(0)
                .withAcceptingStates(1).build();
        notInitial.addTransition(0, 'a', 1);
        notInitial.addTransition(1, 'a', 0);
        assertEquals(Outcome.REJECTED, notInitial.checkString(""));
        assertEquals(Outcome.ACCEPTED, notInitial.checkString("a"));
        assertEquals(Outcome.REJECTED, notInitial.checkString("aa"));
    }

    @Test
    public void testNoAcceptingStatesRejectsEverything() {
        Dfa dfa = Dfa.builder().withAlphabet("a").withStateCount(1).withInitialState(0).build();
        dfa.addTransition(0, 'a', 0);
        assertEquals(Outcome.REJECTED, dfa.checkString(""));
        assertEquals(Outcome.REJECTED, dfa.checkString("aaaa"));
        assertArrayEquals(new int[0], dfa.getAcceptingStates());
    }

    @Test
    public void testRepeatedChecksGiveTheSameOutcome() {
        Dfa dfa = divisibleByThree();
        for (int i = 0; i < 10; i++) {
            assertEquals(Outcome.ACCEPTED, dfa.checkString("1001"));
            assertEquals(Outcome.REJECTED, dfa.checkString("111"));
            assertEquals(Outcome.INVALID_SYMBOL, dfa.checkString("1a"));
        }
        assertTrue(dfa.isComplete());
    }

    @Test
    public void testReRegistrationCountsOnce() {
        Dfa dfa = emptyBinary(true);
        dfa.addTransition(0, '0', 0);
        assertEquals(5, dfa.getIncompleteCellCount());
        dfa.addTransition(0, '0', 1);
        assertEquals(5, dfa.getIncompleteCellCount());
        assertEquals(1, dfa.getTransition(0, '0'));

        // six writes to one cell must not look like a full table
        for (int i = 0; i < 5; i++) {
            dfa.addTransition(0, '0', 0);
        }
        assertEquals(5, dfa.getIncompleteCellCount());
        assertEquals(Outcome.INCOMPLETE_TABLE, dfa.checkString("0"));
    }

    @Test
    public void testLastWriteWins() {
        Dfa dfa = divisibleByThree();
        assertEquals(Outcome.REJECTED, dfa.checkString("1"));
        dfa.addTransition(0, '1', 0);
        assertTrue(dfa.isComplete());
        assertEquals(0, dfa.getIncompleteCellCount());
        assertEquals(0, dfa.getTransition(0, '1'));
        assertEquals(Outcome.ACCEPTED, dfa.checkString("1"));
    }

    @Test
    public void testUnknownTransitionSymbolIsReported() {
        Dfa dfa = emptyBinary(true);
        try {
            dfa.addTransition(0, '2', 1);
            fail("expected SymbolNotFoundException");
        } catch (SymbolNotFoundException e) {
            assertEquals('2', e.getSymbol());
            assertEquals("symbol '2' is not in the alphabet \"01\"", e.getMessage());
        }
        assertEquals(6, dfa.getIncompleteCellCount());
    }

    @Test
    public void testTransitionStatesAreRangeChecked() {
        Dfa dfa = emptyBinary(true);
        try {
            dfa.addTransition(3, '0', 1);
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals(3, e.getState());
            assertEquals(3, e.getStateCount());
            assertEquals("from state 3 is outside the state range [0, 3)", e.getMessage());
        }
        try {
            dfa.addTransition(0, '0', -1);
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals(-1, e.getState());
            assertThat(e.getMessage(), containsString("to state -1"));
        }
        assertEquals(6, dfa.getIncompleteCellCount());
    }

    @Test
    public void testDuplicateTransitionRejectedWithoutOverriding() {
        Dfa dfa = emptyBinary(false);
        dfa.addTransition(1, '1', 0);
        try {
            dfa.addTransition(1, '1', 2);
            fail("expected DuplicateTransitionException");
        } catch (DuplicateTransitionException e) {
            assertEquals("transition for state 1 on '1' is already set to 0, refusing to replace it with 2",
                    e.getMessage());
        }
        assertEquals(0, dfa.getTransition(1, '1'));
        assertEquals(5, dfa.getIncompleteCellCount());
    }

    @Test
    public void testAddTransitions() {
        Dfa dfa = emptyBinary(true);
        dfa.addTransitions(Arrays.asList(
                new Transition(0, '0', 0), new Transition(0, '1', 1),
                new Transition(1, '0', 2), new Transition(1, '1', 0),
                new Transition(2, '0', 1), new Transition(2, '1', 2)));
        assertTrue(dfa.isComplete());
        assertEquals(Outcome.ACCEPTED, dfa.checkString("1111"));
    }

    @Test
    public void testAddTransitionsAppliesNothingOnError() {
        Dfa dfa = emptyBinary(true);
        List<Transition> batch = Arrays.asList(
                new Transition(0, '0', 0), new Transition(0, '1', 1), new Transition(1, '0', 7));
        try {
            dfa.addTransitions(batch);
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals(7, e.getState());
        }
        assertEquals(6, dfa.getIncompleteCellCount());
        assertEquals(Dfa.NO_STATE, dfa.getTransition(0, '0'));
    }

    @Test
    public void testAddTransitionsDetectsDuplicatesInsideBatch() {
        Dfa dfa = emptyBinary(false);
        List<Transition> batch = Arrays.asList(
                new Transition(0, '0', 0), new Transition(2, '1', 1), new Transition(0, '0', 2));
        try {
            dfa.addTransitions(batch);
            fail("expected DuplicateTransitionException");
        } catch (DuplicateTransitionException e) {
            assertThat(e.getMessage(), containsString("already set to 0, refusing to replace it with 2"));
        }
        assertEquals(6, dfa.getIncompleteCellCount());

        dfa.addTransitions(Collections.singletonList(new Transition(0, '0', 1)));
        assertEquals(5, dfa.getIncompleteCellCount());
    }

    @Test
    public void testSymbolIndex() {
        Dfa dfa = divisibleByThree();
        assertEquals(0, dfa.symbolIndex('0'));
        assertEquals(1, dfa.symbolIndex('1'));
        assertEquals(Alphabet.NOT_FOUND, dfa.symbolIndex('2'));
    }

    @Test
    public void testGetTransition() {
        Dfa dfa = emptyBinary(true);
        assertEquals(Dfa.NO_STATE, dfa.getTransition(1, '0'));
        dfa.addTransition(1, '0', 2);
        assertEquals(2, dfa.getTransition(1, '0'));
    }

    @Test(expected = SymbolNotFoundException.class)
    public void testGetTransitionUnknownSymbol() {
        divisibleByThree().getTransition(0, 'z');
    }

    @Test(expected = InvalidStateException.class)
    public void testGetTransitionUnknownState() {
        divisibleByThree().getTransition(3, '0');
    }

    @Test
    public void testAccessors() {
        Dfa dfa = Dfa.builder()
                .withAlphabet(Alphabet.of("ab"))
                .withStateCount(4)
                .withInitialState(1)
                .withAcceptingStates(3, 0, 3)
                .withAcceptingStates(Collections.singletonList(2))
                .build();
        assertEquals(Alphabet.of("ab"), dfa.getAlphabet());
        assertEquals(4, dfa.getStateCount());
        assertEquals(1, dfa.getInitialState());
        assertArrayEquals(new int[] { 0, 2, 3 }, dfa.getAcceptingStates());
        assertTrue(dfa.isAccepting(3));
        assertFalse(dfa.isAccepting(1));
        assertEquals(8, dfa.getIncompleteCellCount());
    }

    @Test
    public void testBuilderRequiresAlphabet() {
        try {
            Dfa.builder().withStateCount(1).withInitialState(0).build();
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("alphabet must be set", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBuilderRequiresPositiveStateCount() {
        Dfa.builder().withAlphabet("a").withStateCount(0).withInitialState(0).build();
    }

    @Test
    public void testBuilderRangeChecksInitialState() {
        try {
            Dfa.builder().withAlphabet("a").withStateCount(3).withInitialState(3).build();
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals("initial state 3 is outside the state range [0, 3)", e.getMessage());
        }
    }

    @Test
    public void testBuilderRequiresInitialState() {
        try {
            Dfa.builder().withAlphabet("a").withStateCount(3).build();
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals(Dfa.NO_STATE, e.getState());
        }
    }

    @Test
    public void testBuilderRangeChecksAcceptingStates() {
        try {
            Dfa.builder().withAlphabet("a").withStateCount(3).withInitialState(0).withAcceptingStates(1, 5).build();
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals(5, e.getState());
            assertThat(e.getMessage(), containsString("accepting state 5"));
        }
    }

    @Test
    public void testDestroy() {
        Dfa dfa = divisibleByThree();
        assertFalse(dfa.isDestroyed());
        dfa.destroy();
        assertTrue(dfa.isDestroyed());
        assertEquals("DFA (destroyed)", dfa.toString());

        try {
            dfa.checkString("0");
            fail("expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("DFA has been destroyed", e.getMessage());
        }
        try {
            dfa.addTransition(0, '0', 0);
            fail("expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            dfa.destroy();
            fail("expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testToString() {
        String rendered = divisibleByThree().toString();
        assertThat(rendered, containsString("alphabet=\"01\" states=3 incomplete=0"));
        assertThat(rendered, containsString("->*0: 0->0 1->1\n"));
        assertThat(rendered, containsString("   1: 0->2 1->0\n"));

        Dfa partial = emptyBinary(true);
        partial.addTransition(2, '1', 0);
        assertThat(partial.toString(), containsString("   2: 0->- 1->0\n"));
    }
}
