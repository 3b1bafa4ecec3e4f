package software.amazon.dfa;

import java.util.Arrays;

/**
 * Dense state-by-symbol table of successor states. Cells start out {@link #UNSET}; a counter of cells that have
 * never been written lets completeness be checked without a scan.
 *
 * Not thread safe on its own; {@link Dfa} guards every access.
 */
class TransitionTable {

    static final int UNSET = -1;

    private final int stateCount;
    private final int symbolCount;

    /**
     * Row-major: the cell for (state, symbolIndex) lives at {@code state * symbolCount + symbolIndex}.
     */
    private final int[] cells;

    /**
     * Number of cells that have never been set. Only the first write to a cell decrements it.
     */
    private int unsetCells;

    TransitionTable(final int stateCount, final int symbolCount) {
        if (stateCount <= 0) {
            throw new IllegalArgumentException("stateCount must be positive");
        }
        if (symbolCount <= 0) {
            throw new IllegalArgumentException("symbolCount must be positive");
        }
        final long size = (long) stateCount * symbolCount;
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException(
                    String.format("transition table of %d x %d cells is too large", stateCount, symbolCount));
        }
        this.stateCount = stateCount;
        this.symbolCount = symbolCount;
        this.cells = new int[(int) size];
        Arrays.fill(cells, UNSET);
        this.unsetCells = cells.length;
    }

    /**
     * @return the successor state, or {@link #UNSET} if the cell has never been written
     */
    int get(final int state, final int symbolIndex) {
        return cells[cellIndex(state, symbolIndex)];
    }

    /**
     * Writes a cell. Callers have already range-checked both states.
     *
     * @return the previous successor, or {@link #UNSET} if this is the first write to the cell
     */
    int put(final int state, final int symbolIndex, final int target) {
        if (target < 0) {
            throw new IllegalArgumentException("target cannot be negative");
        }
        final int idx = cellIndex(state, symbolIndex);
        final int previous = cells[idx];
        cells[idx] = target;
        if (previous == UNSET) {
            unsetCells--;
        }
        return previous;
    }

    boolean isSet(final int state, final int symbolIndex) {
        return get(state, symbolIndex) != UNSET;
    }

    int getUnsetCells() {
        return unsetCells;
    }

    boolean isComplete() {
        return unsetCells == 0;
    }

    int getStateCount() {
        return stateCount;
    }

    int getSymbolCount() {
        return symbolCount;
    }

    private int cellIndex(final int state, final int symbolIndex) {
        if (state < 0 || state >= stateCount) {
            throw new IndexOutOfBoundsException("state " + state + " outside [0, " + stateCount + ")");
        }
        if (symbolIndex < 0 || symbolIndex >= symbolCount) {
            throw new IndexOutOfBoundsException("symbol index " + symbolIndex + " outside [0, " + symbolCount + ")");
        }
        return state * symbolCount + symbolIndex;
    }
}
