package com.bingo.cards.generator;

import com.bingo.cards.card.Card;
import com.bingo.cards.rng.CardRng;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Step 2 of card construction: which rows hold a number in each column.
 *
 * Builds a 3x9 zero/one matrix with the given column sums and row sums of
 * (5, 5, 5). Columns are visited in random order; for each column the row
 * subsets of the required size are tried in random order, skipping full rows
 * and any choice that leaves the remaining columns unable to fill the
 * remaining row capacity. A column with no acceptable subset backtracks to
 * the previous one. The search gives up after a fixed number of steps.
 */
public class RowAssigner {

    // Row subsets indexed by size: ROW_SUBSETS[k] lists every k-subset of {0, 1, 2}
    private static final int[][][] ROW_SUBSETS = {
        {{}},
        {{0}, {1}, {2}},
        {{0, 1}, {0, 2}, {1, 2}},
        {{0, 1, 2}}
    };

    private final int maxSteps;

    public RowAssigner(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /**
     * Assign rows to the numbers of each column.
     *
     * @param columnCounts numbers per column, nine entries in [0, 3]
     * @param rng          random stream for the visiting and candidate order
     * @return marks[row][column], true where the cell holds a number
     * @throws InvalidDistributionException if the counts admit no assignment
     *         or the step budget runs out
     */
    public boolean[][] assign(int[] columnCounts, CardRng rng) throws InvalidDistributionException {
        if (columnCounts.length != Card.COLUMNS) {
            throw new InvalidDistributionException("Expected " + Card.COLUMNS + " column counts, got "
                    + columnCounts.length);
        }
        for (int count : columnCounts) {
            if (count < 0 || count > Card.ROWS) {
                throw new InvalidDistributionException("Column count out of range: "
                        + Arrays.toString(columnCounts));
            }
        }

        int[] capacity = new int[Card.ROWS];
        Arrays.fill(capacity, Card.NUMBERS_PER_ROW);

        int[] order = new int[Card.COLUMNS];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        rng.shuffle(order);

        if (!isFeasible(capacity, columnCounts, order, 0)) {
            throw new InvalidDistributionException("No row assignment exists for column counts "
                    + Arrays.toString(columnCounts));
        }

        Search search = new Search(columnCounts, order, capacity, rng);
        if (!search.place(0)) {
            throw new InvalidDistributionException("Row assignment gave up after " + search.steps + " steps");
        }
        return search.marks;
    }

    /**
     * Gale-Ryser test: can the columns order[from..] fill the row capacities exactly,
     * with at most one number per row and column?
     */
    static boolean isFeasible(int[] capacity, int[] columnCounts, int[] order, int from) {
        int remainingCapacity = 0;
        for (int c : capacity) {
            remainingCapacity += c;
        }
        int remainingNumbers = 0;
        for (int i = from; i < order.length; i++) {
            remainingNumbers += columnCounts[order[i]];
        }
        if (remainingCapacity != remainingNumbers) {
            return false;
        }

        int[] sorted = capacity.clone();
        Arrays.sort(sorted);
        int prefix = 0;
        for (int k = 1; k <= sorted.length; k++) {
            prefix += sorted[sorted.length - k];
            int reachable = 0;
            for (int i = from; i < order.length; i++) {
                reachable += Math.min(columnCounts[order[i]], k);
            }
            if (prefix > reachable) {
                return false;
            }
        }
        return true;
    }

    /**
     * Depth-first state for one assignment.
     */
    private final class Search {
        private final int[] columnCounts;
        private final int[] order;
        private final int[] capacity;
        private final CardRng rng;
        private final boolean[][] marks = new boolean[Card.ROWS][Card.COLUMNS];
        private int steps;

        Search(int[] columnCounts, int[] order, int[] capacity, CardRng rng) {
            this.columnCounts = columnCounts;
            this.order = order;
            this.capacity = capacity;
            this.rng = rng;
        }

        boolean place(int index) {
            if (index == order.length) {
                return true;
            }
            int column = order[index];

            List<int[]> candidates = new ArrayList<>();
            for (int[] rows : ROW_SUBSETS[columnCounts[column]]) {
                if (hasCapacity(rows)) {
                    candidates.add(rows);
                }
            }
            rng.shuffle(candidates);

            for (int[] rows : candidates) {
                if (++steps > maxSteps) {
                    return false;
                }
                apply(column, rows, true);
                if (isFeasible(capacity, columnCounts, order, index + 1) && place(index + 1)) {
                    return true;
                }
                apply(column, rows, false);
                if (steps > maxSteps) {
                    return false;
                }
            }
            return false;
        }

        private boolean hasCapacity(int[] rows) {
            for (int row : rows) {
                if (capacity[row] == 0) return false;
            }
            return true;
        }

        private void apply(int column, int[] rows, boolean mark) {
            for (int row : rows) {
                marks[row][column] = mark;
                capacity[row] += mark ? -1 : 1;
            }
        }
    }
}
