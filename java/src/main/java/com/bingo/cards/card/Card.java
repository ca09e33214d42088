package com.bingo.cards.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * A single bingo card: a fixed 3x9 grid where each cell is empty or holds a number.
 * Empty cells are stored as {@link #EMPTY}.
 *
 * Instances are immutable. Only the grid shape is enforced on construction;
 * the structural rules are checked by {@link CardValidator}.
 */
public final class Card {
    public static final int ROWS = 3;
    public static final int COLUMNS = 9;
    public static final int NUMBERS_PER_ROW = 5;
    public static final int NUMBERS_PER_CARD = ROWS * NUMBERS_PER_ROW;
    public static final int MAX_PER_COLUMN = 3;
    public static final int EMPTY = 0;

    private final int[][] grid;

    private Card(int[][] grid) {
        this.grid = grid;
    }

    /**
     * Create a card from a row-major grid. The grid is copied.
     * @throws IllegalArgumentException if the grid is not 3x9
     */
    public static Card of(int[][] grid) {
        if (grid == null || grid.length != ROWS) {
            throw new IllegalArgumentException("Card grid must have " + ROWS + " rows");
        }
        int[][] copy = new int[ROWS][];
        for (int row = 0; row < ROWS; row++) {
            if (grid[row] == null || grid[row].length != COLUMNS) {
                throw new IllegalArgumentException("Row " + row + " must have " + COLUMNS + " columns");
            }
            copy[row] = grid[row].clone();
        }
        return new Card(copy);
    }

    /**
     * Cell value at the given position, {@link #EMPTY} for an empty cell.
     */
    public int get(int row, int column) {
        return grid[row][column];
    }

    public boolean isEmpty(int row, int column) {
        return grid[row][column] == EMPTY;
    }

    /**
     * Copy of one row, including empty cells.
     */
    public int[] row(int row) {
        return grid[row].clone();
    }

    /**
     * Numbers of a column from top to bottom, empty cells skipped.
     */
    public List<Integer> column(int column) {
        return IntStream.range(0, ROWS)
                .map(row -> grid[row][column])
                .filter(value -> value != EMPTY)
                .boxed()
                .toList();
    }

    /**
     * All numbers on the card, ascending.
     */
    public List<Integer> numbers() {
        return Arrays.stream(grid)
                .flatMapToInt(Arrays::stream)
                .filter(value -> value != EMPTY)
                .sorted()
                .boxed()
                .toList();
    }

    public int filledCount() {
        int count = 0;
        for (int row = 0; row < ROWS; row++) {
            count += rowCount(row);
        }
        return count;
    }

    public int rowCount(int row) {
        int count = 0;
        for (int value : grid[row]) {
            if (value != EMPTY) count++;
        }
        return count;
    }

    public int columnCount(int column) {
        int count = 0;
        for (int row = 0; row < ROWS; row++) {
            if (grid[row][column] != EMPTY) count++;
        }
        return count;
    }

    public boolean contains(int number) {
        if (number == EMPTY) {
            return false;
        }
        for (int[] row : grid) {
            for (int value : row) {
                if (value == number) return true;
            }
        }
        return false;
    }

    /**
     * Copy of the full grid. This is also the JSON form handed to renderers.
     */
    @JsonValue
    public int[][] toGrid() {
        int[][] copy = new int[ROWS][];
        for (int row = 0; row < ROWS; row++) {
            copy[row] = grid[row].clone();
        }
        return copy;
    }

    /**
     * Row-major sequence of all 27 cells with {@link #EMPTY} for empty cells.
     */
    public int[] canonicalForm() {
        int[] cells = new int[ROWS * COLUMNS];
        for (int row = 0; row < ROWS; row++) {
            System.arraycopy(grid[row], 0, cells, row * COLUMNS, COLUMNS);
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Card other)) return false;
        return Arrays.deepEquals(grid, other.grid);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(grid);
    }

    /**
     * Text rendering, one line per row, blanks for empty cells:
     * <pre>
     *  4 |    | 25 |    | 47 |    | 61 |    | 83
     * </pre>
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < ROWS; row++) {
            if (row > 0) sb.append('\n');
            for (int column = 0; column < COLUMNS; column++) {
                if (column > 0) sb.append(" |");
                int value = grid[row][column];
                sb.append(value == EMPTY ? "   " : String.format("%3d", value));
            }
        }
        return sb.toString();
    }
}
