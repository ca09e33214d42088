package com.bingo.cards.card;

/**
 * Legal number range for each of the nine card columns.
 * The last column is the only asymmetric one: it holds 80 through 90.
 */
public enum ColumnRange {
    ONES(1, 9),
    TENS(10, 19),
    TWENTIES(20, 29),
    THIRTIES(30, 39),
    FORTIES(40, 49),
    FIFTIES(50, 59),
    SIXTIES(60, 69),
    SEVENTIES(70, 79),
    EIGHTIES(80, 90);

    private static final ColumnRange[] BY_COLUMN = values();

    private final int min;
    private final int max;

    ColumnRange(int min, int max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Range for a 0-based column index.
     * @throws IllegalArgumentException if the column is outside 0..8
     */
    public static ColumnRange forColumn(int column) {
        if (column < 0 || column >= BY_COLUMN.length) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return BY_COLUMN[column];
    }

    /**
     * Column index a number belongs to.
     * @throws IllegalArgumentException if the number is outside 1..90
     */
    public static ColumnRange forNumber(int number) {
        if (number < ONES.min || number > EIGHTIES.max) {
            throw new IllegalArgumentException("Number out of range: " + number);
        }
        return BY_COLUMN[Math.min(number / 10, BY_COLUMN.length - 1)];
    }

    public int column() {
        return ordinal();
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public int size() {
        return max - min + 1;
    }

    public boolean contains(int number) {
        return number >= min && number <= max;
    }

    /**
     * All numbers of this range, ascending. Returns a fresh array.
     */
    public int[] numbers() {
        int[] numbers = new int[size()];
        for (int i = 0; i < numbers.length; i++) {
            numbers[i] = min + i;
        }
        return numbers;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
