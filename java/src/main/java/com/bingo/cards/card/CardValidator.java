package com.bingo.cards.card;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for a single card, independent of any other card.
 */
public final class CardValidator {

    private CardValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * List every rule the card breaks. An empty list means the card is valid.
     */
    public static List<String> violations(Card card) {
        List<String> violations = new ArrayList<>();

        int filled = card.filledCount();
        if (filled != Card.NUMBERS_PER_CARD) {
            violations.add("Card has " + filled + " numbers, expected " + Card.NUMBERS_PER_CARD);
        }

        for (int row = 0; row < Card.ROWS; row++) {
            int count = card.rowCount(row);
            if (count != Card.NUMBERS_PER_ROW) {
                violations.add("Row " + row + " has " + count + " numbers, expected " + Card.NUMBERS_PER_ROW);
            }
        }

        int columnTotal = 0;
        Set<Integer> seen = new HashSet<>();
        for (int column = 0; column < Card.COLUMNS; column++) {
            ColumnRange range = ColumnRange.forColumn(column);
            List<Integer> numbers = card.column(column);
            columnTotal += numbers.size();

            if (numbers.isEmpty() || numbers.size() > Card.MAX_PER_COLUMN) {
                violations.add("Column " + column + " has " + numbers.size()
                        + " numbers, expected 1 to " + Card.MAX_PER_COLUMN);
            }

            int previous = Integer.MIN_VALUE;
            for (int number : numbers) {
                if (!range.contains(number)) {
                    violations.add("Column " + column + " holds " + number + " outside " + range);
                }
                if (number <= previous) {
                    violations.add("Column " + column + " is not strictly ascending at " + number);
                }
                if (!seen.add(number)) {
                    violations.add("Number " + number + " appears more than once");
                }
                previous = number;
            }
        }

        if (columnTotal != Card.NUMBERS_PER_CARD) {
            violations.add("Column counts sum to " + columnTotal + ", expected " + Card.NUMBERS_PER_CARD);
        }

        return violations;
    }

    public static boolean isValid(Card card) {
        return violations(card).isEmpty();
    }

    /**
     * @throws CardValidationException if the card breaks any rule
     */
    public static Card requireValid(Card card) {
        List<String> violations = violations(card);
        if (!violations.isEmpty()) {
            throw new CardValidationException(violations);
        }
        return card;
    }
}
