package com.bingo.cards.generator;

import com.bingo.cards.card.Card;
import com.bingo.cards.rng.CardRng;

import java.util.Arrays;

/**
 * Step 1 of card construction: how many numbers each column holds.
 *
 * Every column starts with one number; the six remaining numbers are handed
 * out one at a time to a column picked uniformly among those still below
 * three. Nine columns with two spare slots each leave 18 slots for 6 units,
 * so a draw never runs out of eligible columns.
 */
public final class ColumnDistributor {
    private static final int EXTRA_UNITS = Card.NUMBERS_PER_CARD - Card.COLUMNS;

    private ColumnDistributor() {
        // Utility class - prevent instantiation
    }

    /**
     * Draw per-column counts, each in [1, 3], summing to 15.
     */
    public static int[] distribute(CardRng rng) throws InvalidDistributionException {
        int[] counts = new int[Card.COLUMNS];
        Arrays.fill(counts, 1);

        int[] eligible = new int[Card.COLUMNS];
        for (int unit = 0; unit < EXTRA_UNITS; unit++) {
            int eligibleCount = 0;
            for (int column = 0; column < Card.COLUMNS; column++) {
                if (counts[column] < Card.MAX_PER_COLUMN) {
                    eligible[eligibleCount++] = column;
                }
            }
            if (eligibleCount == 0) {
                throw new InvalidDistributionException("No column left with spare capacity");
            }
            counts[eligible[rng.nextInt(eligibleCount)]]++;
        }
        return counts;
    }
}
