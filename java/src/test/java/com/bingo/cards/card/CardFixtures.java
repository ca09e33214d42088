package com.bingo.cards.card;

/**
 * Hand-built grids shared by the card tests.
 */
public final class CardFixtures {

    private CardFixtures() {
    }

    /**
     * A valid card: rows of five, column counts (2,1,2,1,2,2,1,2,2).
     */
    public static int[][] validGrid() {
        return new int[][] {
            {1, 10, 20, 30, 40, 0, 0, 0, 0},
            {0, 0, 0, 0, 41, 50, 60, 70, 80},
            {5, 0, 21, 0, 0, 51, 0, 71, 90}
        };
    }

    public static Card validCard() {
        return Card.of(validGrid());
    }
}
