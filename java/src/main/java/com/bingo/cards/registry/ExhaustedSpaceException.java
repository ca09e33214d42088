package com.bingo.cards.registry;

/**
 * Too many duplicate cards in a row: the requested number of distinct cards
 * is out of reach for this source. Not retried.
 */
public class ExhaustedSpaceException extends Exception {
    private final int accepted;
    private final int requested;

    public ExhaustedSpaceException(int accepted, int requested, int consecutiveDuplicates) {
        super("Card space exhausted: " + consecutiveDuplicates + " duplicates in a row after "
                + accepted + " of " + requested + " distinct cards");
        this.accepted = accepted;
        this.requested = requested;
    }

    /**
     * Distinct cards collected before generation stalled.
     */
    public int getAccepted() {
        return accepted;
    }

    public int getRequested() {
        return requested;
    }
}
