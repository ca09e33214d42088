package com.bingo.cards.generator;

/**
 * A column or row distribution attempt reached a dead end.
 * Always recovered inside {@link CardGenerator} by starting the card over.
 */
public class InvalidDistributionException extends Exception {
    public InvalidDistributionException(String message) {
        super(message);
    }
}
