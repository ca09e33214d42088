package com.bingo.cards.generator;

/**
 * The generator used up its restart budget without producing a valid card.
 * The card rules are always satisfiable, so this points at a defect in the
 * random source or the construction, not at the request.
 */
public class CardGenerationException extends RuntimeException {
    public CardGenerationException(String message) {
        super(message);
    }

    public CardGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
