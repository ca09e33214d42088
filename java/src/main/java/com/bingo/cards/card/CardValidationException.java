package com.bingo.cards.card;

import java.util.List;

/**
 * Thrown when a card breaks one of the structural rules.
 */
public class CardValidationException extends RuntimeException {
    private final List<String> violations;

    public CardValidationException(List<String> violations) {
        super("Invalid card: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
