package com.bingo.cards.generator;

import com.bingo.cards.card.Card;

/**
 * Supplies candidate cards one at a time.
 */
@FunctionalInterface
public interface CardSource {

    /**
     * Produce the next candidate card. Candidates are not guaranteed to be
     * distinct from earlier ones.
     */
    Card next();
}
