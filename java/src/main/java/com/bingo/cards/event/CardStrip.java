package com.bingo.cards.event;

import com.bingo.cards.card.Card;
import com.bingo.cards.card.Fingerprint;
import com.bingo.cards.generator.CardGenerator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Six distinct cards printed together as one strip.
 */
public record CardStrip(List<Card> cards) {
    public static final int CARDS_PER_STRIP = 6;

    public CardStrip {
        if (cards.size() != CARDS_PER_STRIP) {
            throw new IllegalArgumentException("A strip holds " + CARDS_PER_STRIP + " cards, got " + cards.size());
        }
        cards = List.copyOf(cards);
    }

    /**
     * Reproducible strip: the same seed always yields the same six cards.
     */
    public static CardStrip of(long seed) {
        return generate(new CardGenerator(seed));
    }

    /**
     * Draw six distinct cards from a generator.
     */
    public static CardStrip generate(CardGenerator generator) {
        List<Card> cards = new ArrayList<>(CARDS_PER_STRIP);
        Set<Fingerprint> seen = new HashSet<>();
        while (cards.size() < CARDS_PER_STRIP) {
            Card card = generator.generateOne();
            if (seen.add(Fingerprint.of(card))) {
                cards.add(card);
            }
        }
        return new CardStrip(cards);
    }

    public Card get(int index) {
        return cards.get(index);
    }
}
