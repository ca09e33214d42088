package com.bingo.cards.event;

import com.bingo.cards.card.Card;
import com.bingo.cards.card.CardFixtures;
import com.bingo.cards.card.CardValidator;
import com.bingo.cards.generator.CardGenerator;
import com.bingo.cards.registry.CardManager;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for six-card strips.
 */
class CardStripTest {

    @Test
    void testStripHoldsSixDistinctValidCards() {
        CardStrip strip = CardStrip.generate(new CardGenerator(66));

        assertEquals(CardStrip.CARDS_PER_STRIP, strip.cards().size());
        assertTrue(strip.cards().stream().allMatch(CardValidator::isValid));
        assertTrue(CardManager.validateUnique(strip.cards()));
        assertEquals(strip.cards().get(5), strip.get(5));
    }

    @Test
    void testSameSeedSameStrip() {
        assertEquals(CardStrip.of(123), CardStrip.of(123));
        assertNotEquals(CardStrip.of(123), CardStrip.of(124));
    }

    @Test
    void testRejectsWrongCardCount() {
        List<Card> five = Collections.nCopies(5, CardFixtures.validCard());
        assertThrows(IllegalArgumentException.class, () -> new CardStrip(five));
    }

    @Test
    void testCardsAreReadOnly() {
        CardStrip strip = CardStrip.of(1);
        assertThrows(UnsupportedOperationException.class, () -> strip.cards().remove(0));
    }
}
