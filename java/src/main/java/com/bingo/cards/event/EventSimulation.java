package com.bingo.cards.event;

import com.bingo.cards.card.Card;
import com.bingo.cards.config.EventConfig;
import com.bingo.cards.registry.CardManager;
import com.bingo.cards.registry.ExhaustedSpaceException;
import com.bingo.cards.rng.CardRng;

import java.util.List;

/**
 * Runs a full event's card generation and reports throughput and uniqueness.
 */
public final class EventSimulation {

    private EventSimulation() {
        // Utility class - prevent instantiation
    }

    /**
     * Manager for an event: seeded when the config has a seed, securely seeded otherwise.
     */
    public static CardManager managerFor(EventConfig config) {
        CardRng rng = config.seed() != null ? new CardRng(config.seed()) : new CardRng();
        return new CardManager(rng, config.toSettings());
    }

    /**
     * Generate the event's cards on a fresh manager and time the run.
     */
    public static EventReport run(EventConfig config) throws ExhaustedSpaceException {
        CardManager manager = managerFor(config);

        long startTime = System.currentTimeMillis();
        List<Card> cards = manager.prepare(config.totalCards());
        long elapsed = System.currentTimeMillis() - startTime;

        return new EventReport(
                config.round(),
                cards.size(),
                elapsed,
                manager.validateUnique(),
                manager.registeredCount(),
                manager.stats());
    }
}
