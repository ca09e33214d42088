package com.bingo.cards.event;

import com.bingo.cards.generator.GenerationStats;

/**
 * Outcome of one event simulation.
 */
public record EventReport(
        String round,
        int cardsGenerated,
        long elapsedMs,
        boolean allUnique,
        int registeredFingerprints,
        GenerationStats stats
) {
    /** Bytes of one SHA-256 fingerprint, ignoring set overhead. */
    public static final int FINGERPRINT_BYTES = 32;

    public double cardsPerSecond() {
        double seconds = elapsedMs / 1000.0;
        return seconds > 0 ? cardsGenerated / seconds : 0.0;
    }

    /**
     * Time to generate {@code cards} cards at the observed rate.
     */
    public double estimatedSecondsFor(int cards) {
        if (cardsGenerated == 0) {
            return 0.0;
        }
        return (elapsedMs / 1000.0) * cards / cardsGenerated;
    }

    /**
     * Rough registry footprint in megabytes.
     */
    public double registryMegabytes() {
        return (double) registeredFingerprints * FINGERPRINT_BYTES / (1024 * 1024);
    }
}
