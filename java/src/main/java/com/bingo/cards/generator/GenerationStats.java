package com.bingo.cards.generator;

/**
 * Generation counters. Read-only telemetry.
 */
public record GenerationStats(
    /**
     * Card constructions started, including restarts.
     */
    long attempts,

    /**
     * Cards accepted: valid cards for a generator, registered cards for a manager.
     */
    long accepted,

    /**
     * Valid cards discarded because an identical card was already registered.
     */
    long rejectedDuplicate,

    /**
     * Constructed cards that failed validation.
     */
    long rejectedInvalid,

    /**
     * Constructions abandoned because the row or column distribution hit a dead end.
     */
    long distributionRetries
) {
    public static final GenerationStats EMPTY = new GenerationStats(0, 0, 0, 0, 0);

    /**
     * Sum of two sets of counters, used to merge parallel workers.
     */
    public GenerationStats plus(GenerationStats other) {
        return new GenerationStats(
                attempts + other.attempts,
                accepted + other.accepted,
                rejectedDuplicate + other.rejectedDuplicate,
                rejectedInvalid + other.rejectedInvalid,
                distributionRetries + other.distributionRetries);
    }

    /**
     * Replace the acceptance counters with the registry's view.
     */
    public GenerationStats withRegistryCounts(long accepted, long rejectedDuplicate) {
        return new GenerationStats(attempts, accepted, rejectedDuplicate, rejectedInvalid, distributionRetries);
    }

    /**
     * Share of attempts that ended in an accepted card.
     */
    public double acceptanceRate() {
        return attempts == 0 ? 0.0 : (double) accepted / attempts;
    }
}
