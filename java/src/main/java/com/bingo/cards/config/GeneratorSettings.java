package com.bingo.cards.config;

/**
 * Retry budgets and throughput knobs for card generation.
 *
 * @param maxCardAttempts          restarts allowed for one card before generation gives up
 * @param maxAssignmentSteps       search steps allowed for one row assignment
 * @param maxConsecutiveDuplicates duplicate rejections in a row before the card space counts as exhausted
 * @param batchSize                cards per progress report
 * @param workers                  parallel generator workers (1 = sequential)
 */
public record GeneratorSettings(
        int maxCardAttempts,
        int maxAssignmentSteps,
        int maxConsecutiveDuplicates,
        int batchSize,
        int workers
) {
    public static final int DEFAULT_MAX_CARD_ATTEMPTS = 1000;
    public static final int DEFAULT_MAX_ASSIGNMENT_STEPS = 100;
    public static final int DEFAULT_MAX_CONSECUTIVE_DUPLICATES = 10_000;
    public static final int DEFAULT_BATCH_SIZE = 1000;

    public GeneratorSettings {
        requirePositive("maxCardAttempts", maxCardAttempts);
        requirePositive("maxAssignmentSteps", maxAssignmentSteps);
        requirePositive("maxConsecutiveDuplicates", maxConsecutiveDuplicates);
        requirePositive("batchSize", batchSize);
        requirePositive("workers", workers);
    }

    public static GeneratorSettings defaults() {
        return new GeneratorSettings(
                DEFAULT_MAX_CARD_ATTEMPTS,
                DEFAULT_MAX_ASSIGNMENT_STEPS,
                DEFAULT_MAX_CONSECUTIVE_DUPLICATES,
                DEFAULT_BATCH_SIZE,
                1);
    }

    public GeneratorSettings withBatchSize(int batchSize) {
        return new GeneratorSettings(maxCardAttempts, maxAssignmentSteps, maxConsecutiveDuplicates, batchSize, workers);
    }

    public GeneratorSettings withWorkers(int workers) {
        return new GeneratorSettings(maxCardAttempts, maxAssignmentSteps, maxConsecutiveDuplicates, batchSize, workers);
    }

    public GeneratorSettings withMaxConsecutiveDuplicates(int maxConsecutiveDuplicates) {
        return new GeneratorSettings(maxCardAttempts, maxAssignmentSteps, maxConsecutiveDuplicates, batchSize, workers);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
