package com.bingo.cards.generator;

import com.bingo.cards.card.Card;
import com.bingo.cards.card.CardValidationException;
import com.bingo.cards.card.CardValidator;
import com.bingo.cards.card.ColumnRange;
import com.bingo.cards.config.GeneratorSettings;
import com.bingo.cards.rng.CardRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Produces one structurally valid card per call.
 *
 * Construction runs in four steps: column counts, row assignment, number
 * fill, validation. A dead end in the first two steps or a failed validation
 * starts the card over; only an exhausted restart budget reaches the caller.
 *
 * Not thread-safe. Parallel callers each need their own generator with a
 * stream obtained from {@link CardRng#split()}.
 */
public class CardGenerator implements CardSource {
    private static final Logger log = LoggerFactory.getLogger(CardGenerator.class);

    private final CardRng rng;
    private final GeneratorSettings settings;
    private final RowAssigner rowAssigner;

    private long attempts;
    private long accepted;
    private long rejectedInvalid;
    private long distributionRetries;

    /**
     * Create a generator with a fresh, securely seeded stream.
     */
    public CardGenerator() {
        this(new CardRng(), GeneratorSettings.defaults());
    }

    /**
     * Create a reproducible generator.
     */
    public CardGenerator(long seed) {
        this(new CardRng(seed), GeneratorSettings.defaults());
    }

    public CardGenerator(CardRng rng, GeneratorSettings settings) {
        this.rng = rng;
        this.settings = settings;
        this.rowAssigner = new RowAssigner(settings.maxAssignmentSteps());
    }

    /**
     * Generate one valid card.
     *
     * @throws CardGenerationException if the restart budget is exhausted
     */
    public Card generateOne() {
        CardValidationException lastFailure = null;

        for (int attempt = 0; attempt < settings.maxCardAttempts(); attempt++) {
            attempts++;

            Card card;
            try {
                card = construct();
            } catch (InvalidDistributionException e) {
                distributionRetries++;
                log.debug("Restarting card construction: {}", e.getMessage());
                continue;
            }

            List<String> violations = CardValidator.violations(card);
            if (violations.isEmpty()) {
                accepted++;
                return card;
            }

            rejectedInvalid++;
            lastFailure = new CardValidationException(violations);
            log.debug("Discarding invalid card: {}", violations);
        }

        String message = "Failed to generate a valid card after " + settings.maxCardAttempts() + " attempts";
        throw lastFailure == null
                ? new CardGenerationException(message)
                : new CardGenerationException(message, lastFailure);
    }

    @Override
    public Card next() {
        return generateOne();
    }

    /**
     * Build one candidate card from fresh randomness, without validating it.
     */
    protected Card construct() throws InvalidDistributionException {
        int[] columnCounts = ColumnDistributor.distribute(rng);
        boolean[][] marks = rowAssigner.assign(columnCounts, rng);
        return fill(columnCounts, marks);
    }

    /**
     * Step 3: sample each column's numbers from its range and place them
     * ascending into the marked rows, top to bottom.
     */
    private Card fill(int[] columnCounts, boolean[][] marks) {
        int[][] grid = new int[Card.ROWS][Card.COLUMNS];

        for (int column = 0; column < Card.COLUMNS; column++) {
            int[] numbers = rng.sample(ColumnRange.forColumn(column).numbers(), columnCounts[column]);
            Arrays.sort(numbers);

            int next = 0;
            for (int row = 0; row < Card.ROWS && next < numbers.length; row++) {
                if (marks[row][column]) {
                    grid[row][column] = numbers[next++];
                }
            }
        }

        return Card.of(grid);
    }

    /**
     * Counters since this generator was created.
     */
    public GenerationStats stats() {
        return new GenerationStats(attempts, accepted, 0, rejectedInvalid, distributionRetries);
    }

    public CardRng getRng() {
        return rng;
    }

    public GeneratorSettings getSettings() {
        return settings;
    }
}
