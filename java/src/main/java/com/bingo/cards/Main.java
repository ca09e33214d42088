package com.bingo.cards;

import com.bingo.cards.card.Card;
import com.bingo.cards.config.EventConfig;
import com.bingo.cards.config.EventConfigException;
import com.bingo.cards.event.CardStrip;
import com.bingo.cards.event.EventCards;
import com.bingo.cards.event.EventReport;
import com.bingo.cards.event.EventSimulation;
import com.bingo.cards.generator.GenerationStats;
import com.bingo.cards.registry.CardManager;
import com.bingo.cards.registry.ExhaustedSpaceException;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Bingo card generator CLI - Main entry point.
 */
@Command(name = "bingo-cards",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Unique 90-ball bingo card generator",
        subcommands = {
                Main.GenerateCommand.class,
                Main.StripCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== GENERATE COMMAND ==========
    @Command(name = "generate", description = "Generate a set of unique cards for an event")
    static class GenerateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-cards"},
                description = "Number of cards to generate (default: from config, else 100)")
        Integer numCards;

        @Option(names = {"-b", "--batch-size"},
                description = "Cards per progress report")
        Integer batchSize;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-w", "--workers"},
                description = "Parallel generator workers")
        Integer workers;

        @Option(names = {"-r", "--round"},
                description = "Round label printed on the cards")
        String round;

        @Option(names = {"--config"},
                description = "Path to an event JSON file")
        String configPath;

        @Option(names = {"--json"},
                description = "Print the cards as JSON for the renderer")
        boolean json;

        @Option(names = {"--preview"}, defaultValue = "0",
                description = "Print the first N cards as text")
        int preview;

        @Override
        public Integer call() throws Exception {
            EventConfig config;
            try {
                config = loadConfig(configPath);
                if (numCards != null) config = config.withTotalCards(numCards);
                if (batchSize != null) config = config.withBatchSize(batchSize);
                if (seed != null) config = config.withSeed(seed);
                if (workers != null) config = config.withWorkers(workers);
                if (round != null) config = config.withRound(round);
            } catch (EventConfigException e) {
                System.err.println("✗ Failed to load event config: " + e.getMessage());
                return 1;
            }

            CardManager manager;
            try {
                manager = EventSimulation.managerFor(config);
            } catch (IllegalArgumentException e) {
                System.err.println("✗ Invalid settings: " + e.getMessage());
                return 1;
            }

            long startTime = System.currentTimeMillis();
            List<Card> cards;
            try {
                cards = manager.prepare(config.totalCards());
            } catch (ExhaustedSpaceException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            } catch (IllegalArgumentException e) {
                System.err.println("✗ Invalid request: " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            boolean allUnique = CardManager.validateUnique(cards);

            if (json) {
                System.out.println(new EventCards(config.round(), cards.size(), allUnique, cards).toJson());
            } else {
                System.out.println("\n=== Bingo Cards: Round " + config.round() + " ===\n");
                System.out.println("Cards: " + cards.size());
                if (config.seed() != null) {
                    System.out.println("Seed: " + config.seed());
                }
                System.out.println("Workers: " + manager.workerCount());
                System.out.println();

                for (int i = 0; i < Math.min(preview, cards.size()); i++) {
                    System.out.println("Card " + (i + 1) + ":");
                    System.out.println(cards.get(i));
                    System.out.println();
                }

                printStats(manager.stats());
                System.out.printf("%nCompleted in %.2fs%n", elapsed / 1000.0);
            }

            if (!allUnique) {
                System.err.println("✗ Duplicate cards detected");
                return 1;
            }
            System.err.println("✓ All " + cards.size() + " cards are unique");
            return 0;
        }
    }

    // ========== STRIP COMMAND ==========
    @Command(name = "strip", description = "Print one strip of six cards")
    static class StripCommand implements Callable<Integer> {
        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Override
        public Integer call() {
            long stripSeed = seed != null ? seed : System.nanoTime();
            CardStrip strip = CardStrip.of(stripSeed);

            System.out.println("\n=== Strip (seed " + stripSeed + ") ===\n");
            for (int i = 0; i < strip.cards().size(); i++) {
                System.out.println("Card " + (i + 1) + ":");
                System.out.println(strip.get(i));
                System.out.println();
            }
            return 0;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Simulate card generation for an event")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-cards"}, defaultValue = "500",
                description = "Number of cards to generate")
        int numCards;

        @Option(names = {"-r", "--round"}, defaultValue = "9",
                description = "Round label")
        String round;

        @Option(names = {"-w", "--workers"}, defaultValue = "1",
                description = "Parallel generator workers")
        int workers;

        @Option(names = {"--estimate"}, defaultValue = "8000",
                description = "Event size to extrapolate generation time for")
        int estimate;

        @Override
        public Integer call() throws Exception {
            EventConfig config;
            try {
                config = EventConfig.defaults()
                        .withTotalCards(numCards)
                        .withRound(round)
                        .withWorkers(workers);
            } catch (EventConfigException e) {
                System.err.println("✗ Failed to load event defaults: " + e.getMessage());
                return 1;
            }

            System.out.println("\n=== Event Simulation ===\n");
            System.out.println("Simulating event with " + numCards + " cards for round " + round + "...");

            EventReport report;
            try {
                report = EventSimulation.run(config);
            } catch (ExhaustedSpaceException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            } catch (IllegalArgumentException e) {
                System.err.println("✗ Invalid settings: " + e.getMessage());
                return 1;
            }

            System.out.println("\nEvent simulation results:");
            System.out.println("- Generated: " + report.cardsGenerated() + " cards");
            System.out.printf("- Time taken: %.2f seconds%n", report.elapsedMs() / 1000.0);
            System.out.printf("- Rate: %.1f cards/second%n", report.cardsPerSecond());
            System.out.println("- All unique: " + report.allUnique());
            System.out.printf("- Registry memory: %.2f MB%n", report.registryMegabytes());
            System.out.printf("- Estimated time for %d cards: %.1f seconds%n",
                    estimate, report.estimatedSecondsFor(estimate));
            System.out.println();
            printStats(report.stats());

            if (report.allUnique()) {
                System.out.println("\n✓ Event simulation successful - no duplicates detected!");
                return 0;
            }
            System.out.println("\n✗ Event simulation failed - duplicates detected!");
            return 1;
        }
    }

    // ========== HELPER METHODS ==========

    private static EventConfig loadConfig(String path) throws EventConfigException {
        return path != null ? EventConfig.fromFile(path) : EventConfig.defaults();
    }

    /**
     * Print generation counters.
     */
    private static void printStats(GenerationStats stats) {
        System.out.println("Generation stats:");
        System.out.printf("  Attempts:             %d%n", stats.attempts());
        System.out.printf("  Accepted:             %d (%.1f%%)%n", stats.accepted(), stats.acceptanceRate() * 100.0);
        System.out.printf("  Duplicates rejected:  %d%n", stats.rejectedDuplicate());
        System.out.printf("  Invalid rejected:     %d%n", stats.rejectedInvalid());
        System.out.printf("  Distribution retries: %d%n", stats.distributionRetries());
    }
}
