package com.bingo.cards.registry;

import com.bingo.cards.card.Card;
import com.bingo.cards.card.Fingerprint;
import com.bingo.cards.config.GeneratorSettings;
import com.bingo.cards.generator.CardGenerator;
import com.bingo.cards.generator.CardSource;
import com.bingo.cards.generator.GenerationStats;
import com.bingo.cards.rng.CardRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces ordered sequences of pairwise distinct cards for one event session.
 *
 * Candidates are pulled from the card sources one at a time, fingerprinted and
 * kept only if the fingerprint is new to the session registry. The registry
 * survives across {@link #prepare} calls, so every card handed out during a
 * session is distinct from every other; {@link #reset()} starts a new session.
 *
 * With more than one source, each source runs on its own worker thread and
 * the registry is the only shared state.
 */
public class CardManager {
    private static final Logger log = LoggerFactory.getLogger(CardManager.class);

    private final List<CardSource> sources;
    private final GeneratorSettings settings;
    private final CardRegistry registry = new CardRegistry();

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejectedDuplicate = new AtomicLong();

    private List<Card> prepared = List.of();

    /**
     * Create a manager with a fresh, securely seeded stream and default settings.
     */
    public CardManager() {
        this(new CardRng(), GeneratorSettings.defaults());
    }

    /**
     * Create a reproducible single-worker manager.
     */
    public CardManager(long seed) {
        this(new CardRng(seed), GeneratorSettings.defaults());
    }

    /**
     * Create a manager with {@code settings.workers()} generators. The first
     * generator uses {@code rng}; each further one gets a split of it.
     */
    public CardManager(CardRng rng, GeneratorSettings settings) {
        this(createGenerators(rng, settings), settings);
    }

    /**
     * Create a manager over explicit sources, one worker per source.
     */
    public CardManager(List<? extends CardSource> sources, GeneratorSettings settings) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one card source is required");
        }
        this.sources = List.copyOf(sources);
        this.settings = settings;
    }

    private static List<CardSource> createGenerators(CardRng rng, GeneratorSettings settings) {
        List<CardSource> generators = new ArrayList<>(settings.workers());
        for (int i = 1; i < settings.workers(); i++) {
            generators.add(new CardGenerator(rng.split(), settings));
        }
        generators.add(0, new CardGenerator(rng, settings));
        return generators;
    }

    // ==================== PREPARATION ====================

    /**
     * Prepare {@code total} distinct cards using the configured batch size.
     */
    public List<Card> prepare(int total) throws ExhaustedSpaceException {
        return prepare(total, settings.batchSize());
    }

    /**
     * Prepare {@code total} cards, distinct from each other and from every card
     * prepared earlier in this session. Batches only group progress reports.
     * On any failure, including one raised by a card source, the cards
     * collected by this call are dropped from the registry.
     *
     * @return the cards in acceptance order, unmodifiable
     * @throws ExhaustedSpaceException if too many duplicates arrive in a row
     */
    public List<Card> prepare(int total, int batchSize) throws ExhaustedSpaceException {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative, got " + total);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }

        log.info("Generating {} unique bingo cards...", total);
        List<Card> cards = (sources.size() == 1 || total < 2)
                ? prepareSequential(total, batchSize)
                : prepareParallel(total, batchSize);
        log.info("Successfully generated {} unique cards ({} in session)", cards.size(), registry.size());

        prepared = List.copyOf(cards);
        return prepared;
    }

    private List<Card> prepareSequential(int total, int batchSize) throws ExhaustedSpaceException {
        CardSource source = sources.get(0);
        List<Card> cards = new ArrayList<>(total);
        List<Fingerprint> registered = new ArrayList<>(total);
        int consecutiveDuplicates = 0;

        try {
            while (cards.size() < total) {
                Card card = source.next();
                Fingerprint fingerprint = Fingerprint.of(card);

                if (!registry.register(fingerprint)) {
                    rejectedDuplicate.incrementAndGet();
                    if (++consecutiveDuplicates >= settings.maxConsecutiveDuplicates()) {
                        rollback(registered);
                        throw exhausted(cards.size(), total, consecutiveDuplicates);
                    }
                    continue;
                }

                consecutiveDuplicates = 0;
                cards.add(card);
                registered.add(fingerprint);
                accepted.incrementAndGet();
                reportProgress(cards.size(), total, batchSize);
            }
        } catch (RuntimeException e) {
            rollback(registered);
            throw e;
        }
        return cards;
    }

    private List<Card> prepareParallel(int total, int batchSize) throws ExhaustedSpaceException {
        Card[] slots = new Card[total];
        Fingerprint[] slotFingerprints = new Fingerprint[total];
        AtomicInteger claimed = new AtomicInteger();
        AtomicBoolean stop = new AtomicBoolean();
        AtomicInteger stalledAt = new AtomicInteger(-1);

        ExecutorService executor = Executors.newFixedThreadPool(sources.size());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (CardSource source : sources) {
                futures.add(executor.submit(() -> {
                    try {
                        runWorker(source, total, batchSize, slots, slotFingerprints, claimed, stop, stalledAt);
                    } catch (RuntimeException e) {
                        stop.set(true);
                        throw e;
                    }
                }));
            }
            // Every worker must finish before a rollback, or a late one could register again
            RuntimeException failure = null;
            for (Future<?> future : futures) {
                try {
                    awaitWorker(future);
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                rollback(collected(slotFingerprints));
                throw failure;
            }
        } finally {
            executor.shutdownNow();
        }

        if (stalledAt.get() >= 0 && claimed.get() < total) {
            List<Fingerprint> collected = collected(slotFingerprints);
            rollback(collected);
            throw exhausted(collected.size(), total, stalledAt.get());
        }
        return Arrays.asList(slots);
    }

    private void runWorker(CardSource source, int total, int batchSize,
                           Card[] slots, Fingerprint[] slotFingerprints,
                           AtomicInteger claimed, AtomicBoolean stop, AtomicInteger stalledAt) {
        int consecutiveDuplicates = 0;

        while (!stop.get() && claimed.get() < total) {
            Card card = source.next();
            Fingerprint fingerprint = Fingerprint.of(card);

            if (!registry.register(fingerprint)) {
                rejectedDuplicate.incrementAndGet();
                if (++consecutiveDuplicates >= settings.maxConsecutiveDuplicates()) {
                    stalledAt.compareAndSet(-1, consecutiveDuplicates);
                    stop.set(true);
                    return;
                }
                continue;
            }

            int slot = claimed.getAndIncrement();
            if (slot >= total) {
                // Another worker filled the last slot first
                registry.release(fingerprint);
                return;
            }

            consecutiveDuplicates = 0;
            slots[slot] = card;
            slotFingerprints[slot] = fingerprint;
            accepted.incrementAndGet();
            reportProgress(slot + 1, total, batchSize);
        }
    }

    private static List<Fingerprint> collected(Fingerprint[] slotFingerprints) {
        List<Fingerprint> collected = new ArrayList<>();
        for (Fingerprint fingerprint : slotFingerprints) {
            if (fingerprint != null) {
                collected.add(fingerprint);
            }
        }
        return collected;
    }

    /**
     * Undo a failed call: its cards were never handed out, so they leave the
     * registry and the acceptance count.
     */
    private void rollback(List<Fingerprint> registered) {
        registered.forEach(registry::release);
        accepted.addAndGet(-registered.size());
        log.debug("Released {} fingerprints of a failed preparation", registered.size());
    }

    private static void awaitWorker(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for card workers", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Card worker failed", e.getCause());
        }
    }

    private void reportProgress(int done, int total, int batchSize) {
        if (done % batchSize == 0 && done < total) {
            log.info("Batch complete. Generated {}/{} cards ({} unique so far), {} remaining",
                    done, total, registry.size(), total - done);
        }
    }

    private ExhaustedSpaceException exhausted(int collected, int total, int consecutiveDuplicates) {
        ExhaustedSpaceException e = new ExhaustedSpaceException(collected, total, consecutiveDuplicates);
        log.warn(e.getMessage());
        return e;
    }

    // ==================== VERIFICATION ====================

    /**
     * Check that the given cards are pairwise distinct, using fresh fingerprints
     * and no session state.
     */
    public static boolean validateUnique(Collection<Card> cards) {
        Set<Fingerprint> seen = new HashSet<>();
        for (Card card : cards) {
            if (!seen.add(Fingerprint.of(card))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Check the most recently prepared sequence.
     */
    public boolean validateUnique() {
        return validateUnique(prepared);
    }

    // ==================== ACCESS ====================

    /**
     * Card at {@code index} of the most recently prepared sequence.
     * @throws IndexOutOfBoundsException if index is outside [0, size)
     */
    public Card get(int index) {
        if (index < 0 || index >= prepared.size()) {
            throw new IndexOutOfBoundsException(
                    "Card index " + index + " out of range (have " + prepared.size() + " cards)");
        }
        return prepared.get(index);
    }

    /**
     * The most recently prepared sequence, unmodifiable.
     */
    public List<Card> cards() {
        return prepared;
    }

    public int size() {
        return prepared.size();
    }

    /**
     * Distinct cards handed out in this session across all prepare calls.
     */
    public int registeredCount() {
        return registry.size();
    }

    /**
     * Forget every card of the session and start a new one.
     */
    public void reset() {
        log.info("Starting new session, discarding {} fingerprints", registry.size());
        registry.clear();
        accepted.set(0);
        rejectedDuplicate.set(0);
        prepared = List.of();
    }

    /**
     * Merged generator counters with this session's acceptance counts.
     * Generator counters run since creation; {@code accepted} counts the
     * cards handed out in this session and {@code rejectedDuplicate} the
     * duplicates turned away in it, failed calls included.
     */
    public GenerationStats stats() {
        GenerationStats total = GenerationStats.EMPTY;
        for (CardSource source : sources) {
            if (source instanceof CardGenerator generator) {
                total = total.plus(generator.stats());
            }
        }
        return total.withRegistryCounts(accepted.get(), rejectedDuplicate.get());
    }

    public GeneratorSettings getSettings() {
        return settings;
    }

    public int workerCount() {
        return sources.size();
    }
}
