package com.bingo.cards.registry;

import com.bingo.cards.card.Card;
import com.bingo.cards.card.CardValidator;
import com.bingo.cards.card.Fingerprint;
import com.bingo.cards.config.GeneratorSettings;
import com.bingo.cards.generator.CardGenerationException;
import com.bingo.cards.generator.CardGenerator;
import com.bingo.cards.generator.CardSource;
import com.bingo.cards.generator.GenerationStats;
import com.bingo.cards.rng.CardRng;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardManager preparation, verification and access.
 */
class CardManagerTest {

    /**
     * Source cycling through a fixed pool of cards.
     */
    private static CardSource cycling(List<Card> pool) {
        int[] next = {0};
        return () -> pool.get(next[0]++ % pool.size());
    }

    /**
     * Source that hands out {@code pool} in order and fails once it runs dry.
     */
    private static CardSource failingAfter(List<Card> pool) {
        int[] next = {0};
        return () -> {
            if (next[0] == pool.size()) {
                throw new CardGenerationException("Failed to generate a valid card after 1000 attempts");
            }
            return pool.get(next[0]++);
        };
    }

    private static List<Card> pool(long seed, int size) {
        CardGenerator generator = new CardGenerator(seed);
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            cards.add(generator.generateOne());
        }
        return cards;
    }

    private static GeneratorSettings smallDuplicateBound() {
        return GeneratorSettings.defaults().withMaxConsecutiveDuplicates(50);
    }

    @Test
    void testPrepareZeroReturnsEmpty() throws ExhaustedSpaceException {
        CardManager manager = new CardManager(1);
        List<Card> cards = manager.prepare(0);

        assertTrue(cards.isEmpty());
        assertTrue(manager.validateUnique());
        assertEquals(0, manager.registeredCount());
    }

    @Test
    void testPrepareThousandCards() {
        CardManager manager = new CardManager(12345);

        List<Card> cards = assertTimeoutPreemptively(Duration.ofSeconds(60), () -> manager.prepare(1000));

        assertEquals(1000, cards.size());
        assertTrue(cards.stream().allMatch(CardValidator::isValid));
        assertTrue(CardManager.validateUnique(cards));
        Set<Fingerprint> fingerprints = new HashSet<>();
        cards.forEach(card -> fingerprints.add(Fingerprint.of(card)));
        assertEquals(1000, fingerprints.size());
    }

    @Test
    void testBatchSizeDoesNotChangeResult() throws ExhaustedSpaceException {
        List<Card> oneBatch = new CardManager(42).prepare(120, 1000);
        List<Card> smallBatches = new CardManager(42).prepare(120, 7);
        assertEquals(oneBatch, smallBatches);
    }

    @Test
    void testPreparedSequenceIsReadOnly() throws ExhaustedSpaceException {
        CardManager manager = new CardManager(2);
        List<Card> cards = manager.prepare(3);
        assertThrows(UnsupportedOperationException.class, () -> cards.add(cards.get(0)));
        assertThrows(UnsupportedOperationException.class, () -> manager.cards().clear());
    }

    @Test
    void testUniquenessSpansSession() throws ExhaustedSpaceException {
        List<Card> pool = pool(5, 30);
        CardManager manager = new CardManager(List.of(cycling(pool)), smallDuplicateBound());

        List<Card> first = manager.prepare(20);
        List<Card> second = manager.prepare(10);

        List<Card> all = new ArrayList<>(first);
        all.addAll(second);
        assertTrue(CardManager.validateUnique(all), "Cards of one session must never repeat");
        assertEquals(30, manager.registeredCount());
        assertEquals(second, manager.cards());
    }

    @Test
    void testResetStartsNewSession() throws ExhaustedSpaceException {
        List<Card> pool = pool(6, 10);
        CardManager manager = new CardManager(List.of(cycling(pool)), smallDuplicateBound());

        manager.prepare(10);
        manager.reset();
        assertEquals(0, manager.registeredCount());
        assertEquals(0, manager.size());

        assertEquals(pool, manager.prepare(10));
    }

    @Test
    void testDuplicatesAreSkipped() throws ExhaustedSpaceException {
        List<Card> pool = pool(7, 4);
        Card repeated = pool.get(0);
        List<Card> stream = List.of(repeated, repeated, pool.get(1), repeated, pool.get(2), pool.get(3));
        CardManager manager = new CardManager(List.of(cycling(stream)), smallDuplicateBound());

        List<Card> cards = manager.prepare(4);

        assertEquals(pool, cards);
        GenerationStats stats = manager.stats();
        assertEquals(4, stats.accepted());
        assertEquals(2, stats.rejectedDuplicate());
    }

    @Test
    void testExhaustedSpace() {
        List<Card> pool = pool(8, 5);
        CardManager manager = new CardManager(List.of(cycling(pool)), smallDuplicateBound());

        ExhaustedSpaceException e = assertThrows(ExhaustedSpaceException.class, () -> manager.prepare(6));
        assertEquals(5, e.getAccepted());
        assertEquals(6, e.getRequested());
        assertEquals(0, manager.registeredCount(), "A failed call should not leave fingerprints behind");
        assertEquals(0, manager.size());
    }

    @Test
    void testExhaustedSpaceInParallel() {
        List<Card> pool = pool(9, 5);
        CardManager manager = new CardManager(List.of(cycling(pool), cycling(pool)), smallDuplicateBound());

        ExhaustedSpaceException e = assertThrows(ExhaustedSpaceException.class, () -> manager.prepare(20));
        assertEquals(5, e.getAccepted());
        assertEquals(0, manager.registeredCount());
    }

    @Test
    void testRejectsInvalidArguments() {
        CardManager manager = new CardManager(1);
        assertThrows(IllegalArgumentException.class, () -> manager.prepare(-1));
        assertThrows(IllegalArgumentException.class, () -> manager.prepare(10, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new CardManager(List.of(), GeneratorSettings.defaults()));
    }

    @Test
    void testValidateUniqueDetectsDuplicates() {
        List<Card> pool = pool(10, 3);
        List<Card> withDuplicate = List.of(pool.get(0), pool.get(1), pool.get(2), pool.get(1));

        assertFalse(CardManager.validateUnique(withDuplicate));
        assertTrue(CardManager.validateUnique(pool));
        assertTrue(CardManager.validateUnique(List.of()));
    }

    @Test
    void testValidateUniqueIsIdempotent() throws ExhaustedSpaceException {
        CardManager manager = new CardManager(11);
        List<Card> cards = manager.prepare(200);
        int registered = manager.registeredCount();

        boolean first = CardManager.validateUnique(cards);
        boolean second = CardManager.validateUnique(cards);
        assertEquals(first, second);
        assertTrue(manager.validateUnique());
        assertEquals(registered, manager.registeredCount(), "Verification must not touch the registry");

        List<Card> duplicated = new ArrayList<>(cards);
        duplicated.add(cards.get(17));
        assertFalse(CardManager.validateUnique(duplicated));
        assertFalse(CardManager.validateUnique(duplicated));
    }

    @Test
    void testGetByIndex() throws ExhaustedSpaceException {
        CardManager manager = new CardManager(12);
        List<Card> cards = manager.prepare(10);

        assertEquals(cards.get(0), manager.get(0));
        assertEquals(cards.get(9), manager.get(9));

        IndexOutOfBoundsException e = assertThrows(IndexOutOfBoundsException.class, () -> manager.get(20));
        assertEquals("Card index 20 out of range (have 10 cards)", e.getMessage());
        assertThrows(IndexOutOfBoundsException.class, () -> manager.get(10));
        assertThrows(IndexOutOfBoundsException.class, () -> manager.get(-1));
    }

    @Test
    void testGetBeforePrepare() {
        assertThrows(IndexOutOfBoundsException.class, () -> new CardManager(13).get(0));
    }

    @Test
    void testParallelWorkersProduceDistinctCards() throws ExhaustedSpaceException {
        GeneratorSettings settings = GeneratorSettings.defaults().withWorkers(4).withBatchSize(250);
        CardManager manager = new CardManager(new CardRng(2024), settings);
        assertEquals(4, manager.workerCount());

        List<Card> cards = manager.prepare(2000);

        assertEquals(2000, cards.size());
        assertTrue(cards.stream().allMatch(CardValidator::isValid));
        assertTrue(CardManager.validateUnique(cards));
        assertEquals(2000, manager.registeredCount(), "Overshooting workers must release their fingerprints");

        GenerationStats stats = manager.stats();
        assertEquals(2000, stats.accepted());
        assertTrue(stats.attempts() >= 2000);
    }

    @Test
    void testParallelWorkersShareOneRegistry() throws ExhaustedSpaceException {
        // Both workers draw from the same pool, so every card is offered twice
        List<Card> pool = pool(14, 40);
        CardManager manager = new CardManager(List.of(cycling(pool), cycling(pool)), smallDuplicateBound());

        List<Card> cards = manager.prepare(40);

        assertEquals(40, cards.size());
        assertTrue(CardManager.validateUnique(cards));
        assertEquals(new HashSet<>(pool), new HashSet<>(cards));
    }

    @Test
    void testStatsMergeGeneratorCounters() throws ExhaustedSpaceException {
        CardManager manager = new CardManager(15);
        manager.prepare(50);

        GenerationStats stats = manager.stats();
        assertEquals(50, stats.accepted());
        assertEquals(0, stats.rejectedInvalid());
        assertTrue(stats.attempts() >= 50);
    }

    @Test
    void testGeneratorFailureReleasesCallFingerprints() {
        List<Card> pool = pool(16, 5);
        CardManager manager = new CardManager(List.of(failingAfter(pool)), smallDuplicateBound());

        assertThrows(CardGenerationException.class, () -> manager.prepare(10));

        assertEquals(0, manager.size());
        assertEquals(0, manager.registeredCount(), "Cards never handed out must not stay registered");
        assertEquals(0, manager.stats().accepted());
    }

    @Test
    void testGeneratorFailureKeepsEarlierCalls() throws ExhaustedSpaceException {
        List<Card> pool = pool(17, 8);
        CardManager manager = new CardManager(List.of(failingAfter(pool)), smallDuplicateBound());

        List<Card> first = manager.prepare(3);
        assertThrows(CardGenerationException.class, () -> manager.prepare(10));

        assertEquals(first, manager.cards());
        assertEquals(3, manager.registeredCount());
        assertEquals(3, manager.stats().accepted());
    }

    @Test
    void testWorkerFailureReleasesCallFingerprints() {
        List<Card> pool = pool(18, 10);
        List<CardSource> sources = List.of(
                failingAfter(pool.subList(0, 5)),
                failingAfter(pool.subList(5, 10)));
        CardManager manager = new CardManager(sources, smallDuplicateBound());

        assertThrows(CardGenerationException.class, () -> manager.prepare(20));

        assertEquals(0, manager.size());
        assertEquals(0, manager.registeredCount());
        assertEquals(0, manager.stats().accepted());
    }

    @Test
    void testExhaustedSpaceRollsBackAcceptedCount() {
        List<Card> pool = pool(19, 5);
        CardManager manager = new CardManager(List.of(cycling(pool)), smallDuplicateBound());

        assertThrows(ExhaustedSpaceException.class, () -> manager.prepare(6));

        GenerationStats stats = manager.stats();
        assertEquals(0, stats.accepted());
        assertEquals(manager.registeredCount(), stats.accepted());
        assertEquals(50, stats.rejectedDuplicate());
    }

    @Test
    void testResetClearsSessionCounters() throws ExhaustedSpaceException {
        List<Card> pool = pool(20, 4);
        Card repeated = pool.get(0);
        CardManager manager = new CardManager(
                List.of(cycling(List.of(repeated, repeated, pool.get(1), pool.get(2), pool.get(3)))),
                smallDuplicateBound());

        manager.prepare(4);
        assertEquals(4, manager.stats().accepted());
        assertEquals(1, manager.stats().rejectedDuplicate());

        manager.reset();
        assertEquals(0, manager.stats().accepted());
        assertEquals(0, manager.stats().rejectedDuplicate());
    }
}
