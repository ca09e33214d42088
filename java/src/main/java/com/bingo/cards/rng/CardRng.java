package com.bingo.cards.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Long-lived random number stream for one generation session or one worker.
 * A stream is seeded exactly once; parallel workers obtain their own stream
 * through {@link #split()} instead of re-seeding from the clock.
 */
public class CardRng {
    private final SplittableRandom random;
    private final long seed;

    /**
     * Create a new CardRng with the specified seed.
     * The same seed always yields the same sequence of cards.
     */
    public CardRng(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    /**
     * Create a new CardRng seeded from SecureRandom mixed with the
     * high-resolution clock.
     */
    public CardRng() {
        this(new SecureRandom().nextLong() ^ System.nanoTime());
    }

    private CardRng(SplittableRandom random, long seed) {
        this.random = random;
        this.seed = seed;
    }

    /**
     * Derive an independent stream for a parallel worker.
     * The child shares no state with this stream after the split.
     */
    public CardRng split() {
        return new CardRng(random.split(), seed);
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /**
     * Generate a random integer in range [origin, bound).
     */
    public int nextInt(int origin, int bound) {
        return random.nextInt(origin, bound);
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = random.nextInt(i + 1);
            Collections.swap(list, i, j);
        }
    }

    /**
     * Fisher-Yates shuffle for an array.
     */
    public void shuffle(int[] array) {
        for (int i = array.length - 1; i >= 1; i--) {
            int j = random.nextInt(i + 1);
            int temp = array[i];
            array[i] = array[j];
            array[j] = temp;
        }
    }

    /**
     * Draw {@code count} distinct elements of {@code pool} without replacement.
     * Partial Fisher-Yates over a copy; the pool itself is left untouched.
     *
     * @throws IllegalArgumentException if count is negative or larger than the pool
     */
    public int[] sample(int[] pool, int count) {
        if (count < 0 || count > pool.length) {
            throw new IllegalArgumentException(
                    "Cannot sample " + count + " values from a pool of " + pool.length);
        }
        int[] work = pool.clone();
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(work.length - i);
            int temp = work[i];
            work[i] = work[j];
            work[j] = temp;
        }
        int[] picked = new int[count];
        System.arraycopy(work, 0, picked, 0, count);
        return picked;
    }

    /**
     * Get the seed this stream (or the stream it was split from) started with.
     */
    public long getSeed() {
        return seed;
    }
}
