package com.starkiller.core.encounter;

import java.util.List;
import java.util.Random;

/**
 * The one pseudo-random source of a session. Every random draw made while
 * generating encounters goes through this instance, so a seed and an identical
 * call sequence reproduce the same shift.
 */
public class GameRandom {

    private Random random;
    private long seed;

    public GameRandom(long seed) {
        reseed(seed);
    }

    public final void reseed(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long seed() {
        return seed;
    }

    public double nextDouble() {
        return random.nextDouble();
    }

    /** True with the given probability. */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    /** Uniform integer in {@code [0, bound)}. */
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /** Uniform integer in {@code [min, max]}. */
    public int between(int min, int max) {
        if (max <= min) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }

    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(random.nextInt(items.size()));
    }
}
