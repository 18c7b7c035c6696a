package org.carma.fleetalloc.experiment;

import java.util.Arrays;
import java.util.Random;

/**
 * Derives an independent, reproducible seed for every trial of an experiment.
 *
 * Each trial seed depends only on the base seed and the trial index, so a
 * trial's random stream never overlaps another's and trials can run in any
 * order or in parallel with identical results.
 */
public final class SeedSequence {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private SeedSequence() {
    }

    /**
     * Seed for trial {@code trialIndex} of an experiment seeded with {@code baseSeed}.
     */
    public static long trialSeed(long baseSeed, int trialIndex) {
        if (trialIndex < 0) {
            throw new IllegalArgumentException("Trial index cannot be negative: " + trialIndex);
        }
        return mix(baseSeed + (trialIndex + 1L) * GOLDEN_GAMMA);
    }

    /**
     * Random source for one trial.
     */
    public static Random trialRandom(long baseSeed, int trialIndex) {
        return new Random(trialSeed(baseSeed, trialIndex));
    }

    /**
     * Detect seed collisions in a batch.
     */
    public static boolean hasCollisions(long[] seeds) {
        return Arrays.stream(seeds).distinct().count() != seeds.length;
    }

    // Stafford variant 13 finalizer, a bijection on 64-bit values
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
