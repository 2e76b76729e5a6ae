package dev.perceptron.net.math;

import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Factory for the explicit, seedable random generators threaded through
 * network construction and training.
 */
public final class RandomSource {

    private static final String ALGORITHM = "Xoroshiro128PlusPlus";

    /** Generator with a fixed seed; identical seeds give identical sequences. */
    public static RandomGenerator create(long seed) {
        return RandomGeneratorFactory.of(ALGORITHM).create(seed);
    }

    /** Generator seeded from system entropy. */
    public static RandomGenerator create() {
        return RandomGeneratorFactory.of(ALGORITHM).create();
    }

    /**
     * In-place Fisher-Yates shuffle, every permutation equally likely.
     */
    public static void shuffle(int[] indices, RandomGenerator random) {
        for (int i = indices.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
    }

    private RandomSource() {}
}
