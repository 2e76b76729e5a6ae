package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

import java.util.random.RandomGenerator;

/**
 * Fills a matrix with independent draws from N(mean, stddev^2).
 */
public final class GaussianInit {

    public static void compute(Matrix target, double mean, double stddev, RandomGenerator random) {
        if (stddev < 0)
            throw new IllegalArgumentException("Standard deviation must be non-negative: " + stddev);

        double[] values = target.data();
        for (int i = 0; i < values.length; i++)
            values[i] = random.nextGaussian() * stddev + mean;
    }

    private GaussianInit() {}
}
