package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

/**
 * In-place accumulation: target[i] += addend[i]
 * Sums per-example gradients into a mini-batch accumulator.
 */
public final class Accumulate {

    public static void compute(Matrix target, Matrix addend) {
        ElementwiseMultiply.requireSameShape(target, addend, target);

        double[] t = target.data();
        double[] a = addend.data();
        for (int i = 0; i < t.length; i++)
            t[i] += a[i];
    }

    private Accumulate() {}
}
