package dev.perceptron.net.math;

import dev.perceptron.net.math.ops.*;

import java.util.random.RandomGenerator;

/**
 * Central entry point for the network's numeric kernels.
 * Methods are prefixed by operation type for intuitive autocomplete.
 */
public final class NetMath {

    // ========== DENSE TRANSITIONS ==========

    /**
     * Pre-activations: output = weights . input + biases
     */
    public static void preActivations(Matrix weights, Matrix input, Matrix biases, Matrix output) {
        PreActivations.compute(weights, input, biases, output);
    }

    /**
     * Back-propagated error: output = weights^T . delta
     */
    public static void transposeMultiply(Matrix weights, Matrix delta, Matrix output) {
        TransposeMultiply.compute(weights, delta, output);
    }

    /**
     * Outer product: output = a . b^T
     */
    public static void outerProduct(Matrix a, Matrix b, Matrix output) {
        OuterProduct.compute(a, b, output);
    }

    // ========== ELEMENT-WISE OPERATIONS ==========

    /**
     * Element-wise multiplication: output[i] = a[i] * b[i]
     */
    public static void elementwiseMultiply(Matrix a, Matrix b, Matrix output) {
        ElementwiseMultiply.compute(a, b, output);
    }

    /**
     * Element-wise subtraction: output[i] = a[i] - b[i]
     */
    public static void elementwiseSubtract(Matrix a, Matrix b, Matrix output) {
        ElementwiseSubtract.compute(a, b, output);
    }

    /**
     * In-place accumulation: target[i] += addend[i]
     */
    public static void accumulate(Matrix target, Matrix addend) {
        Accumulate.compute(target, addend);
    }

    // ========== PARAMETERS ==========

    /**
     * Gradient step: parameters[i] -= scale * gradients[i]
     */
    public static void parameterUpdate(Matrix parameters, Matrix gradients, double scale) {
        ParameterUpdate.compute(parameters, gradients, scale);
    }

    /**
     * Standard normal initialisation, N(0, 1) per element.
     */
    public static void standardNormalInit(Matrix target, RandomGenerator random) {
        GaussianInit.compute(target, 0.0, 1.0, random);
    }

    // ========== REDUCTIONS ==========

    /**
     * Index of the largest element; the first one wins on ties. NaN elements are skipped
     * unless every element is NaN, in which case 0 is returned.
     */
    public static int argmax(Matrix values) {
        double[] data = values.data();
        int best = -1;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < data.length; i++) {
            double v = data[i];
            if (Double.isNaN(v))
                continue;
            if (best < 0 || v > bestValue) {
                best = i;
                bestValue = v;
            }
        }
        return Math.max(best, 0);
    }

    /**
     * Squared Euclidean norm: sum of a[i]^2
     */
    public static double squaredNorm(Matrix values) {
        double sum = 0.0;
        for (double v : values.data())
            sum += v * v;
        return sum;
    }

    private NetMath() {}
}
