package dev.perceptron.net.math.ops;

import dev.perceptron.net.DimensionMismatchException;
import dev.perceptron.net.math.Matrix;

/**
 * Affine pre-activations of a dense transition: z = W . a + b
 */
public final class PreActivations {

    /**
     * @param weights rows x cols weight matrix
     * @param input   cols x 1 activation column
     * @param biases  rows x 1 bias column
     * @param output  pre-allocated rows x 1 column, overwritten
     */
    public static void compute(Matrix weights, Matrix input, Matrix biases, Matrix output) {
        int rows = weights.rows();
        int cols = weights.cols();
        input.requireShape(cols, 1, "Input activation");
        biases.requireShape(rows, 1, "Bias vector");
        output.requireShape(rows, 1, "Pre-activation output");
        if (input == output)
            throw new DimensionMismatchException("Pre-activations cannot be computed in place");

        double[] w = weights.data();
        double[] a = input.data();
        double[] b = biases.data();
        double[] z = output.data();

        for (int r = 0; r < rows; r++) {
            double sum = 0.0;
            int offset = r * cols;
            for (int c = 0; c < cols; c++)
                sum += w[offset + c] * a[c];
            z[r] = sum + b[r];
        }
    }

    private PreActivations() {}
}
