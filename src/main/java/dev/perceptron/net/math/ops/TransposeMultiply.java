package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

import java.util.Arrays;

/**
 * Transposed matrix-vector product: output = W^T . delta
 * Carries an error column backwards through a dense transition.
 */
public final class TransposeMultiply {

    /**
     * @param weights rows x cols weight matrix
     * @param delta   rows x 1 error column of the later layer
     * @param output  pre-allocated cols x 1 column, overwritten
     */
    public static void compute(Matrix weights, Matrix delta, Matrix output) {
        int rows = weights.rows();
        int cols = weights.cols();
        delta.requireShape(rows, 1, "Error vector");
        output.requireShape(cols, 1, "Back-propagated error");

        double[] w = weights.data();
        double[] d = delta.data();
        double[] out = output.data();

        Arrays.fill(out, 0.0);
        for (int r = 0; r < rows; r++) {
            double dr = d[r];
            int offset = r * cols;
            for (int c = 0; c < cols; c++)
                out[c] += w[offset + c] * dr;
        }
    }

    private TransposeMultiply() {}
}
