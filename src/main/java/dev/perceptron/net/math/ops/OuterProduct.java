package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

/**
 * Outer product of two columns: output[i][j] = a[i] * b[j]
 */
public final class OuterProduct {

    /**
     * @param a      m x 1 column
     * @param b      n x 1 column
     * @param output pre-allocated m x n matrix, overwritten
     */
    public static void compute(Matrix a, Matrix b, Matrix output) {
        a.requireShape(a.rows(), 1, "Outer product left operand");
        b.requireShape(b.rows(), 1, "Outer product right operand");
        output.requireShape(a.rows(), b.rows(), "Outer product output");

        double[] av = a.data();
        double[] bv = b.data();
        double[] out = output.data();
        int n = bv.length;

        for (int i = 0; i < av.length; i++) {
            double ai = av[i];
            int offset = i * n;
            for (int j = 0; j < n; j++)
                out[offset + j] = ai * bv[j];
        }
    }

    private OuterProduct() {}
}
