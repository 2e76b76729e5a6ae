package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

/**
 * Element-wise subtraction: output[i] = a[i] - b[i]
 */
public final class ElementwiseSubtract {

    public static void compute(Matrix a, Matrix b, Matrix output) {
        ElementwiseMultiply.requireSameShape(a, b, output);

        double[] av = a.data();
        double[] bv = b.data();
        double[] out = output.data();
        for (int i = 0; i < out.length; i++)
            out[i] = av[i] - bv[i];
    }

    private ElementwiseSubtract() {}
}
