package dev.perceptron.net.math.ops;

import dev.perceptron.net.DimensionMismatchException;
import dev.perceptron.net.math.Matrix;

/**
 * Hadamard product: output[i] = a[i] * b[i]
 */
public final class ElementwiseMultiply {

    public static void compute(Matrix a, Matrix b, Matrix output) {
        requireSameShape(a, b, output);

        double[] av = a.data();
        double[] bv = b.data();
        double[] out = output.data();
        for (int i = 0; i < out.length; i++)
            out[i] = av[i] * bv[i];
    }

    static void requireSameShape(Matrix a, Matrix b, Matrix output) {
        if (!a.sameShape(b) || !a.sameShape(output))
            throw new DimensionMismatchException("Elementwise operands must share a shape: "
                    + a.shapeString() + ", " + b.shapeString() + ", " + output.shapeString());
    }

    private ElementwiseMultiply() {}
}
