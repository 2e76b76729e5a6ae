package dev.perceptron.net.math.ops;

import dev.perceptron.net.math.Matrix;

/**
 * Parameter update operation: param[i] = param[i] - scale * gradient[i]
 */
public final class ParameterUpdate {

    /**
     * @param parameters updated in place
     * @param gradients  same shape as {@code parameters}
     * @param scale      step multiplier, for SGD {@code learningRate / batchSize}
     */
    public static void compute(Matrix parameters, Matrix gradients, double scale) {
        ElementwiseMultiply.requireSameShape(parameters, gradients, parameters);

        double[] p = parameters.data();
        double[] g = gradients.data();
        for (int i = 0; i < p.length; i++)
            p[i] -= scale * g[i];
    }

    private ParameterUpdate() {}
}
