package dev.perceptron.net.activators;

import dev.perceptron.net.DimensionMismatchException;
import dev.perceptron.net.math.Matrix;

/**
 * Sigmoid activation function: f(x) = 1 / (1 + e^(-x))
 *
 * Properties:
 * - Output range: (0, 1) for finite inputs of moderate magnitude
 * - Derivative: f'(x) = f(x) * (1 - f(x)), peaking at 0.25 for x = 0
 *
 * Unlike an output-cached derivative, {@link #derivative(Matrix, Matrix)} takes the
 * pre-activation z, which is what backpropagation retains.
 */
public final class SigmoidActivator implements Activator {

    public static final SigmoidActivator INSTANCE = new SigmoidActivator();

    private SigmoidActivator() {} // Singleton pattern

    @Override
    public void activate(Matrix input, Matrix output) {
        checkShape(input, output);

        double[] in = input.data();
        double[] out = output.data();
        for (int i = 0; i < in.length; i++)
            out[i] = activate(in[i]);
    }

    @Override
    public void derivative(Matrix input, Matrix output) {
        checkShape(input, output);

        double[] in = input.data();
        double[] out = output.data();
        for (int i = 0; i < in.length; i++)
            out[i] = derivative(in[i]);
    }

    @Override
    public double activate(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public double derivative(double z) {
        double sigmoid = activate(z);
        return sigmoid * (1.0 - sigmoid);
    }

    private void checkShape(Matrix input, Matrix output) {
        if (!input.sameShape(output))
            throw new DimensionMismatchException("Input and output must have the same shape: "
                    + input.shapeString() + " vs " + output.shapeString());
    }
}
