package dev.perceptron.net.activators;

import dev.perceptron.net.math.Matrix;

public interface Activator {

    /**
     * Apply the activation element-wise: output[i] = f(input[i])
     */
    void activate(Matrix input, Matrix output);

    /**
     * Derivative with respect to the pre-activation: output[i] = f'(input[i])
     */
    void derivative(Matrix input, Matrix output);

    /**
     * Scalar form of {@link #activate(Matrix, Matrix)}.
     */
    double activate(double z);

    /**
     * Scalar form of {@link #derivative(Matrix, Matrix)}.
     */
    double derivative(double z);
}
