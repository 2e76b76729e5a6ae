package dev.perceptron.net.losses;

import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.NetMath;

/**
 * Quadratic cost for a single example.
 *
 * <p>Loss: C = 1/2 * sum((a[i] - y[i])^2)
 * <p>Derivative: dC/da[i] = a[i] - y[i]
 */
public final class QuadraticCost {

    public static final QuadraticCost INSTANCE = new QuadraticCost();

    private QuadraticCost() {} // Private constructor for singleton

    public double loss(Matrix prediction, Matrix target) {
        Matrix diff = Matrix.zerosLike(prediction);
        NetMath.elementwiseSubtract(prediction, target, diff);
        return 0.5 * NetMath.squaredNorm(diff);
    }

    /**
     * Partial derivatives of the cost with respect to the output activations.
     */
    public Matrix derivatives(Matrix prediction, Matrix target) {
        Matrix derivatives = Matrix.zerosLike(prediction);
        NetMath.elementwiseSubtract(prediction, target, derivatives);
        return derivatives;
    }
}
