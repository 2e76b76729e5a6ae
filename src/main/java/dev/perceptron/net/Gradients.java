package dev.perceptron.net;

import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.NetMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cost gradients for every bias vector and weight matrix of a {@link Network}, in
 * transition order. Shapes match the network's parameters exactly.
 *
 * <p>Used both for a single example (the result of backpropagation) and as the
 * zero-initialised accumulator summed across a mini-batch.
 */
public final class Gradients {

    private final List<Matrix> biases;
    private final List<Matrix> weights;

    Gradients(List<Matrix> biases, List<Matrix> weights) {
        if (biases.size() != weights.size())
            throw new IllegalArgumentException("Bias and weight gradient counts differ: "
                    + biases.size() + " vs " + weights.size());
        this.biases = Collections.unmodifiableList(new ArrayList<>(biases));
        this.weights = Collections.unmodifiableList(new ArrayList<>(weights));
    }

    /**
     * Zero gradients shaped like the network's parameters.
     */
    public static Gradients zerosLike(Network network) {
        List<Matrix> b = new ArrayList<>();
        List<Matrix> w = new ArrayList<>();
        for (Matrix bias : network.getBiases())
            b.add(Matrix.zerosLike(bias));
        for (Matrix weight : network.getWeights())
            w.add(Matrix.zerosLike(weight));
        return new Gradients(b, w);
    }

    /**
     * Gradients with respect to each bias vector, nabla_b[l].
     */
    public List<Matrix> biases() {
        return biases;
    }

    /**
     * Gradients with respect to each weight matrix, nabla_w[l].
     */
    public List<Matrix> weights() {
        return weights;
    }

    public int transitions() {
        return weights.size();
    }

    /**
     * Add {@code other} into these gradients element-wise.
     *
     * @throws DimensionMismatchException if the two sets were shaped for different networks
     */
    public void accumulate(Gradients other) {
        if (other.transitions() != transitions())
            throw new DimensionMismatchException("Gradient sets have " + other.transitions()
                    + " transitions, expected " + transitions());
        for (int l = 0; l < transitions(); l++) {
            NetMath.accumulate(biases.get(l), other.biases.get(l));
            NetMath.accumulate(weights.get(l), other.weights.get(l));
        }
    }
}
