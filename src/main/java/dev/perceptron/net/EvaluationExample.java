package dev.perceptron.net;

import dev.perceptron.net.math.Matrix;

import java.util.Objects;

/**
 * Evaluation pair: an input column and its class index.
 */
public record EvaluationExample(Matrix input, int label) {

    public EvaluationExample {
        Objects.requireNonNull(input, "input");
        if (label < 0)
            throw new IllegalArgumentException("Label must be non-negative: " + label);
    }
}
