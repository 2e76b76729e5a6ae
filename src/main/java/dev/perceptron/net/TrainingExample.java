package dev.perceptron.net;

import dev.perceptron.net.math.Matrix;

import java.util.Objects;

/**
 * Labelled training pair: an input column and its one-hot target column.
 */
public record TrainingExample(Matrix input, Matrix target) {

    public TrainingExample {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(target, "target");
    }
}
