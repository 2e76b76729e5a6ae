package dev.perceptron.net.service;

import dev.perceptron.net.inspection.ExamplePrediction;
import dev.perceptron.net.math.Matrix;

/**
 * A classified test example together with the output layer's weights.
 *
 * @param outputWeights copy of the last weight matrix
 */
public record ExampleReport(String networkId, ExamplePrediction prediction, Matrix outputWeights) {
}
