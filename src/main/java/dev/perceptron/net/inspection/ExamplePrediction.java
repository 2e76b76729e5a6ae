package dev.perceptron.net.inspection;

import java.util.List;

/**
 * The network's answer for one evaluation example.
 *
 * @param index     position of the example in its dataset
 * @param predicted index of the largest output activation
 * @param actual    the example's label
 * @param outputs   raw output activations
 */
public record ExamplePrediction(int index, int predicted, int actual, List<Double> outputs) {

    public ExamplePrediction {
        outputs = List.copyOf(outputs);
    }

    public boolean isCorrect() {
        return predicted == actual;
    }
}
