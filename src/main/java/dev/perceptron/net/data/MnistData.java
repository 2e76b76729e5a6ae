package dev.perceptron.net.data;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.TrainingExample;

import java.util.List;

/**
 * MNIST split the way the trainer consumes it: one-hot training pairs, and
 * label-indexed validation and test pairs.
 */
public record MnistData(List<TrainingExample> training,
                        List<EvaluationExample> validation,
                        List<EvaluationExample> test) {

    public MnistData {
        training = List.copyOf(training);
        validation = List.copyOf(validation);
        test = List.copyOf(test);
    }
}
