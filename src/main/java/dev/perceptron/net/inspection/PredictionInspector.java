package dev.perceptron.net.inspection;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.NetMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Looks up how a network classifies individual examples. Never mutates the network.
 */
public final class PredictionInspector {

    public static ExamplePrediction predict(Network network, List<EvaluationExample> examples, int index) {
        EvaluationExample example = examples.get(index);
        Matrix output = network.feedforward(example.input());

        List<Double> outputs = new ArrayList<>(output.size());
        for (double v : output.data())
            outputs.add(v);
        return new ExamplePrediction(index, NetMath.argmax(output), example.label(), outputs);
    }

    /**
     * Sample random examples until one is classified correctly ({@code wantCorrect})
     * or incorrectly, giving up after {@code maxAttempts} draws.
     */
    public static Optional<ExamplePrediction> findExample(Network network, List<EvaluationExample> examples,
                                                         boolean wantCorrect, int maxAttempts,
                                                         RandomGenerator random) {
        if (examples.isEmpty())
            return Optional.empty();

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            ExamplePrediction prediction = predict(network, examples, random.nextInt(examples.size()));
            if (prediction.isCorrect() == wantCorrect)
                return Optional.of(prediction);
        }
        return Optional.empty();
    }

    /**
     * Indices of up to {@code maxCount} misclassified examples among the first {@code maxCheck}.
     */
    public static List<Integer> findMisclassified(Network network, List<EvaluationExample> examples,
                                                  int maxCount, int maxCheck) {
        List<Integer> misclassified = new ArrayList<>();
        int limit = Math.min(maxCheck, examples.size());
        for (int i = 0; i < limit && misclassified.size() < maxCount; i++) {
            EvaluationExample example = examples.get(i);
            if (network.predictClass(example.input()) != example.label())
                misclassified.add(i);
        }
        return misclassified;
    }

    private PredictionInspector() {}
}
