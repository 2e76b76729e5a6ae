package dev.perceptron.net.training;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;

import java.util.Collection;

/**
 * Classification scoring: the predicted class is the index of the largest output
 * activation, compared against each example's label. Read-only with respect to
 * the network.
 */
public final class Evaluator {

    private final Network network;

    public Evaluator(Network network) {
        this.network = network;
    }

    /**
     * Number of examples whose predicted class equals the label; 0 for an empty collection.
     *
     * @throws dev.perceptron.net.DimensionMismatchException if an input has the wrong length
     */
    public int evaluate(Collection<EvaluationExample> examples) {
        int correct = 0;
        for (EvaluationExample example : examples) {
            if (network.predictClass(example.input()) == example.label())
                correct++;
        }
        return correct;
    }

    public EvaluationResult score(Collection<EvaluationExample> examples) {
        return new EvaluationResult(evaluate(examples), examples.size());
    }
}
