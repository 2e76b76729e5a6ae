package dev.perceptron.net.training;

/**
 * Correct-prediction count over an evaluation set.
 */
public record EvaluationResult(int correct, int total) {

    /**
     * correct / total, or NaN for an empty evaluation set.
     */
    public double accuracy() {
        return total == 0 ? Double.NaN : (double) correct / total;
    }
}
