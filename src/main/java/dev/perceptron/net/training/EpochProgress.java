package dev.perceptron.net.training;

import java.time.Duration;

/**
 * Per-epoch payload handed to {@link TrainingCallback#onEpochEnd}.
 *
 * @param epoch       1-based index of the epoch that just finished
 * @param totalEpochs number of epochs the run was asked for
 * @param elapsed     wall-clock time since the run started
 * @param accuracy    correct / total on the evaluation set, null without evaluation data
 * @param correct     number of correctly classified evaluation examples, or null
 * @param total       size of the evaluation set, or null
 */
public record EpochProgress(int epoch,
                            int totalEpochs,
                            Duration elapsed,
                            Double accuracy,
                            Integer correct,
                            Integer total) {

    static EpochProgress withoutEvaluation(int epoch, int totalEpochs, Duration elapsed) {
        return new EpochProgress(epoch, totalEpochs, elapsed, null, null, null);
    }

    static EpochProgress evaluated(int epoch, int totalEpochs, Duration elapsed, int correct, int total) {
        return new EpochProgress(epoch, totalEpochs, elapsed, (double) correct / total, correct, total);
    }

    public boolean hasEvaluation() {
        return accuracy != null;
    }

    /**
     * Completed share of the run in percent.
     */
    public double percentComplete() {
        return 100.0 * epoch / totalEpochs;
    }
}
