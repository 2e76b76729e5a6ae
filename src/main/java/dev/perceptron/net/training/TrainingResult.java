package dev.perceptron.net.training;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a completed {@link SgdTrainer#fit} run.
 *
 * @param epochs       per-epoch progress in order
 * @param totalTime    wall-clock duration of the run
 */
public record TrainingResult(List<EpochProgress> epochs, Duration totalTime) {

    public TrainingResult {
        epochs = List.copyOf(epochs);
    }

    public int epochsCompleted() {
        return epochs.size();
    }

    /**
     * Accuracy after the final epoch, or null if the run had no evaluation data.
     */
    public Double finalAccuracy() {
        return epochs.isEmpty() ? null : epochs.get(epochs.size() - 1).accuracy();
    }
}
