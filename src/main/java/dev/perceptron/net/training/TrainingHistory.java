package dev.perceptron.net.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Callback that records every epoch's progress. Safe to read from another
 * thread while training runs.
 */
public class TrainingHistory implements TrainingCallback {

    private final List<EpochProgress> epochs = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onEpochEnd(EpochProgress progress) {
        epochs.add(progress);
    }

    /**
     * Snapshot of the epochs recorded so far.
     */
    public List<EpochProgress> getEpochs() {
        synchronized (epochs) {
            return List.copyOf(epochs);
        }
    }

    public EpochProgress getLatest() {
        synchronized (epochs) {
            return epochs.isEmpty() ? null : epochs.get(epochs.size() - 1);
        }
    }

    /**
     * Best evaluation accuracy seen so far, or null if no epoch was evaluated.
     */
    public Double getBestAccuracy() {
        Double best = null;
        for (EpochProgress progress : getEpochs()) {
            if (progress.hasEvaluation() && (best == null || progress.accuracy() > best))
                best = progress.accuracy();
        }
        return best;
    }
}
