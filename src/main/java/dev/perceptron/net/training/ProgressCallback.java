package dev.perceptron.net.training;

import dev.perceptron.net.Network;

import java.io.PrintStream;

/**
 * Progress reporting callback that prints one line per epoch to the console.
 *
 * Example output:
 * Epoch  3/30 - acc: 0.9412 (9412/10000) - 4.1s
 */
public class ProgressCallback implements TrainingCallback {

    private final PrintStream out;

    public ProgressCallback() {
        this(System.out);
    }

    public ProgressCallback(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onTrainingStart(Network network, TrainingConfig config) {
        out.printf("Training %s for %d epochs (mini-batch %d, eta %s)%n",
                network, config.epochs, config.miniBatchSize, config.learningRate);
    }

    @Override
    public void onEpochEnd(EpochProgress progress) {
        if (progress.hasEvaluation()) {
            out.printf("Epoch %3d/%d - acc: %.4f (%d/%d) - %s%n",
                    progress.epoch(), progress.totalEpochs(),
                    progress.accuracy(), progress.correct(), progress.total(),
                    formatTime(progress.elapsed().toMillis()));
        } else {
            out.printf("Epoch %3d/%d complete - %s%n",
                    progress.epoch(), progress.totalEpochs(),
                    formatTime(progress.elapsed().toMillis()));
        }
    }

    @Override
    public void onTrainingEnd(Network network, TrainingResult result) {
        out.println("Training completed");
        out.printf("Total time: %s%n", formatTime(result.totalTime().toMillis()));
        if (result.finalAccuracy() != null)
            out.printf("Final accuracy: %.4f%n", result.finalAccuracy());
    }

    static String formatTime(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60000) {
            return String.format("%.1fs", millis / 1000.0);
        } else {
            long minutes = millis / 60000;
            long seconds = (millis % 60000) / 1000;
            return String.format("%dm %ds", minutes, seconds);
        }
    }
}
