package dev.perceptron.net.training;

import dev.perceptron.net.EmptyDatasetException;
import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Gradients;
import dev.perceptron.net.Network;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.math.RandomSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Mini-batch stochastic gradient descent:
 * - Full reshuffle of the training set every epoch
 * - Consecutive mini-batches of the configured size (the last may be smaller)
 * - Per-example backpropagation summed into fresh accumulators
 * - One synchronous update per batch: w = w - (eta / |batch|) * sum(nabla_w)
 * - Optional evaluation and callbacks at every epoch boundary
 *
 * <p>Runs exactly {@code config.epochs} epochs; there is no early stopping. Batches
 * are processed strictly one after another on the calling thread. A trainer must
 * not be shared between threads, and only one trainer may update a given network
 * at a time.
 */
public class SgdTrainer {

    private final Network network;
    private final TrainingConfig config;
    private final RandomGenerator random;
    private final List<TrainingCallback> callbacks = new ArrayList<>();

    public SgdTrainer(Network network, TrainingConfig config) {
        this(network, config, config.randomSeed != null
                ? RandomSource.create(config.randomSeed)
                : RandomSource.create());
    }

    /**
     * @param random source of the per-epoch shuffles
     */
    public SgdTrainer(Network network, TrainingConfig config, RandomGenerator random) {
        this.network = network;
        this.config = config;
        this.random = random;
        if (config.verbosity > 0)
            callbacks.add(new ProgressCallback());
    }

    public SgdTrainer withCallback(TrainingCallback callback) {
        callbacks.add(callback);
        return this;
    }

    public Network getNetwork() {
        return network;
    }

    public TrainingConfig getConfig() {
        return config;
    }

    /**
     * Train without evaluation data. Callbacks still fire every epoch, with empty
     * accuracy fields.
     */
    public TrainingResult fit(List<TrainingExample> training) {
        return fit(training, null);
    }

    /**
     * Train for the configured number of epochs.
     *
     * @param training   non-empty training examples
     * @param evaluation examples scored after every epoch, or null to skip scoring
     * @throws EmptyDatasetException if {@code training} (or a supplied {@code evaluation}) is empty
     * @throws dev.perceptron.net.DimensionMismatchException if any example has the wrong shape;
     *         raised before the first update
     */
    public TrainingResult fit(List<TrainingExample> training, List<EvaluationExample> evaluation) {
        validate(training, evaluation);

        Evaluator evaluator = new Evaluator(network);
        List<EpochProgress> history = new ArrayList<>(config.epochs);
        long start = System.nanoTime();

        for (TrainingCallback callback : callbacks)
            callback.onTrainingStart(network, config);

        for (int epoch = 1; epoch <= config.epochs; epoch++) {
            trainEpoch(training);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            EpochProgress progress;
            if (evaluation != null) {
                int correct = evaluator.evaluate(evaluation);
                progress = EpochProgress.evaluated(epoch, config.epochs, elapsed, correct, evaluation.size());
            } else {
                progress = EpochProgress.withoutEvaluation(epoch, config.epochs, elapsed);
            }
            history.add(progress);

            for (TrainingCallback callback : callbacks)
                callback.onEpochEnd(progress);
        }

        TrainingResult result = new TrainingResult(history, Duration.ofNanos(System.nanoTime() - start));
        for (TrainingCallback callback : callbacks)
            callback.onTrainingEnd(network, result);
        return result;
    }

    private void trainEpoch(List<TrainingExample> training) {
        int[] order = nextEpochOrder(training.size());

        for (int i = 0; i < order.length; i += config.miniBatchSize) {
            int batchEnd = Math.min(i + config.miniBatchSize, order.length);

            List<TrainingExample> batch = new ArrayList<>(batchEnd - i);
            for (int j = i; j < batchEnd; j++)
                batch.add(training.get(order[j]));

            updateMiniBatch(batch);
        }
    }

    /**
     * Fresh uniformly random permutation of {@code 0..size-1}, drawn from this
     * trainer's generator. Each call advances the generator.
     */
    int[] nextEpochOrder(int size) {
        int[] indices = new int[size];
        for (int i = 0; i < size; i++)
            indices[i] = i;
        RandomSource.shuffle(indices, random);
        return indices;
    }

    /**
     * Apply one gradient-descent step computed over {@code batch} with the configured
     * learning rate.
     *
     * @throws EmptyDatasetException if the batch is empty
     */
    public void updateMiniBatch(List<TrainingExample> batch) {
        if (batch.isEmpty())
            throw new EmptyDatasetException("Mini-batch must contain at least one example");

        Gradients sums = Gradients.zerosLike(network);
        for (TrainingExample example : batch)
            sums.accumulate(network.backprop(example.input(), example.target()));

        network.applyGradients(sums, config.learningRate / batch.size());
    }

    private void validate(List<TrainingExample> training, List<EvaluationExample> evaluation) {
        if (training == null || training.isEmpty())
            throw new EmptyDatasetException("Training data must contain at least one example");
        if (evaluation != null && evaluation.isEmpty())
            throw new EmptyDatasetException("Evaluation data was supplied but is empty");

        int inputSize = network.getInputSize();
        int outputSize = network.getOutputSize();
        for (int i = 0; i < training.size(); i++) {
            TrainingExample example = training.get(i);
            example.input().requireShape(inputSize, 1, "Training input " + i);
            example.target().requireShape(outputSize, 1, "Training target " + i);
        }
        if (evaluation != null) {
            for (int i = 0; i < evaluation.size(); i++)
                evaluation.get(i).input().requireShape(inputSize, 1, "Evaluation input " + i);
        }
    }
}
