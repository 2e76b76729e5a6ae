package dev.perceptron.net.training;

import dev.perceptron.net.Network;

/**
 * Observer of a training run.
 *
 * All hooks run synchronously on the trainer's thread. They should be cheap; an
 * exception thrown from any hook aborts the run and propagates to the caller of
 * {@link SgdTrainer#fit}, leaving the network as the last completed mini-batch
 * update left it.
 *
 * Use cases:
 * - Progress monitoring and logging
 * - Forwarding progress to a remote observer
 * - Collecting per-epoch history
 */
public interface TrainingCallback {

    /**
     * Called once before the first epoch.
     *
     * @param network the network being trained
     * @param config  hyper-parameters of this run
     */
    default void onTrainingStart(Network network, TrainingConfig config) {}

    /**
     * Called after every epoch's last mini-batch update (and evaluation, if any).
     */
    void onEpochEnd(EpochProgress progress);

    /**
     * Called once after the last epoch completed normally.
     */
    default void onTrainingEnd(Network network, TrainingResult result) {}
}
