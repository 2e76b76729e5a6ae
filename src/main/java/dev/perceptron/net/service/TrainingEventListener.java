package dev.perceptron.net.service;

/**
 * Delivery end of training events: push to remote observers, queue for polling, etc.
 * Called on the training worker thread; implementations must not block.
 */
@FunctionalInterface
public interface TrainingEventListener {

    void onEvent(TrainingEvent event);
}
