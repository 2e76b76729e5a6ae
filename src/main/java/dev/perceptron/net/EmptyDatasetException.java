package dev.perceptron.net;

/**
 * Thrown when a training (or required evaluation) collection has no examples.
 */
public class EmptyDatasetException extends IllegalArgumentException {

    public EmptyDatasetException(String message) {
        super(message);
    }
}
