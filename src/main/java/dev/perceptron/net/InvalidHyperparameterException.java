package dev.perceptron.net;

/**
 * Thrown when epoch count, mini-batch size or learning rate is not strictly positive.
 */
public class InvalidHyperparameterException extends IllegalArgumentException {

    public InvalidHyperparameterException(String message) {
        super(message);
    }
}
