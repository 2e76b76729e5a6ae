package dev.perceptron.net;

/**
 * Thrown when a layer-size sequence cannot describe a network: fewer than two
 * layers, or a layer with a non-positive number of neurons.
 */
public class InvalidArchitectureException extends IllegalArgumentException {

    public InvalidArchitectureException(String message) {
        super(message);
    }
}
