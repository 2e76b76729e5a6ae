package dev.perceptron.net.service;

/**
 * Outcome of deleting one network.
 */
public record DeletionResult(String networkId, boolean deletedFromMemory, boolean deletedFromDisk) {
}
