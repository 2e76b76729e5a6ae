package dev.perceptron.net.serialization;

import dev.perceptron.net.Network;

import java.time.Instant;

/**
 * A network read back from storage together with its metadata.
 */
public record SavedModel(Network network, ModelMetadata metadata, Instant savedAt) {
}
