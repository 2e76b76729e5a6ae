package dev.perceptron.net.serialization;

import java.util.Objects;

/**
 * Descriptive data stored next to the parameters of a saved model.
 *
 * @param networkId identifier the model was saved under, empty for anonymous saves
 * @param trained   whether a training run completed on the model
 * @param accuracy  test accuracy in [0, 1] after training, or null if unknown
 */
public record ModelMetadata(String networkId, boolean trained, Double accuracy) {

    public ModelMetadata {
        Objects.requireNonNull(networkId, "networkId");
    }

    public static ModelMetadata anonymous() {
        return new ModelMetadata("", false, null);
    }
}
