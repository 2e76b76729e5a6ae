package dev.perceptron.net.serialization;

import dev.perceptron.net.Network;
import dev.perceptron.net.math.Matrix;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Listing entry for a model on disk: identity, architecture and tensor shapes.
 */
public record SavedModelInfo(String networkId,
                             List<Integer> architecture,
                             List<String> weightShapes,
                             List<String> biasShapes,
                             boolean trained,
                             Double accuracy,
                             Instant savedAt) {

    static SavedModelInfo of(String networkId, SavedModel saved) {
        Network network = saved.network();
        List<Integer> architecture = new ArrayList<>();
        for (int size : network.getLayerSizes())
            architecture.add(size);

        List<String> weightShapes = new ArrayList<>();
        for (Matrix w : network.getWeights())
            weightShapes.add(w.shapeString());
        List<String> biasShapes = new ArrayList<>();
        for (Matrix b : network.getBiases())
            biasShapes.add(b.shapeString());

        return new SavedModelInfo(networkId,
                Collections.unmodifiableList(architecture),
                Collections.unmodifiableList(weightShapes),
                Collections.unmodifiableList(biasShapes),
                saved.metadata().trained(),
                saved.metadata().accuracy(),
                saved.savedAt());
    }
}
