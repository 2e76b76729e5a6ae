package dev.perceptron.net.service;

import java.util.List;

/**
 * One entry of {@link NetworkService#listNetworks()}.
 */
public record NetworkListing(String networkId,
                             List<Integer> architecture,
                             boolean trained,
                             Double accuracy,
                             Source source) {

    public enum Source {
        IN_MEMORY,
        SAVED
    }

    public NetworkListing {
        architecture = List.copyOf(architecture);
    }
}
