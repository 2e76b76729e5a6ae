package dev.perceptron.net.service;

import dev.perceptron.net.Network;

import java.util.ArrayList;
import java.util.List;

/**
 * A network held in memory by the service, with its training outcome.
 */
public class NetworkSession {

    private final String networkId;
    private final Network network;
    private volatile boolean trained;
    private volatile Double accuracy;

    NetworkSession(String networkId, Network network, boolean trained, Double accuracy) {
        this.networkId = networkId;
        this.network = network;
        this.trained = trained;
        this.accuracy = accuracy;
    }

    public String getNetworkId() {
        return networkId;
    }

    public Network getNetwork() {
        return network;
    }

    public List<Integer> getArchitecture() {
        List<Integer> architecture = new ArrayList<>();
        for (int size : network.getLayerSizes())
            architecture.add(size);
        return architecture;
    }

    public boolean isTrained() {
        return trained;
    }

    public Double getAccuracy() {
        return accuracy;
    }

    void markTrained(Double accuracy) {
        this.accuracy = accuracy;
        this.trained = true;
    }
}
