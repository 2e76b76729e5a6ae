package dev.perceptron.net.inspection;

import dev.perceptron.net.Network;
import dev.perceptron.net.math.Matrix;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only statistics over a network's parameters.
 */
public record NetworkStatistics(List<Integer> architecture,
                                long parameterCount,
                                List<LayerStatistics> layers) {

    public NetworkStatistics {
        architecture = List.copyOf(architecture);
        layers = List.copyOf(layers);
    }

    public static NetworkStatistics of(Network network) {
        List<Integer> architecture = new ArrayList<>();
        for (int size : network.getLayerSizes())
            architecture.add(size);

        List<LayerStatistics> layers = new ArrayList<>();
        List<Matrix> weights = network.getWeights();
        List<Matrix> biases = network.getBiases();
        for (int l = 0; l < weights.size(); l++)
            layers.add(describe(l, weights.get(l), biases.get(l)));

        return new NetworkStatistics(architecture, network.getParameterCount(), layers);
    }

    private static LayerStatistics describe(int transition, Matrix weights, Matrix biases) {
        double sum = 0;
        double sumAbs = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double w : weights.data()) {
            sum += w;
            sumAbs += Math.abs(w);
            min = Math.min(min, w);
            max = Math.max(max, w);
        }
        int n = weights.size();
        double mean = sum / n;

        double squares = 0;
        for (double w : weights.data())
            squares += (w - mean) * (w - mean);

        double biasSum = 0;
        for (double b : biases.data())
            biasSum += b;

        return new LayerStatistics(transition, weights.rows(), weights.cols(),
                mean, Math.sqrt(squares / n), min, max, sumAbs / n, biasSum / biases.size());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Network %s, %d parameters%n", architecture, parameterCount));
        for (LayerStatistics layer : layers) {
            sb.append(String.format("  %d: %dx%d  mean=%.4f std=%.4f min=%.4f max=%.4f |w|=%.4f bias=%.4f%n",
                    layer.transition(), layer.rows(), layer.cols(),
                    layer.weightMean(), layer.weightStdDev(), layer.weightMin(), layer.weightMax(),
                    layer.meanAbsWeight(), layer.biasMean()));
        }
        return sb.toString();
    }
}
