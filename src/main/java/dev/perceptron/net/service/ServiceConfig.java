package dev.perceptron.net.service;

import dev.perceptron.net.InvalidArchitectureException;
import dev.perceptron.net.InvalidHyperparameterException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Defaults and limits for {@link NetworkService}. Built through {@link #builder()}
 * or read from a properties file with {@link #fromProperties(Properties)}.
 */
public final class ServiceConfig {

    public static final String LAYER_SIZES = "perceptron.layerSizes";
    public static final String EPOCHS = "perceptron.epochs";
    public static final String MINI_BATCH_SIZE = "perceptron.miniBatchSize";
    public static final String LEARNING_RATE = "perceptron.learningRate";
    public static final String MODEL_DIRECTORY = "perceptron.modelDirectory";
    public static final String SUCCESS_ATTEMPTS = "perceptron.successAttempts";
    public static final String FAILURE_ATTEMPTS = "perceptron.failureAttempts";
    public static final String WORKER_THREADS = "perceptron.workerThreads";
    public static final String RANDOM_SEED = "perceptron.randomSeed";

    public final List<Integer> defaultLayerSizes;
    public final int defaultEpochs;
    public final int defaultMiniBatchSize;
    public final double defaultLearningRate;
    public final Path modelDirectory;
    public final int successAttempts;
    public final int failureAttempts;
    public final int workerThreads;
    public final Long randomSeed; // null = entropy-seeded

    private ServiceConfig(Builder builder) {
        this.defaultLayerSizes = List.copyOf(builder.defaultLayerSizes);
        this.defaultEpochs = builder.defaultEpochs;
        this.defaultMiniBatchSize = builder.defaultMiniBatchSize;
        this.defaultLearningRate = builder.defaultLearningRate;
        this.modelDirectory = builder.modelDirectory;
        this.successAttempts = builder.successAttempts;
        this.failureAttempts = builder.failureAttempts;
        this.workerThreads = builder.workerThreads;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServiceConfig defaults() {
        return builder().build();
    }

    /**
     * Read the {@code perceptron.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ServiceConfig fromProperties(Properties properties) {
        Builder builder = builder();

        String sizes = properties.getProperty(LAYER_SIZES);
        if (sizes != null) {
            List<Integer> parsed = new ArrayList<>();
            for (String part : sizes.split(","))
                parsed.add(parseInt(LAYER_SIZES, part.trim()));
            builder.defaultLayerSizes(parsed);
        }

        String value;
        if ((value = properties.getProperty(EPOCHS)) != null)
            builder.defaultEpochs(parseInt(EPOCHS, value));
        if ((value = properties.getProperty(MINI_BATCH_SIZE)) != null)
            builder.defaultMiniBatchSize(parseInt(MINI_BATCH_SIZE, value));
        if ((value = properties.getProperty(LEARNING_RATE)) != null)
            builder.defaultLearningRate(parseDouble(LEARNING_RATE, value));
        if ((value = properties.getProperty(MODEL_DIRECTORY)) != null)
            builder.modelDirectory(Paths.get(value.trim()));
        if ((value = properties.getProperty(SUCCESS_ATTEMPTS)) != null)
            builder.successAttempts(parseInt(SUCCESS_ATTEMPTS, value));
        if ((value = properties.getProperty(FAILURE_ATTEMPTS)) != null)
            builder.failureAttempts(parseInt(FAILURE_ATTEMPTS, value));
        if ((value = properties.getProperty(WORKER_THREADS)) != null)
            builder.workerThreads(parseInt(WORKER_THREADS, value));
        if ((value = properties.getProperty(RANDOM_SEED)) != null) {
            try {
                builder.randomSeed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + RANDOM_SEED + ": " + value, e);
            }
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("ServiceConfig[layers=%s, epochs=%d, miniBatchSize=%d, learningRate=%s, models=%s, workers=%d]",
                defaultLayerSizes, defaultEpochs, defaultMiniBatchSize, defaultLearningRate,
                modelDirectory, workerThreads);
    }

    public static class Builder {
        private List<Integer> defaultLayerSizes = List.of(784, 30, 10);
        private int defaultEpochs = 5;
        private int defaultMiniBatchSize = 10;
        private double defaultLearningRate = 3.0;
        private Path modelDirectory = Paths.get("models");
        private int successAttempts = 100;
        private int failureAttempts = 200;
        private int workerThreads = 1;
        private Long randomSeed = null;

        public Builder defaultLayerSizes(List<Integer> sizes) {
            if (sizes == null || sizes.size() < 2)
                throw new InvalidArchitectureException("At least two layer sizes are required: " + sizes);
            for (Integer size : sizes) {
                if (size == null || size <= 0)
                    throw new InvalidArchitectureException("Layer sizes must be positive: " + sizes);
            }
            this.defaultLayerSizes = List.copyOf(sizes);
            return this;
        }

        public Builder defaultEpochs(int epochs) {
            if (epochs <= 0)
                throw new InvalidHyperparameterException("Epochs must be positive: " + epochs);
            this.defaultEpochs = epochs;
            return this;
        }

        public Builder defaultMiniBatchSize(int miniBatchSize) {
            if (miniBatchSize <= 0)
                throw new InvalidHyperparameterException("Mini-batch size must be positive: " + miniBatchSize);
            this.defaultMiniBatchSize = miniBatchSize;
            return this;
        }

        public Builder defaultLearningRate(double learningRate) {
            if (!(learningRate > 0) || Double.isInfinite(learningRate))
                throw new InvalidHyperparameterException("Learning rate must be positive and finite: " + learningRate);
            this.defaultLearningRate = learningRate;
            return this;
        }

        public Builder modelDirectory(Path directory) {
            if (directory == null)
                throw new IllegalArgumentException("Model directory must not be null");
            this.modelDirectory = directory;
            return this;
        }

        public Builder successAttempts(int attempts) {
            if (attempts <= 0)
                throw new IllegalArgumentException("Success attempts must be positive: " + attempts);
            this.successAttempts = attempts;
            return this;
        }

        public Builder failureAttempts(int attempts) {
            if (attempts <= 0)
                throw new IllegalArgumentException("Failure attempts must be positive: " + attempts);
            this.failureAttempts = attempts;
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads <= 0)
                throw new IllegalArgumentException("Worker threads must be positive: " + threads);
            this.workerThreads = threads;
            return this;
        }

        public Builder randomSeed(long seed) {
            this.randomSeed = seed;
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(this);
        }
    }
}
