package dev.perceptron.net.training;

import dev.perceptron.net.InvalidHyperparameterException;

/**
 * Immutable hyper-parameters for {@link SgdTrainer}. Every setter of the builder
 * validates eagerly, so an invalid value fails before any training starts.
 */
public final class TrainingConfig {

    public final int epochs;
    public final int miniBatchSize;
    public final double learningRate;
    public final Long randomSeed; // null = entropy-seeded shuffling
    public final int verbosity;   // 0=silent, 1=per-epoch console line

    private TrainingConfig(Builder builder) {
        this.epochs = builder.epochs;
        this.miniBatchSize = builder.miniBatchSize;
        this.learningRate = builder.learningRate;
        this.randomSeed = builder.randomSeed;
        this.verbosity = builder.verbosity;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("TrainingConfig[epochs=%d, miniBatchSize=%d, learningRate=%s, seed=%s]",
                epochs, miniBatchSize, learningRate, randomSeed);
    }

    public static class Builder {
        private int epochs = 30;
        private int miniBatchSize = 10;
        private double learningRate = 3.0;
        private Long randomSeed = null;
        private int verbosity = 0;

        public Builder epochs(int epochs) {
            if (epochs <= 0)
                throw new InvalidHyperparameterException("Epochs must be positive: " + epochs);
            this.epochs = epochs;
            return this;
        }

        public Builder miniBatchSize(int miniBatchSize) {
            if (miniBatchSize <= 0)
                throw new InvalidHyperparameterException("Mini-batch size must be positive: " + miniBatchSize);
            this.miniBatchSize = miniBatchSize;
            return this;
        }

        public Builder learningRate(double learningRate) {
            if (!(learningRate > 0) || Double.isInfinite(learningRate))
                throw new InvalidHyperparameterException("Learning rate must be positive and finite: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        public Builder randomSeed(long seed) {
            this.randomSeed = seed;
            return this;
        }

        public Builder verbosity(int level) {
            if (level < 0 || level > 1)
                throw new IllegalArgumentException("Verbosity must be 0 or 1");
            this.verbosity = level;
            return this;
        }

        public TrainingConfig build() {
            return new TrainingConfig(this);
        }
    }
}
