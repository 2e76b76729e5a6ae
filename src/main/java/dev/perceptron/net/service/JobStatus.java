package dev.perceptron.net.service;

import java.util.Locale;

/**
 * Lifecycle of a background training job.
 */
public enum JobStatus {
    PENDING,
    TRAINING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == TRAINING;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
