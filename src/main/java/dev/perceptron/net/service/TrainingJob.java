package dev.perceptron.net.service;

import java.time.Instant;

/**
 * State of one training run. Written by the worker thread, read by anyone.
 */
public class TrainingJob {

    private final String jobId;
    private final String networkId;
    private final int epochs;
    private final Instant createdAt;

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile double progress;
    private volatile int epochsCompleted;
    private volatile Double accuracy;
    private volatile String error;

    TrainingJob(String jobId, String networkId, int epochs) {
        this.jobId = jobId;
        this.networkId = networkId;
        this.epochs = epochs;
        this.createdAt = Instant.now();
    }

    public String getJobId() { return jobId; }
    public String getNetworkId() { return networkId; }
    public int getEpochs() { return epochs; }
    public Instant getCreatedAt() { return createdAt; }
    public JobStatus getStatus() { return status; }
    public double getProgress() { return progress; }
    public int getEpochsCompleted() { return epochsCompleted; }
    public Double getAccuracy() { return accuracy; }
    public String getError() { return error; }

    void recordEpoch(int epoch, double percentComplete, Double epochAccuracy) {
        this.status = JobStatus.TRAINING;
        this.epochsCompleted = epoch;
        this.progress = percentComplete;
        if (epochAccuracy != null)
            this.accuracy = epochAccuracy;
    }

    void complete(Double finalAccuracy) {
        this.accuracy = finalAccuracy;
        this.progress = 100.0;
        this.status = JobStatus.COMPLETED;
    }

    void fail(String message) {
        this.error = message;
        this.status = JobStatus.FAILED;
    }

    @Override
    public String toString() {
        return String.format("TrainingJob[%s, network=%s, %s, %.0f%%]", jobId, networkId, status, progress);
    }
}
