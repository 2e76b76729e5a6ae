package dev.perceptron.net.service;

public record ServiceStatus(String status, int activeNetworks, int trainingJobs) {
}
