package dev.perceptron.net.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owner of the in-memory networks and training jobs. Safe for concurrent use.
 */
public class SessionStore {

    private final ConcurrentMap<String, NetworkSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TrainingJob> jobs = new ConcurrentHashMap<>();

    // ========== NETWORKS ==========

    public void putSession(NetworkSession session) {
        sessions.put(session.getNetworkId(), session);
    }

    public Optional<NetworkSession> getSession(String networkId) {
        return Optional.ofNullable(sessions.get(networkId));
    }

    public boolean hasSession(String networkId) {
        return sessions.containsKey(networkId);
    }

    public List<NetworkSession> listSessions() {
        return new ArrayList<>(sessions.values());
    }

    public Optional<NetworkSession> removeSession(String networkId) {
        return Optional.ofNullable(sessions.remove(networkId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    public void clearSessions() {
        sessions.clear();
    }

    // ========== JOBS ==========

    public void putJob(TrainingJob job) {
        jobs.put(job.getJobId(), job);
    }

    public Optional<TrainingJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<TrainingJob> listJobs() {
        return new ArrayList<>(jobs.values());
    }

    /**
     * The pending or running job for {@code networkId}, if any.
     */
    public Optional<TrainingJob> activeJobFor(String networkId) {
        return jobs.values().stream()
                .filter(job -> job.getNetworkId().equals(networkId) && job.getStatus().isActive())
                .findFirst();
    }

    public Optional<TrainingJob> removeJob(String jobId) {
        return Optional.ofNullable(jobs.remove(jobId));
    }

    public int jobCount() {
        return jobs.size();
    }

    public void clearJobs() {
        jobs.clear();
    }
}
