package dev.perceptron.net.service;

import dev.perceptron.net.EmptyDatasetException;
import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.data.MnistData;
import dev.perceptron.net.inspection.ExamplePrediction;
import dev.perceptron.net.inspection.NetworkStatistics;
import dev.perceptron.net.inspection.PredictionInspector;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.RandomSource;
import dev.perceptron.net.serialization.ModelRepository;
import dev.perceptron.net.serialization.SavedModel;
import dev.perceptron.net.serialization.SavedModelInfo;
import dev.perceptron.net.training.EpochProgress;
import dev.perceptron.net.training.SgdTrainer;
import dev.perceptron.net.training.TrainingConfig;
import dev.perceptron.net.training.TrainingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

/**
 * Manages networks on behalf of remote clients: creation, background training,
 * persistence and inspection. Transport-agnostic; a front end maps requests onto
 * these methods and forwards {@link TrainingEvent}s to its observers.
 *
 * <p>Training runs on a fixed pool of worker threads. At most one job may be
 * pending or running per network, since parameter updates are unsynchronized.
 * Starting a job, and loading or deleting a network, are serialized on one lock,
 * so a network cannot be deleted or replaced between the moment a job is
 * accepted for it and the moment that job finishes.
 * Prediction and inspection of a network that is currently training read
 * parameters mid-update and are only approximate.
 *
 * <p>Call {@link #close()} to stop the workers.
 */
public class NetworkService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkService.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ServiceConfig config;
    private final SessionStore store;
    private final ModelRepository repository;
    private final List<TrainingExample> training;
    private final List<EvaluationExample> test;
    private final TrainingEventListener listener;
    private final ExecutorService workers;
    private final Map<String, Future<?>> running = new ConcurrentHashMap<>();
    private final RandomGenerator random;
    private final Object trainingLock = new Object();

    public NetworkService(ServiceConfig config, MnistData data) {
        this(config, new SessionStore(), new ModelRepository(config.modelDirectory),
                data.training(), data.test(), new LoggingEventListener());
    }

    /**
     * @param training examples every job trains on
     * @param test     examples scored after every epoch and searched by {@link #findExample}
     */
    public NetworkService(ServiceConfig config,
                          SessionStore store,
                          ModelRepository repository,
                          List<TrainingExample> training,
                          List<EvaluationExample> test,
                          TrainingEventListener listener) {
        this.config = config;
        this.store = store;
        this.repository = repository;
        this.training = List.copyOf(training);
        this.test = List.copyOf(test);
        this.listener = listener;
        this.random = config.randomSeed != null
                ? RandomSource.create(config.randomSeed)
                : RandomSource.create();
        this.workers = Executors.newFixedThreadPool(config.workerThreads, workerThreadFactory());

        log.info("Network service started: {} training and {} test examples, {}",
                this.training.size(), this.test.size(), config);
    }

    public ServiceConfig getConfig() {
        return config;
    }

    public ServiceStatus status() {
        return new ServiceStatus("online", store.sessionCount(), store.jobCount());
    }

    // ========== NETWORKS ==========

    /**
     * Create an untrained network and keep it in memory.
     *
     * @param layerSizes layer sizes, or null for the configured default
     * @throws dev.perceptron.net.InvalidArchitectureException if the sizes are invalid
     */
    public NetworkSession createNetwork(List<Integer> layerSizes) {
        List<Integer> sizes = layerSizes != null ? layerSizes : config.defaultLayerSizes;

        Network network;
        synchronized (random) {
            network = Network.of(sizes, random);
        }
        NetworkSession session = new NetworkSession(UUID.randomUUID().toString(), network, false, null);
        store.putSession(session);

        log.info("Created network {} with architecture {}", session.getNetworkId(), sizes);
        return session;
    }

    public NetworkSession getNetwork(String networkId) {
        return store.getSession(networkId)
                .orElseThrow(() -> new NoSuchElementException("Network not found: " + networkId));
    }

    /**
     * Networks in memory followed by saved networks that are not in memory.
     */
    public List<NetworkListing> listNetworks() throws IOException {
        List<NetworkListing> result = new ArrayList<>();
        for (NetworkSession session : store.listSessions()) {
            result.add(new NetworkListing(session.getNetworkId(), session.getArchitecture(),
                    session.isTrained(), session.getAccuracy(), NetworkListing.Source.IN_MEMORY));
        }
        for (SavedModelInfo saved : repository.list()) {
            if (store.hasSession(saved.networkId()))
                continue;
            result.add(new NetworkListing(saved.networkId(), saved.architecture(),
                    saved.trained(), saved.accuracy(), NetworkListing.Source.SAVED));
        }
        return result;
    }

    /**
     * Bring a saved network back into memory as a trained session, replacing any
     * in-memory network with the same id.
     *
     * @throws NoSuchElementException if no model is saved under {@code networkId}
     * @throws IOException            if the saved file cannot be read
     */
    public NetworkSession loadNetwork(String networkId) throws IOException {
        NetworkSession session;
        SavedModel saved;
        synchronized (trainingLock) {
            requireNoActiveJob(networkId);
            saved = repository.loadSaved(networkId)
                    .orElseThrow(() -> new NoSuchElementException("Saved network not found: " + networkId));

            session = new NetworkSession(networkId, saved.network(), true, saved.metadata().accuracy());
            store.putSession(session);
        }
        log.info("Loaded network {} {}", networkId, saved.network());
        return session;
    }

    /**
     * Remove a network from memory and from disk.
     *
     * @throws NoSuchElementException if the network is in neither place
     * @throws IllegalStateException  if the network is still training
     */
    public DeletionResult deleteNetwork(String networkId) throws IOException {
        boolean fromMemory;
        boolean fromDisk;
        synchronized (trainingLock) {
            requireNoActiveJob(networkId);

            fromMemory = store.removeSession(networkId).isPresent();
            fromDisk = repository.exists(networkId) && repository.delete(networkId);
        }
        if (!fromMemory && !fromDisk)
            throw new NoSuchElementException("Network not found: " + networkId);

        log.info("Deleted network {} (memory={}, disk={})", networkId, fromMemory, fromDisk);
        return new DeletionResult(networkId, fromMemory, fromDisk);
    }

    /**
     * Remove every network from memory and disk.
     *
     * @throws IllegalStateException if any network is still training
     */
    public BulkDeletionResult deleteAllNetworks() throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        int fromMemory = 0;
        int fromDisk = 0;
        synchronized (trainingLock) {
            for (TrainingJob job : store.listJobs()) {
                if (job.getStatus().isActive())
                    throw new IllegalStateException("Network " + job.getNetworkId() + " is still training");
            }

            for (NetworkSession session : store.listSessions())
                ids.add(session.getNetworkId());
            for (SavedModelInfo saved : repository.list())
                ids.add(saved.networkId());

            for (String id : ids) {
                if (store.removeSession(id).isPresent())
                    fromMemory++;
                if (repository.delete(id))
                    fromDisk++;
            }
        }

        log.info("Deleted {} network(s): {} from memory, {} from disk", ids.size(), fromMemory, fromDisk);
        return new BulkDeletionResult(ids.size(), fromMemory, fromDisk);
    }

    // ========== TRAINING ==========

    /**
     * Train with the configured defaults.
     */
    public TrainingJob startTraining(String networkId) {
        return startTraining(networkId, null, null, null);
    }

    /**
     * Queue a training job for an in-memory network. Null arguments take the
     * configured defaults. Hyper-parameters are validated here, before the job exists.
     *
     * @throws NoSuchElementException if the network is not in memory
     * @throws IllegalStateException  if the network already has a pending or running job
     * @throws dev.perceptron.net.InvalidHyperparameterException if a value is not positive
     * @throws RejectedExecutionException if the service has been closed; no job is recorded
     */
    public TrainingJob startTraining(String networkId, Integer epochs, Integer miniBatchSize, Double learningRate) {
        TrainingConfig.Builder builder = TrainingConfig.builder()
                .epochs(epochs != null ? epochs : config.defaultEpochs)
                .miniBatchSize(miniBatchSize != null ? miniBatchSize : config.defaultMiniBatchSize)
                .learningRate(learningRate != null ? learningRate : config.defaultLearningRate);
        if (config.randomSeed != null)
            builder.randomSeed(config.randomSeed);
        TrainingConfig trainingConfig = builder.build();

        if (training.isEmpty())
            throw new EmptyDatasetException("The service has no training data");

        TrainingJob job;
        synchronized (trainingLock) {
            NetworkSession session = getNetwork(networkId);
            requireNoActiveJob(networkId);
            job = new TrainingJob(UUID.randomUUID().toString(), networkId, trainingConfig.epochs);
            store.putJob(job);

            TrainingJob submitted = job;
            try {
                running.put(job.getJobId(), workers.submit(() -> runJob(submitted, session, trainingConfig)));
            } catch (RejectedExecutionException e) {
                store.removeJob(job.getJobId());
                log.warn("Training job for network {} rejected: the service is closed", networkId);
                throw e;
            }
        }

        log.info("Queued training job {} for network {}: {}", job.getJobId(), networkId, trainingConfig);
        return job;
    }

    /**
     * @throws NoSuchElementException if no job has that id
     */
    public TrainingJob getJob(String jobId) {
        return store.getJob(jobId)
                .orElseThrow(() -> new NoSuchElementException("Training job not found: " + jobId));
    }

    /**
     * Block until the job's worker finishes or the timeout elapses.
     *
     * @return the job in its final state
     * @throws TimeoutException if the job is still running after the timeout
     */
    public TrainingJob awaitJob(String jobId, long timeout, TimeUnit unit)
            throws InterruptedException, TimeoutException {
        TrainingJob job = getJob(jobId);
        Future<?> future = running.get(jobId);
        if (future != null) {
            try {
                future.get(timeout, unit);
            } catch (ExecutionException e) {
                // runJob records its own failures, so this only wraps errors
                throw new IllegalStateException("Training worker crashed for job " + jobId, e.getCause());
            }
        }
        return job;
    }

    private void runJob(TrainingJob job, NetworkSession session, TrainingConfig trainingConfig) {
        String networkId = session.getNetworkId();
        try {
            SgdTrainer trainer = new SgdTrainer(session.getNetwork(), trainingConfig)
                    .withCallback(progress -> onEpoch(job, progress));

            TrainingResult result = trainer.fit(training, test.isEmpty() ? null : test);
            Double accuracy = result.finalAccuracy();

            session.markTrained(accuracy);
            repository.save(networkId, session.getNetwork(), true, accuracy);
            job.complete(accuracy);

            log.info("Training job {} completed in {} ms, accuracy {}",
                    job.getJobId(), result.totalTime().toMillis(), accuracy);
            publish(TrainingEvent.Type.TRAINING_COMPLETE, completePayload(job));
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            job.fail(message);
            log.error("Training job {} for network {} failed", job.getJobId(), networkId, e);
            publish(TrainingEvent.Type.TRAINING_ERROR, errorPayload(job));
        } finally {
            // taken after the submitting thread has registered the future
            synchronized (trainingLock) {
                running.remove(job.getJobId());
            }
        }
    }

    /**
     * Number of jobs whose worker has not yet finished.
     */
    int runningJobCount() {
        return running.size();
    }

    private void onEpoch(TrainingJob job, EpochProgress progress) {
        job.recordEpoch(progress.epoch(), progress.percentComplete(), progress.accuracy());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.getJobId());
        payload.put("network_id", job.getNetworkId());
        payload.put("epoch", progress.epoch());
        payload.put("total_epochs", progress.totalEpochs());
        payload.put("accuracy", progress.accuracy());
        payload.put("elapsed_time", progress.elapsed().toNanos() / 1e9);
        payload.put("progress", progress.percentComplete());
        payload.put("correct", progress.correct());
        payload.put("total", progress.total());
        publish(TrainingEvent.Type.TRAINING_UPDATE, payload);
    }

    private static Map<String, Object> completePayload(TrainingJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.getJobId());
        payload.put("network_id", job.getNetworkId());
        payload.put("status", job.getStatus().wireName());
        payload.put("accuracy", job.getAccuracy());
        payload.put("progress", job.getProgress());
        return payload;
    }

    private static Map<String, Object> errorPayload(TrainingJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.getJobId());
        payload.put("network_id", job.getNetworkId());
        payload.put("status", job.getStatus().wireName());
        payload.put("error", job.getError());
        return payload;
    }

    private void publish(TrainingEvent.Type type, Map<String, Object> payload) {
        try {
            listener.onEvent(new TrainingEvent(type, payload));
        } catch (RuntimeException e) {
            // a broken observer must not fail the job
            log.warn("Event listener failed on {} for job {}", type.eventName(), payload.get("job_id"), e);
        }
    }

    private void requireNoActiveJob(String networkId) {
        store.activeJobFor(networkId).ifPresent(job -> {
            throw new IllegalStateException("Network " + networkId + " is already training in job " + job.getJobId());
        });
    }

    // ========== INSPECTION ==========

    /**
     * Sample the test set for an example the network classifies correctly
     * ({@code successful}) or incorrectly.
     *
     * @return empty if none was found within the configured number of attempts
     * @throws NoSuchElementException if the network is not in memory
     */
    public Optional<ExampleReport> findExample(String networkId, boolean successful) {
        NetworkSession session = getNetwork(networkId);
        Network network = session.getNetwork();
        int attempts = successful ? config.successAttempts : config.failureAttempts;

        Optional<ExamplePrediction> found;
        synchronized (random) {
            found = PredictionInspector.findExample(network, test, successful, attempts, random);
        }

        List<Matrix> weights = network.getWeights();
        Matrix outputWeights = weights.get(weights.size() - 1).copy();
        return found.map(prediction -> new ExampleReport(networkId, prediction, outputWeights));
    }

    /**
     * @throws NoSuchElementException if the network is not in memory
     */
    public NetworkStatistics statistics(String networkId) {
        return NetworkStatistics.of(getNetwork(networkId).getNetwork());
    }

    /**
     * Indices of misclassified test examples, scanning at most {@code maxCheck}.
     */
    public List<Integer> findMisclassified(String networkId, int maxCount, int maxCheck) {
        return PredictionInspector.findMisclassified(getNetwork(networkId).getNetwork(), test, maxCount, maxCheck);
    }

    // ========== LIFECYCLE ==========

    /**
     * Stop accepting jobs and wait for running ones, interrupting them after a timeout.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Network service stopped");
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "training-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
