package dev.perceptron.net.training;

import dev.perceptron.net.DimensionMismatchException;
import dev.perceptron.net.EmptyDatasetException;
import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.data.Datasets;
import dev.perceptron.net.losses.QuadraticCost;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.RandomSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class SgdTrainerTest {

    /**
     * Two-class problem: class 1 when the first input exceeds the second.
     */
    private static List<TrainingExample> comparisonData(int count, long seed) {
        RandomGenerator random = RandomSource.create(seed);
        List<TrainingExample> data = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double a = random.nextDouble();
            double b = random.nextDouble();
            data.add(Datasets.trainingExample(Matrix.column(a, b), a > b ? 1 : 0, 2));
        }
        return data;
    }

    private static TrainingConfig config(int epochs, int batch, double eta) {
        return TrainingConfig.builder()
                .epochs(epochs)
                .miniBatchSize(batch)
                .learningRate(eta)
                .randomSeed(1234)
                .build();
    }

    private static double totalCost(Network net, List<TrainingExample> data) {
        double cost = 0;
        for (TrainingExample example : data)
            cost += QuadraticCost.INSTANCE.loss(net.feedforward(example.input()), example.target());
        return cost;
    }

    private static List<Matrix> snapshot(Network net) {
        List<Matrix> copies = new ArrayList<>();
        for (Matrix w : net.getWeights())
            copies.add(w.copy());
        for (Matrix b : net.getBiases())
            copies.add(b.copy());
        return copies;
    }

    private static void assertUnchanged(List<Matrix> before, Network net) {
        List<Matrix> after = snapshot(net);
        for (int i = 0; i < before.size(); i++)
            assertTrue(before.get(i).contentEquals(after.get(i)), "Parameter tensor " + i + " changed");
    }

    @Test
    void testCallbackFiresOncePerEpochInOrder() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        TrainingHistory history = new TrainingHistory();

        TrainingResult result = new SgdTrainer(net, config(4, 5, 1.0))
                .withCallback(history)
                .fit(comparisonData(20, 1));

        List<EpochProgress> epochs = history.getEpochs();
        assertEquals(4, epochs.size());
        assertEquals(4, result.epochsCompleted());
        for (int i = 0; i < epochs.size(); i++) {
            assertEquals(i + 1, epochs.get(i).epoch());
            assertEquals(4, epochs.get(i).totalEpochs());
            if (i > 0)
                assertTrue(epochs.get(i).elapsed().compareTo(epochs.get(i - 1).elapsed()) >= 0);
        }
        assertEquals(100.0, epochs.get(3).percentComplete(), 1e-12);
    }

    @Test
    void testProgressWithoutEvaluationHasNoAccuracy() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        TrainingHistory history = new TrainingHistory();

        TrainingResult result = new SgdTrainer(net, config(2, 5, 1.0)).withCallback(history).fit(comparisonData(10, 1));

        EpochProgress latest = history.getLatest();
        assertFalse(latest.hasEvaluation());
        assertNull(latest.accuracy());
        assertNull(latest.correct());
        assertNull(latest.total());
        assertNull(result.finalAccuracy());
        assertNull(history.getBestAccuracy());
    }

    @Test
    void testProgressWithEvaluation() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<TrainingExample> data = comparisonData(30, 2);
        List<EvaluationExample> evaluation = Datasets.toEvaluation(data);
        TrainingHistory history = new TrainingHistory();

        new SgdTrainer(net, config(3, 10, 1.0)).withCallback(history).fit(data, evaluation);

        for (EpochProgress progress : history.getEpochs()) {
            assertTrue(progress.hasEvaluation());
            assertEquals(30, progress.total());
            assertEquals((double) progress.correct() / 30, progress.accuracy(), 1e-12);
        }
        assertEquals(new Evaluator(net).evaluate(evaluation), history.getLatest().correct());
    }

    @Test
    void testStartAndEndHooksBracketEpochs() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<String> calls = new ArrayList<>();
        TrainingCallback recorder = new TrainingCallback() {
            @Override
            public void onTrainingStart(Network network, TrainingConfig config) {
                calls.add("start");
            }

            @Override
            public void onEpochEnd(EpochProgress progress) {
                calls.add("epoch" + progress.epoch());
            }

            @Override
            public void onTrainingEnd(Network network, TrainingResult result) {
                calls.add("end");
            }
        };

        new SgdTrainer(net, config(2, 4, 1.0)).withCallback(recorder).fit(comparisonData(8, 3));

        assertEquals(List.of("start", "epoch1", "epoch2", "end"), calls);
    }

    @Test
    void testCallbackExceptionAbortsTraining() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<Integer> seen = new ArrayList<>();
        TrainingCallback failing = progress -> {
            seen.add(progress.epoch());
            throw new IllegalStateException("observer failed");
        };

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new SgdTrainer(net, config(5, 4, 1.0)).withCallback(failing).fit(comparisonData(8, 3)));

        assertEquals("observer failed", e.getMessage());
        assertEquals(List.of(1), seen);
    }

    @Test
    void testEmptyTrainingDataLeavesNetworkUntouched() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<Matrix> before = snapshot(net);
        SgdTrainer trainer = new SgdTrainer(net, config(2, 4, 1.0));

        assertThrows(EmptyDatasetException.class, () -> trainer.fit(List.of()));
        assertThrows(EmptyDatasetException.class, () -> trainer.fit(null));
        assertUnchanged(before, net);
    }

    @Test
    void testEmptyEvaluationDataRejectedBeforeTraining() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<Matrix> before = snapshot(net);

        assertThrows(EmptyDatasetException.class,
                () -> new SgdTrainer(net, config(2, 4, 1.0)).fit(comparisonData(8, 1), List.of()));
        assertUnchanged(before, net);
    }

    @Test
    void testMismatchedExampleRejectedBeforeAnyUpdate() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<Matrix> before = snapshot(net);
        List<TrainingExample> data = comparisonData(20, 1);
        data.add(new TrainingExample(Matrix.column(1, 2, 3), Matrix.column(1, 0)));

        assertThrows(DimensionMismatchException.class, () -> new SgdTrainer(net, config(2, 4, 1.0)).fit(data));
        assertUnchanged(before, net);
    }

    @Test
    void testOneMiniBatchReducesCost() {
        Network net = new Network(RandomSource.create(5), 2, 4, 2);
        List<TrainingExample> batch = comparisonData(10, 5);
        SgdTrainer trainer = new SgdTrainer(net, config(1, 10, 0.5));

        double before = totalCost(net, batch);
        trainer.updateMiniBatch(batch);
        double after = totalCost(net, batch);

        assertTrue(after < before, "Cost should drop: " + before + " -> " + after);
    }

    @Test
    void testEmptyMiniBatchRejected() {
        Network net = new Network(RandomSource.create(5), 2, 4, 2);
        assertThrows(EmptyDatasetException.class,
                () -> new SgdTrainer(net, config(1, 10, 0.5)).updateMiniBatch(List.of()));
    }

    @Test
    void testUpdateUsesBatchAverage() {
        // the same example twice in one batch must move parameters exactly as once alone
        Network a = new Network(RandomSource.create(6), 2, 3, 2);
        Network b = new Network(RandomSource.create(6), 2, 3, 2);
        TrainingExample example = Datasets.trainingExample(Matrix.column(0.3, 0.7), 0, 2);

        new SgdTrainer(a, config(1, 2, 1.0)).updateMiniBatch(List.of(example, example));
        new SgdTrainer(b, config(1, 1, 1.0)).updateMiniBatch(List.of(example));

        for (int l = 0; l < 2; l++) {
            assertArrayEquals(b.getWeights().get(l).data(), a.getWeights().get(l).data(), 1e-12);
            assertArrayEquals(b.getBiases().get(l).data(), a.getBiases().get(l).data(), 1e-12);
        }
    }

    @Test
    void testLastBatchMayBeSmaller() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        List<Integer> batchSizes = new ArrayList<>();
        SgdTrainer trainer = new SgdTrainer(net, config(2, 10, 1.0)) {
            @Override
            public void updateMiniBatch(List<TrainingExample> batch) {
                batchSizes.add(batch.size());
                super.updateMiniBatch(batch);
            }
        };

        trainer.fit(comparisonData(23, 1));

        assertEquals(List.of(10, 10, 3, 10, 10, 3), batchSizes);
    }

    @Test
    void testEachEpochDrawsFreshPermutation() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        SgdTrainer trainer = new SgdTrainer(net, config(1, 10, 1.0));

        int[] first = trainer.nextEpochOrder(100);
        int[] second = trainer.nextEpochOrder(100);

        assertFalse(Arrays.equals(first, second));
        int[] sorted = first.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++)
            assertEquals(i, sorted[i]);
    }

    @Test
    void testSameSeedSameShuffles() {
        Network net = new Network(RandomSource.create(1), 2, 3, 2);
        SgdTrainer a = new SgdTrainer(net, config(1, 10, 1.0));
        SgdTrainer b = new SgdTrainer(net, config(1, 10, 1.0));

        assertArrayEquals(a.nextEpochOrder(50), b.nextEpochOrder(50));
    }

    @Test
    void testSeededRunsAreReproducible() {
        Network a = new Network(RandomSource.create(3), 2, 4, 2);
        Network b = new Network(RandomSource.create(3), 2, 4, 2);
        List<TrainingExample> data = comparisonData(40, 9);

        new SgdTrainer(a, config(3, 8, 2.0)).fit(data);
        new SgdTrainer(b, config(3, 8, 2.0)).fit(data);

        for (int l = 0; l < 2; l++)
            assertTrue(a.getWeights().get(l).contentEquals(b.getWeights().get(l)));
    }

    @Test
    void testLearnsLinearlySeparableProblem() {
        Network net = new Network(RandomSource.create(21), 2, 6, 2);
        List<TrainingExample> training = comparisonData(400, 21);
        List<EvaluationExample> test = Datasets.toEvaluation(comparisonData(200, 22));

        TrainingResult result = new SgdTrainer(net, config(30, 10, 3.0)).fit(training, test);

        assertTrue(result.finalAccuracy() > 0.85, "Accuracy too low: " + result.finalAccuracy());
    }
}
