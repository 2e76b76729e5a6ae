package dev.perceptron.examples;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;
import dev.perceptron.net.data.MnistData;
import dev.perceptron.net.data.MnistDataLoader;
import dev.perceptron.net.inspection.ExamplePrediction;
import dev.perceptron.net.inspection.NetworkStatistics;
import dev.perceptron.net.inspection.PredictionInspector;
import dev.perceptron.net.math.RandomSource;
import dev.perceptron.net.training.SgdTrainer;
import dev.perceptron.net.training.TrainingConfig;
import dev.perceptron.net.training.TrainingResult;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Trains a 784-128-64-10 sigmoid network on MNIST, scoring against the test set
 * after every epoch, then prints parameter statistics and a few misclassified digits.
 *
 * <p>Usage: {@code MnistTrainingExample <mnist-dir> [epochs]}. The directory holds the
 * Knowm MNIST database files.
 */
public class MnistTrainingExample {

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: MnistTrainingExample <mnist-dir> [epochs]");
            System.exit(1);
        }

        // hyperparams
        final int EPOCHS         = args.length > 1 ? Integer.parseInt(args[1]) : 5;
        final int BATCH_SIZE     = 10;
        final double LEARNING_RATE = 2.5;

        Path dir = Paths.get(args[0]);
        MnistData data = new MnistDataLoader().load(dir);

        Network net = new Network(RandomSource.create(), 784, 128, 64, 10);
        System.out.println("Built " + net);

        TrainingConfig config = TrainingConfig.builder()
                .epochs(EPOCHS)
                .miniBatchSize(BATCH_SIZE)
                .learningRate(LEARNING_RATE)
                .verbosity(1)
                .build();

        TrainingResult result = new SgdTrainer(net, config).fit(data.training(), data.test());
        System.out.printf("Final test accuracy: %.2f%%%n", result.finalAccuracy() * 100);

        System.out.println();
        System.out.println(NetworkStatistics.of(net));

        List<EvaluationExample> test = data.test();
        List<Integer> misclassified = PredictionInspector.findMisclassified(net, test, 5, 1000);
        System.out.println("Misclassified examples among the first 1000 test digits:");
        for (int index : misclassified) {
            ExamplePrediction p = PredictionInspector.predict(net, test, index);
            System.out.printf("  #%d: predicted %d, actual %d%n", p.index(), p.predicted(), p.actual());
        }
    }
}
