package dev.perceptron.examples;

import dev.perceptron.net.Network;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.data.Datasets;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.RandomSource;
import dev.perceptron.net.training.SgdTrainer;
import dev.perceptron.net.training.TrainingConfig;

import java.util.ArrayList;
import java.util.List;

public class XorExample {

    public static void main(String[] args) {
        Network net = new Network(RandomSource.create(7), 2, 4, 2);

        // class 1 = "a xor b"; the truth table is repeated so each epoch has several batches
        List<TrainingExample> data = new ArrayList<>();
        for (int repeat = 0; repeat < 25; repeat++) {
            for (int a = 0; a <= 1; a++) {
                for (int b = 0; b <= 1; b++)
                    data.add(Datasets.trainingExample(Matrix.column(a, b), a ^ b, 2));
            }
        }

        TrainingConfig config = TrainingConfig.builder()
                .epochs(300)
                .miniBatchSize(4)
                .learningRate(3.0)
                .randomSeed(7)
                .build();

        new SgdTrainer(net, config).fit(data);

        for (int a = 0; a <= 1; a++) {
            for (int b = 0; b <= 1; b++) {
                Matrix output = net.feedforward(Matrix.column(a, b));
                System.out.printf("%d xor %d -> %d  (outputs %.3f, %.3f)%n",
                        a, b, net.predictClass(Matrix.column(a, b)), output.at(0), output.at(1));
            }
        }
    }
}
