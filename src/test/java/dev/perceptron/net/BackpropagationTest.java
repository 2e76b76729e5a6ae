package dev.perceptron.net;

import dev.perceptron.net.losses.QuadraticCost;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.RandomSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackpropagationTest {

    private static final double H = 1e-6;

    @Test
    void testGradientShapesMatchParameters() {
        Network net = new Network(RandomSource.create(4), 3, 4, 2);

        Gradients g = net.backprop(Matrix.column(0.2, 0.4, 0.6), Matrix.column(1, 0));

        assertEquals(2, g.transitions());
        for (int l = 0; l < 2; l++) {
            assertTrue(g.weights().get(l).sameShape(net.getWeights().get(l)));
            assertTrue(g.biases().get(l).sameShape(net.getBiases().get(l)));
        }
    }

    @Test
    void testBackpropDoesNotMutateNetwork() {
        Network net = new Network(RandomSource.create(4), 3, 4, 2);
        Matrix before = net.getWeights().get(1).copy();

        net.backprop(Matrix.column(0.2, 0.4, 0.6), Matrix.column(1, 0));

        assertTrue(before.contentEquals(net.getWeights().get(1)));
    }

    @Test
    void testGradientsMatchFiniteDifferences() {
        Network net = new Network(RandomSource.create(17), 3, 5, 4, 2);
        Matrix x = Matrix.column(0.3, -0.8, 0.5);
        Matrix y = Matrix.column(1.0, 0.0);

        Gradients analytic = net.backprop(x, y);

        for (int l = 0; l < net.getWeights().size(); l++) {
            checkAgainstNumeric(net, x, y, net.getWeights().get(l), analytic.weights().get(l), "W" + l);
            checkAgainstNumeric(net, x, y, net.getBiases().get(l), analytic.biases().get(l), "b" + l);
        }
    }

    private static void checkAgainstNumeric(Network net, Matrix x, Matrix y,
                                            Matrix parameter, Matrix gradient, String name) {
        double[] p = parameter.data();
        for (int i = 0; i < p.length; i++) {
            double original = p[i];
            p[i] = original + H;
            double plus = cost(net, x, y);
            p[i] = original - H;
            double minus = cost(net, x, y);
            p[i] = original;

            double numeric = (plus - minus) / (2 * H);
            assertEquals(numeric, gradient.at(i), 1e-7, name + "[" + i + "]");
        }
    }

    private static double cost(Network net, Matrix x, Matrix y) {
        return QuadraticCost.INSTANCE.loss(net.feedforward(x), y);
    }

    @Test
    void testOutputDeltaByHand() {
        // one transition: delta = (a - y) * sigma'(z), nabla_w = delta * x^T
        Matrix w = Matrix.of(new double[][]{{0.5, -0.25}});
        Network net = new Network(new int[]{2, 1}, List.of(w), List.of(Matrix.column(0.1)));
        Matrix x = Matrix.column(1.0, 2.0);

        Gradients g = net.backprop(x, Matrix.column(1.0));

        double z = 0.5 - 0.5 + 0.1;
        double a = 1.0 / (1.0 + Math.exp(-z));
        double delta = (a - 1.0) * a * (1.0 - a);
        assertEquals(delta, g.biases().get(0).at(0), 1e-12);
        assertEquals(delta * 1.0, g.weights().get(0).get(0, 0), 1e-12);
        assertEquals(delta * 2.0, g.weights().get(0).get(0, 1), 1e-12);
    }

    @Test
    void testBackpropDimensionMismatch() {
        Network net = new Network(RandomSource.create(4), 3, 4, 2);

        assertThrows(DimensionMismatchException.class,
                () -> net.backprop(Matrix.column(1, 2), Matrix.column(1, 0)));
        assertThrows(DimensionMismatchException.class,
                () -> net.backprop(Matrix.column(1, 2, 3), Matrix.column(1, 0, 0)));
    }

    @Test
    void testApplyGradientsUpdatesEveryParameter() {
        Network net = new Network(RandomSource.create(8), 2, 3, 1);
        Matrix w0 = net.getWeights().get(0).copy();
        Matrix b1 = net.getBiases().get(1).copy();

        Gradients g = net.backprop(Matrix.column(0.5, 0.5), Matrix.column(1));
        net.applyGradients(g, 2.0);

        for (int i = 0; i < w0.size(); i++)
            assertEquals(w0.at(i) - 2.0 * g.weights().get(0).at(i), net.getWeights().get(0).at(i), 1e-12);
        assertEquals(b1.at(0) - 2.0 * g.biases().get(1).at(0), net.getBiases().get(1).at(0), 1e-12);
    }

    @Test
    void testApplyGradientsForOtherArchitectureLeavesNetworkUntouched() {
        Network net = new Network(RandomSource.create(8), 2, 3, 1);
        Network other = new Network(RandomSource.create(8), 2, 4, 1);
        Matrix before = net.getWeights().get(0).copy();

        Gradients foreign = Gradients.zerosLike(other);
        assertThrows(DimensionMismatchException.class, () -> net.applyGradients(foreign, 1.0));
        assertTrue(before.contentEquals(net.getWeights().get(0)));
    }

    @Test
    void testGradientAccumulation() {
        Network net = new Network(RandomSource.create(8), 2, 3, 1);
        Gradients one = net.backprop(Matrix.column(0.1, 0.9), Matrix.column(0));

        Gradients sum = Gradients.zerosLike(net);
        sum.accumulate(one);
        sum.accumulate(one);

        for (int i = 0; i < one.weights().get(0).size(); i++)
            assertEquals(2 * one.weights().get(0).at(i), sum.weights().get(0).at(i), 1e-12);
    }
}
