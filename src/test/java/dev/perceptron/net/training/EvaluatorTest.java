package dev.perceptron.net.training;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.Network;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.RandomSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private static final int CLASSES = 3;

    private final Network net = new Network(RandomSource.create(12), 4, 5, CLASSES);

    /**
     * Examples labelled with the network's own prediction, shifted by {@code offset} classes.
     */
    private List<EvaluationExample> labelled(int count, int offset) {
        RandomGenerator random = RandomSource.create(99);
        List<EvaluationExample> examples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Matrix x = Matrix.column(random.nextDouble(), random.nextDouble(), random.nextDouble(), random.nextDouble());
            examples.add(new EvaluationExample(x, (net.predictClass(x) + offset) % CLASSES));
        }
        return examples;
    }

    @Test
    void testAllCorrect() {
        assertEquals(25, new Evaluator(net).evaluate(labelled(25, 0)));
    }

    @Test
    void testNoneCorrect() {
        assertEquals(0, new Evaluator(net).evaluate(labelled(25, 1)));
    }

    @Test
    void testMixed() {
        List<EvaluationExample> examples = new ArrayList<>(labelled(6, 0));
        examples.addAll(labelled(4, 2));

        EvaluationResult result = new Evaluator(net).score(examples);

        assertEquals(6, result.correct());
        assertEquals(10, result.total());
        assertEquals(0.6, result.accuracy(), 1e-12);
    }

    @Test
    void testEmptySetScoresZero() {
        EvaluationResult result = new Evaluator(net).score(List.of());

        assertEquals(0, result.correct());
        assertEquals(0, result.total());
        assertTrue(Double.isNaN(result.accuracy()));
    }

    @Test
    void testEvaluationDoesNotMutateNetwork() {
        Matrix before = net.getWeights().get(0).copy();
        new Evaluator(net).evaluate(labelled(10, 0));
        assertTrue(before.contentEquals(net.getWeights().get(0)));
    }
}
