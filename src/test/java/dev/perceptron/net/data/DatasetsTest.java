package dev.perceptron.net.data;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.math.Matrix;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetsTest {

    @Test
    void testVectorizedResult() {
        Matrix target = Datasets.vectorizedResult(7, 10);

        assertEquals("10x1", target.shapeString());
        for (int i = 0; i < 10; i++)
            assertEquals(i == 7 ? 1.0 : 0.0, target.at(i));
    }

    @Test
    void testVectorizedResultRange() {
        assertThrows(IllegalArgumentException.class, () -> Datasets.vectorizedResult(10, 10));
        assertThrows(IllegalArgumentException.class, () -> Datasets.vectorizedResult(-1, 10));
    }

    @Test
    void testToEvaluationRecoversLabels() {
        List<TrainingExample> training = List.of(
                Datasets.trainingExample(Matrix.column(0.1), 2, 4),
                Datasets.trainingExample(Matrix.column(0.2), 0, 4));

        List<EvaluationExample> evaluation = Datasets.toEvaluation(training);

        assertEquals(2, evaluation.get(0).label());
        assertEquals(0, evaluation.get(1).label());
        assertSame(training.get(0).input(), evaluation.get(0).input());
    }

    @Test
    void testExampleValidation() {
        assertThrows(IllegalArgumentException.class, () -> new EvaluationExample(Matrix.column(1), -1));
        assertThrows(NullPointerException.class, () -> new TrainingExample(null, Matrix.column(1)));
    }
}
