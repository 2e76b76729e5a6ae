package dev.perceptron.net.losses;

import dev.perceptron.net.DimensionMismatchException;
import dev.perceptron.net.math.Matrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuadraticCostTest {

    private static final double DELTA = 1e-12;

    @Test
    void testLossIsHalfSquaredError() {
        Matrix prediction = Matrix.column(0.8, 0.1, 0.3);
        Matrix target = Matrix.column(1.0, 0.0, 0.0);

        double expected = 0.5 * (0.04 + 0.01 + 0.09);
        assertEquals(expected, QuadraticCost.INSTANCE.loss(prediction, target), DELTA);
    }

    @Test
    void testPerfectPredictionHasZeroLoss() {
        Matrix y = Matrix.column(0.0, 1.0);
        assertEquals(0.0, QuadraticCost.INSTANCE.loss(y, y.copy()), DELTA);
    }

    @Test
    void testDerivativesAreDifference() {
        Matrix d = QuadraticCost.INSTANCE.derivatives(Matrix.column(0.8, 0.1), Matrix.column(1.0, 0.0));

        assertEquals(-0.2, d.at(0), DELTA);
        assertEquals(0.1, d.at(1), DELTA);
    }

    @Test
    void testShapeMismatch() {
        assertThrows(DimensionMismatchException.class,
                () -> QuadraticCost.INSTANCE.loss(Matrix.zeros(3, 1), Matrix.zeros(2, 1)));
    }
}
