package dev.perceptron.net.math;

import org.junit.jupiter.api.Test;

import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class NetMathTest {

    @Test
    void testArgmaxPicksLargest() {
        assertEquals(2, NetMath.argmax(Matrix.column(0.1, 0.3, 0.9, 0.2)));
    }

    @Test
    void testArgmaxFirstWinsTies() {
        assertEquals(1, NetMath.argmax(Matrix.column(0.1, 0.7, 0.7)));
    }

    @Test
    void testArgmaxSkipsNaN() {
        assertEquals(2, NetMath.argmax(Matrix.column(Double.NaN, 0.2, 0.5)));
        assertEquals(0, NetMath.argmax(Matrix.column(Double.NaN, Double.NaN)));
    }

    @Test
    void testSquaredNorm() {
        assertEquals(25.0, NetMath.squaredNorm(Matrix.column(3, 4)), 1e-12);
    }

    @Test
    void testStandardNormalInitIsSeeded() {
        Matrix a = Matrix.zeros(20, 5);
        Matrix b = Matrix.zeros(20, 5);
        NetMath.standardNormalInit(a, RandomSource.create(11));
        NetMath.standardNormalInit(b, RandomSource.create(11));

        assertTrue(a.contentEquals(b));
    }

    @Test
    void testStandardNormalInitMoments() {
        Matrix m = Matrix.zeros(200, 100);
        NetMath.standardNormalInit(m, RandomSource.create(3));

        double sum = 0;
        double sumSq = 0;
        for (double v : m.data()) {
            sum += v;
            sumSq += v * v;
        }
        double mean = sum / m.size();
        double variance = sumSq / m.size() - mean * mean;
        assertEquals(0.0, mean, 0.05);
        assertEquals(1.0, variance, 0.05);
    }

    @Test
    void testShuffleIsPermutation() {
        int[] indices = new int[50];
        for (int i = 0; i < indices.length; i++)
            indices[i] = i;
        RandomGenerator random = RandomSource.create(5);

        RandomSource.shuffle(indices, random);

        boolean[] seen = new boolean[indices.length];
        for (int index : indices) {
            assertFalse(seen[index], "Duplicate index " + index);
            seen[index] = true;
        }
    }
}
