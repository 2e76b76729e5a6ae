package dev.perceptron.net.math;

import dev.perceptron.net.DimensionMismatchException;

import java.util.Arrays;

/**
 * Dense matrix of doubles stored row-major.
 *
 * <p>The shape is fixed at construction and every consuming operation checks it;
 * nothing is broadcast. Column vectors are plain {@code n x 1} matrices, see
 * {@link #column(double...)}.
 */
public final class Matrix {

    private final int rows;
    private final int cols;
    private final double[] data;

    private Matrix(int rows, int cols, double[] data) {
        if (rows <= 0 || cols <= 0)
            throw new IllegalArgumentException("Matrix dimensions must be positive: " + rows + "x" + cols);
        if (data.length != rows * cols)
            throw new IllegalArgumentException("Backing array has " + data.length
                    + " values, expected " + rows * cols);
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public static Matrix zeros(int rows, int cols) {
        return new Matrix(rows, cols, new double[rows * cols]);
    }

    /**
     * Zero matrix with the same shape as {@code other}.
     */
    public static Matrix zerosLike(Matrix other) {
        return zeros(other.rows, other.cols);
    }

    /**
     * Column vector ({@code values.length x 1}) holding a copy of {@code values}.
     */
    public static Matrix column(double... values) {
        return new Matrix(values.length, 1, values.clone());
    }

    /**
     * Wrap a row-major array without copying.
     */
    public static Matrix wrap(int rows, int cols, double[] rowMajor) {
        return new Matrix(rows, cols, rowMajor);
    }

    /**
     * Build from nested row arrays; every row must have the same length.
     */
    public static Matrix of(double[][] values) {
        if (values.length == 0)
            throw new IllegalArgumentException("Matrix needs at least one row");
        int cols = values[0].length;
        double[] data = new double[values.length * cols];
        for (int r = 0; r < values.length; r++) {
            if (values[r].length != cols)
                throw new IllegalArgumentException("Matrix rows must all have length " + cols);
            System.arraycopy(values[r], 0, data, r * cols, cols);
        }
        return new Matrix(values.length, cols, data);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int size() {
        return data.length;
    }

    public boolean isColumnVector() {
        return cols == 1;
    }

    public double get(int row, int col) {
        checkIndex(row, col);
        return data[row * cols + col];
    }

    public void set(int row, int col, double value) {
        checkIndex(row, col);
        data[row * cols + col] = value;
    }

    /**
     * Element {@code i} of the row-major storage; for column vectors this is entry {@code i}.
     */
    public double at(int i) {
        return data[i];
    }

    /**
     * Live row-major backing array. Kernels in {@code math.ops} write through it.
     */
    public double[] data() {
        return data;
    }

    public Matrix copy() {
        return new Matrix(rows, cols, data.clone());
    }

    public boolean sameShape(Matrix other) {
        return rows == other.rows && cols == other.cols;
    }

    /**
     * @throws DimensionMismatchException if this matrix is not {@code expectedRows x expectedCols}
     */
    public Matrix requireShape(int expectedRows, int expectedCols, String what) {
        if (rows != expectedRows || cols != expectedCols)
            throw DimensionMismatchException.of(what, expectedRows, expectedCols, rows, cols);
        return this;
    }

    /**
     * Copy into nested row arrays, for read-only consumers that want plain arrays.
     */
    public double[][] toArray() {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++)
            System.arraycopy(data, r * cols, out[r], 0, cols);
        return out;
    }

    /**
     * Exact, bit-level element comparison (NaN equals NaN, 0.0 differs from -0.0).
     */
    public boolean contentEquals(Matrix other) {
        return sameShape(other) && Arrays.equals(data, other.data);
    }

    public String shapeString() {
        return rows + "x" + cols;
    }

    private void checkIndex(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + shapeString());
    }

    @Override
    public String toString() {
        return "Matrix[" + shapeString() + "]";
    }
}
