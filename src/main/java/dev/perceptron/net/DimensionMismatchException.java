package dev.perceptron.net;

/**
 * Thrown when a vector or matrix does not have the shape an operation expects.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static DimensionMismatchException of(String what, int expectedRows, int expectedCols,
                                                int actualRows, int actualCols) {
        return new DimensionMismatchException(String.format("%s must be %dx%d but was %dx%d",
                what, expectedRows, expectedCols, actualRows, actualCols));
    }
}
