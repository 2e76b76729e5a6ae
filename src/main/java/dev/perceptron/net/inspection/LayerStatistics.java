package dev.perceptron.net.inspection;

/**
 * Summary of one transition's parameters.
 *
 * @param transition    index of the transition (layer {@code transition} to {@code transition + 1})
 * @param rows          neurons in the receiving layer
 * @param cols          neurons in the sending layer
 * @param weightMean    mean weight
 * @param weightStdDev  population standard deviation of the weights
 * @param weightMin     smallest weight
 * @param weightMax     largest weight
 * @param meanAbsWeight mean absolute weight, the connection strength a plot would draw
 * @param biasMean      mean bias
 */
public record LayerStatistics(int transition,
                              int rows,
                              int cols,
                              double weightMean,
                              double weightStdDev,
                              double weightMin,
                              double weightMax,
                              double meanAbsWeight,
                              double biasMean) {
}
