package dev.perceptron.net;

import dev.perceptron.net.activators.Activator;
import dev.perceptron.net.activators.SigmoidActivator;
import dev.perceptron.net.losses.QuadraticCost;
import dev.perceptron.net.math.Matrix;
import dev.perceptron.net.math.NetMath;
import dev.perceptron.net.math.RandomSource;
import dev.perceptron.net.serialization.ModelSerializer;
import dev.perceptron.net.serialization.Serializable;
import dev.perceptron.net.serialization.SerializationConstants;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Fully-connected feed-forward network with sigmoid activations on every layer.
 * <p>
 * The layer-size sequence is fixed at construction. Transition {@code l} connects
 * layer {@code l} to layer {@code l + 1} through a {@code sizes[l+1] x sizes[l]}
 * weight matrix and a {@code sizes[l+1] x 1} bias column, both drawn from N(0, 1).
 * <p>
 * Usage:
 * Network net = new Network(RandomSource.create(42), 784, 30, 10);
 * Matrix output = net.feedforward(input);
 * <p>
 * Prediction is pure and may run from several threads at once. Parameter updates
 * ({@link #applyGradients}) are unsynchronized: only one training run may touch a
 * network at a time.
 */
public class Network implements Serializable {

    private static final Activator ACTIVATOR = SigmoidActivator.INSTANCE;

    private final int[] sizes;
    private final List<Matrix> weights;
    private final List<Matrix> biases;

    /**
     * Create a network with parameters drawn from the given generator.
     *
     * @throws InvalidArchitectureException if fewer than two sizes are given or any size is not positive
     */
    public Network(RandomGenerator random, int... sizes) {
        this.sizes = validateArchitecture(sizes);

        List<Matrix> w = new ArrayList<>(this.sizes.length - 1);
        List<Matrix> b = new ArrayList<>(this.sizes.length - 1);
        for (int l = 0; l < this.sizes.length - 1; l++) {
            Matrix bias = Matrix.zeros(this.sizes[l + 1], 1);
            NetMath.standardNormalInit(bias, random);
            b.add(bias);
        }
        for (int l = 0; l < this.sizes.length - 1; l++) {
            Matrix weight = Matrix.zeros(this.sizes[l + 1], this.sizes[l]);
            NetMath.standardNormalInit(weight, random);
            w.add(weight);
        }
        this.weights = Collections.unmodifiableList(w);
        this.biases = Collections.unmodifiableList(b);
    }

    /**
     * Create a network with an entropy-seeded generator.
     */
    public Network(int... sizes) {
        this(RandomSource.create(), sizes);
    }

    public static Network of(List<Integer> sizes, RandomGenerator random) {
        if (sizes == null)
            throw new InvalidArchitectureException("Layer sizes must not be null");
        int[] array = new int[sizes.size()];
        for (int i = 0; i < array.length; i++) {
            Integer size = sizes.get(i);
            if (size == null)
                throw new InvalidArchitectureException("Layer size " + i + " is null");
            array[i] = size;
        }
        return new Network(random, array);
    }

    /**
     * Rebuild a network from stored parameters, validating every shape.
     */
    Network(int[] sizes, List<Matrix> weights, List<Matrix> biases) {
        this.sizes = validateArchitecture(sizes);
        if (weights.size() != this.sizes.length - 1 || biases.size() != this.sizes.length - 1)
            throw new InvalidArchitectureException("Expected " + (this.sizes.length - 1)
                    + " weight and bias tensors, got " + weights.size() + " and " + biases.size());
        for (int l = 0; l < this.sizes.length - 1; l++) {
            weights.get(l).requireShape(this.sizes[l + 1], this.sizes[l], "Weight matrix " + l);
            biases.get(l).requireShape(this.sizes[l + 1], 1, "Bias vector " + l);
        }
        this.weights = Collections.unmodifiableList(new ArrayList<>(weights));
        this.biases = Collections.unmodifiableList(new ArrayList<>(biases));
    }

    private static int[] validateArchitecture(int[] sizes) {
        if (sizes == null || sizes.length < 2)
            throw new InvalidArchitectureException("A network needs at least an input and an output layer, got "
                    + (sizes == null ? "null" : Arrays.toString(sizes)));
        for (int i = 0; i < sizes.length; i++) {
            if (sizes[i] <= 0)
                throw new InvalidArchitectureException("Layer " + i + " must have a positive size, got " + sizes[i]);
        }
        return sizes.clone();
    }

    // ===============================
    // TOPOLOGY AND PARAMETERS
    // ===============================

    /**
     * @return a copy of the layer-size sequence
     */
    public int[] getLayerSizes() {
        return sizes.clone();
    }

    public int getLayerCount() {
        return sizes.length;
    }

    public int getInputSize() {
        return sizes[0];
    }

    public int getOutputSize() {
        return sizes[sizes.length - 1];
    }

    /**
     * Weight matrices in transition order. The list cannot be resized; the matrices
     * are the live parameters.
     */
    public List<Matrix> getWeights() {
        return weights;
    }

    /**
     * Bias columns in transition order. The list cannot be resized; the columns
     * are the live parameters.
     */
    public List<Matrix> getBiases() {
        return biases;
    }

    public long getParameterCount() {
        long count = 0;
        for (int l = 0; l < weights.size(); l++)
            count += weights.get(l).size() + biases.get(l).size();
        return count;
    }

    // ===============================
    // FORWARD PASS
    // ===============================

    /**
     * Output activations for a single input column. Does not touch any parameter.
     *
     * @param input column of length {@code sizes[0]}
     * @return column of length {@code sizes[L-1]}, every element in (0, 1) for
     *         pre-activations of moderate magnitude; in doubles the sigmoid rounds
     *         to exactly 1.0 once z exceeds about 37 and to 0.0 below about -745
     * @throws DimensionMismatchException if the input is not {@code sizes[0] x 1}
     */
    public Matrix feedforward(Matrix input) {
        input.requireShape(sizes[0], 1, "Input vector");

        Matrix activation = input;
        for (int l = 0; l < weights.size(); l++) {
            Matrix z = Matrix.zeros(sizes[l + 1], 1);
            NetMath.preActivations(weights.get(l), activation, biases.get(l), z);
            ACTIVATOR.activate(z, z);
            activation = z;
        }
        return activation;
    }

    /**
     * Index of the largest output activation.
     */
    public int predictClass(Matrix input) {
        return NetMath.argmax(feedforward(input));
    }

    // ===============================
    // BACKPROPAGATION
    // ===============================

    /**
     * Gradients of the quadratic cost for one example with respect to every bias and weight.
     *
     * @param input  column of length {@code sizes[0]}
     * @param target column of length {@code sizes[L-1]}
     * @throws DimensionMismatchException if either column has the wrong length
     */
    public Gradients backprop(Matrix input, Matrix target) {
        input.requireShape(sizes[0], 1, "Input vector");
        target.requireShape(getOutputSize(), 1, "Target vector");

        int transitions = weights.size();

        // activations[0] is the input, activations[l + 1] = sigmoid(zs[l])
        Matrix[] zs = new Matrix[transitions];
        Matrix[] activations = new Matrix[transitions + 1];
        activations[0] = input;
        for (int l = 0; l < transitions; l++) {
            Matrix z = Matrix.zeros(sizes[l + 1], 1);
            NetMath.preActivations(weights.get(l), activations[l], biases.get(l), z);
            zs[l] = z;

            Matrix a = Matrix.zeros(sizes[l + 1], 1);
            ACTIVATOR.activate(z, a);
            activations[l + 1] = a;
        }

        Matrix[] nablaB = new Matrix[transitions];
        Matrix[] nablaW = new Matrix[transitions];

        int last = transitions - 1;
        Matrix delta = QuadraticCost.INSTANCE.derivatives(activations[transitions], target);
        multiplyBySigmoidPrime(delta, zs[last]);
        nablaB[last] = delta;
        nablaW[last] = outer(delta, activations[last]);

        for (int l = last - 1; l >= 0; l--) {
            Matrix propagated = Matrix.zeros(sizes[l + 1], 1);
            NetMath.transposeMultiply(weights.get(l + 1), delta, propagated);
            multiplyBySigmoidPrime(propagated, zs[l]);
            delta = propagated;
            nablaB[l] = delta;
            nablaW[l] = outer(delta, activations[l]);
        }

        return new Gradients(Arrays.asList(nablaB), Arrays.asList(nablaW));
    }

    private static void multiplyBySigmoidPrime(Matrix delta, Matrix z) {
        Matrix prime = Matrix.zerosLike(z);
        ACTIVATOR.derivative(z, prime);
        NetMath.elementwiseMultiply(delta, prime, delta);
    }

    private static Matrix outer(Matrix delta, Matrix previousActivation) {
        Matrix result = Matrix.zeros(delta.rows(), previousActivation.rows());
        NetMath.outerProduct(delta, previousActivation, result);
        return result;
    }

    // ===============================
    // PARAMETER UPDATE
    // ===============================

    /**
     * Subtract {@code scale} times the given gradients from every parameter:
     * w = w - scale * nabla_w, b = b - scale * nabla_b.
     *
     * @throws DimensionMismatchException if the gradients were shaped for another architecture
     */
    public void applyGradients(Gradients gradients, double scale) {
        if (gradients.transitions() != weights.size())
            throw new DimensionMismatchException("Gradients cover " + gradients.transitions()
                    + " transitions, network has " + weights.size());
        // validate every shape first so a mismatch leaves the parameters untouched
        for (int l = 0; l < weights.size(); l++) {
            Matrix w = weights.get(l);
            Matrix b = biases.get(l);
            gradients.weights().get(l).requireShape(w.rows(), w.cols(), "Weight gradient " + l);
            gradients.biases().get(l).requireShape(b.rows(), b.cols(), "Bias gradient " + l);
        }
        for (int l = 0; l < weights.size(); l++) {
            NetMath.parameterUpdate(weights.get(l), gradients.weights().get(l), scale);
            NetMath.parameterUpdate(biases.get(l), gradients.biases().get(l), scale);
        }
    }

    // ===============================
    // SAVE/LOAD METHODS
    // ===============================

    /**
     * Save this network to a file with compression.
     *
     * @param path file path to save to
     * @throws IOException if save fails
     */
    public void save(Path path) throws IOException {
        ModelSerializer.save(this, path);
    }

    /**
     * Load a network from a file.
     *
     * @param path file path to load from
     * @return loaded network
     * @throws IOException if load fails
     */
    public static Network load(Path path) throws IOException {
        return ModelSerializer.load(path);
    }

    // Serialization implementation

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(sizes.length);
        for (int size : sizes)
            out.writeInt(size);

        for (int l = 0; l < weights.size(); l++) {
            writeMatrix(out, weights.get(l));
            writeMatrix(out, biases.get(l));
        }
    }

    @Override
    public void readFrom(DataInputStream in, int version) throws IOException {
        throw new UnsupportedOperationException("Use Network.deserialize(DataInputStream, int) instead");
    }

    /**
     * Static method to deserialize a Network from stream.
     * Required because the parameter lists are fixed at construction.
     */
    public static Network deserialize(DataInputStream in, int version) throws IOException {
        int layerCount = in.readInt();
        if (layerCount < 2 || layerCount > SerializationConstants.MAX_LAYERS)
            throw new IOException("Invalid layer count in model data: " + layerCount);

        int[] sizes = new int[layerCount];
        for (int i = 0; i < layerCount; i++)
            sizes[i] = in.readInt();

        List<Matrix> weights = new ArrayList<>(layerCount - 1);
        List<Matrix> biases = new ArrayList<>(layerCount - 1);
        for (int l = 0; l < layerCount - 1; l++) {
            weights.add(readMatrix(in));
            biases.add(readMatrix(in));
        }

        try {
            return new Network(sizes, weights, biases);
        } catch (IllegalArgumentException e) {
            throw new IOException("Model data is inconsistent: " + e.getMessage(), e);
        }
    }

    private static void writeMatrix(DataOutputStream out, Matrix matrix) throws IOException {
        out.writeInt(matrix.rows());
        out.writeInt(matrix.cols());
        for (double v : matrix.data())
            out.writeLong(Double.doubleToRawLongBits(v));
    }

    private static Matrix readMatrix(DataInputStream in) throws IOException {
        int rows = in.readInt();
        int cols = in.readInt();
        if (rows <= 0 || cols <= 0 || (long) rows * cols > SerializationConstants.MAX_TENSOR_ELEMENTS)
            throw new IOException("Invalid tensor shape in model data: " + rows + "x" + cols);

        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++)
            data[i] = Double.longBitsToDouble(in.readLong());
        return Matrix.wrap(rows, cols, data);
    }

    @Override
    public int getSerializedSize(int version) {
        int size = 4 + 4 * sizes.length;
        for (int l = 0; l < weights.size(); l++) {
            size += 8 + 8 * weights.get(l).size();
            size += 8 + 8 * biases.get(l).size();
        }
        return size;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_NETWORK;
    }

    @Override
    public String toString() {
        return "Network" + Arrays.toString(sizes);
    }
}
