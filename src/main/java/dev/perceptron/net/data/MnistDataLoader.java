package dev.perceptron.net.data;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.math.Matrix;
import org.knowm.datasets.mnist.Mnist;
import org.knowm.datasets.mnist.MnistDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the MNIST digits through the Knowm datasets {@link MnistDAO}.
 *
 * <p>The directory is the one handed to {@link MnistDAO#init(String)}; it holds the
 * MNIST database files. Records below the DAO's train/test split are training
 * records, the rest are test records. Pixels become {@code rows*cols x 1} columns
 * scaled to [0, 1].
 *
 * <p>The first {@code trainingSize} training records become one-hot training
 * examples; the remaining training records become the validation set.
 */
public class MnistDataLoader {

    private static final Logger log = LoggerFactory.getLogger(MnistDataLoader.class);

    public static final int CLASSES = 10;
    public static final int DEFAULT_TRAINING_SIZE = 50_000;

    private final int trainingSize;

    public MnistDataLoader() {
        this(DEFAULT_TRAINING_SIZE);
    }

    /**
     * @param trainingSize number of leading training records used for training; the
     *                     remainder is the validation set
     */
    public MnistDataLoader(int trainingSize) {
        if (trainingSize <= 0)
            throw new IllegalArgumentException("Training size must be positive: " + trainingSize);
        this.trainingSize = trainingSize;
    }

    /**
     * @throws FileNotFoundException if {@code directory} does not exist
     */
    public MnistData load(Path directory) throws FileNotFoundException {
        if (!Files.isDirectory(directory))
            throw new FileNotFoundException("MNIST dataset directory not found: " + directory);

        log.info("Loading MNIST data from {}", directory);
        MnistDAO.init(directory.toString());

        int split = MnistDAO.getTrainTestSplit();
        int count = (int) MnistDAO.selectCount();

        List<Matrix> trainImages = new ArrayList<>(split);
        List<Integer> trainLabels = new ArrayList<>(split);
        for (int i = 0; i < split; i++) {
            Mnist entry = MnistDAO.selectSingle(i);
            trainImages.add(pixels(entry.getImageMatrix()));
            trainLabels.add(entry.getLabel());
        }

        List<Matrix> testImages = new ArrayList<>(count - split);
        List<Integer> testLabels = new ArrayList<>(count - split);
        for (int i = split; i < count; i++) {
            Mnist entry = MnistDAO.selectSingle(i);
            testImages.add(pixels(entry.getImageMatrix()));
            testLabels.add(entry.getLabel());
        }

        MnistData data = assemble(trainImages, trainLabels, testImages, testLabels);
        log.info("Loaded {} training, {} validation and {} test examples",
                data.training().size(), data.validation().size(), data.test().size());
        return data;
    }

    /**
     * Split decoded records into training, validation and test examples.
     *
     * @throws IllegalArgumentException if image and label counts differ or a label
     *                                  is outside [0, 10)
     */
    MnistData assemble(List<Matrix> trainImages, List<Integer> trainLabels,
                       List<Matrix> testImages, List<Integer> testLabels) {
        requireSameCount(trainImages, trainLabels, "training");
        requireSameCount(testImages, testLabels, "test");

        int cut = Math.min(trainingSize, trainImages.size());
        List<TrainingExample> training = new ArrayList<>(cut);
        for (int i = 0; i < cut; i++)
            training.add(Datasets.trainingExample(trainImages.get(i), trainLabels.get(i), CLASSES));

        List<EvaluationExample> validation = new ArrayList<>(trainImages.size() - cut);
        for (int i = cut; i < trainImages.size(); i++)
            validation.add(new EvaluationExample(trainImages.get(i), checkedLabel(trainLabels.get(i), i)));

        List<EvaluationExample> test = new ArrayList<>(testImages.size());
        for (int i = 0; i < testImages.size(); i++)
            test.add(new EvaluationExample(testImages.get(i), checkedLabel(testLabels.get(i), i)));

        return new MnistData(training, validation, test);
    }

    /**
     * Flatten a grey-scale image row by row into a column scaled to [0, 1].
     */
    public static Matrix pixels(int[][] image) {
        int rows = requireRectangular(image.length, image.length > 0 ? image[0].length : 0);
        int cols = image[0].length;
        double[] values = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (image[r].length != cols)
                throw new IllegalArgumentException("Image must be rectangular");
            for (int c = 0; c < cols; c++)
                values[r * cols + c] = (image[r][c] & 0xFF) / 255.0;
        }
        return Matrix.wrap(rows * cols, 1, values);
    }

    /**
     * Same as {@link #pixels(int[][])} for images stored as unsigned bytes.
     */
    public static Matrix pixels(byte[][] image) {
        int rows = requireRectangular(image.length, image.length > 0 ? image[0].length : 0);
        int cols = image[0].length;
        double[] values = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (image[r].length != cols)
                throw new IllegalArgumentException("Image must be rectangular");
            for (int c = 0; c < cols; c++)
                values[r * cols + c] = (image[r][c] & 0xFF) / 255.0;
        }
        return Matrix.wrap(rows * cols, 1, values);
    }

    private static int requireRectangular(int rows, int cols) {
        if (rows == 0 || cols == 0)
            throw new IllegalArgumentException("Image cannot be empty");
        return rows;
    }

    private static int checkedLabel(int label, int index) {
        if (label < 0 || label >= CLASSES)
            throw new IllegalArgumentException("Label " + label + " at index " + index + " outside [0, " + CLASSES + ")");
        return label;
    }

    private static void requireSameCount(List<Matrix> images, List<Integer> labels, String which) {
        if (images.size() != labels.size())
            throw new IllegalArgumentException("MNIST " + which + " set has " + images.size()
                    + " images but " + labels.size() + " labels");
    }
}
