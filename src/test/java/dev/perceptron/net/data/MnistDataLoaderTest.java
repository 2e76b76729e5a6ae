package dev.perceptron.net.data;

import dev.perceptron.net.math.Matrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MnistDataLoaderTest {

    @TempDir
    Path tempDir;

    /**
     * {@code count} 2x2 images; image i has every pixel set to i * 50.
     */
    private static List<Matrix> images(int count) {
        List<Matrix> images = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int v = i * 50;
            images.add(MnistDataLoader.pixels(new int[][]{{v, v}, {v, v}}));
        }
        return images;
    }

    @Test
    void testPixelsScaledRowByRow() {
        Matrix column = MnistDataLoader.pixels(new int[][]{{0, 51, 255}, {102, 0, 204}});

        assertEquals("6x1", column.shapeString());
        assertEquals(0.0, column.at(0));
        assertEquals(0.2, column.at(1), 1e-12);
        assertEquals(1.0, column.at(2), 1e-12);
        assertEquals(0.4, column.at(3), 1e-12);
        assertEquals(0.8, column.at(5), 1e-12);
    }

    @Test
    void testBytePixelsReadUnsigned() {
        Matrix column = MnistDataLoader.pixels(new byte[][]{{(byte) 255, (byte) 128}});

        assertEquals(1.0, column.at(0), 1e-12);
        assertEquals(128 / 255.0, column.at(1), 1e-12);
    }

    @Test
    void testRaggedOrEmptyImageRejected() {
        assertThrows(IllegalArgumentException.class, () -> MnistDataLoader.pixels(new int[][]{{1, 2}, {3}}));
        assertThrows(IllegalArgumentException.class, () -> MnistDataLoader.pixels(new int[0][0]));
    }

    @Test
    void testAssembleSplitsTrainingAndValidation() {
        MnistData data = new MnistDataLoader(3).assemble(
                images(5), List.of(3, 1, 4, 1, 5),
                images(2), List.of(9, 2));

        assertEquals(3, data.training().size());
        assertEquals(2, data.validation().size());
        assertEquals(2, data.test().size());

        // one-hot targets for training, plain labels elsewhere
        Matrix target = data.training().get(0).target();
        assertEquals("10x1", target.shapeString());
        assertEquals(1.0, target.at(3));
        assertEquals(1, data.validation().get(0).label());
        assertEquals(5, data.validation().get(1).label());
        assertEquals(9, data.test().get(0).label());
        assertEquals(50 / 255.0, data.test().get(1).input().at(0), 1e-12);
    }

    @Test
    void testAssembleWithFewerRecordsThanTrainingSize() {
        MnistData data = new MnistDataLoader().assemble(
                images(5), List.of(3, 1, 4, 1, 5),
                images(2), List.of(9, 2));

        // everything trains, nothing validates
        assertEquals(5, data.training().size());
        assertTrue(data.validation().isEmpty());
        assertEquals(2, data.test().size());
    }

    @Test
    void testCountMismatchRejected() {
        MnistDataLoader loader = new MnistDataLoader();

        assertThrows(IllegalArgumentException.class,
                () -> loader.assemble(images(2), List.of(1, 2), images(2), List.of(1, 2, 3)));
    }

    @Test
    void testOutOfRangeLabelRejected() {
        MnistDataLoader loader = new MnistDataLoader(1);

        assertThrows(IllegalArgumentException.class,
                () -> loader.assemble(images(2), List.of(1, 2), images(1), List.of(12)));
        assertThrows(IllegalArgumentException.class,
                () -> loader.assemble(images(2), List.of(1, -1), images(1), List.of(0)));
    }

    @Test
    void testMissingDirectoryReported() {
        assertThrows(FileNotFoundException.class,
                () -> new MnistDataLoader().load(tempDir.resolve("absent")));
    }

    @Test
    void testInvalidTrainingSize() {
        assertThrows(IllegalArgumentException.class, () -> new MnistDataLoader(0));
    }

    @Test
    void testLoadFullDataset() throws FileNotFoundException {
        // Skip test if dataset is not available
        File datasetDir = new File("src/test/resources/datasets");
        if (!datasetDir.exists()) {
            System.out.println("Skipping MNIST load test - dataset not available");
            return;
        }

        MnistData data = new MnistDataLoader().load(Paths.get("src/test/resources/datasets"));

        assertEquals(50_000, data.training().size());
        assertEquals(10_000, data.validation().size());
        assertEquals(10_000, data.test().size());
        assertEquals("784x1", data.test().get(0).input().shapeString());
    }
}
