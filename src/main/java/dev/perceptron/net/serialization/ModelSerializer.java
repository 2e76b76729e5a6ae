package dev.perceptron.net.serialization;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import dev.perceptron.net.Network;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Binary model serialization with Zstd compression.
 *
 * Layout (big-endian, inside the compressed stream):
 * - header: magic number, format version, save timestamp (epoch millis)
 * - metadata section: network id, trained flag, accuracy (NaN when unknown)
 * - model section: type id followed by {@link Network#writeTo}
 * - end marker
 *
 * Parameters are stored as raw IEEE-754 bits, so a reloaded network predicts
 * bit-for-bit what the saved one did.
 */
public class ModelSerializer {

    // Compression level: 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Save a network to file with compression and no metadata.
     */
    public static void save(Network model, Path filePath) throws IOException {
        save(model, ModelMetadata.anonymous(), filePath);
    }

    /**
     * Save a network and its metadata to file with compression.
     *
     * @throws IOException if saving fails
     */
    public static void save(Network model, ModelMetadata metadata, Path filePath) throws IOException {
        try (OutputStream fileOut = Files.newOutputStream(filePath)) {
            write(model, metadata, fileOut);
        }
    }

    /**
     * Write a compressed model to an arbitrary stream. The stream is flushed, not closed.
     */
    public static void write(Network model, ModelMetadata metadata, OutputStream target) throws IOException {
        BufferedOutputStream buffered = new BufferedOutputStream(nonClosing(target), BUFFER_SIZE);
        try (ZstdOutputStream zstdOut = new ZstdOutputStream(buffered, COMPRESSION_LEVEL);
             DataOutputStream out = new DataOutputStream(zstdOut)) {

            writeHeader(out);

            out.writeInt(SerializationConstants.SECTION_METADATA);
            out.writeUTF(metadata.networkId());
            out.writeBoolean(metadata.trained());
            out.writeDouble(metadata.accuracy() != null ? metadata.accuracy() : Double.NaN);

            out.writeInt(SerializationConstants.SECTION_MODEL);
            out.writeInt(model.getTypeId());
            model.writeTo(out, SerializationConstants.CURRENT_VERSION);

            out.writeInt(SerializationConstants.SECTION_END);
        }
    }

    /**
     * Load a network from file, discarding metadata.
     *
     * @throws IOException if the file is missing, truncated or not a model file
     */
    public static Network load(Path filePath) throws IOException {
        return loadSaved(filePath).network();
    }

    /**
     * Load a network with its metadata.
     */
    public static SavedModel loadSaved(Path filePath) throws IOException {
        try (InputStream fileIn = Files.newInputStream(filePath)) {
            return read(fileIn);
        }
    }

    /**
     * Read a compressed model from an arbitrary stream.
     */
    public static SavedModel read(InputStream source) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(nonClosing(source), BUFFER_SIZE);
        try (ZstdInputStream zstdIn = new ZstdInputStream(buffered);
             DataInputStream in = new DataInputStream(zstdIn)) {

            int version = readHeaderVersion(in);
            Instant savedAt = Instant.ofEpochMilli(in.readLong());

            expectMarker(in, SerializationConstants.SECTION_METADATA, "metadata section");
            String networkId = in.readUTF();
            boolean trained = in.readBoolean();
            double accuracy = in.readDouble();
            ModelMetadata metadata = new ModelMetadata(networkId, trained,
                    Double.isNaN(accuracy) ? null : accuracy);

            expectMarker(in, SerializationConstants.SECTION_MODEL, "model section");
            int typeId = in.readInt();
            if (typeId != SerializationConstants.TYPE_NETWORK)
                throw new IOException("Unknown model type id: " + typeId);
            Network network = Network.deserialize(in, version);

            expectMarker(in, SerializationConstants.SECTION_END, "end marker");
            return new SavedModel(network, metadata, savedAt);
        } catch (EOFException e) {
            throw new IOException("Invalid file format: model data is truncated", e);
        }
    }

    /**
     * Uncompressed size of a model file.
     */
    public static long estimateFileSize(Network model) {
        return 16 + 16 + model.getSerializedSize(SerializationConstants.CURRENT_VERSION);
    }

    private static void writeHeader(DataOutputStream out) throws IOException {
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeLong(System.currentTimeMillis()); // Timestamp
    }

    private static int readHeaderVersion(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != SerializationConstants.MAGIC_NUMBER)
            throw new IOException("Invalid file format: wrong magic number");

        int version = in.readInt();
        if (version < 1 || version > SerializationConstants.CURRENT_VERSION)
            throw new IOException("Unsupported file version: " + version +
                    " (current version: " + SerializationConstants.CURRENT_VERSION + ")");
        return version;
    }

    private static void expectMarker(DataInputStream in, int marker, String what) throws IOException {
        int actual = in.readInt();
        if (actual != marker)
            throw new IOException("Invalid file format: missing " + what);
    }

    private static OutputStream nonClosing(OutputStream out) {
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    private static InputStream nonClosing(InputStream in) {
        return new FilterInputStream(in) {
            @Override
            public void close() {
                // owner closes the underlying stream
            }
        };
    }
}
