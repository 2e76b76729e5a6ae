package dev.perceptron.net.serialization;

/**
 * Constants for the model file format.
 */
public final class SerializationConstants {

    // File format identification
    public static final int MAGIC_NUMBER = 0x50435452; // "PCTR"
    public static final int CURRENT_VERSION = 1;

    // Type IDs
    public static final int TYPE_NETWORK = 1;

    // File structure markers
    public static final int SECTION_METADATA = 0x1000;
    public static final int SECTION_MODEL = 0x1001;
    public static final int SECTION_END = 0x1999;

    // Sanity limits applied while reading untrusted files
    public static final int MAX_LAYERS = 4096;
    public static final long MAX_TENSOR_ELEMENTS = 1L << 28;

    public static final String FILE_EXTENSION = ".model";

    private SerializationConstants() {} // Prevent instantiation
}
