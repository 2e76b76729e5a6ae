package dev.perceptron.net.serialization;

import java.io.*;

/**
 * Interface for binary serialization.
 *
 * Each class implements its own serialization logic for:
 * - Maintainability: Each class owns its data format
 * - Performance: Direct binary writing, no reflection
 * - Extensibility: Version-aware serialization
 */
public interface Serializable {

    /**
     * Write this object's data to the output stream.
     * Should write in a format that the matching deserializer understands.
     *
     * @param out output stream to write to
     * @param version serialization version for compatibility
     * @throws IOException if writing fails
     */
    void writeTo(DataOutputStream out, int version) throws IOException;

    /**
     * Read this object's data from the input stream.
     * Immutable types throw {@link UnsupportedOperationException} and offer a static
     * {@code deserialize} method instead.
     *
     * @param in input stream to read from
     * @param version serialization version for compatibility
     * @throws IOException if reading fails
     */
    void readFrom(DataInputStream in, int version) throws IOException;

    /**
     * Get the serialized size in bytes, before compression.
     *
     * @param version serialization version
     * @return size in bytes
     */
    int getSerializedSize(int version);

    /**
     * Get the type identifier for this serializable class.
     * Written ahead of the payload and checked during deserialization.
     *
     * @return unique type identifier
     */
    int getTypeId();
}
