package dev.perceptron.net.serialization;

import dev.perceptron.net.Network;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Directory-backed store of saved networks, one {@code <id>.model} file per network.
 *
 * <p>The directory is created on the first save. Ids are restricted to letters,
 * digits, {@code -} and {@code _} so every file stays inside the directory.
 */
public class ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelRepository.class);
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;

    public ModelRepository(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Save (or overwrite) a network under {@code networkId}.
     */
    public void save(String networkId, Network network, boolean trained, Double accuracy) throws IOException {
        Path file = pathFor(networkId);
        Files.createDirectories(directory);

        // write next to the target, then move, so readers never see half a file
        Path temp = Files.createTempFile(directory, networkId, ".tmp");
        try {
            ModelSerializer.save(network, new ModelMetadata(networkId, trained, accuracy), temp);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Saved network {} {} to {}", networkId, network, file);
    }

    /**
     * @return the saved network, or empty if no model exists under {@code networkId}
     * @throws IOException if the file exists but cannot be read
     */
    public Optional<Network> load(String networkId) throws IOException {
        return loadSaved(networkId).map(SavedModel::network);
    }

    public Optional<SavedModel> loadSaved(String networkId) throws IOException {
        Path file = pathFor(networkId);
        if (!Files.exists(file))
            return Optional.empty();
        return Optional.of(ModelSerializer.loadSaved(file));
    }

    public boolean exists(String networkId) {
        return Files.exists(pathFor(networkId));
    }

    /**
     * Describe every readable model in the directory, ordered by id. Unreadable files
     * are logged and skipped.
     */
    public List<SavedModelInfo> list() throws IOException {
        List<SavedModelInfo> result = new ArrayList<>();
        if (!Files.isDirectory(directory))
            return result;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory,
                "*" + SerializationConstants.FILE_EXTENSION)) {
            for (Path file : files) {
                String id = idOf(file);
                try {
                    result.add(SavedModelInfo.of(id, ModelSerializer.loadSaved(file)));
                } catch (IOException e) {
                    log.warn("Skipping unreadable model file {}: {}", file, e.getMessage());
                }
            }
        }
        result.sort(Comparator.comparing(SavedModelInfo::networkId));
        return result;
    }

    /**
     * @return true if a file was removed
     */
    public boolean delete(String networkId) throws IOException {
        boolean deleted = Files.deleteIfExists(pathFor(networkId));
        if (deleted)
            log.info("Deleted saved network {}", networkId);
        return deleted;
    }

    private Path pathFor(String networkId) {
        if (networkId == null || !VALID_ID.matcher(networkId).matches())
            throw new IllegalArgumentException("Invalid network id: " + networkId);
        return directory.resolve(networkId + SerializationConstants.FILE_EXTENSION);
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - SerializationConstants.FILE_EXTENSION.length());
    }
}
