package ai.pokercoach.solver.cache;

import ai.pokercoach.solver.CacheIOException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.DateTimeException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON document per key under a directory, named by the SHA-256 of the key.
 * <p>
 * Writes go to a temporary file in the same directory and are moved into place
 * atomically, so a reader never sees a half-written entry.
 */
public class FileSolutionStore implements SolutionStore {
    private static final Logger log = LoggerFactory.getLogger(FileSolutionStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSolutionStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    /** File holding {@code key}, whether or not it exists yet. */
    public Path pathFor(String key) {
        return directory.resolve(fileName(key));
    }

    @Override
    public Optional<CacheEntry> load(String key) {
        Path file = pathFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        CacheEntry entry = read(file, key);
        if (!entry.key().equals(key)) {
            throw new CacheIOException(key, "File " + file + " holds key " + entry.key(), null);
        }
        return Optional.of(entry);
    }

    @Override
    public void save(CacheEntry entry) {
        Path target = pathFor(entry.key());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".entry-", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), CacheEntryDocument.from(entry));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            if (log.isDebugEnabled()) {
                log.debug("Stored {} ({}) at {}", entry.key(), entry.provenance(), target);
            }
        } catch (IOException e) {
            deleteTemp(temp);
            throw new CacheIOException(entry.key(), "Cannot write " + target, e);
        }
    }

    @Override
    public boolean contains(String key) {
        return Files.isRegularFile(pathFor(key));
    }

    @Override
    public int size() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(directory)) {
            return (int) files.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            throw new CacheIOException("*", "Cannot list " + directory, e);
        }
    }

    /**
     * Reads any cache document, e.g. one shipped as precomputed data.
     *
     * @param expectedKey key reported in errors
     * @throws CacheIOException if the file cannot be read or does not hold a valid entry
     */
    public CacheEntry read(Path file, String expectedKey) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return objectMapper.readValue(json, CacheEntryDocument.class).toEntry();
        } catch (IOException e) {
            throw new CacheIOException(expectedKey, "Cannot read " + file, e);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new CacheIOException(expectedKey, "Invalid cache document " + file + ": " + e.getMessage(), e);
        }
    }

    static String fileName(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8))) + SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary cache file {}: {}", temp, e.toString());
        }
    }
}
