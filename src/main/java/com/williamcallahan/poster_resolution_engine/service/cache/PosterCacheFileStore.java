package com.williamcallahan.poster_resolution_engine.service.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.poster_resolution_engine.types.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * JSON file persistence for the poster cache
 *
 * @author William Callahan
 *
 * Features:
 * - Writes to a sibling temp file then moves it over the target so readers never see a partial file
 * - Falls back to a plain replace where the file system has no atomic move
 * - Missing or unreadable files yield an empty result instead of an error
 */
public class PosterCacheFileStore {

    private static final Logger logger = LoggerFactory.getLogger(PosterCacheFileStore.class);

    public static final String FORMAT_VERSION = "1.0";

    private final Path path;
    private final ObjectMapper objectMapper;

    public PosterCacheFileStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the snapshot file
     *
     * @return the snapshot, or empty when the file is missing or cannot be decoded
     */
    public Optional<Snapshot> read() {
        try {
            byte[] content = Files.readAllBytes(path);
            Snapshot snapshot = objectMapper.readValue(content, Snapshot.class);
            return Optional.ofNullable(snapshot);
        } catch (NoSuchFileException e) {
            logger.info("No poster cache file at {}; starting with an empty cache", path);
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Could not read poster cache file {}; starting with an empty cache: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Atomically replaces the snapshot file
     *
     * @throws IOException when the temp file cannot be written or moved
     */
    public void write(Snapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Poster cache saved to {} ({} entries)", path, snapshot.entries().size());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snapshot(String version, long timestamp, Map<String, CacheEntry> entries, Stats stats) {

        public Snapshot {
            entries = entries == null ? Map.of() : entries;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stats(long sets, long evictions, int size) {
    }
}
