package com.regressionsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot store backed by a single JSON file.
 * <p>
 * Writes go to a sibling temporary file which then replaces the target, so a
 * crash mid-write never leaves a truncated snapshot behind.
 * </p>
 *
 * @param <T> snapshot type
 */
public class JsonFileSnapshotStore<T> implements SnapshotStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileSnapshotStore.class);

    private final Path path;
    private final TypeReference<T> type;
    private final ObjectMapper mapper;

    public JsonFileSnapshotStore(Path path, TypeReference<T> type) {
        this(path, type, ObjectMappers.standard());
    }

    public JsonFileSnapshotStore(Path path, TypeReference<T> type, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<T> load() {
        if (!Files.exists(path)) {
            LOG.debug("No snapshot at {}", path);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read snapshot " + path, e);
        }
    }

    @Override
    public void save(T snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot write snapshot " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
