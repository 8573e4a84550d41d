package com.regressionsentinel.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot store that keeps the serialized JSON in memory.
 * <p>
 * Storing the JSON text rather than the object means a loaded snapshot never
 * aliases the engine's live state, the same as a file-backed store.
 * </p>
 *
 * @param <T> snapshot type
 */
public class InMemorySnapshotStore<T> implements SnapshotStore<T> {

    private final TypeReference<T> type;
    private final ObjectMapper mapper;
    private volatile String json;

    public InMemorySnapshotStore(TypeReference<T> type) {
        this(type, ObjectMappers.standard());
    }

    public InMemorySnapshotStore(TypeReference<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<T> load() {
        String current = json;
        if (current == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(current, type));
        } catch (JsonProcessingException e) {
            throw new SnapshotStoreException("Cannot read in-memory snapshot", e);
        }
    }

    @Override
    public void save(T snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            json = mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotStoreException("Cannot serialize snapshot", e);
        }
    }

    /**
     * @return the raw JSON last saved, or {@code null}
     */
    public String rawJson() {
        return json;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
