package com.regressionsentinel.core.store;

import java.util.Optional;

/**
 * Repository for a single snapshot document. Engines keep their state in
 * memory and write the whole snapshot through after every mutation.
 *
 * @param <T> snapshot type
 */
public interface SnapshotStore<T> {

    /**
     * @return the last saved snapshot, or empty if nothing was saved yet
     * @throws SnapshotStoreException if the snapshot exists but cannot be read
     */
    Optional<T> load();

    /**
     * Replace the stored snapshot.
     *
     * @param snapshot snapshot to store; must not be {@code null}
     * @throws SnapshotStoreException if the snapshot cannot be written
     */
    void save(T snapshot);

    /**
     * @return a short human-readable location, used in log messages
     */
    String describe();
}
