package com.newsflow.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable, run-keyed snapshot storage.
 * <p>
 * Implementations must be safe for concurrent use. {@link #loadLatest} must return
 * the checkpoint with the highest sequence saved for the run, including after a
 * process restart for durable backends. A failed write throws
 * {@link CheckpointStoreException} and must leave no partial checkpoint behind.
 */
public interface CheckpointStore {

    /**
     * Persists a checkpoint.
     *
     * @throws CheckpointStoreException if the write fails or the sequence does not
     *                                  advance past the latest stored one
     */
    void save(Checkpoint checkpoint);

    Optional<Checkpoint> loadLatest(String runId);

    /** All checkpoints of a run in write order. */
    List<Checkpoint> list(String runId);

    List<String> listRunIds();

    /** Deletes every checkpoint of a run and returns how many were removed. */
    int release(String runId);
}
