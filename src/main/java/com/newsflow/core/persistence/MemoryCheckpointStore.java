package com.newsflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link CheckpointStore} for development and ephemeral runs.
 * State is lost when the process exits.
 */
public class MemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryCheckpointStore.class);

    private final ConcurrentHashMap<String, List<Checkpoint>> checkpointsByRun = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        checkpointsByRun.compute(checkpoint.runId(), (runId, existing) -> {
            var checkpoints = existing != null ? existing : new ArrayList<Checkpoint>();
            if (!checkpoints.isEmpty()) {
                long latest = checkpoints.get(checkpoints.size() - 1).sequence();
                if (checkpoint.sequence() <= latest) {
                    throw new CheckpointStoreException("Checkpoint sequence " + checkpoint.sequence()
                            + " for run '" + runId + "' does not advance past " + latest);
                }
            }
            checkpoints.add(checkpoint);
            return checkpoints;
        });
        log.debug("Saved checkpoint {} (seq {}) for run '{}'",
                checkpoint.id(), checkpoint.sequence(), checkpoint.runId());
    }

    @Override
    public Optional<Checkpoint> loadLatest(String runId) {
        List<Checkpoint> snapshot = list(runId);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    @Override
    public List<Checkpoint> list(String runId) {
        var result = new ArrayList<Checkpoint>();
        checkpointsByRun.computeIfPresent(runId, (id, checkpoints) -> {
            result.addAll(checkpoints);
            return checkpoints;
        });
        return List.copyOf(result);
    }

    @Override
    public List<String> listRunIds() {
        return checkpointsByRun.keySet().stream().sorted().toList();
    }

    @Override
    public int release(String runId) {
        List<Checkpoint> removed = checkpointsByRun.remove(runId);
        int count = removed != null ? removed.size() : 0;
        log.debug("Released {} checkpoints for run '{}'", count, runId);
        return count;
    }
}
