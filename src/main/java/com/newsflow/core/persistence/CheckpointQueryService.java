package com.newsflow.core.persistence;

import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over the checkpoint store for the CLI and the REST surface.
 */
@Service
public class CheckpointQueryService {

    private final CheckpointStore store;

    public CheckpointQueryService(CheckpointStore store) {
        this.store = store;
    }

    public List<String> listRunIds() {
        return store.listRunIds();
    }

    /**
     * Lists all checkpoints for a run, ordered chronologically.
     */
    public List<Checkpoint> listCheckpoints(String runId) {
        return store.list(runId);
    }

    public Optional<Checkpoint> getLatestCheckpoint(String runId) {
        return store.loadLatest(runId);
    }

    /**
     * Gets a {@link PipelineState} from the latest checkpoint of a run.
     */
    public Optional<PipelineState> getLatestState(String runId) {
        return getLatestCheckpoint(runId).map(cp -> new PipelineState(cp.state()));
    }
}
