package com.newsflow.core.persistence;

import com.newsflow.core.model.RunStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a run, written after every superstep and before every suspension.
 *
 * @param id            unique checkpoint id
 * @param runId         run the snapshot belongs to
 * @param sequence      write order within the run, strictly increasing
 * @param superstep     number of supersteps committed so far
 * @param status        run status at the time of the snapshot
 * @param state         state contents
 * @param frontier      tasks to execute next; for an AWAITING checkpoint, the tasks of
 *                      the suspended superstep
 * @param interrupt     outstanding suspension (null unless AWAITING)
 * @param pendingWrites results of tasks that already finished in the suspended superstep
 * @param error         failure description (null unless FAILED)
 * @param createdAt     wall-clock time of the snapshot
 */
public record Checkpoint(
    String id,
    String runId,
    long sequence,
    int superstep,
    RunStatus status,
    Map<String, Object> state,
    List<PendingTask> frontier,
    PendingInterrupt interrupt,
    List<TaskWrite> pendingWrites,
    String error,
    Instant createdAt
) implements Serializable {

    public Checkpoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
        frontier = frontier == null ? List.of() : List.copyOf(frontier);
        pendingWrites = pendingWrites == null ? List.of() : List.copyOf(pendingWrites);
    }

    public boolean awaitingResume() {
        return status == RunStatus.AWAITING && interrupt != null;
    }
}
