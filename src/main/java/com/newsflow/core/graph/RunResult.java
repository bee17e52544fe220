package com.newsflow.core.graph;

import com.newsflow.core.model.RunStatus;
import com.newsflow.core.persistence.Checkpoint;
import com.newsflow.core.persistence.PendingInterrupt;
import com.newsflow.core.state.GraphState;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of driving a run until it completes, suspends, or fails.
 *
 * @param runId     the run
 * @param status    COMPLETED, AWAITING, FAILED, or RUNNING when read mid-flight
 * @param state     state as of the latest checkpoint
 * @param interrupt the outstanding suspension, null unless AWAITING
 * @param superstep supersteps committed so far
 * @param error     failure description, null unless FAILED
 */
public record RunResult<S extends GraphState>(
    String runId,
    RunStatus status,
    S state,
    PendingInterrupt interrupt,
    int superstep,
    String error
) {

    static <S extends GraphState> RunResult<S> from(Checkpoint checkpoint, Function<Map<String, Object>, S> stateFactory) {
        return new RunResult<>(checkpoint.runId(), checkpoint.status(),
                stateFactory.apply(checkpoint.state()), checkpoint.interrupt(),
                checkpoint.superstep(), checkpoint.error());
    }

    public boolean isInterrupted() {
        return status == RunStatus.AWAITING;
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public Optional<Map<String, Object>> interruptPayload() {
        return Optional.ofNullable(interrupt).map(PendingInterrupt::payload);
    }
}
