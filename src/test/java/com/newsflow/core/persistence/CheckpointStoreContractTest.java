package com.newsflow.core.persistence;

import com.newsflow.core.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every {@link CheckpointStore} backend must share.
 */
abstract class CheckpointStoreContractTest {

    protected CheckpointStore store;

    protected abstract CheckpointStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    static Checkpoint checkpoint(String runId, long sequence, RunStatus status, Map<String, Object> state) {
        return new Checkpoint(UUID.randomUUID().toString(), runId, sequence, (int) sequence, status,
                state, List.of(PendingTask.plain("next")), null, List.of(), null, Instant.now());
    }

    @Test
    @DisplayName("loadLatest returns the checkpoint with the highest sequence")
    void loadLatest() {
        store.save(checkpoint("run-1", 0, RunStatus.RUNNING, Map.of("step", "zero")));
        store.save(checkpoint("run-1", 1, RunStatus.RUNNING, Map.of("step", "one")));
        store.save(checkpoint("run-1", 2, RunStatus.COMPLETED, Map.of("step", "two")));

        Checkpoint latest = store.loadLatest("run-1").orElseThrow();
        assertEquals(2, latest.sequence());
        assertEquals(RunStatus.COMPLETED, latest.status());
        assertEquals("two", latest.state().get("step"));
    }

    @Test
    @DisplayName("loadLatest is empty for an unknown run")
    void unknownRun() {
        assertTrue(store.loadLatest("nope").isEmpty());
        assertTrue(store.list("nope").isEmpty());
    }

    @Test
    @DisplayName("list returns checkpoints in write order")
    void listInOrder() {
        store.save(checkpoint("run-2", 0, RunStatus.RUNNING, Map.of()));
        store.save(checkpoint("run-2", 1, RunStatus.RUNNING, Map.of()));

        List<Checkpoint> checkpoints = store.list("run-2");
        assertEquals(List.of(0L, 1L), checkpoints.stream().map(Checkpoint::sequence).toList());
    }

    @Test
    @DisplayName("a sequence that does not advance is rejected and nothing is written")
    void nonAdvancingSequence() {
        store.save(checkpoint("run-3", 0, RunStatus.RUNNING, Map.of()));
        store.save(checkpoint("run-3", 1, RunStatus.RUNNING, Map.of("v", "kept")));

        assertThrows(CheckpointStoreException.class,
                () -> store.save(checkpoint("run-3", 1, RunStatus.FAILED, Map.of("v", "lost"))));

        assertEquals(2, store.list("run-3").size());
        assertEquals("kept", store.loadLatest("run-3").orElseThrow().state().get("v"));
    }

    @Test
    @DisplayName("runs are isolated from each other")
    void runsIsolated() {
        store.save(checkpoint("run-a", 0, RunStatus.RUNNING, Map.of()));
        store.save(checkpoint("run-b", 0, RunStatus.RUNNING, Map.of()));
        store.save(checkpoint("run-b", 1, RunStatus.COMPLETED, Map.of()));

        assertEquals(1, store.list("run-a").size());
        assertEquals(List.of("run-a", "run-b"), store.listRunIds());
    }

    @Test
    @DisplayName("release deletes every checkpoint of a run")
    void release() {
        store.save(checkpoint("run-r", 0, RunStatus.RUNNING, Map.of()));
        store.save(checkpoint("run-r", 1, RunStatus.COMPLETED, Map.of()));

        assertEquals(2, store.release("run-r"));
        assertTrue(store.loadLatest("run-r").isEmpty());
        assertEquals(0, store.release("run-r"));
    }

    @Test
    @DisplayName("suspension details survive a save and load")
    void awaitingCheckpointPreserved() {
        var interrupt = new PendingInterrupt(1, "human_approval", Map.of("message", "review"));
        var writes = List.of(new TaskWrite(0, "scrape", Map.of("rawArticles", List.of("a"))));
        var frontier = List.of(PendingTask.fanOut("scrape", Map.of("sourceName", "arxiv")),
                PendingTask.plain("human_approval"));
        store.save(new Checkpoint("cp-1", "run-w", 0, 4, RunStatus.AWAITING, Map.of("revisionCount", 1),
                frontier, interrupt, writes, null, Instant.parse("2025-01-06T09:00:00Z")));

        Checkpoint loaded = store.loadLatest("run-w").orElseThrow();
        assertTrue(loaded.awaitingResume());
        assertEquals("human_approval", loaded.interrupt().node());
        assertEquals(1, loaded.interrupt().taskIndex());
        assertEquals("review", loaded.interrupt().payload().get("message"));
        assertEquals(frontier, loaded.frontier());
        assertEquals("scrape", loaded.pendingWrites().get(0).node());
        assertEquals(List.of("a"), loaded.pendingWrites().get(0).update().get("rawArticles"));
        assertEquals(4, loaded.superstep());
        assertEquals(Instant.parse("2025-01-06T09:00:00Z"), loaded.createdAt());
    }
}
