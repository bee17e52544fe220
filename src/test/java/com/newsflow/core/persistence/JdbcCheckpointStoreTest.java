package com.newsflow.core.persistence;

import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.state.PipelineState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against a file-backed SQLite database.
 */
class JdbcCheckpointStoreTest extends CheckpointStoreContractTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;

    @Override
    protected CheckpointStore createStore() {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("checkpoints.db"));
        var jdbcStore = new JdbcCheckpointStore(dataSource);
        jdbcStore.createTables();
        return jdbcStore;
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() {
        var again = new JdbcCheckpointStore(dataSource);
        assertDoesNotThrow(again::createTables);
    }

    @Test
    @DisplayName("checkpoints survive a restart with a new store instance")
    void durableAcrossRestart() {
        var article = new NewsArticle("Model X released", "https://arxiv.org/abs/1", "feed:arxiv",
                "Details.", "2025-01-06T09:00:00Z", 0.77);
        store.save(checkpoint("run-d", 0, RunStatus.RUNNING, Map.of("rawArticles", List.of(article))));
        store.save(checkpoint("run-d", 1, RunStatus.RUNNING, Map.of(
                "deduplicatedArticles", List.of(article), "revisionCount", 2)));

        var restarted = new JdbcCheckpointStore(dataSource);
        restarted.createTables();

        Checkpoint latest = restarted.loadLatest("run-d").orElseThrow();
        assertEquals(1, latest.sequence());

        var state = new PipelineState(latest.state());
        assertEquals(List.of(article), state.deduplicatedArticles());
        assertEquals(2, state.revisionCount());
        assertEquals(List.of("run-d"), restarted.listRunIds());
    }

    @Test
    @DisplayName("sequence check also applies across store instances")
    void sequenceCheckedAfterRestart() {
        store.save(checkpoint("run-x", 0, RunStatus.RUNNING, Map.of()));

        var restarted = new JdbcCheckpointStore(dataSource);

        assertThrows(CheckpointStoreException.class,
                () -> restarted.save(checkpoint("run-x", 0, RunStatus.RUNNING, Map.of())));
    }

    @Test
    @DisplayName("database errors surface as CheckpointStoreException")
    void databaseErrorWrapped() {
        var broken = new SQLiteDataSource();
        broken.setUrl("jdbc:sqlite:" + tempDir.resolve("missing-dir").resolve("nested").resolve("x.db"));
        var brokenStore = new JdbcCheckpointStore(broken);

        assertThrows(CheckpointStoreException.class, brokenStore::createTables);
    }
}
