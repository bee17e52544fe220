package com.newsflow.core.persistence;

import com.newsflow.core.model.RunStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CheckpointStoreConfigTest {

    private final CheckpointStoreConfig config = new CheckpointStoreConfig();

    @Test
    @SuppressWarnings("unchecked")
    void fallsBackToMemoryWithoutDataSource() {
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);

        assertInstanceOf(MemoryCheckpointStore.class, config.checkpointStore(provider));
    }

    @Test
    @SuppressWarnings("unchecked")
    void usesJdbcStoreWithDataSource(@TempDir Path dir) {
        var dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dir.resolve("config.db"));
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(dataSource);

        CheckpointStore store = config.checkpointStore(provider);

        assertInstanceOf(JdbcCheckpointStore.class, store);
        store.save(CheckpointStoreContractTest.checkpoint("NEWS-1", 0, RunStatus.RUNNING, Map.of("runId", "NEWS-1")));
        assertEquals(1, store.list("NEWS-1").size());
    }
}
