package com.newsflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * When a {@link DataSource} is available (i.e. PostgreSQL is configured), a
 * {@link JdbcCheckpointStore} is created that persists checkpoints to the
 * database. Otherwise an in-memory {@link MemoryCheckpointStore} is used as a
 * fallback, suitable for development and testing but not durable across restarts.
 */
@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource) {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory checkpoint store (state will not persist across restarts)");
            return new MemoryCheckpointStore();
        }
        log.info("Configuring JDBC checkpoint store");
        var store = new JdbcCheckpointStore(ds);
        store.createTables();
        return store;
    }
}
