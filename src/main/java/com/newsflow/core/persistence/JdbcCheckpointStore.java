package com.newsflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link CheckpointStore} that persists checkpoints to a relational table.
 * <p>
 * Each checkpoint is one JSON-serialized row keyed by {@code (run_id, sequence)}.
 * Rows are only ever inserted, never updated, so a checkpoint cannot change after
 * it is written and a duplicate sequence is rejected by the primary key. The SQL
 * sticks to what PostgreSQL and SQLite both accept.
 * <p>
 * The table {@code newsflow_checkpoints} is created via {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final String TABLE_NAME = "newsflow_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                run_id        VARCHAR(255) NOT NULL,
                sequence      BIGINT       NOT NULL,
                checkpoint_id VARCHAR(64)  NOT NULL,
                superstep     INTEGER      NOT NULL,
                status        VARCHAR(32)  NOT NULL,
                payload       TEXT         NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (run_id, sequence)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (run_id, sequence, checkpoint_id, superstep, status, payload)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SEQUENCE_SQL = """
            SELECT MAX(sequence) AS latest FROM %s WHERE run_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_RUN_SQL = """
            SELECT payload FROM %s WHERE run_id = ? ORDER BY sequence ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT payload FROM %s WHERE run_id = ? ORDER BY sequence DESC LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_RUNS_SQL = """
            SELECT DISTINCT run_id FROM %s ORDER BY run_id
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_RUN_SQL = """
            DELETE FROM %s WHERE run_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to create checkpoint table " + TABLE_NAME, e);
        }
    }

    @Override
    public void save(Checkpoint checkpoint) {
        String payload = serialize(checkpoint);

        try (Connection conn = dataSource.getConnection()) {
            long latest = latestSequence(conn, checkpoint.runId());
            if (latest >= 0 && checkpoint.sequence() <= latest) {
                throw new CheckpointStoreException("Checkpoint sequence " + checkpoint.sequence()
                        + " for run '" + checkpoint.runId() + "' does not advance past " + latest);
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, checkpoint.runId());
                stmt.setLong(2, checkpoint.sequence());
                stmt.setString(3, checkpoint.id());
                stmt.setInt(4, checkpoint.superstep());
                stmt.setString(5, checkpoint.status().name());
                stmt.setString(6, payload);
                stmt.executeUpdate();
            }
            log.debug("Saved checkpoint '{}' (seq {}) for run '{}'",
                    checkpoint.id(), checkpoint.sequence(), checkpoint.runId());
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to save checkpoint " + checkpoint.sequence()
                    + " for run '" + checkpoint.runId() + "'", e);
        }
    }

    @Override
    public Optional<Checkpoint> loadLatest(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("payload")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to load latest checkpoint for run '" + runId + "'", e);
        }
    }

    @Override
    public List<Checkpoint> list(String runId) {
        List<Checkpoint> checkpoints = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_RUN_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(deserialize(rs.getString("payload")));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to list checkpoints for run '" + runId + "'", e);
        }

        return checkpoints;
    }

    /**
     * Returns all distinct run IDs stored in the checkpoint table.
     */
    @Override
    public List<String> listRunIds() {
        List<String> runIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_RUNS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                runIds.add(rs.getString("run_id"));
            }
        } catch (SQLException e) {
            log.error("Failed to list all run IDs", e);
            throw new CheckpointStoreException("Failed to list run IDs", e);
        }
        return runIds;
    }

    @Override
    public int release(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_RUN_SQL)) {
            stmt.setString(1, runId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for run '{}'", deleted, runId);
            return deleted;
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to release checkpoints for run '" + runId + "'", e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private long latestSequence(Connection conn, String runId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SEQUENCE_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    long latest = rs.getLong("latest");
                    return rs.wasNull() ? -1 : latest;
                }
                return -1;
            }
        }
    }

    private String serialize(Checkpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("Failed to serialize checkpoint for run '"
                    + checkpoint.runId() + "'", e);
        }
    }

    private Checkpoint deserialize(String json) {
        try {
            return objectMapper.readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("Failed to deserialize checkpoint", e);
        }
    }
}
