package com.rewind.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rewind.core.exception.StorageIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link CheckpointStore} backed by PostgreSQL.
 * <p>
 * Blobs live in {@code rewind_blobs} keyed by {@code (project_id, hash)}. Checkpoint records are
 * stored as JSON in {@code rewind_checkpoints} together with their transcript, and the per-session
 * timeline in {@code rewind_timelines}. {@link #commit} runs in a single transaction.
 * <p>
 * The tables are created by {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final String CREATE_BLOBS_SQL = """
            CREATE TABLE IF NOT EXISTS rewind_blobs (
                project_id VARCHAR(255) NOT NULL,
                hash       VARCHAR(64)  NOT NULL,
                content    BYTEA        NOT NULL,
                size       BIGINT       NOT NULL,
                PRIMARY KEY (project_id, hash)
            )
            """;

    private static final String CREATE_CHECKPOINTS_SQL = """
            CREATE TABLE IF NOT EXISTS rewind_checkpoints (
                project_id    VARCHAR(255) NOT NULL,
                session_id    VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                sequence      BIGINT       NOT NULL,
                created_at    TIMESTAMP    NOT NULL,
                record        TEXT         NOT NULL,
                transcript    TEXT         NOT NULL,
                PRIMARY KEY (project_id, checkpoint_id)
            )
            """;

    private static final String CREATE_TIMELINES_SQL = """
            CREATE TABLE IF NOT EXISTS rewind_timelines (
                project_id VARCHAR(255) NOT NULL,
                session_id VARCHAR(255) NOT NULL,
                timeline   TEXT         NOT NULL,
                PRIMARY KEY (project_id, session_id)
            )
            """;

    private static final String HAS_BLOB_SQL =
            "SELECT 1 FROM rewind_blobs WHERE project_id = ? AND hash = ?";

    private static final String READ_BLOB_SQL =
            "SELECT content FROM rewind_blobs WHERE project_id = ? AND hash = ?";

    private static final String INSERT_BLOB_SQL = """
            INSERT INTO rewind_blobs (project_id, hash, content, size)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (project_id, hash) DO NOTHING
            """;

    private static final String LIST_BLOBS_SQL =
            "SELECT hash FROM rewind_blobs WHERE project_id = ?";

    private static final String DELETE_BLOB_SQL =
            "DELETE FROM rewind_blobs WHERE project_id = ? AND hash = ?";

    private static final String INSERT_CHECKPOINT_SQL = """
            INSERT INTO rewind_checkpoints
                (project_id, session_id, checkpoint_id, sequence, created_at, record, transcript)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String READ_CHECKPOINT_SQL = """
            SELECT record FROM rewind_checkpoints
            WHERE project_id = ? AND session_id = ? AND checkpoint_id = ?
            """;

    private static final String FIND_CHECKPOINT_SQL = """
            SELECT record FROM rewind_checkpoints
            WHERE project_id = ? AND checkpoint_id = ?
            """;

    private static final String LIST_CHECKPOINTS_SQL = """
            SELECT record FROM rewind_checkpoints
            WHERE project_id = ? AND session_id = ?
            ORDER BY sequence ASC
            """;

    private static final String LIST_PROJECT_CHECKPOINTS_SQL = """
            SELECT record FROM rewind_checkpoints
            WHERE project_id = ?
            ORDER BY session_id ASC, sequence ASC
            """;

    private static final String READ_TRANSCRIPT_SQL = """
            SELECT transcript FROM rewind_checkpoints
            WHERE project_id = ? AND session_id = ? AND checkpoint_id = ?
            """;

    private static final String LAST_SEQUENCE_SQL = """
            SELECT COALESCE(MAX(sequence), 0) FROM rewind_checkpoints
            WHERE project_id = ? AND session_id = ?
            """;

    private static final String DELETE_CHECKPOINT_SQL = """
            DELETE FROM rewind_checkpoints
            WHERE project_id = ? AND session_id = ? AND checkpoint_id = ?
            """;

    private static final String UPSERT_TIMELINE_SQL = """
            INSERT INTO rewind_timelines (project_id, session_id, timeline)
            VALUES (?, ?, ?)
            ON CONFLICT (project_id, session_id)
            DO UPDATE SET timeline = EXCLUDED.timeline
            """;

    private static final String READ_TIMELINE_SQL =
            "SELECT timeline FROM rewind_timelines WHERE project_id = ? AND session_id = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper = StoreJson.mapper();

    public JdbcCheckpointStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the blob, checkpoint and timeline tables if they do not already exist.
     * Called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : List.of(CREATE_BLOBS_SQL, CREATE_CHECKPOINTS_SQL, CREATE_TIMELINES_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
            log.info("Checkpoint tables ensured");
        } catch (SQLException e) {
            throw new StorageIoException("Failed to create checkpoint tables", e);
        }
    }

    @Override
    public boolean hasBlob(String projectId, String hash) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(HAS_BLOB_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, hash);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageIoException("Failed to look up blob " + hash, e);
        }
    }

    @Override
    public Optional<byte[]> readBlob(String projectId, String hash) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(READ_BLOB_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, hash);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getBytes(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageIoException("Failed to read blob " + hash, e);
        }
    }

    @Override
    public void writeBlob(String projectId, String hash, byte[] content) {
        try (Connection conn = dataSource.getConnection()) {
            insertBlob(conn, projectId, hash, content);
        } catch (SQLException e) {
            throw new StorageIoException("Failed to write blob " + hash, e);
        }
    }

    @Override
    public Collection<String> listBlobs(String projectId) {
        return queryStrings(LIST_BLOBS_SQL, "Failed to list blobs of project " + projectId, projectId);
    }

    @Override
    public void deleteBlob(String projectId, String hash) {
        update(DELETE_BLOB_SQL, "Failed to delete blob " + hash, projectId, hash);
    }

    @Override
    public void commit(CheckpointRecord record, String transcript, Map<String, byte[]> newBlobs) {
        var checkpoint = record.checkpoint();
        String json = toJson(record);
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (Map.Entry<String, byte[]> blob : newBlobs.entrySet()) {
                    insertBlob(conn, checkpoint.projectId(), blob.getKey(), blob.getValue());
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_CHECKPOINT_SQL)) {
                    stmt.setString(1, checkpoint.projectId());
                    stmt.setString(2, checkpoint.sessionId());
                    stmt.setString(3, checkpoint.id());
                    stmt.setLong(4, record.sequence());
                    stmt.setTimestamp(5, Timestamp.from(checkpoint.createdAt()));
                    stmt.setString(6, json);
                    stmt.setString(7, transcript);
                    stmt.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            log.debug("Committed checkpoint {} ({} new blobs)", checkpoint.id(), newBlobs.size());
        } catch (SQLException e) {
            throw new StorageIoException("Failed to commit checkpoint " + checkpoint.id(), e);
        }
    }

    @Override
    public Optional<CheckpointRecord> readCheckpoint(String projectId, String sessionId, String checkpointId) {
        return queryStrings(READ_CHECKPOINT_SQL, "Failed to read checkpoint " + checkpointId,
                projectId, sessionId, checkpointId).stream().findFirst().map(this::fromJson);
    }

    @Override
    public Optional<CheckpointRecord> findCheckpoint(String projectId, String checkpointId) {
        return queryStrings(FIND_CHECKPOINT_SQL, "Failed to find checkpoint " + checkpointId,
                projectId, checkpointId).stream().findFirst().map(this::fromJson);
    }

    @Override
    public List<CheckpointRecord> listCheckpoints(String projectId, String sessionId) {
        return queryStrings(LIST_CHECKPOINTS_SQL, "Failed to list checkpoints of session " + sessionId,
                projectId, sessionId).stream().map(this::fromJson).toList();
    }

    @Override
    public List<CheckpointRecord> listProjectCheckpoints(String projectId) {
        return queryStrings(LIST_PROJECT_CHECKPOINTS_SQL, "Failed to list checkpoints of project " + projectId,
                projectId).stream().map(this::fromJson).toList();
    }

    @Override
    public Optional<String> readTranscript(String projectId, String sessionId, String checkpointId) {
        return queryStrings(READ_TRANSCRIPT_SQL, "Failed to read transcript of checkpoint " + checkpointId,
                projectId, sessionId, checkpointId).stream().findFirst();
    }

    @Override
    public long lastSequence(String projectId, String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LAST_SEQUENCE_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageIoException("Failed to read sequence of session " + sessionId, e);
        }
    }

    @Override
    public void deleteCheckpoint(String projectId, String sessionId, String checkpointId) {
        update(DELETE_CHECKPOINT_SQL, "Failed to delete checkpoint " + checkpointId,
                projectId, sessionId, checkpointId);
    }

    @Override
    public void saveTimeline(TimelineRecord timeline) {
        String json;
        try {
            json = objectMapper.writeValueAsString(timeline);
        } catch (JsonProcessingException e) {
            throw new StorageIoException("Failed to serialize timeline of session " + timeline.sessionId(), e);
        }
        update(UPSERT_TIMELINE_SQL, "Failed to save timeline of session " + timeline.sessionId(),
                timeline.projectId(), timeline.sessionId(), json);
    }

    @Override
    public Optional<TimelineRecord> readTimeline(String projectId, String sessionId) {
        return queryStrings(READ_TIMELINE_SQL, "Failed to read timeline of session " + sessionId,
                projectId, sessionId).stream().findFirst().map(json -> {
                    try {
                        return objectMapper.readValue(json, TimelineRecord.class);
                    } catch (JsonProcessingException e) {
                        throw new StorageIoException("Corrupt timeline of session " + sessionId, e);
                    }
                });
    }

    // --- Helpers ---

    private void insertBlob(Connection conn, String projectId, String hash, byte[] content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_BLOB_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, hash);
            stmt.setBytes(3, content);
            stmt.setLong(4, content.length);
            stmt.executeUpdate();
        }
    }

    private List<String> queryStrings(String sql, String failure, String... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            var values = new ArrayList<String>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
            return values;
        } catch (SQLException e) {
            throw new StorageIoException(failure, e);
        }
    }

    private void update(String sql, String failure, String... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageIoException(failure, e);
        }
    }

    private String toJson(CheckpointRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageIoException("Failed to serialize checkpoint " + record.checkpoint().id(), e);
        }
    }

    private CheckpointRecord fromJson(String json) {
        try {
            return objectMapper.readValue(json, CheckpointRecord.class);
        } catch (JsonProcessingException e) {
            throw new StorageIoException("Corrupt checkpoint record", e);
        }
    }
}
