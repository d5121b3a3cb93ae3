package com.rewind.core.persistence;

import com.rewind.core.exception.StorageIoException;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointMetadata;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.FileRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link JdbcCheckpointStore} against mocked JDBC objects.
 */
class JdbcCheckpointStoreTest {

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        store = new JdbcCheckpointStore(dataSource);
    }

    private static CheckpointRecord record() {
        var checkpoint = new Checkpoint("cp-1", "s1", "proj", null, Instant.parse("2026-03-01T10:00:00Z"),
                "first", 3, CheckpointMetadata.empty());
        return new CheckpointRecord(checkpoint, 1, List.of(new FileRef("a.txt", "aa", 2)));
    }

    @Test
    @DisplayName("createTables issues the three DDL statements")
    void createTables() throws SQLException {
        store.createTables();
        verify(connection, times(3)).prepareStatement(startsWith("CREATE TABLE IF NOT EXISTS"));
        verify(statement, times(3)).execute();
    }

    @Test
    @DisplayName("commit writes blobs and record in one transaction")
    void commitIsTransactional() throws SQLException {
        store.commit(record(), "t\n", Map.of("aa", new byte[]{1, 2}));

        verify(connection).setAutoCommit(false);
        verify(statement, times(2)).executeUpdate();
        verify(statement).setBytes(3, new byte[]{1, 2});
        verify(connection).commit();
        verify(connection, never()).rollback();
    }

    @Test
    @DisplayName("commit rolls back and raises StorageIoException when an insert fails")
    void commitRollsBack() throws SQLException {
        when(statement.executeUpdate()).thenReturn(1).thenThrow(new SQLException("duplicate key"));

        var ex = assertThrows(StorageIoException.class,
                () -> store.commit(record(), "t\n", Map.of("aa", new byte[]{1})));

        assertTrue(ex.getMessage().contains("cp-1"));
        verify(connection).rollback();
        verify(connection, never()).commit();
    }

    @Test
    @DisplayName("readCheckpoint parses the stored JSON record")
    void readCheckpoint() throws Exception {
        String json = StoreJson.mapper().writeValueAsString(record());
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString(1)).thenReturn(json);

        var loaded = store.readCheckpoint("proj", "s1", "cp-1");

        assertEquals(record(), loaded.orElseThrow());
        verify(statement).setString(1, "proj");
        verify(statement).setString(2, "s1");
        verify(statement).setString(3, "cp-1");
    }

    @Test
    @DisplayName("readBlob returns empty when no row matches")
    void readBlobMissing() throws SQLException {
        when(resultSet.next()).thenReturn(false);
        assertTrue(store.readBlob("proj", "ff").isEmpty());
    }

    @Test
    @DisplayName("lastSequence reads the aggregate")
    void lastSequence() throws SQLException {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(7L);
        assertEquals(7L, store.lastSequence("proj", "s1"));
    }

    @Test
    @DisplayName("saveTimeline upserts the serialized timeline")
    void saveTimeline() throws SQLException {
        store.saveTimeline(new TimelineRecord("s1", "proj", null, true, CheckpointStrategy.PER_PROMPT));

        verify(connection).prepareStatement(contains("ON CONFLICT (project_id, session_id)"));
        verify(statement).setString(eq(3), contains("\"per_prompt\""));
        verify(statement).executeUpdate();
    }

    @Test
    @DisplayName("connection failures surface as StorageIoException")
    void connectionFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("refused"));
        assertThrows(StorageIoException.class, () -> store.listBlobs("proj"));
    }
}
