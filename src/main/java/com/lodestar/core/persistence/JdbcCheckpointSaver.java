package com.lodestar.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.core.state.StateJson;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * JDBC-based {@link BaseCheckpointSaver} that persists run state after every graph
 * transition, so a run can be resumed or inspected across JVM restarts.
 * <p>
 * Each checkpoint is a JSON row keyed by {@code (thread_id, checkpoint_id)}; the
 * identity column {@code seq} gives the write order. Listing returns the newest
 * checkpoint first, as {@link org.bsc.langgraph4j.checkpoint.MemorySaver} does. The SQL
 * is kept to what both PostgreSQL and H2 accept.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    private static final String TABLE_NAME = "lodestar_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY,
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         TEXT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET node_id = ?, next_node_id = ?, state = ?, created_at = CURRENT_TIMESTAMP
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq DESC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq DESC
            FETCH FIRST 1 ROWS ONLY
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_THREAD_SQL = """
            DELETE FROM %s WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_THREADS_SQL = """
            SELECT thread_id, MIN(seq) AS first_seq FROM %s GROUP BY thread_id ORDER BY first_seq
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = StateJson.mapper();
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        List<Checkpoint> checkpoints = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list checkpoints for run '" + threadId + "'", e);
        }
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        Optional<String> checkpointId = config.checkPointId();
        String sql = checkpointId.isPresent() ? SELECT_BY_ID_SQL : SELECT_LATEST_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (checkpointId.isPresent()) {
                stmt.setString(2, checkpointId.get());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read checkpoint " + checkpointId.orElse("latest")
                    + " for run '" + threadId + "'", e);
        }
        return Optional.empty();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        String state = serializeState(checkpoint.getState());

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {
                update.setString(1, checkpoint.getNodeId());
                update.setString(2, checkpoint.getNextNodeId());
                update.setString(3, state);
                update.setString(4, threadId);
                update.setString(5, checkpoint.getId());
                updated = update.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                    insert.setString(1, threadId);
                    insert.setString(2, checkpoint.getId());
                    insert.setString(3, checkpoint.getNodeId());
                    insert.setString(4, checkpoint.getNextNodeId());
                    insert.setString(5, state);
                    insert.executeUpdate();
                }
            }
            log.debug("Saved checkpoint '{}' for run '{}' after node '{}'", checkpoint.getId(), threadId,
                    checkpoint.getNodeId());
        }

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for run '{}'", deleted, threadId);
        }
        return new Tag(threadId, released);
    }

    /**
     * Returns every run ID in the checkpoint table, oldest run first.
     */
    public List<String> listAllThreadIds() {
        List<String> threadIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_THREADS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                threadIds.add(rs.getString("thread_id"));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list runs", e);
        }
        return threadIds;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint state", e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        var builder = Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(deserializeState(rs.getString("state")));

        String nodeId = rs.getString("node_id");
        String nextNodeId = rs.getString("next_node_id");
        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }
        return builder.build();
    }
}
