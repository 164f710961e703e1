package com.wavegate.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link SessionStore}.
 * <p>
 * Each durable key is one row holding a JSON document: session metadata in
 * {@code wg_sessions}, the shared context in {@code wg_contexts}, checkpoints in
 * {@code wg_checkpoints} keyed by {@code (session_id, checkpoint_no)} and terminal artifacts in
 * {@code wg_artifacts}. Upserts run as update-then-insert inside one transaction, which works
 * on PostgreSQL and H2 alike.
 * <p>
 * Tables are created by {@link #createTables()}.
 */
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    private static final String[] CREATE_TABLES_SQL = {
            """
            CREATE TABLE IF NOT EXISTS wg_sessions (
                session_id VARCHAR(128) NOT NULL PRIMARY KEY,
                status     VARCHAR(32)  NOT NULL,
                created_at TIMESTAMP    NOT NULL,
                body       TEXT         NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS wg_contexts (
                session_id VARCHAR(128) NOT NULL PRIMARY KEY,
                version    BIGINT       NOT NULL,
                body       TEXT         NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS wg_checkpoints (
                session_id    VARCHAR(128) NOT NULL,
                checkpoint_no INTEGER      NOT NULL,
                status        VARCHAR(32)  NOT NULL,
                body          TEXT         NOT NULL,
                PRIMARY KEY (session_id, checkpoint_no)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS wg_artifacts (
                session_id VARCHAR(128) NOT NULL PRIMARY KEY,
                body       TEXT         NOT NULL
            )
            """
    };

    private static final String INSERT_SESSION_SQL =
            "INSERT INTO wg_sessions (status, created_at, body, session_id) VALUES (?, ?, ?, ?)";
    private static final String UPDATE_SESSION_SQL =
            "UPDATE wg_sessions SET status = ?, created_at = ?, body = ? WHERE session_id = ?";
    private static final String SELECT_SESSION_SQL =
            "SELECT body FROM wg_sessions WHERE session_id = ?";
    private static final String SELECT_SESSION_IDS_SQL =
            "SELECT session_id FROM wg_sessions ORDER BY created_at ASC, session_id ASC";

    private static final String INSERT_CONTEXT_SQL =
            "INSERT INTO wg_contexts (version, body, session_id) VALUES (?, ?, ?)";
    private static final String UPDATE_CONTEXT_SQL =
            "UPDATE wg_contexts SET version = ?, body = ? WHERE session_id = ?";
    private static final String SELECT_CONTEXT_SQL =
            "SELECT body FROM wg_contexts WHERE session_id = ?";

    private static final String INSERT_CHECKPOINT_SQL =
            "INSERT INTO wg_checkpoints (status, body, session_id, checkpoint_no) VALUES (?, ?, ?, ?)";
    private static final String UPDATE_CHECKPOINT_SQL =
            "UPDATE wg_checkpoints SET status = ?, body = ? WHERE session_id = ? AND checkpoint_no = ?";
    private static final String SELECT_CHECKPOINT_SQL =
            "SELECT body FROM wg_checkpoints WHERE session_id = ? AND checkpoint_no = ?";
    private static final String SELECT_CHECKPOINTS_SQL =
            "SELECT body FROM wg_checkpoints WHERE session_id = ? ORDER BY checkpoint_no ASC";

    private static final String INSERT_ARTIFACT_SQL =
            "INSERT INTO wg_artifacts (body, session_id) VALUES (?, ?)";
    private static final String UPDATE_ARTIFACT_SQL =
            "UPDATE wg_artifacts SET body = ? WHERE session_id = ?";
    private static final String SELECT_ARTIFACT_SQL =
            "SELECT body FROM wg_artifacts WHERE session_id = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcSessionStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the store tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Session store tables ensured");
        } catch (SQLException e) {
            throw new StoreException("Cannot create session store tables", e);
        }
    }

    @Override
    public void createSession(Session session) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SESSION_SQL)) {
                    bindSession(stmt, session);
                    stmt.executeUpdate();
                }
                SharedContext empty = SharedContext.empty();
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_CONTEXT_SQL)) {
                    stmt.setLong(1, empty.getVersion());
                    stmt.setString(2, toJson(empty));
                    stmt.setString(3, session.id());
                    stmt.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                if (loadSession(session.id()).isPresent()) {
                    throw new IllegalStateException("Session already exists: " + session.id(), e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot create session " + session.id(), e);
        }
    }

    @Override
    public Optional<Session> loadSession(String sessionId) {
        return queryOne(SELECT_SESSION_SQL, Session.class, sessionId);
    }

    @Override
    public void saveSession(Session session) {
        upsert(UPDATE_SESSION_SQL, INSERT_SESSION_SQL, stmt -> bindSession(stmt, session),
                "session " + session.id());
    }

    @Override
    public SharedContext loadContext(String sessionId) {
        return queryOne(SELECT_CONTEXT_SQL, SharedContext.class, sessionId)
                .orElseGet(SharedContext::empty);
    }

    @Override
    public void saveContext(String sessionId, SharedContext context) {
        String json = toJson(context);
        upsert(UPDATE_CONTEXT_SQL, INSERT_CONTEXT_SQL, stmt -> {
            stmt.setLong(1, context.getVersion());
            stmt.setString(2, json);
            stmt.setString(3, sessionId);
        }, "context of " + sessionId);
    }

    @Override
    public void saveCheckpoint(String sessionId, Checkpoint checkpoint) {
        String json = toJson(checkpoint);
        upsert(UPDATE_CHECKPOINT_SQL, INSERT_CHECKPOINT_SQL, stmt -> {
            stmt.setString(1, checkpoint.status().wireName());
            stmt.setString(2, json);
            stmt.setString(3, sessionId);
            stmt.setInt(4, checkpoint.number());
        }, "checkpoint " + checkpoint.number() + " of " + sessionId);
    }

    @Override
    public Optional<Checkpoint> loadCheckpoint(String sessionId, int number) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHECKPOINT_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setInt(2, number);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromJson(rs.getString("body"), Checkpoint.class)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot load checkpoint " + number + " of " + sessionId, e);
        }
    }

    @Override
    public List<Checkpoint> listCheckpoints(String sessionId) {
        var checkpoints = new ArrayList<Checkpoint>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHECKPOINTS_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromJson(rs.getString("body"), Checkpoint.class));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list checkpoints of " + sessionId, e);
        }
        return checkpoints;
    }

    @Override
    public void saveTerminalArtifact(TerminalArtifact artifact) {
        String json = toJson(artifact);
        upsert(UPDATE_ARTIFACT_SQL, INSERT_ARTIFACT_SQL, stmt -> {
            stmt.setString(1, json);
            stmt.setString(2, artifact.sessionId());
        }, "result of " + artifact.sessionId());
    }

    @Override
    public Optional<TerminalArtifact> loadTerminalArtifact(String sessionId) {
        return queryOne(SELECT_ARTIFACT_SQL, TerminalArtifact.class, sessionId);
    }

    @Override
    public List<String> listSessionIds() {
        var ids = new ArrayList<String>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SESSION_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("session_id"));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list sessions", e);
        }
        return ids;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    /**
     * Update-then-insert in one transaction. Both statements take the same parameters in the
     * same order, key columns last.
     */
    private void upsert(String updateSql, String insertSql, Binder binder, String what) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
                    binder.bind(stmt);
                    updated = stmt.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                        binder.bind(stmt);
                        stmt.executeUpdate();
                    }
                }
                conn.commit();
                log.debug("Saved {}", what);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot save " + what, e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Class<T> type, String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromJson(rs.getString("body"), type)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot load " + type.getSimpleName() + " of " + sessionId, e);
        }
    }

    private void bindSession(PreparedStatement stmt, Session session) throws SQLException {
        stmt.setString(1, session.status().wireName());
        stmt.setTimestamp(2, Timestamp.from(session.createdAt()));
        stmt.setString(3, toJson(session));
        stmt.setString(4, session.id());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
