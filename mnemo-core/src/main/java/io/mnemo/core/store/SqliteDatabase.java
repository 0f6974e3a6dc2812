package io.mnemo.core.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

/**
 * Shared SQLite file holding memories, goals, profile attributes, sessions and turns.
 * Every store opens short-lived connections through {@link #inTransaction}.
 */
public final class SqliteDatabase {
    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS memories (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            content TEXT NOT NULL,
            category TEXT NOT NULL
                CHECK (category IN ('fact', 'preference', 'personality', 'skill', 'goal_related')),
            importance REAL NOT NULL CHECK (importance >= 0.0 AND importance <= 1.0),
            access_count INTEGER NOT NULL DEFAULT 0 CHECK (access_count >= 0),
            last_accessed_at INTEGER,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL,
            last_decayed_at INTEGER,
            archived_at INTEGER
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_memories_category
        ON memories(category, created_at DESC)
        """,
        """
        CREATE VIRTUAL TABLE IF NOT EXISTS memories_fts
        USING fts5(content, tokenize = 'porter unicode61')
        """,
        """
        CREATE TABLE IF NOT EXISTS goals (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            title TEXT NOT NULL,
            description TEXT,
            deadline TEXT,
            priority TEXT NOT NULL CHECK (priority IN ('low', 'medium', 'high')),
            status TEXT NOT NULL CHECK (status IN ('active', 'completed', 'archived')),
            progress INTEGER NOT NULL CHECK (progress >= 0 AND progress <= 100),
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS profile_attributes (
            key TEXT PRIMARY KEY,
            value TEXT NOT NULL,
            category TEXT,
            updated_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS sessions (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            conversation_id TEXT NOT NULL,
            started_at INTEGER NOT NULL,
            ended_at INTEGER,
            summary TEXT,
            window_start INTEGER NOT NULL DEFAULT 1
        )
        """,
        """
        CREATE UNIQUE INDEX IF NOT EXISTS idx_sessions_open_conversation
        ON sessions(conversation_id) WHERE ended_at IS NULL
        """,
        """
        CREATE TABLE IF NOT EXISTS conversation_turns (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            session_id INTEGER NOT NULL REFERENCES sessions(id),
            seq INTEGER NOT NULL,
            role TEXT NOT NULL CHECK (role IN ('user', 'assistant')),
            content TEXT NOT NULL,
            created_at INTEGER NOT NULL,
            archived INTEGER NOT NULL DEFAULT 0,
            UNIQUE (session_id, seq)
        )
        """
    );

    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    public <T> T inTransaction(String failure, SqlWork<T> work) throws StoreException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException(failure, e);
        }
    }

    public <T> T query(String failure, SqlWork<T> work) throws StoreException {
        try (Connection connection = openConnection()) {
            return work.apply(connection);
        } catch (SQLException e) {
            throw new StoreException(failure, e);
        }
    }

    public StoreStats stats() throws StoreException {
        return query("Failed to read store statistics", connection -> new StoreStats(
            count(connection, "SELECT COUNT(*) FROM memories WHERE archived_at IS NULL"),
            count(connection, "SELECT COUNT(*) FROM memories WHERE archived_at IS NOT NULL"),
            count(connection, "SELECT COUNT(*) FROM profile_attributes"),
            count(connection, "SELECT COUNT(*) FROM goals"),
            count(connection, "SELECT COUNT(*) FROM goals WHERE status = 'active'"),
            count(connection, "SELECT COUNT(*) FROM sessions"),
            count(connection, "SELECT COUNT(*) FROM sessions WHERE ended_at IS NULL"),
            count(connection, "SELECT COUNT(*) FROM conversation_turns"),
            count(connection, "SELECT COUNT(*) FROM conversation_turns WHERE archived = 1")
        ));
    }

    private static long count(Connection connection, String sql) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        }
    }

    private static void rollback(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    private Connection openConnection() throws SQLException {
        Properties properties = new Properties();
        properties.setProperty("foreign_keys", "true");
        properties.setProperty("busy_timeout", "5000");
        properties.setProperty("transaction_mode", "IMMEDIATE");
        Connection connection = DriverManager.getConnection(jdbcUrl, properties);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }
}
