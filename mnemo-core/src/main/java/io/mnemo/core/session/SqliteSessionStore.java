package io.mnemo.core.session;

import static io.mnemo.core.store.SqlColumns.generatedId;
import static io.mnemo.core.store.SqlColumns.instant;
import static io.mnemo.core.store.SqlColumns.setInstant;

import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.NotFoundException;
import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class SqliteSessionStore implements SessionStore {
    private static final String SESSION_COLUMNS =
        "id, conversation_id, started_at, ended_at, summary, window_start";
    private static final String TURN_COLUMNS =
        "id, session_id, seq, role, content, created_at, archived";

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteSessionStore(SqliteDatabase database, Clock clock) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Session open(String conversationId) throws IOException {
        String conversation = ConstraintViolationException.requireText(conversationId, "conversationId");
        Instant now = clock.instant();
        String sql = """
            INSERT INTO sessions (conversation_id, started_at, window_start)
            VALUES (?, ?, 1)
            """;
        return database.inTransaction("Failed to open session for " + conversation, connection -> {
            long id;
            try (PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                statement.setString(1, conversation);
                setInstant(statement, 2, now);
                statement.executeUpdate();
                id = generatedId(statement);
            } catch (SQLException e) {
                if (isUniqueViolation(e)) {
                    throw new ConstraintViolationException("conversation " + conversation + " already has an open session");
                }
                throw e;
            }
            return requireSession(connection, id);
        });
    }

    @Override
    public Optional<Session> findOpen(String conversationId) throws IOException {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        String sql = "SELECT " + SESSION_COLUMNS + " FROM sessions WHERE conversation_id = ? AND ended_at IS NULL";
        return database.query("Failed to find open session for " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, conversationId.trim());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(mapSession(resultSet)) : Optional.<Session>empty();
                }
            }
        });
    }

    @Override
    public Session get(long sessionId) throws IOException {
        return database.query("Failed to read session " + sessionId, connection -> requireSession(connection, sessionId));
    }

    @Override
    public Session close(long sessionId) throws IOException {
        Instant now = clock.instant();
        return database.inTransaction("Failed to close session " + sessionId, connection -> {
            Session session = requireSession(connection, sessionId);
            if (!session.isOpen()) {
                return session;
            }
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sessions SET ended_at = ? WHERE id = ? AND ended_at IS NULL")) {
                setInstant(statement, 1, now);
                statement.setLong(2, sessionId);
                statement.executeUpdate();
            }
            return requireSession(connection, sessionId);
        });
    }

    @Override
    public Session setSummary(long sessionId, String summary) throws IOException {
        String text = ConstraintViolationException.requireText(summary, "summary");
        return database.inTransaction("Failed to store summary of session " + sessionId, connection -> {
            Session session = requireSession(connection, sessionId);
            if (session.isOpen()) {
                throw new ConstraintViolationException("session " + sessionId + " is still open");
            }
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sessions SET summary = ? WHERE id = ? AND ended_at IS NOT NULL")) {
                statement.setString(1, text);
                statement.setLong(2, sessionId);
                statement.executeUpdate();
            }
            return requireSession(connection, sessionId);
        });
    }

    @Override
    public ConversationTurn appendTurn(long sessionId, TurnRole role, String content) throws IOException {
        if (role == null) {
            throw new ConstraintViolationException("role must not be null");
        }
        String text = content == null ? "" : content;
        Instant now = clock.instant();
        String insert = """
            INSERT INTO conversation_turns (session_id, seq, role, content, created_at, archived)
            VALUES (?, ?, ?, ?, ?, 0)
            """;
        return database.inTransaction("Failed to append turn to session " + sessionId, connection -> {
            Session session = requireSession(connection, sessionId);
            if (!session.isOpen()) {
                throw new ConstraintViolationException("session " + sessionId + " is closed");
            }
            int seq = lastSeq(connection, sessionId) + 1;
            long id;
            try (PreparedStatement statement = connection.prepareStatement(insert, Statement.RETURN_GENERATED_KEYS)) {
                statement.setLong(1, sessionId);
                statement.setInt(2, seq);
                statement.setString(3, role.value());
                statement.setString(4, text);
                setInstant(statement, 5, now);
                statement.executeUpdate();
                id = generatedId(statement);
            }
            return new ConversationTurn(id, sessionId, seq, role, text, now, false);
        });
    }

    @Override
    public List<ConversationTurn> listTurns(long sessionId) throws IOException {
        return turns("SELECT " + TURN_COLUMNS + " FROM conversation_turns WHERE session_id = ? ORDER BY seq ASC",
            sessionId);
    }

    @Override
    public List<ConversationTurn> activeWindow(long sessionId) throws IOException {
        String sql = "SELECT " + TURN_COLUMNS + """
             FROM conversation_turns
            WHERE session_id = ?
              AND archived = 0
              AND seq >= (SELECT window_start FROM sessions WHERE id = conversation_turns.session_id)
            ORDER BY seq ASC
            """;
        return turns(sql, sessionId);
    }

    @Override
    public int lastSeq(long sessionId) throws IOException {
        return database.query("Failed to read last turn of session " + sessionId,
            connection -> lastSeq(connection, sessionId));
    }

    @Override
    public boolean advanceWindow(long sessionId, int windowStart) throws IOException {
        if (windowStart < 1) {
            throw new ConstraintViolationException("windowStart must be at least 1 but was " + windowStart);
        }
        return database.inTransaction("Failed to advance window of session " + sessionId, connection -> {
            requireSession(connection, sessionId);
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sessions SET window_start = ? WHERE id = ? AND window_start < ?")) {
                statement.setInt(1, windowStart);
                statement.setLong(2, sessionId);
                statement.setInt(3, windowStart);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int archiveTurnsBefore(long sessionId, Instant cutoff) throws IOException {
        if (cutoff == null) {
            throw new ConstraintViolationException("cutoff must not be null");
        }
        String sql = """
            UPDATE conversation_turns SET archived = 1
            WHERE session_id = ?
              AND archived = 0
              AND created_at < ?
              AND EXISTS (
                  SELECT 1 FROM sessions s
                  WHERE s.id = conversation_turns.session_id
                    AND s.ended_at IS NOT NULL
                    AND s.summary IS NOT NULL
                    AND trim(s.summary) <> ''
              )
            """;
        return database.inTransaction("Failed to archive turns of session " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, sessionId);
                setInstant(statement, 2, cutoff);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public List<Session> listClosed(boolean unsummarizedOnly) throws IOException {
        String sql = "SELECT " + SESSION_COLUMNS + " FROM sessions WHERE ended_at IS NOT NULL"
            + (unsummarizedOnly ? " AND (summary IS NULL OR trim(summary) = '')" : "")
            + " ORDER BY ended_at ASC, id ASC";
        return database.query("Failed to list closed sessions", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql);
                 ResultSet resultSet = statement.executeQuery()) {
                List<Session> sessions = new ArrayList<>();
                while (resultSet.next()) {
                    sessions.add(mapSession(resultSet));
                }
                return sessions;
            }
        });
    }

    private List<ConversationTurn> turns(String sql, long sessionId) throws IOException {
        return database.query("Failed to list turns of session " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, sessionId);
                List<ConversationTurn> turns = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        turns.add(mapTurn(resultSet));
                    }
                }
                return turns;
            }
        });
    }

    private static int lastSeq(Connection connection, long sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT COALESCE(MAX(seq), 0) FROM conversation_turns WHERE session_id = ?")) {
            statement.setLong(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        }
    }

    private static Session requireSession(Connection connection, long sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT " + SESSION_COLUMNS + " FROM sessions WHERE id = ?")) {
            statement.setLong(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    throw new NotFoundException("session", sessionId);
                }
                return mapSession(resultSet);
            }
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage();
        return message != null && message.toUpperCase(Locale.ROOT).contains("UNIQUE");
    }

    private static Session mapSession(ResultSet resultSet) throws SQLException {
        return new Session(
            resultSet.getLong("id"),
            resultSet.getString("conversation_id"),
            instant(resultSet, "started_at"),
            instant(resultSet, "ended_at"),
            resultSet.getString("summary"),
            resultSet.getInt("window_start")
        );
    }

    private static ConversationTurn mapTurn(ResultSet resultSet) throws SQLException {
        return new ConversationTurn(
            resultSet.getLong("id"),
            resultSet.getLong("session_id"),
            resultSet.getInt("seq"),
            TurnRole.fromValue(resultSet.getString("role")),
            resultSet.getString("content"),
            instant(resultSet, "created_at"),
            resultSet.getInt("archived") != 0
        );
    }
}
