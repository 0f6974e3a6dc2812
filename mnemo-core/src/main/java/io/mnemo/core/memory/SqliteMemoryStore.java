package io.mnemo.core.memory;

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
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteMemoryStore implements MemoryStore {
    private static final String COLUMNS = """
        m.id, m.content, m.category, m.importance, m.access_count, m.last_accessed_at,
        m.created_at, m.updated_at, m.last_decayed_at, m.archived_at
        """;

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteMemoryStore(SqliteDatabase database, Clock clock) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public MemoryRecord create(NewMemory memory) throws IOException {
        if (memory == null) {
            throw new ConstraintViolationException("memory must not be null");
        }
        Instant now = clock.instant();
        String insert = """
            INSERT INTO memories (content, category, importance, access_count, created_at, updated_at)
            VALUES (?, ?, ?, 0, ?, ?)
            """;
        return database.inTransaction("Failed to create memory", connection -> {
            long id;
            try (PreparedStatement statement = connection.prepareStatement(insert, Statement.RETURN_GENERATED_KEYS)) {
                statement.setString(1, memory.content());
                statement.setString(2, memory.category().value());
                statement.setDouble(3, memory.importance());
                setInstant(statement, 4, now);
                setInstant(statement, 5, now);
                statement.executeUpdate();
                id = generatedId(statement);
            }
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO memories_fts (rowid, content) VALUES (?, ?)")) {
                statement.setLong(1, id);
                statement.setString(2, memory.content());
                statement.executeUpdate();
            }
            return require(connection, id);
        });
    }

    @Override
    public MemoryRecord get(long id) throws IOException {
        return find(id).orElseThrow(() -> new NotFoundException("memory", id));
    }

    @Override
    public Optional<MemoryRecord> find(long id) throws IOException {
        return database.query("Failed to read memory " + id, connection -> Optional.ofNullable(load(connection, id)));
    }

    @Override
    public List<MemoryMatch> matchText(String matchExpression, MemoryCategory category, int limit) throws IOException {
        if (matchExpression == null || matchExpression.isBlank() || limit <= 0) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + """
            , f.text_rank AS text_rank
            FROM (
                SELECT rowid AS memory_id, bm25(memories_fts) AS text_rank
                FROM memories_fts
                WHERE memories_fts MATCH ?
            ) f
            JOIN memories m ON m.id = f.memory_id
            WHERE m.archived_at IS NULL AND (? IS NULL OR m.category = ?)
            ORDER BY f.text_rank ASC, m.created_at DESC
            LIMIT ?
            """;
        return database.query("Failed to search memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, matchExpression);
                bindCategory(statement, 2, category);
                bindCategory(statement, 3, category);
                statement.setInt(4, limit);
                List<MemoryMatch> matches = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        matches.add(new MemoryMatch(map(resultSet), -resultSet.getDouble("text_rank")));
                    }
                }
                return matches;
            }
        });
    }

    @Override
    public MemoryRecord touch(long id) throws IOException {
        Instant now = clock.instant();
        String sql = """
            UPDATE memories SET access_count = access_count + 1, last_accessed_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        return database.inTransaction("Failed to touch memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                setInstant(statement, 1, now);
                statement.setLong(2, id);
                requireUpdated(statement.executeUpdate(), id);
            }
            return require(connection, id);
        });
    }

    @Override
    public MemoryRecord reinforce(long id, double importance) throws IOException {
        ConstraintViolationException.requireImportance(importance);
        Instant now = clock.instant();
        String sql = """
            UPDATE memories SET importance = ?, updated_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        return database.inTransaction("Failed to reinforce memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setDouble(1, importance);
                setInstant(statement, 2, now);
                statement.setLong(3, id);
                requireUpdated(statement.executeUpdate(), id);
            }
            return require(connection, id);
        });
    }

    @Override
    public MemoryRecord update(long id, String content, double importance) throws IOException {
        String normalized = ConstraintViolationException.requireText(content, "content");
        ConstraintViolationException.requireImportance(importance);
        Instant now = clock.instant();
        String sql = """
            UPDATE memories SET content = ?, importance = ?, updated_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        return database.inTransaction("Failed to update memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, normalized);
                statement.setDouble(2, importance);
                setInstant(statement, 3, now);
                statement.setLong(4, id);
                requireUpdated(statement.executeUpdate(), id);
            }
            replaceIndexedContent(connection, id, normalized);
            return require(connection, id);
        });
    }

    @Override
    public MemoryRecord merge(long survivorId, long absorbedId, MergedMemory merged) throws IOException {
        if (survivorId == absorbedId) {
            throw new ConstraintViolationException("cannot merge memory " + survivorId + " into itself");
        }
        if (merged == null) {
            throw new ConstraintViolationException("merged must not be null");
        }
        Instant now = clock.instant();
        String updateSurvivor = """
            UPDATE memories
            SET content = ?, importance = ?, access_count = ?, updated_at = ?, last_accessed_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        String archiveAbsorbed = """
            UPDATE memories SET archived_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        return database.inTransaction("Failed to merge memory " + absorbedId + " into " + survivorId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(updateSurvivor)) {
                statement.setString(1, merged.content());
                statement.setDouble(2, merged.importance());
                statement.setLong(3, merged.accessCount());
                setInstant(statement, 4, merged.updatedAt() == null ? now : merged.updatedAt());
                setInstant(statement, 5, merged.lastAccessedAt());
                statement.setLong(6, survivorId);
                requireUpdated(statement.executeUpdate(), survivorId);
            }
            try (PreparedStatement statement = connection.prepareStatement(archiveAbsorbed)) {
                setInstant(statement, 1, now);
                statement.setLong(2, absorbedId);
                requireUpdated(statement.executeUpdate(), absorbedId);
            }
            replaceIndexedContent(connection, survivorId, merged.content());
            try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM memories_fts WHERE rowid = ?")) {
                statement.setLong(1, absorbedId);
                statement.executeUpdate();
            }
            return require(connection, survivorId);
        });
    }

    @Override
    public MemoryRecord decay(long id, double importance, Instant decayedThrough) throws IOException {
        ConstraintViolationException.requireImportance(importance);
        String sql = """
            UPDATE memories SET importance = ?, last_decayed_at = ?
            WHERE id = ? AND archived_at IS NULL
            """;
        return database.inTransaction("Failed to decay memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setDouble(1, importance);
                setInstant(statement, 2, decayedThrough == null ? clock.instant() : decayedThrough);
                statement.setLong(3, id);
                requireUpdated(statement.executeUpdate(), id);
            }
            return require(connection, id);
        });
    }

    @Override
    public List<MemoryRecord> list(MemoryCategory category) throws IOException {
        String sql = "SELECT " + COLUMNS + """
            FROM memories m
            WHERE m.archived_at IS NULL AND (? IS NULL OR m.category = ?)
            ORDER BY m.created_at DESC, m.id DESC
            """;
        return database.query("Failed to list memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bindCategory(statement, 1, category);
                bindCategory(statement, 2, category);
                List<MemoryRecord> records = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        records.add(map(resultSet));
                    }
                }
                return records;
            }
        });
    }

    @Override
    public int count() throws IOException {
        return database.query("Failed to count memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM memories WHERE archived_at IS NULL");
                 ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        });
    }

    private static void replaceIndexedContent(Connection connection, long id, String content) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "UPDATE memories_fts SET content = ? WHERE rowid = ?")) {
            statement.setString(1, content);
            statement.setLong(2, id);
            statement.executeUpdate();
        }
    }

    private static void bindCategory(PreparedStatement statement, int index, MemoryCategory category)
        throws SQLException {
        if (category == null) {
            statement.setNull(index, Types.VARCHAR);
        } else {
            statement.setString(index, category.value());
        }
    }

    private static void requireUpdated(int rows, long id) {
        if (rows == 0) {
            throw new NotFoundException("memory", id);
        }
    }

    private static MemoryRecord require(Connection connection, long id) throws SQLException {
        MemoryRecord record = load(connection, id);
        if (record == null) {
            throw new NotFoundException("memory", id);
        }
        return record;
    }

    private static MemoryRecord load(Connection connection, long id) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM memories m WHERE m.id = ? AND m.archived_at IS NULL";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? map(resultSet) : null;
            }
        }
    }

    private static MemoryRecord map(ResultSet resultSet) throws SQLException {
        return new MemoryRecord(
            resultSet.getLong("id"),
            resultSet.getString("content"),
            MemoryCategory.fromValue(resultSet.getString("category")),
            resultSet.getDouble("importance"),
            resultSet.getLong("access_count"),
            instant(resultSet, "last_accessed_at"),
            instant(resultSet, "created_at"),
            instant(resultSet, "updated_at"),
            instant(resultSet, "last_decayed_at"),
            instant(resultSet, "archived_at")
        );
    }
}
