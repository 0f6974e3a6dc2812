package io.mnemo.core.goal;

import static io.mnemo.core.store.SqlColumns.generatedId;
import static io.mnemo.core.store.SqlColumns.instant;
import static io.mnemo.core.store.SqlColumns.setInstant;
import static io.mnemo.core.store.SqlColumns.setNullableString;

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
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteGoalStore implements GoalStore {
    private static final String COLUMNS =
        "id, title, description, deadline, priority, status, progress, created_at, updated_at";

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteGoalStore(SqliteDatabase database, Clock clock) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Goal create(NewGoal goal) throws IOException {
        if (goal == null) {
            throw new ConstraintViolationException("goal must not be null");
        }
        Instant now = clock.instant();
        String sql = """
            INSERT INTO goals (title, description, deadline, priority, status, progress, created_at, updated_at)
            VALUES (?, ?, ?, ?, 'active', 0, ?, ?)
            """;
        return database.inTransaction("Failed to create goal", connection -> {
            long id;
            try (PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                statement.setString(1, goal.title());
                setNullableString(statement, 2, goal.description());
                setNullableString(statement, 3, goal.deadline() == null ? null : goal.deadline().toString());
                statement.setString(4, goal.priority().value());
                setInstant(statement, 5, now);
                setInstant(statement, 6, now);
                statement.executeUpdate();
                id = generatedId(statement);
            }
            return require(connection, id);
        });
    }

    @Override
    public Goal get(long id) throws IOException {
        return find(id).orElseThrow(() -> new NotFoundException("goal", id));
    }

    @Override
    public Optional<Goal> find(long id) throws IOException {
        return database.query("Failed to read goal " + id, connection -> Optional.ofNullable(load(connection, id)));
    }

    @Override
    public Goal update(long id, GoalUpdate update) throws IOException {
        if (update == null) {
            throw new ConstraintViolationException("update must not be null");
        }
        Instant now = clock.instant();
        String sql = """
            UPDATE goals
            SET title = ?, description = ?, deadline = ?, priority = ?, status = ?, progress = ?, updated_at = ?
            WHERE id = ?
            """;
        return database.inTransaction("Failed to update goal " + id, connection -> {
            Goal updated = update.applyTo(require(connection, id), now);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, updated.title());
                setNullableString(statement, 2, updated.description());
                setNullableString(statement, 3, updated.deadline() == null ? null : updated.deadline().toString());
                statement.setString(4, updated.priority().value());
                statement.setString(5, updated.status().value());
                statement.setInt(6, updated.progress());
                setInstant(statement, 7, now);
                statement.setLong(8, id);
                statement.executeUpdate();
            }
            return require(connection, id);
        });
    }

    @Override
    public List<Goal> list(GoalStatus status) throws IOException {
        String sql = "SELECT " + COLUMNS + """
             FROM goals
            WHERE (? IS NULL OR status = ?)
            ORDER BY CASE priority WHEN 'high' THEN 0 WHEN 'medium' THEN 1 ELSE 2 END,
                     deadline IS NULL, deadline ASC, created_at ASC, id ASC
            """;
        return database.query("Failed to list goals", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (int index = 1; index <= 2; index++) {
                    if (status == null) {
                        statement.setNull(index, Types.VARCHAR);
                    } else {
                        statement.setString(index, status.value());
                    }
                }
                List<Goal> goals = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        goals.add(map(resultSet));
                    }
                }
                return goals;
            }
        });
    }

    @Override
    public Optional<Goal> findActiveByTitle(String title) throws IOException {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + """
             FROM goals
            WHERE status = 'active' AND lower(trim(title)) = lower(?)
            ORDER BY id ASC
            LIMIT 1
            """;
        return database.query("Failed to find goal by title", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, title.trim());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(map(resultSet)) : Optional.<Goal>empty();
                }
            }
        });
    }

    private static Goal require(Connection connection, long id) throws SQLException {
        Goal goal = load(connection, id);
        if (goal == null) {
            throw new NotFoundException("goal", id);
        }
        return goal;
    }

    private static Goal load(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT " + COLUMNS + " FROM goals WHERE id = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? map(resultSet) : null;
            }
        }
    }

    private static Goal map(ResultSet resultSet) throws SQLException {
        String deadline = resultSet.getString("deadline");
        return new Goal(
            resultSet.getLong("id"),
            resultSet.getString("title"),
            resultSet.getString("description"),
            deadline == null ? null : LocalDate.parse(deadline),
            GoalPriority.fromValue(resultSet.getString("priority")),
            GoalStatus.fromValue(resultSet.getString("status")),
            resultSet.getInt("progress"),
            instant(resultSet, "created_at"),
            instant(resultSet, "updated_at")
        );
    }
}
