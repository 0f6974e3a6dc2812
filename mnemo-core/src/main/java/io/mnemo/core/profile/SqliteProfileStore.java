package io.mnemo.core.profile;

import static io.mnemo.core.store.SqlColumns.instant;
import static io.mnemo.core.store.SqlColumns.setInstant;
import static io.mnemo.core.store.SqlColumns.setNullableString;

import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public final class SqliteProfileStore implements ProfileStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteProfileStore(SqliteDatabase database, Clock clock) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.database = database;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public ProfileAttribute upsert(String key, String value, String category) throws IOException {
        ProfileAttribute attribute = new ProfileAttribute(
            normalizeKey(key),
            ConstraintViolationException.requireText(value, "value"),
            category,
            clock.instant()
        );
        String sql = """
            INSERT INTO profile_attributes (key, value, category, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET
                value = excluded.value,
                category = COALESCE(excluded.category, profile_attributes.category),
                updated_at = excluded.updated_at
            """;
        database.inTransaction("Failed to store profile attribute " + attribute.key(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, attribute.key());
                statement.setString(2, attribute.value());
                setNullableString(statement, 3, attribute.category());
                setInstant(statement, 4, attribute.updatedAt());
                return statement.executeUpdate();
            }
        });
        return get(List.of(attribute.key())).get(0);
    }

    @Override
    public List<ProfileAttribute> get(Collection<String> keys) throws IOException {
        Set<String> wanted = new LinkedHashSet<>();
        if (keys != null) {
            for (String key : keys) {
                if (key != null && !key.isBlank()) {
                    wanted.add(normalizeKey(key));
                }
            }
        }
        String filter = wanted.isEmpty()
            ? ""
            : " WHERE key IN (" + String.join(", ", Collections.nCopies(wanted.size(), "?")) + ")";
        String sql = "SELECT key, value, category, updated_at FROM profile_attributes" + filter + " ORDER BY key ASC";
        return database.query("Failed to read profile attributes", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = 1;
                for (String key : wanted) {
                    statement.setString(index++, key);
                }
                List<ProfileAttribute> attributes = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        attributes.add(map(resultSet));
                    }
                }
                return attributes;
            }
        });
    }

    @Override
    public boolean delete(String key) throws IOException {
        String normalized = normalizeKey(key);
        return database.inTransaction("Failed to delete profile attribute " + normalized, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM profile_attributes WHERE key = ?")) {
                statement.setString(1, normalized);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public String formatForPrompt() throws IOException {
        List<ProfileAttribute> attributes = get(List.of());
        if (attributes.isEmpty()) {
            return "";
        }
        return "## User Profile\n\n" + attributes.stream()
            .map(attribute -> "- " + attribute.key() + ": " + attribute.value())
            .collect(Collectors.joining("\n")) + "\n";
    }

    private static String normalizeKey(String key) {
        return ConstraintViolationException.requireText(key, "key");
    }

    private static ProfileAttribute map(ResultSet resultSet) throws SQLException {
        Instant updatedAt = instant(resultSet, "updated_at");
        return new ProfileAttribute(
            resultSet.getString("key"),
            resultSet.getString("value"),
            resultSet.getString("category"),
            updatedAt
        );
    }
}
