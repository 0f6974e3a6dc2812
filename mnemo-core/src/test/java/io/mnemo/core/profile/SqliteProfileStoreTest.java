package io.mnemo.core.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteProfileStoreTest {

    @TempDir
    Path tempDir;

    private SqliteProfileStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteProfileStore(new SqliteDatabase(tempDir.resolve("mnemo.db")),
            MutableClock.at("2026-03-01T10:00:00Z"));
    }

    @Test
    void shouldUpsertAndKeepCategoryWhenOmitted() throws Exception {
        store.upsert("city", "Kyoto", "personal");

        ProfileAttribute updated = store.upsert("city", "Osaka", null);

        assertThat(updated.value()).isEqualTo("Osaka");
        assertThat(updated.category()).isEqualTo("personal");
        assertThat(store.get(List.of())).hasSize(1);
    }

    @Test
    void shouldReturnOnlyRequestedKnownKeys() throws Exception {
        store.upsert("name", "Aiko", "personal");
        store.upsert("job", "teacher", "work");

        assertThat(store.get(List.of("job", "unknown"))).extracting(ProfileAttribute::key).containsExactly("job");
        assertThat(store.get(null)).extracting(ProfileAttribute::key).containsExactly("job", "name");
    }

    @Test
    void shouldDeleteAttribute() throws Exception {
        store.upsert("pet", "cat", null);

        assertThat(store.delete("pet")).isTrue();
        assertThat(store.delete("pet")).isFalse();
    }

    @Test
    void shouldFormatProfileForPrompt() throws Exception {
        assertThat(store.formatForPrompt()).isEmpty();

        store.upsert("name", "Aiko", null);
        store.upsert("city", "Osaka", null);

        assertThat(store.formatForPrompt()).isEqualTo("## User Profile\n\n- city: Osaka\n- name: Aiko\n");
    }

    @Test
    void shouldRejectBlankValues() {
        assertThatThrownBy(() -> store.upsert("name", " ", null)).isInstanceOf(ConstraintViolationException.class);
    }
}
