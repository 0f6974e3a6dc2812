package io.mnemo.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryCommitterTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteMemoryStore store;
    private MemoryCommitter committer;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new SqliteMemoryStore(new SqliteDatabase(tempDir.resolve("mnemo.db")), clock);
        committer = new MemoryCommitter(store, new RecordLockManager(), 0.9);
    }

    @Test
    void shouldReinforceInsteadOfDuplicating() throws Exception {
        CommitResult first = committer.commit(new NewMemory("Prefers dark mode", MemoryCategory.PREFERENCE, 0.4));
        clock.advance(Duration.ofDays(1));

        CommitResult second = committer.commit(new NewMemory("prefers dark mode.", MemoryCategory.PREFERENCE, 0.6));

        assertThat(first.merged()).isFalse();
        assertThat(second.merged()).isTrue();
        assertThat(second.record().id()).isEqualTo(first.record().id());
        assertThat(second.record().importance()).isEqualTo(0.6);
        assertThat(second.record().updatedAt()).isAfter(first.record().updatedAt());
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldKeepHigherImportanceWhenReinforcing() throws Exception {
        committer.commit(new NewMemory("Prefers dark mode", MemoryCategory.PREFERENCE, 0.8));

        CommitResult again = committer.commit(new NewMemory("Prefers dark mode", MemoryCategory.PREFERENCE, 0.3));

        assertThat(again.record().importance()).isEqualTo(0.8);
    }

    @Test
    void shouldCreateSeparateRecordsAcrossCategories() throws Exception {
        committer.commit(new NewMemory("Speaks Japanese", MemoryCategory.SKILL, 0.5));
        committer.commit(new NewMemory("Speaks Japanese", MemoryCategory.FACT, 0.5));

        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void shouldCreateWhenBelowDuplicateThreshold() throws Exception {
        committer.commit(new NewMemory("Likes coffee", MemoryCategory.PREFERENCE, 0.5));
        CommitResult refined = committer.commit(
            new NewMemory("Likes coffee in the morning", MemoryCategory.PREFERENCE, 0.5)
        );

        assertThat(refined.merged()).isFalse();
        assertThat(store.count()).isEqualTo(2);
    }
}
