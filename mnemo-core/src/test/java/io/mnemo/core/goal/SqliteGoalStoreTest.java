package io.mnemo.core.goal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.NotFoundException;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteGoalStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteGoalStore store;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new SqliteGoalStore(new SqliteDatabase(tempDir.resolve("mnemo.db")), clock);
    }

    @Test
    void shouldCreateActiveGoalWithDefaults() throws Exception {
        Goal goal = store.create(NewGoal.titled("Pass the JLPT N2"));

        assertThat(goal.id()).isPositive();
        assertThat(goal.status()).isEqualTo(GoalStatus.ACTIVE);
        assertThat(goal.priority()).isEqualTo(GoalPriority.MEDIUM);
        assertThat(goal.progress()).isZero();
        assertThat(goal.deadline()).isNull();
    }

    @Test
    void shouldApplyPartialUpdate() throws Exception {
        Goal goal = store.create(new NewGoal("Run a half marathon", "spring race", LocalDate.of(2026, 5, 10),
            GoalPriority.HIGH));
        clock.advance(Duration.ofDays(3));

        Goal updated = store.update(goal.id(), GoalUpdate.progress(40));

        assertThat(updated.progress()).isEqualTo(40);
        assertThat(updated.title()).isEqualTo("Run a half marathon");
        assertThat(updated.deadline()).isEqualTo(LocalDate.of(2026, 5, 10));
        assertThat(updated.updatedAt()).isAfter(goal.updatedAt());
    }

    @Test
    void shouldRejectProgressAboveHundredAndKeepStoredValue() throws Exception {
        Goal goal = store.create(NewGoal.titled("Learn to swim"));
        store.update(goal.id(), GoalUpdate.progress(30));

        assertThatThrownBy(() -> store.update(goal.id(), GoalUpdate.progress(150)))
            .isInstanceOf(ConstraintViolationException.class)
            .hasMessageContaining("progress");

        assertThat(store.get(goal.id()).progress()).isEqualTo(30);
    }

    @Test
    void shouldReportMissingGoalOnUpdate() {
        assertThatThrownBy(() -> store.update(999, GoalUpdate.status(GoalStatus.COMPLETED)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldListByStatusOrderedByPriorityThenDeadline() throws Exception {
        Goal low = store.create(new NewGoal("Tidy the garage", null, null, GoalPriority.LOW));
        Goal later = store.create(new NewGoal("Renew passport", null, LocalDate.of(2026, 9, 1), GoalPriority.HIGH));
        Goal sooner = store.create(new NewGoal("File taxes", null, LocalDate.of(2026, 4, 15), GoalPriority.HIGH));
        Goal done = store.create(NewGoal.titled("Buy a desk"));
        store.update(done.id(), GoalUpdate.status(GoalStatus.COMPLETED));

        assertThat(store.list(GoalStatus.ACTIVE)).extracting(Goal::id)
            .containsExactly(sooner.id(), later.id(), low.id());
        assertThat(store.list(GoalStatus.COMPLETED)).extracting(Goal::id).containsExactly(done.id());
        assertThat(store.list(null)).hasSize(4);
    }

    @Test
    void shouldFindActiveGoalByTitleIgnoringCase() throws Exception {
        Goal goal = store.create(NewGoal.titled("Read 20 books"));

        assertThat(store.findActiveByTitle("  read 20 BOOKS ")).map(Goal::id).contains(goal.id());

        store.update(goal.id(), GoalUpdate.status(GoalStatus.ARCHIVED));
        assertThat(store.findActiveByTitle("Read 20 books")).isEmpty();
    }
}
