package io.mnemo.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.NewMemory;
import io.mnemo.core.memory.SqliteMemoryStore;
import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelevanceRankerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteMemoryStore store;
    private RelevanceRanker ranker;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new SqliteMemoryStore(new SqliteDatabase(tempDir.resolve("mnemo.db")), clock);
        ranker = new RelevanceRanker(store, new RecordLockManager(), QueryAnalyzer.withDefaults(),
            RankingWeights.defaults(), clock);
    }

    @Test
    void shouldFindOccupationForJobQuestion() throws Exception {
        MemoryRecord teacher = store.create(new NewMemory("Works as a teacher in Osaka", MemoryCategory.FACT, 0.7));
        store.create(new NewMemory("Likes jazz music", MemoryCategory.PREFERENCE, 0.9));
        store.create(new NewMemory("Has two cats", MemoryCategory.FACT, 0.6));

        List<ScoredMemory> hits = ranker.search("What is my job?", null);

        assertThat(hits).isNotEmpty();
        assertThat(hits.get(0).record().id()).isEqualTo(teacher.id());
        assertThat(hits.get(0).textMatch()).isPositive();
    }

    @Test
    void shouldTouchReturnedRecordsOnSearch() throws Exception {
        MemoryRecord created = store.create(new NewMemory("Plays the violin", MemoryCategory.SKILL, 0.5));
        store.create(new NewMemory("Lives near the sea", MemoryCategory.FACT, 0.5));
        clock.advance(Duration.ofHours(1));

        List<ScoredMemory> hits = ranker.search("violin", null);

        assertThat(hits).extracting(hit -> hit.record().id()).containsExactly(created.id());
        assertThat(hits.get(0).record().accessCount()).isZero();
        MemoryRecord after = store.get(created.id());
        assertThat(after.accessCount()).isEqualTo(1);
        assertThat(after.lastAccessedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldNotTouchWhenOnlyRanking() throws Exception {
        MemoryRecord created = store.create(new NewMemory("Plays the violin", MemoryCategory.SKILL, 0.5));

        ranker.rank("violin", null, 5);

        assertThat(store.get(created.id()).accessCount()).isZero();
    }

    @Test
    void shouldRankByImportanceWhenQueryHasNoContentWords() throws Exception {
        MemoryRecord low = store.create(new NewMemory("Owns a bicycle", MemoryCategory.FACT, 0.2));
        MemoryRecord high = store.create(new NewMemory("Is vegetarian", MemoryCategory.FACT, 0.9));

        List<ScoredMemory> hits = ranker.rank("what is the", null, 5);

        assertThat(hits).extracting(hit -> hit.record().id()).containsExactly(high.id(), low.id());
        assertThat(hits).allSatisfy(hit -> assertThat(hit.textMatch()).isZero());
    }

    @Test
    void shouldBreakTiesByNewestRecord() throws Exception {
        RelevanceRanker flat = new RelevanceRanker(store, new RecordLockManager(), QueryAnalyzer.withDefaults(),
            new RankingWeights(1.0, 0.5, 0.1, 0.0, Duration.ofDays(14)), clock);
        MemoryRecord older = store.create(new NewMemory("Reads mystery novels", MemoryCategory.PREFERENCE, 0.5));
        clock.advance(Duration.ofMinutes(5));
        MemoryRecord newer = store.create(new NewMemory("Collects vinyl records", MemoryCategory.PREFERENCE, 0.5));

        List<ScoredMemory> hits = flat.rank("", MemoryCategory.PREFERENCE, 5);

        assertThat(hits).extracting(hit -> hit.record().id()).containsExactly(newer.id(), older.id());
    }

    @Test
    void shouldPreferExactStatementOverMoreImportantPartialMatch() throws Exception {
        store.create(new NewMemory("Enjoys tea every morning", MemoryCategory.PREFERENCE, 1.0));
        MemoryRecord exact = store.create(new NewMemory("Likes tea", MemoryCategory.PREFERENCE, 0.1));
        store.create(new NewMemory("Keeps a vegetable garden", MemoryCategory.PREFERENCE, 1.0));

        List<ScoredMemory> hits = ranker.search("Likes tea", MemoryCategory.PREFERENCE, 1);

        assertThat(hits).extracting(hit -> hit.record().id()).containsExactly(exact.id());
        assertThat(hits.get(0).textMatch()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldScoreTextMatchOnQueryScale() throws Exception {
        MemoryRecord partial = store.create(new NewMemory("Enjoys tea every morning", MemoryCategory.PREFERENCE, 0.5));
        MemoryRecord exact = store.create(new NewMemory("Likes tea", MemoryCategory.PREFERENCE, 0.5));

        List<ScoredMemory> hits = ranker.rank("likes tea", MemoryCategory.PREFERENCE, 5);

        assertThat(hits).extracting(hit -> hit.record().id()).containsExactly(exact.id(), partial.id());
        assertThat(hits.get(1).textMatch()).isBetween(0.3, 0.6);
    }

    @Test
    void shouldRespectCategoryAndLimit() throws Exception {
        store.create(new NewMemory("Drinks green tea daily", MemoryCategory.PREFERENCE, 0.5));
        store.create(new NewMemory("Drinks black tea at work", MemoryCategory.PREFERENCE, 0.5));
        store.create(new NewMemory("Grew up on a tea farm", MemoryCategory.FACT, 0.5));

        assertThat(ranker.rank("tea", MemoryCategory.FACT, 5)).hasSize(1);
        assertThat(ranker.rank("tea", null, 2)).hasSize(2);
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> ranker.search("tea", null, 0))
            .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void shouldWeightImportanceAndRecencyIntoScore() throws Exception {
        MemoryRecord record = store.create(new NewMemory("Speaks French", MemoryCategory.SKILL, 1.0));

        ScoredMemory scored = ranker.score(record, 0.0, clock.instant());

        // importance 0.5 * 1.0 plus full recency 0.2 * 1.0
        assertThat(scored.score()).isCloseTo(0.7, within(1e-9));
    }
}
