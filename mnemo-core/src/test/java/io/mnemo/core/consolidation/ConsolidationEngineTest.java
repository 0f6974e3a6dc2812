package io.mnemo.core.consolidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.NewMemory;
import io.mnemo.core.memory.SqliteMemoryStore;
import io.mnemo.core.provider.LlmException;
import io.mnemo.core.session.ConversationTurn;
import io.mnemo.core.session.Session;
import io.mnemo.core.session.SqliteSessionStore;
import io.mnemo.core.session.TurnRole;
import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConsolidationEngineTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteMemoryStore memories;
    private SqliteSessionStore sessions;
    private RecordLockManager locks;
    private final AtomicReference<String> summaryReply = new AtomicReference<>("User talked about coffee.");

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("mnemo.db"));
        memories = new SqliteMemoryStore(database, clock);
        sessions = new SqliteSessionStore(database, clock);
        locks = new RecordLockManager();
    }

    @Test
    void shouldMergeNearDuplicatesIntoMoreImportantRecord() throws Exception {
        MemoryRecord detailed = memories.create(
            new NewMemory("User likes coffee in the morning", MemoryCategory.PREFERENCE, 0.4));
        MemoryRecord important = memories.create(new NewMemory("User likes coffee", MemoryCategory.PREFERENCE, 0.8));
        MemoryRecord otherCategory = memories.create(new NewMemory("User likes coffee", MemoryCategory.FACT, 0.5));
        memories.touch(detailed.id());
        memories.touch(detailed.id());
        memories.touch(important.id());

        ConsolidationReport report = engine(ConsolidationPolicy.defaults()).run();

        assertThat(report.memoriesMerged()).isEqualTo(1);
        MemoryRecord survivor = memories.get(important.id());
        assertThat(survivor.content()).isEqualTo("User likes coffee in the morning");
        assertThat(survivor.importance()).isEqualTo(0.8);
        assertThat(survivor.accessCount()).isEqualTo(3);
        assertThat(memories.find(detailed.id())).isEmpty();
        assertThat(memories.find(otherCategory.id())).isPresent();
        assertThat(memories.count()).isEqualTo(2);
    }

    @Test
    void shouldLeaveDistinctMemoriesAlone() throws Exception {
        memories.create(new NewMemory("User likes coffee", MemoryCategory.PREFERENCE, 0.5));
        memories.create(new NewMemory("User plays the violin", MemoryCategory.PREFERENCE, 0.5));

        ConsolidationReport report = engine(ConsolidationPolicy.defaults()).run();

        assertThat(report.memoriesMerged()).isZero();
        assertThat(report.changedAnything()).isFalse();
        assertThat(memories.count()).isEqualTo(2);
    }

    @Test
    void shouldDecayIdleMemoryOncePerElapsedPeriod() throws Exception {
        ConsolidationEngine engine = engine(weeklyDecay());
        MemoryRecord idle = memories.create(new NewMemory("Owns a bicycle", MemoryCategory.FACT, 0.8));

        clock.advance(Duration.ofDays(7));
        assertThat(engine.run().memoriesDecayed()).isEqualTo(1);
        assertThat(memories.get(idle.id()).importance()).isCloseTo(0.72, within(1e-9));

        ConsolidationReport rerun = engine.run();
        assertThat(rerun.memoriesDecayed()).isZero();
        assertThat(memories.get(idle.id()).importance()).isCloseTo(0.72, within(1e-9));

        clock.advance(Duration.ofDays(7));
        engine.run();
        assertThat(memories.get(idle.id()).importance()).isCloseTo(0.648, within(1e-9));
    }

    @Test
    void shouldNotDecayBelowFloorOrRecentlyAccessedMemories() throws Exception {
        ConsolidationEngine engine = engine(weeklyDecay());
        MemoryRecord faint = memories.create(new NewMemory("Visited Lisbon once", MemoryCategory.FACT, 0.12));
        MemoryRecord used = memories.create(new NewMemory("Speaks Portuguese", MemoryCategory.SKILL, 0.6));

        clock.advance(Duration.ofDays(70));
        memories.touch(used.id());
        engine.run();

        assertThat(memories.get(faint.id()).importance()).isCloseTo(0.1, within(1e-9));
        assertThat(memories.get(used.id()).importance()).isEqualTo(0.6);
        assertThat(engine.run().memoriesDecayed()).isZero();
    }

    @Test
    void shouldSummarizeClosedSessionsAndArchiveOldTurnsAfterwards() throws Exception {
        ConsolidationEngine engine = engine(ConsolidationPolicy.defaults());
        Session session = closedSessionWithTurns("chat-1");
        Session open = sessions.open("chat-2");
        sessions.appendTurn(open.id(), TurnRole.USER, "still talking");

        ConsolidationReport first = engine.run();

        assertThat(first.sessionsSummarized()).isEqualTo(1);
        assertThat(first.turnsArchived()).isZero();
        assertThat(sessions.get(session.id()).summary()).isEqualTo("User talked about coffee.");

        clock.advance(Duration.ofDays(8));
        ConsolidationReport second = engine.run();

        assertThat(second.sessionsSummarized()).isZero();
        assertThat(second.turnsArchived()).isEqualTo(2);
        assertThat(sessions.listTurns(session.id())).allMatch(ConversationTurn::archived);
        assertThat(sessions.listTurns(open.id())).noneMatch(ConversationTurn::archived);
        assertThat(sessions.get(open.id()).summary()).isNull();
    }

    @Test
    void shouldDeferSummaryAndKeepTurnsWhenSummarizationFails() throws Exception {
        Session session = closedSessionWithTurns("chat-1");
        clock.advance(Duration.ofDays(8));
        ConsolidationEngine failing = new ConsolidationEngine(
            memories,
            sessions,
            prompt -> {
                throw new LlmException("timeout");
            },
            locks,
            ConsolidationPolicy.defaults(),
            clock
        );

        ConsolidationReport report = failing.run();

        assertThat(report.summaryFailures()).isEqualTo(1);
        assertThat(report.turnsArchived()).isZero();
        assertThat(sessions.get(session.id()).hasSummary()).isFalse();
        assertThat(sessions.listTurns(session.id())).noneMatch(ConversationTurn::archived);

        ConsolidationReport retried = engine(ConsolidationPolicy.defaults()).run();

        assertThat(retried.sessionsSummarized()).isEqualTo(1);
        assertThat(retried.turnsArchived()).isEqualTo(2);
    }

    @Test
    void shouldTreatBlankSummaryAsFailure() throws Exception {
        Session session = closedSessionWithTurns("chat-1");
        summaryReply.set("   ");

        ConsolidationReport report = engine(ConsolidationPolicy.defaults()).run();

        assertThat(report.summaryFailures()).isEqualTo(1);
        assertThat(sessions.get(session.id()).summary()).isNull();
    }

    @Test
    void shouldSummarizeEmptySessionWithoutCompletion() throws Exception {
        Session empty = sessions.open("chat-1");
        sessions.close(empty.id());
        ConsolidationEngine engine = new ConsolidationEngine(
            memories,
            sessions,
            prompt -> {
                throw new IOException("must not be called");
            },
            locks,
            ConsolidationPolicy.defaults(),
            clock
        );

        assertThat(engine.run().sessionsSummarized()).isEqualTo(1);
        assertThat(sessions.get(empty.id()).hasSummary()).isTrue();
    }

    @Test
    void shouldSkipSessionWhoseLockIsHeld() throws Exception {
        Session session = closedSessionWithTurns("chat-1");
        ConsolidationEngine engine = engine(ConsolidationPolicy.defaults());
        AtomicReference<ConsolidationReport> report = new AtomicReference<>();

        Thread holder = new Thread(() -> {
            try {
                locks.withLock(RecordLockManager.sessionKey(session.id()), () -> {
                    report.set(runInOtherThread(engine));
                    return null;
                });
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        holder.start();
        holder.join();

        assertThat(report.get().sessionsSummarized()).isZero();
        assertThat(report.get().skippedBusy()).isEqualTo(1);
        assertThat(sessions.get(session.id()).hasSummary()).isFalse();
    }

    private static ConsolidationReport runInOtherThread(ConsolidationEngine engine) throws Exception {
        AtomicReference<ConsolidationReport> result = new AtomicReference<>();
        AtomicReference<Exception> failure = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                result.set(engine.run());
            } catch (IOException e) {
                failure.set(e);
            }
        });
        runner.start();
        runner.join();
        if (failure.get() != null) {
            throw failure.get();
        }
        return result.get();
    }

    private Session closedSessionWithTurns(String conversationId) throws IOException {
        Session session = sessions.open(conversationId);
        sessions.appendTurn(session.id(), TurnRole.USER, "I drink coffee every morning");
        sessions.appendTurn(session.id(), TurnRole.ASSISTANT, "Noted, coffee in the morning.");
        return sessions.close(session.id());
    }

    private ConsolidationEngine engine(ConsolidationPolicy policy) {
        return new ConsolidationEngine(memories, sessions, prompt -> summaryReply.get(), locks, policy, clock);
    }

    private static ConsolidationPolicy weeklyDecay() {
        return new ConsolidationPolicy(0.75, Duration.ofDays(7), Duration.ofDays(7), 0.9, 0.1, Duration.ofDays(7), 12_000);
    }
}
