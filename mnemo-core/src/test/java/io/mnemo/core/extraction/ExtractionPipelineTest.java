package io.mnemo.core.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.goal.Goal;
import io.mnemo.core.goal.GoalStatus;
import io.mnemo.core.goal.SqliteGoalStore;
import io.mnemo.core.memory.MemoryCommitter;
import io.mnemo.core.memory.SqliteMemoryStore;
import io.mnemo.core.profile.SqliteProfileStore;
import io.mnemo.core.provider.LlmException;
import io.mnemo.core.provider.TextCompletion;
import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.store.StoreStats;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractionPipelineTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private SqliteMemoryStore memories;
    private SqliteGoalStore goals;
    private SqliteProfileStore profile;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        database = new SqliteDatabase(tempDir.resolve("mnemo.db"));
        memories = new SqliteMemoryStore(database, clock);
        goals = new SqliteGoalStore(database, clock);
        profile = new SqliteProfileStore(database, clock);
    }

    @Test
    void shouldCommitMemoriesGoalsAndProfile() throws Exception {
        RecordingCompletion completion = new RecordingCompletion("""
            {
              "memories": [{"content": "Works as a teacher in Osaka", "category": "fact", "importance": 0.8}],
              "goals": [{"title": "Pass the JLPT N1", "priority": "high"}],
              "profile": [{"key": "city", "value": "Osaka"}]
            }
            """);

        ExtractionOutcome outcome = pipeline(completion).process(
            "I teach at a school in Osaka and want to pass the JLPT N1.", "That sounds great!");

        assertThat(outcome.state()).isEqualTo(ExtractionState.COMMITTED);
        assertThat(outcome.trail()).containsExactly(
            ExtractionState.PENDING,
            ExtractionState.PROMPT_BUILT,
            ExtractionState.INVOKED,
            ExtractionState.PARSE_ATTEMPTED,
            ExtractionState.COMMITTED
        );
        assertThat(outcome.memoriesCreated()).isEqualTo(1);
        assertThat(outcome.goalsCreated()).isEqualTo(1);
        assertThat(outcome.profileFactsStored()).isEqualTo(1);
        assertThat(outcome.committedAnything()).isTrue();
        assertThat(goals.list(GoalStatus.ACTIVE)).extracting(Goal::title).containsExactly("Pass the JLPT N1");
        assertThat(completion.prompts.get(0)).contains("I teach at a school in Osaka").contains("2026-03-01");
    }

    @Test
    void shouldDiscardMalformedOutputWithoutWritingAnything() throws Exception {
        RecordingCompletion completion = new RecordingCompletion("""
            [{"content": "Likes tea", "category": "preference"}, {"content": 42}]
            """);

        ExtractionOutcome outcome = pipeline(completion).process("I like tea", "Noted.");

        assertThat(outcome.state()).isEqualTo(ExtractionState.DISCARDED);
        assertThat(outcome.trail()).endsWith(ExtractionState.PARSE_ATTEMPTED, ExtractionState.DISCARDED);
        assertThat(outcome.rowsWritten()).isZero();
        StoreStats stats = database.stats();
        assertThat(stats.memories()).isZero();
        assertThat(stats.goals()).isZero();
        assertThat(stats.profileAttributes()).isZero();
    }

    @Test
    void shouldDiscardWhenCompletionFails() {
        TextCompletion failing = prompt -> {
            throw new LlmException("upstream unavailable", 503, null);
        };

        ExtractionOutcome outcome = pipeline(failing).process("I like tea", "Noted.");

        assertThat(outcome.state()).isEqualTo(ExtractionState.DISCARDED);
        assertThat(outcome.trail()).doesNotContain(ExtractionState.INVOKED);
        assertThat(outcome.failure()).isEqualTo("completion failed");
    }

    @Test
    void shouldCommitNothingForEmptyClassification() throws Exception {
        ExtractionOutcome outcome = pipeline(new RecordingCompletion("[]")).process("hello", "hi");

        assertThat(outcome.state()).isEqualTo(ExtractionState.COMMITTED);
        assertThat(outcome.committedAnything()).isFalse();
        assertThat(memories.count()).isZero();
    }

    @Test
    void shouldNotDuplicateActiveGoal() throws Exception {
        String output = """
            {"goals": [{"title": "Run a marathon"}]}
            """;

        pipeline(new RecordingCompletion(output)).process("I want to run a marathon", "Go for it");
        ExtractionOutcome second = pipeline(new RecordingCompletion(output)).process("Still on the marathon", "Nice");

        assertThat(second.goalsCreated()).isZero();
        assertThat(goals.list(null)).hasSize(1);
    }

    private ExtractionPipeline pipeline(TextCompletion completion) {
        return new ExtractionPipeline(
            completion,
            new ExtractionResponseParser(),
            new MemoryCommitter(memories, new RecordLockManager(), 0.9),
            goals,
            profile,
            clock
        );
    }

    private static final class RecordingCompletion implements TextCompletion {
        private final String output;
        private final List<String> prompts = new ArrayList<>();

        private RecordingCompletion(String output) {
            this.output = output;
        }

        @Override
        public String complete(String prompt) {
            prompts.add(prompt);
            return output;
        }
    }
}
