package io.mnemo.core.extraction;

import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.memory.CommitResult;
import io.mnemo.core.memory.MemoryCommitter;
import io.mnemo.core.profile.ProfileStore;
import io.mnemo.core.provider.TextCompletion;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a finished (user, assistant) exchange with a text completion and commits what is
 * worth remembering. Never throws and never alters the user-visible response; a parse failure
 * discards the whole attempt.
 */
public final class ExtractionPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final TextCompletion completion;
    private final ExtractionResponseParser parser;
    private final MemoryCommitter committer;
    private final GoalStore goals;
    private final ProfileStore profile;
    private final Clock clock;

    public ExtractionPipeline(
        TextCompletion completion,
        ExtractionResponseParser parser,
        MemoryCommitter committer,
        GoalStore goals,
        ProfileStore profile,
        Clock clock
    ) {
        if (completion == null || committer == null || goals == null || profile == null) {
            throw new IllegalArgumentException("completion, committer, goals and profile must not be null");
        }
        this.completion = completion;
        this.parser = parser == null ? new ExtractionResponseParser() : parser;
        this.committer = committer;
        this.goals = goals;
        this.profile = profile;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ExtractionOutcome process(String userText, String assistantText) {
        List<ExtractionState> trail = new ArrayList<>();
        trail.add(ExtractionState.PENDING);
        if (userText == null || userText.isBlank()) {
            return discarded(trail, "nothing to classify");
        }

        String prompt = ExtractionPrompt.build(userText, assistantText, LocalDate.now(clock));
        trail.add(ExtractionState.PROMPT_BUILT);

        String raw;
        try {
            raw = completion.complete(prompt);
        } catch (IOException e) {
            LOG.warn("Extraction completion failed: {}", e.getMessage());
            LOG.debug("Extraction completion failure", e);
            return discarded(trail, "completion failed");
        }
        trail.add(ExtractionState.INVOKED);

        ExtractionResult result;
        trail.add(ExtractionState.PARSE_ATTEMPTED);
        try {
            result = parser.parse(raw);
        } catch (ExtractionParseException e) {
            LOG.debug("Discarding extraction output: {}", e.getMessage());
            return discarded(trail, e.getMessage());
        }

        return commit(trail, result);
    }

    private ExtractionOutcome commit(List<ExtractionState> trail, ExtractionResult result) {
        int created = 0;
        int merged = 0;
        int goalsCreated = 0;
        int profileStored = 0;
        List<String> failures = new ArrayList<>();

        for (ExtractedMemory memory : result.memories()) {
            try {
                CommitResult committed = committer.commit(memory.toNewMemory());
                if (committed.merged()) {
                    merged++;
                } else {
                    created++;
                }
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to commit extracted memory: {}", e.getMessage());
                failures.add("memory");
            }
        }
        for (ExtractedGoal goal : result.goals()) {
            try {
                if (goals.findActiveByTitle(goal.title()).isEmpty()) {
                    goals.create(goal.toNewGoal());
                    goalsCreated++;
                } else {
                    LOG.debug("Active goal '{}' already exists", goal.title());
                }
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to commit extracted goal: {}", e.getMessage());
                failures.add("goal");
            }
        }
        for (ExtractedProfileFact fact : result.profile()) {
            try {
                profile.upsert(fact.key(), fact.value(), fact.category());
                profileStored++;
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to commit extracted profile fact {}: {}", fact.key(), e.getMessage());
                failures.add("profile");
            }
        }

        trail.add(ExtractionState.COMMITTED);
        if (created + merged + goalsCreated + profileStored > 0) {
            LOG.debug("Extraction committed {} new, {} merged memories, {} goals, {} profile facts",
                created, merged, goalsCreated, profileStored);
        }
        return new ExtractionOutcome(
            ExtractionState.COMMITTED,
            trail,
            created,
            merged,
            goalsCreated,
            profileStored,
            failures.isEmpty() ? null : "failed to store " + String.join(", ", failures)
        );
    }

    private static ExtractionOutcome discarded(List<ExtractionState> trail, String reason) {
        trail.add(ExtractionState.DISCARDED);
        return new ExtractionOutcome(ExtractionState.DISCARDED, trail, 0, 0, 0, 0, reason);
    }
}
