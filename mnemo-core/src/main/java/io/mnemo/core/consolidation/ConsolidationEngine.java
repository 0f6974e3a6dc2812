package io.mnemo.core.consolidation;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.MemoryStore;
import io.mnemo.core.memory.MergedMemory;
import io.mnemo.core.memory.TextSimilarity;
import io.mnemo.core.provider.TextCompletion;
import io.mnemo.core.session.ConversationTurn;
import io.mnemo.core.session.Session;
import io.mnemo.core.session.SessionStore;
import io.mnemo.core.session.TurnRole;
import io.mnemo.core.store.RecordLockManager;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background compaction of accumulated memory and history. One run summarizes closed sessions,
 * merges near-duplicate memories, decays idle memories and archives old turns of summarized
 * sessions. Open sessions are never touched, and every unit is skipped if its lock is busy.
 */
public final class ConsolidationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ConsolidationEngine.class);
    private static final String EMPTY_SESSION_SUMMARY = "No conversation took place in this session.";
    private static final String SUMMARY_PROMPT = """
        You are a conversation summarization expert. Create a concise, accurate summary of the
        conversation below that preserves essential information.

        Guidelines:
        - Preserve key facts, decisions and important context about the user
        - Maintain chronological order of events
        - Keep user preferences and stated requirements
        - Include specific data points (dates, numbers, names)
        - Remove pleasantries and acknowledgments
        - Return only the summary text

        Conversation:
        %s
        """;

    private final MemoryStore memories;
    private final SessionStore sessions;
    private final TextCompletion completion;
    private final RecordLockManager locks;
    private final ConsolidationPolicy policy;
    private final Clock clock;

    public ConsolidationEngine(
        MemoryStore memories,
        SessionStore sessions,
        TextCompletion completion,
        RecordLockManager locks,
        ConsolidationPolicy policy,
        Clock clock
    ) {
        if (memories == null || sessions == null || completion == null || locks == null) {
            throw new IllegalArgumentException("memories, sessions, completion and locks must not be null");
        }
        this.memories = memories;
        this.sessions = sessions;
        this.completion = completion;
        this.locks = locks;
        this.policy = policy == null ? ConsolidationPolicy.defaults() : policy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized ConsolidationReport run() throws IOException {
        Instant startedAt = clock.instant();
        Tally tally = new Tally();
        summarizeClosedSessions(tally);
        mergeDuplicates(tally);
        decayIdleMemories(tally);
        archiveSummarizedTurns(tally);
        ConsolidationReport report = new ConsolidationReport(
            startedAt,
            clock.instant(),
            tally.summarized,
            tally.summaryFailures,
            tally.merged,
            tally.decayed,
            tally.archived,
            tally.busy
        );
        LOG.info(
            "Consolidation finished: {} sessions summarized ({} failed), {} memories merged, {} decayed, {} turns archived, {} busy units skipped",
            report.sessionsSummarized(),
            report.summaryFailures(),
            report.memoriesMerged(),
            report.memoriesDecayed(),
            report.turnsArchived(),
            report.skippedBusy()
        );
        return report;
    }

    private void summarizeClosedSessions(Tally tally) throws IOException {
        for (Session session : sessions.listClosed(true)) {
            boolean ran = locks.tryWithLock(RecordLockManager.sessionKey(session.id()), () -> {
                try {
                    String summary = summarize(session);
                    sessions.setSummary(session.id(), summary);
                    tally.summarized++;
                } catch (ConsolidationException e) {
                    tally.summaryFailures++;
                    LOG.warn("Summary of session {} deferred to next run: {}", session.id(), e.getMessage());
                } catch (IOException e) {
                    tally.summaryFailures++;
                    LOG.warn("Failed to store summary of session {}", session.id(), e);
                }
            });
            if (!ran) {
                tally.busy++;
            }
        }
    }

    String summarize(Session session) throws ConsolidationException, IOException {
        List<ConversationTurn> turns = sessions.listTurns(session.id());
        if (turns.isEmpty()) {
            return EMPTY_SESSION_SUMMARY;
        }
        String response;
        try {
            response = completion.complete(SUMMARY_PROMPT.formatted(transcript(turns)));
        } catch (IOException e) {
            throw new ConsolidationException("summary generation failed for session " + session.id(), e);
        }
        if (response == null || response.isBlank()) {
            throw new ConsolidationException("empty summary returned for session " + session.id());
        }
        return response.trim();
    }

    private String transcript(List<ConversationTurn> turns) {
        StringBuilder out = new StringBuilder();
        for (ConversationTurn turn : turns) {
            out.append(turn.role() == TurnRole.USER ? "User: " : "Assistant: ")
                .append(turn.content().trim().replaceAll("\\s+", " "))
                .append('\n');
        }
        String text = out.toString();
        if (text.length() > policy.maxTranscriptChars()) {
            text = text.substring(text.length() - policy.maxTranscriptChars());
        }
        return text;
    }

    private void mergeDuplicates(Tally tally) throws IOException {
        for (MemoryCategory category : MemoryCategory.values()) {
            List<MemoryRecord> live = new ArrayList<>(memories.list(category));
            live.sort(Comparator.comparingLong(MemoryRecord::id));
            for (int i = 0; i < live.size(); i++) {
                for (int j = i + 1; j < live.size() && live.get(i) != null; j++) {
                    MemoryRecord first = live.get(i);
                    MemoryRecord second = live.get(j);
                    if (second == null
                        || TextSimilarity.similarity(first.content(), second.content()) < policy.mergeThreshold()) {
                        continue;
                    }
                    Optional<MemoryRecord> survivor = mergePair(first, second, tally);
                    if (survivor.isEmpty()) {
                        continue;
                    }
                    tally.merged++;
                    if (survivor.get().id() == first.id()) {
                        live.set(i, survivor.get());
                        live.set(j, null);
                    } else {
                        live.set(j, survivor.get());
                        live.set(i, null);
                    }
                }
            }
        }
    }

    private Optional<MemoryRecord> mergePair(MemoryRecord first, MemoryRecord second, Tally tally) throws IOException {
        AtomicReference<MemoryRecord> result = new AtomicReference<>();
        boolean ran = locks.tryWithLock(RecordLockManager.memoryKey(first.id()), () -> {
            boolean inner = locks.tryWithLock(RecordLockManager.memoryKey(second.id()), () -> {
                Optional<MemoryRecord> a = memories.find(first.id());
                Optional<MemoryRecord> b = memories.find(second.id());
                if (a.isPresent() && b.isPresent()) {
                    result.set(merge(a.get(), b.get()));
                }
            });
            if (!inner) {
                tally.busy++;
            }
        });
        if (!ran) {
            tally.busy++;
        }
        return Optional.ofNullable(result.get());
    }

    private MemoryRecord merge(MemoryRecord a, MemoryRecord b) throws IOException {
        MemoryRecord survivor;
        MemoryRecord absorbed;
        if (a.importance() > b.importance() || (a.importance() == b.importance() && a.id() < b.id())) {
            survivor = a;
            absorbed = b;
        } else {
            survivor = b;
            absorbed = a;
        }
        String content = absorbed.content().length() > survivor.content().length()
            ? absorbed.content()
            : survivor.content();
        MergedMemory merged = new MergedMemory(
            content,
            Math.max(a.importance(), b.importance()),
            a.accessCount() + b.accessCount(),
            latest(a.updatedAt(), b.updatedAt()),
            latest(a.lastAccessedAt(), b.lastAccessedAt())
        );
        MemoryRecord result = memories.merge(survivor.id(), absorbed.id(), merged);
        LOG.debug("Merged memory {} into {}", absorbed.id(), survivor.id());
        return result;
    }

    private void decayIdleMemories(Tally tally) throws IOException {
        Instant now = clock.instant();
        long periodMillis = policy.decayPeriod().toMillis();
        for (MemoryRecord candidate : memories.list(null)) {
            if (!decayDue(candidate, now, periodMillis)) {
                continue;
            }
            boolean ran = locks.tryWithLock(RecordLockManager.memoryKey(candidate.id()), () -> {
                Optional<MemoryRecord> fresh = memories.find(candidate.id());
                if (fresh.isEmpty() || !decayDue(fresh.get(), now, periodMillis)) {
                    return;
                }
                MemoryRecord record = fresh.get();
                Instant since = latest(record.lastTouchedAt(), record.lastDecayedAt());
                long periods = Duration.between(since, now).toMillis() / periodMillis;
                double decayed = Math.max(
                    policy.minImportance(),
                    record.importance() * Math.pow(policy.decayFactor(), periods)
                );
                memories.decay(record.id(), decayed, since.plusMillis(periods * periodMillis));
                tally.decayed++;
            });
            if (!ran) {
                tally.busy++;
            }
        }
    }

    /**
     * Idle past the decay window, above the floor, and at least one full period since the last
     * decay or access.
     */
    private boolean decayDue(MemoryRecord record, Instant now, long periodMillis) {
        Instant touched = record.lastTouchedAt();
        if (touched == null || record.importance() <= policy.minImportance()) {
            return false;
        }
        if (Duration.between(touched, now).compareTo(policy.decayWindow()) < 0) {
            return false;
        }
        Instant since = latest(touched, record.lastDecayedAt());
        return Duration.between(since, now).toMillis() >= periodMillis;
    }

    private void archiveSummarizedTurns(Tally tally) throws IOException {
        Instant cutoff = clock.instant().minus(policy.turnRetention());
        for (Session session : sessions.listClosed(false)) {
            if (!session.hasSummary()) {
                continue;
            }
            boolean ran = locks.tryWithLock(RecordLockManager.sessionKey(session.id()), () -> {
                tally.archived += sessions.archiveTurnsBefore(session.id(), cutoff);
            });
            if (!ran) {
                tally.busy++;
            }
        }
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static final class Tally {
        private int summarized;
        private int summaryFailures;
        private int merged;
        private int decayed;
        private int archived;
        private int busy;
    }
}
