package io.mnemo.core.retrieval;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryMatch;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.MemoryStore;
import io.mnemo.core.memory.TextSimilarity;
import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.NotFoundException;
import io.mnemo.core.store.RecordLockManager;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores stored memories against a query. Candidates come from the full-text index; every
 * returned record is touched afterwards, the returned snapshot being the pre-touch read.
 */
public final class RelevanceRanker {
    public static final int DEFAULT_LIMIT = 5;
    private static final Logger LOG = LoggerFactory.getLogger(RelevanceRanker.class);
    private static final int MIN_CANDIDATES = 50;
    private static final double MIN_INDEX_MATCH = 0.05;

    private final MemoryStore store;
    private final RecordLockManager locks;
    private final QueryAnalyzer analyzer;
    private final RankingWeights weights;
    private final Clock clock;

    public RelevanceRanker(
        MemoryStore store,
        RecordLockManager locks,
        QueryAnalyzer analyzer,
        RankingWeights weights,
        Clock clock
    ) {
        if (store == null || locks == null) {
            throw new IllegalArgumentException("store and locks must not be null");
        }
        this.store = store;
        this.locks = locks;
        this.analyzer = analyzer == null ? QueryAnalyzer.withDefaults() : analyzer;
        this.weights = weights == null ? RankingWeights.defaults() : weights;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public List<ScoredMemory> search(String query, MemoryCategory category) throws IOException {
        return search(query, category, DEFAULT_LIMIT);
    }

    public List<ScoredMemory> search(String query, MemoryCategory category, int limit) throws IOException {
        if (limit <= 0) {
            throw new ConstraintViolationException("limit must be greater than 0 but was " + limit);
        }
        List<ScoredMemory> ranked = rank(query, category, limit);
        for (ScoredMemory hit : ranked) {
            long id = hit.record().id();
            try {
                locks.withLock(RecordLockManager.memoryKey(id), () -> store.touch(id));
            } catch (NotFoundException e) {
                LOG.debug("Memory {} was archived before it could be touched", id);
            }
        }
        return ranked;
    }

    /**
     * Ranks without touching. Used when assembling context where retrieval should not count as access.
     */
    public List<ScoredMemory> rank(String query, MemoryCategory category, int limit) throws IOException {
        if (limit <= 0) {
            throw new ConstraintViolationException("limit must be greater than 0 but was " + limit);
        }
        String expression = analyzer.matchExpression(query);
        List<MemoryMatch> candidates;
        if (expression.isEmpty()) {
            candidates = new ArrayList<>();
            for (MemoryRecord record : store.list(category)) {
                candidates.add(new MemoryMatch(record, 0.0));
            }
        } else {
            candidates = store.matchText(expression, category, Math.max(limit * 4, MIN_CANDIDATES));
        }

        Instant now = clock.instant();
        List<String> queryTokens = expression.isEmpty()
            ? List.of()
            : TextSimilarity.tokens(query).stream().distinct().toList();
        return candidates.stream()
            .map(candidate -> score(candidate.record(), textMatch(query, queryTokens, candidate.record()), now))
            .sorted(Comparator.comparingDouble(ScoredMemory::score).reversed()
                .thenComparing((ScoredMemory scored) -> scored.record().createdAt(), Comparator.reverseOrder())
                .thenComparing((ScoredMemory scored) -> scored.record().id(), Comparator.reverseOrder()))
            .limit(limit)
            .toList();
    }

    ScoredMemory score(MemoryRecord record, double match, Instant now) {
        double score = weights.text() * match
            + weights.importance() * record.importance()
            + weights.access() * Math.log1p(record.accessCount())
            + weights.recency() * recency(record, now);
        return new ScoredMemory(record, score, match);
    }

    /**
     * Match in [0, 1] measured against the query alone: the share of query words the content
     * mentions, directly or through a related term, blended evenly with whole-statement similarity.
     * bm25 is only used to pick candidates; its scale collapses when a term occurs in most rows.
     */
    double textMatch(String query, List<String> queryTokens, MemoryRecord record) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        List<String> contentTokens = TextSimilarity.tokens(record.content());
        int found = 0;
        for (String token : queryTokens) {
            if (analyzer.expand(token).stream().anyMatch(term -> mentions(contentTokens, term))) {
                found++;
            }
        }
        double coverage = (double) found / queryTokens.size();
        double match = 0.5 * coverage + 0.5 * TextSimilarity.similarity(query, record.content());
        // the index stems more aggressively than the word check, so its hits keep a floor
        return Math.max(MIN_INDEX_MATCH, match);
    }

    private static boolean mentions(List<String> contentTokens, String term) {
        for (String token : contentTokens) {
            if (token.equals(term) || term.length() >= 4 && token.startsWith(term)) {
                return true;
            }
        }
        return false;
    }

    private double recency(MemoryRecord record, Instant now) {
        Instant reference = record.lastTouchedAt();
        if (reference == null) {
            return 0.0;
        }
        long elapsed = Math.max(0L, Duration.between(reference, now).toMillis());
        double halfLives = (double) elapsed / weights.recencyHalfLife().toMillis();
        return Math.pow(0.5, halfLives);
    }
}
