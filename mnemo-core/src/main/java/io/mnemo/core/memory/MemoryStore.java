package io.mnemo.core.memory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MemoryStore {
    MemoryRecord create(NewMemory memory) throws IOException;

    /**
     * @throws io.mnemo.core.store.NotFoundException when the id is absent or archived
     */
    MemoryRecord get(long id) throws IOException;

    Optional<MemoryRecord> find(long id) throws IOException;

    /**
     * Full-text candidates for an FTS5 match expression, best text match first.
     */
    List<MemoryMatch> matchText(String matchExpression, MemoryCategory category, int limit) throws IOException;

    /** Increments the access count and stamps the access time. */
    MemoryRecord touch(long id) throws IOException;

    /** Re-affirms an existing record: new importance and a fresh {@code updatedAt}. */
    MemoryRecord reinforce(long id, double importance) throws IOException;

    MemoryRecord update(long id, String content, double importance) throws IOException;

    /**
     * Folds {@code absorbedId} into {@code survivorId} and archives the absorbed record, atomically.
     */
    MemoryRecord merge(long survivorId, long absorbedId, MergedMemory merged) throws IOException;

    MemoryRecord decay(long id, double importance, Instant decayedThrough) throws IOException;

    /** Live records, newest first. A null category lists every category. */
    List<MemoryRecord> list(MemoryCategory category) throws IOException;

    int count() throws IOException;
}
