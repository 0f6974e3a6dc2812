package io.mnemo.core.memory;

import io.mnemo.core.store.NotFoundException;
import io.mnemo.core.store.RecordLockManager;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes memories with near-duplicate detection. A candidate whose similarity to a live record in
 * the same category reaches the duplicate threshold reinforces that record: importance becomes the
 * larger of the two and {@code updatedAt} moves forward.
 */
public final class MemoryCommitter {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryCommitter.class);

    private final MemoryStore store;
    private final RecordLockManager locks;
    private final double duplicateThreshold;

    public MemoryCommitter(MemoryStore store, RecordLockManager locks, double duplicateThreshold) {
        if (store == null || locks == null) {
            throw new IllegalArgumentException("store and locks must not be null");
        }
        if (duplicateThreshold <= 0.0 || duplicateThreshold > 1.0) {
            throw new IllegalArgumentException("duplicateThreshold must be within (0.0, 1.0]");
        }
        this.store = store;
        this.locks = locks;
        this.duplicateThreshold = duplicateThreshold;
    }

    public CommitResult commit(NewMemory memory) throws IOException {
        return locks.withLock("commit:" + memory.category().value(), () -> commitLocked(memory));
    }

    private CommitResult commitLocked(NewMemory memory) throws IOException {
        MemoryRecord duplicate = null;
        double best = 0.0;
        for (MemoryRecord existing : store.list(memory.category())) {
            double similarity = TextSimilarity.similarity(existing.content(), memory.content());
            if (similarity >= duplicateThreshold && similarity > best) {
                duplicate = existing;
                best = similarity;
            }
        }
        if (duplicate != null) {
            long id = duplicate.id();
            double importance = Math.max(duplicate.importance(), memory.importance());
            try {
                MemoryRecord reinforced = locks.withLock(
                    RecordLockManager.memoryKey(id),
                    () -> store.reinforce(id, importance)
                );
                LOG.debug("Reinforced memory {} (similarity {})", id, best);
                return new CommitResult(reinforced, true);
            } catch (NotFoundException e) {
                LOG.debug("Duplicate memory {} was archived concurrently, creating a new record", id);
            }
        }
        return new CommitResult(store.create(memory), false);
    }
}
