package io.mnemo.core.memory;

/**
 * @param merged true when an existing near-duplicate was reinforced instead of a new row created
 */
public record CommitResult(MemoryRecord record, boolean merged) {
}
