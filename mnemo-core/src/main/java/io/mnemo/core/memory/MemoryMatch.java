package io.mnemo.core.memory;

/**
 * A full-text candidate. {@code textScore} is the negated bm25 rank, higher is better.
 */
public record MemoryMatch(MemoryRecord record, double textScore) {
}
