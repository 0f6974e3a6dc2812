package io.mnemo.core.retrieval;

import io.mnemo.core.memory.MemoryRecord;

public record ScoredMemory(MemoryRecord record, double score, double textMatch) {
}
