package io.mnemo.core.extraction;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.NewMemory;

public record ExtractedMemory(String content, MemoryCategory category, double importance) {

    public NewMemory toNewMemory() {
        return new NewMemory(content, category, importance);
    }
}
