package io.mnemo.core.extraction;

import java.util.List;

public record ExtractionResult(
    List<ExtractedMemory> memories,
    List<ExtractedGoal> goals,
    List<ExtractedProfileFact> profile
) {
    public ExtractionResult {
        memories = memories == null ? List.of() : List.copyOf(memories);
        goals = goals == null ? List.of() : List.copyOf(goals);
        profile = profile == null ? List.of() : List.copyOf(profile);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return memories.isEmpty() && goals.isEmpty() && profile.isEmpty();
    }
}
