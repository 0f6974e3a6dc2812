package io.mnemo.core.model;

import io.mnemo.core.extraction.ExtractionOutcome;
import io.mnemo.core.segmentation.SegmentationDecision;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TurnResult(
    String content,
    List<ChatMessage> transcript,
    Map<String, Object> usage,
    ExtractionOutcome extraction,
    SegmentationDecision segmentation,
    boolean aborted
) {
    public TurnResult {
        content = content == null ? "" : content;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static TurnResult aborted(List<ChatMessage> transcript) {
        return new TurnResult("", transcript, Map.of(), null, null, true);
    }
}
