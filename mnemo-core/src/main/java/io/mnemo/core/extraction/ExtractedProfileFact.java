package io.mnemo.core.extraction;

public record ExtractedProfileFact(String key, String value, String category) {
}
