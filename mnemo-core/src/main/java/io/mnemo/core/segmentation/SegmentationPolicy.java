package io.mnemo.core.segmentation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class SegmentationPolicy {
    public static final List<String> DEFAULT_EXPLICIT_PATTERNS = List.of(
        "(?i)\\b(new topic|change (the )?(topic|subject)|something else|start over|moving on)\\b",
        "(?i)\\blet'?s talk about\\b",
        "話題を変え",
        "別の話",
        "新しい話題",
        "話は変わ"
    );

    private final boolean resetOnCommit;
    private final int maxTurns;
    private final int maxEstimatedTokens;
    private final List<Pattern> explicitPatterns;

    public SegmentationPolicy(boolean resetOnCommit, int maxTurns, int maxEstimatedTokens, List<String> explicitPatterns) {
        if (maxTurns <= 0 || maxEstimatedTokens <= 0) {
            throw new IllegalArgumentException("maxTurns and maxEstimatedTokens must be positive");
        }
        this.resetOnCommit = resetOnCommit;
        this.maxTurns = maxTurns;
        this.maxEstimatedTokens = maxEstimatedTokens;
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : explicitPatterns == null ? DEFAULT_EXPLICIT_PATTERNS : explicitPatterns) {
            try {
                compiled.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid segmentation pattern: " + pattern, e);
            }
        }
        this.explicitPatterns = List.copyOf(compiled);
    }

    public static SegmentationPolicy defaults() {
        return new SegmentationPolicy(true, 20, 3000, DEFAULT_EXPLICIT_PATTERNS);
    }

    public boolean resetOnCommit() {
        return resetOnCommit;
    }

    public int maxTurns() {
        return maxTurns;
    }

    public int maxEstimatedTokens() {
        return maxEstimatedTokens;
    }

    public boolean isExplicitReset(String userText) {
        if (userText == null || userText.isBlank()) {
            return false;
        }
        for (Pattern pattern : explicitPatterns) {
            if (pattern.matcher(userText).find()) {
                return true;
            }
        }
        return false;
    }

    /** Rough token estimate: four characters per token. */
    public static int estimateTokens(int characters) {
        return characters / 4;
    }
}
