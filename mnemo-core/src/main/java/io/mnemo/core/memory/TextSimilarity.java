package io.mnemo.core.memory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Near-duplicate heuristic for short memory statements: the larger of the normalized
 * edit-distance ratio and an even blend of token Jaccard and containment.
 */
public final class TextSimilarity {
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her", "i", "me", "my",
        "what", "which", "who", "do", "does", "did", "am", "user", "s"
    );

    private TextSimilarity() {
    }

    public static double similarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        return Math.max(editRatio(a, b), tokenOverlap(tokens(a), tokens(b)));
    }

    /**
     * Lower-cased content words with stop words removed and a plural/third-person "s" trimmed.
     */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (raw.isEmpty() || STOP_WORDS.contains(raw)) {
                continue;
            }
            out.add(stem(raw));
        }
        return out;
    }

    public static boolean isStopWord(String token) {
        return STOP_WORDS.contains(token);
    }

    static double editRatio(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    static double tokenOverlap(List<String> left, List<String> right) {
        Set<String> a = new LinkedHashSet<>(left);
        Set<String> b = new LinkedHashSet<>(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        double jaccard = (double) intersection.size() / union.size();
        double containment = (double) intersection.size() / Math.min(a.size(), b.size());
        return 0.5 * jaccard + 0.5 * containment;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").replaceAll("[.!?]+$", "");
    }

    private static String stem(String token) {
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
