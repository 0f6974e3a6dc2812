package io.mnemo.core.retrieval;

import io.mnemo.core.memory.TextSimilarity;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a free-text query into an FTS5 match expression: content words OR-ed together, each
 * expanded with its configured related terms. Stemming is left to the index tokenizer.
 */
public final class QueryAnalyzer {
    private static final Map<String, List<String>> DEFAULT_SYNONYMS = Map.ofEntries(
        Map.entry("job", List.of("work", "occupation", "profession", "career", "employ")),
        Map.entry("work", List.of("job", "occupation", "profession", "career")),
        Map.entry("occupation", List.of("job", "work", "profession")),
        Map.entry("hobby", List.of("enjoy", "like", "interest", "pastime")),
        Map.entry("live", List.of("reside", "home", "city", "based")),
        Map.entry("home", List.of("live", "reside", "city")),
        Map.entry("name", List.of("called")),
        Map.entry("food", List.of("eat", "cuisine", "dish")),
        Map.entry("drink", List.of("coffee", "tea", "beverage")),
        Map.entry("family", List.of("wife", "husband", "child", "children", "parent", "sibling")),
        Map.entry("study", List.of("learn", "student", "school", "university")),
        Map.entry("age", List.of("old", "born", "birthday"))
    );

    private final Map<String, List<String>> synonyms;

    public QueryAnalyzer(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms == null ? Map.of() : Map.copyOf(synonyms);
    }

    public static QueryAnalyzer withDefaults() {
        return new QueryAnalyzer(DEFAULT_SYNONYMS);
    }

    public static Map<String, List<String>> defaultSynonyms() {
        return DEFAULT_SYNONYMS;
    }

    public List<String> terms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : TextSimilarity.tokens(query)) {
            terms.addAll(expand(token));
        }
        return new ArrayList<>(terms);
    }

    /**
     * The token itself followed by its related terms, as they appear in the match expression.
     */
    public List<String> expand(String token) {
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(token);
        for (String related : synonyms.getOrDefault(token, List.of())) {
            String normalized = related.trim().toLowerCase(Locale.ROOT);
            if (normalized.matches("[\\p{L}\\p{N}]+")) {
                expanded.add(normalized);
            }
        }
        return new ArrayList<>(expanded);
    }

    /**
     * @return the match expression, or an empty string when the query has no content words
     */
    public String matchExpression(String query) {
        return terms(query).stream()
            .map(term -> "\"" + term + "\"")
            .collect(Collectors.joining(" OR "));
    }
}
