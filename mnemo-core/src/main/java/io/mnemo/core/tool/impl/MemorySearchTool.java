package io.mnemo.core.tool.impl;

import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.retrieval.RelevanceRanker;
import io.mnemo.core.retrieval.ScoredMemory;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import io.mnemo.core.tool.ToolValidationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MemorySearchTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.MEMORY_SEARCH;
    }

    @Override
    public String description() {
        return "Search long-term memories about the user, most relevant first";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "query", Map.of("type", "string", "description", "What to look for"),
                "category", Map.of("type", "string", "enum", Schemas.categoryValues()),
                "limit", Map.of("type", "integer", "minimum", 1, "default", RelevanceRanker.DEFAULT_LIMIT)
            ),
            "required", List.of("query")
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        RelevanceRanker ranker = context.requireService(ToolContext.RELEVANCE_RANKER, RelevanceRanker.class);
        if (!arguments.has("query")) {
            throw new ToolValidationException("'query' is required");
        }
        String query = arguments.optionalString("query");
        String rawCategory = arguments.optionalString("category");
        MemoryCategory category = null;
        if (rawCategory != null && !rawCategory.isBlank()) {
            try {
                category = MemoryCategory.fromValue(rawCategory);
            } catch (IllegalArgumentException e) {
                throw new ToolValidationException("'category' must be one of " + String.join(", ", Schemas.categoryValues()));
            }
        }
        Integer limit = arguments.optionalInt("limit");
        if (limit != null && limit <= 0) {
            throw new ToolValidationException("'limit' must be greater than 0");
        }

        List<ScoredMemory> hits = ranker.search(query, category, limit == null ? RelevanceRanker.DEFAULT_LIMIT : limit);
        List<Map<String, Object>> memories = new ArrayList<>();
        for (ScoredMemory hit : hits) {
            memories.add(view(hit));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("memories", memories);
        return payload;
    }

    static Map<String, Object> view(ScoredMemory hit) {
        MemoryRecord record = hit.record();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", record.id());
        view.put("content", record.content());
        view.put("category", record.category().value());
        view.put("importance", record.importance());
        view.put("access_count", record.accessCount());
        view.put("last_accessed_at", record.lastAccessedAt());
        view.put("created_at", record.createdAt());
        view.put("updated_at", record.updatedAt());
        view.put("score", Math.round(hit.score() * 1000.0) / 1000.0);
        return view;
    }
}
