package io.mnemo.core.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.memory.MemoryCategory;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses classification output. Accepts a bare array of memories or an object with
 * {@code memories}, {@code goals} and {@code profile} arrays. Markdown fences are tolerated;
 * any schema breach rejects the whole response.
 */
public final class ExtractionResponseParser {
    private final ObjectMapper mapper;

    public ExtractionResponseParser() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public ExtractionResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExtractionResult parse(String raw) throws ExtractionParseException {
        String json = stripFences(raw);
        if (json.isEmpty()) {
            throw new ExtractionParseException("empty classification output");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionParseException("classification output is not JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ExtractionParseException("empty classification output");
        }
        if (root.isArray()) {
            return new ExtractionResult(memories(root), List.of(), List.of());
        }
        if (!root.isObject()) {
            throw new ExtractionParseException("classification output must be a JSON array or object");
        }
        return new ExtractionResult(
            memories(optionalArray(root, "memories")),
            goals(optionalArray(root, "goals")),
            profile(root.has("profile") ? optionalArray(root, "profile") : optionalArray(root, "user_profile"))
        );
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }

    private List<ExtractedMemory> memories(JsonNode array) throws ExtractionParseException {
        List<ExtractedMemory> out = new ArrayList<>();
        for (JsonNode item : array) {
            requireObject(item, "memory");
            String content = requireText(item, "content", "memory");
            MemoryCategory category;
            try {
                category = MemoryCategory.fromValue(requireText(item, "category", "memory"));
            } catch (IllegalArgumentException e) {
                throw new ExtractionParseException(e.getMessage(), e);
            }
            JsonNode importanceNode = item.get("importance");
            if (importanceNode == null || importanceNode.isNull()) {
                throw new ExtractionParseException("memory is missing 'importance'");
            }
            if (!importanceNode.isNumber()) {
                throw new ExtractionParseException("memory importance must be a number");
            }
            double importance = importanceNode.asDouble();
            if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
                throw new ExtractionParseException("memory importance out of range: " + importance);
            }
            out.add(new ExtractedMemory(content, category, importance));
        }
        return out;
    }

    private List<ExtractedGoal> goals(JsonNode array) throws ExtractionParseException {
        List<ExtractedGoal> out = new ArrayList<>();
        for (JsonNode item : array) {
            requireObject(item, "goal");
            String title = requireText(item, "title", "goal");
            String description = optionalText(item, "description");
            LocalDate deadline = null;
            String rawDeadline = optionalText(item, "deadline");
            if (rawDeadline != null && !"null".equals(rawDeadline.toLowerCase(Locale.ROOT))) {
                try {
                    deadline = LocalDate.parse(rawDeadline);
                } catch (DateTimeParseException e) {
                    throw new ExtractionParseException("goal deadline is not an ISO date: " + rawDeadline, e);
                }
            }
            GoalPriority priority = null;
            String rawPriority = optionalText(item, "priority");
            if (rawPriority != null) {
                try {
                    priority = GoalPriority.fromValue(rawPriority);
                } catch (IllegalArgumentException e) {
                    throw new ExtractionParseException(e.getMessage(), e);
                }
            }
            out.add(new ExtractedGoal(title, description, deadline, priority));
        }
        return out;
    }

    private List<ExtractedProfileFact> profile(JsonNode array) throws ExtractionParseException {
        List<ExtractedProfileFact> out = new ArrayList<>();
        for (JsonNode item : array) {
            requireObject(item, "profile entry");
            out.add(new ExtractedProfileFact(
                requireText(item, "key", "profile entry"),
                requireText(item, "value", "profile entry"),
                optionalText(item, "category")
            ));
        }
        return out;
    }

    private static JsonNode optionalArray(JsonNode root, String field) throws ExtractionParseException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!node.isArray()) {
            throw new ExtractionParseException("'" + field + "' must be an array");
        }
        return node;
    }

    private static void requireObject(JsonNode item, String kind) throws ExtractionParseException {
        if (item == null || !item.isObject()) {
            throw new ExtractionParseException(kind + " entries must be JSON objects");
        }
    }

    private static String requireText(JsonNode item, String field, String kind) throws ExtractionParseException {
        JsonNode node = item.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ExtractionParseException(kind + " is missing '" + field + "'");
        }
        return node.asText().trim();
    }

    private static String optionalText(JsonNode item, String field) throws ExtractionParseException {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ExtractionParseException("'" + field + "' must be a string");
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
