package io.mnemo.core.extraction;

import java.time.LocalDate;

final class ExtractionPrompt {
    private static final String TEMPLATE = """
        You are a memory extraction assistant. Analyze one conversation exchange and extract
        information about the user that is worth remembering long-term.

        Memory categories:
        - fact: stable facts about the user (job, home, family, background)
        - preference: likes, dislikes, how the user wants things done
        - personality: traits and dispositions
        - skill: abilities and expertise
        - goal_related: context around something the user is working towards

        Rules:
        - Only extract information about the user, stated or clearly implied by the user
        - Write each memory as one short third-person statement without the subject, e.g. "works as a teacher in Osaka"
        - Every memory needs an importance from 0.0 (trivial) to 1.0 (critical)
        - Goals are concrete objectives the user wants to achieve; include deadline (YYYY-MM-DD) and priority (low/medium/high) if mentioned
        - Profile entries are short key/value facts such as name, location or timezone
        - Use empty lists if nothing is worth remembering
        - Return ONLY a raw JSON object, no markdown, no explanations

        Today is %s.

        User message: %s
        Assistant response: %s

        Response format:
        {"memories": [{"content": "...", "category": "fact|preference|personality|skill|goal_related", "importance": 0.0}],
         "goals": [{"title": "...", "description": "...", "deadline": "YYYY-MM-DD or null", "priority": "low|medium|high"}],
         "profile": [{"key": "short_key_name", "value": "...", "category": "personal|work|hobby|preference"}]}
        """;

    private ExtractionPrompt() {
    }

    static String build(String userText, String assistantText, LocalDate today) {
        return TEMPLATE.formatted(today, quote(userText), quote(assistantText));
    }

    private static String quote(String text) {
        String normalized = text == null ? "" : text.trim();
        return "\"" + normalized.replace("\"", "'") + "\"";
    }
}
