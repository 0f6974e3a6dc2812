package io.mnemo.core.agent;

public record AgentSettings(
    String systemPrompt,
    String model,
    int maxToolIterations,
    int recallLimit
) {
    public static final String DEFAULT_SYSTEM_PROMPT = """
        You are a personal assistant with long-term memory. Use memory_search before answering \
        questions about the user, memory_store for durable facts they share, and the goal tools to \
        keep track of what they are working towards.""";

    public AgentSettings {
        maxToolIterations = Math.max(1, maxToolIterations);
        recallLimit = Math.max(0, recallLimit);
        model = model == null || model.isBlank() ? "gpt-4o-mini" : model;
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }
}
