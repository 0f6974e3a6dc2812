package io.mnemo.core.tool;

import io.mnemo.core.session.ConversationContext;
import java.util.Map;

public record ToolContext(ConversationContext conversation, Map<String, Object> services) {
    public static final String MEMORY_COMMITTER = "memoryCommitter";
    public static final String RELEVANCE_RANKER = "relevanceRanker";
    public static final String GOAL_STORE = "goalStore";
    public static final String PROFILE_STORE = "profileStore";

    public ToolContext {
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }

    public <T> T requireService(String key, Class<T> type) {
        T service = service(key, type);
        if (service == null) {
            throw new IllegalStateException("Service '" + key + "' is not configured");
        }
        return service;
    }
}
