package io.mnemo.core.tool;

import java.util.Optional;

/**
 * The closed set of operations the model may invoke. Adding one is a schema change.
 */
public enum ToolOperation {
    MEMORY_SEARCH("memory_search"),
    MEMORY_STORE("memory_store"),
    GOAL_LIST("goal_list"),
    GOAL_UPDATE("goal_update"),
    GOAL_CREATE("goal_create"),
    PROFILE_GET("profile_get"),
    PROFILE_SET("profile_set");

    private final String wireName;

    ToolOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolOperation> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (ToolOperation operation : values()) {
            if (operation.wireName.equals(trimmed)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
