package io.mnemo.core.tool;

import java.util.Map;

/**
 * Outcome of one gateway invocation. Exactly one of {@code payload} and {@code error} is set.
 */
public record ToolResult(ToolOperation operation, Map<String, Object> payload, ToolError error) {

    public static ToolResult success(ToolOperation operation, Map<String, Object> payload) {
        return new ToolResult(operation, payload == null ? Map.of("success", true) : payload, null);
    }

    public static ToolResult failure(ToolOperation operation, ToolErrorCode code, String message) {
        return new ToolResult(operation, null, new ToolError(code, message));
    }

    public boolean success() {
        return error == null;
    }
}
