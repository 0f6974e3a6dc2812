package io.mnemo.core.tool;

public record ToolError(ToolErrorCode code, String message) {
}
