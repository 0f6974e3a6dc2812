package io.mnemo.core.tool;

public enum ToolErrorCode {
    TOOL_NOT_FOUND,
    TOOL_VALIDATION_ERROR,
    NOT_FOUND,
    CONSTRAINT_VIOLATION,
    STORE_ERROR
}
