package io.mnemo.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
