package io.mnemo.core.extraction;

public enum ExtractionState {
    PENDING,
    PROMPT_BUILT,
    INVOKED,
    PARSE_ATTEMPTED,
    COMMITTED,
    DISCARDED;

    public boolean terminal() {
        return this == COMMITTED || this == DISCARDED;
    }
}
