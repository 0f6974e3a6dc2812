package io.mnemo.core.provider;

import java.io.IOException;

/**
 * Prompt in, text out. Never yields tool calls.
 */
@FunctionalInterface
public interface TextCompletion {
    String complete(String prompt) throws IOException;
}
