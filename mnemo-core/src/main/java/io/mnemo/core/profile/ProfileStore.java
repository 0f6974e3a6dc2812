package io.mnemo.core.profile;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

public interface ProfileStore {
    /** Inserts or replaces the value stored under {@code key}. */
    ProfileAttribute upsert(String key, String value, String category) throws IOException;

    /**
     * Attributes for the given keys, or every attribute when {@code keys} is null or empty.
     * Unknown keys are omitted.
     */
    List<ProfileAttribute> get(Collection<String> keys) throws IOException;

    boolean delete(String key) throws IOException;

    String formatForPrompt() throws IOException;
}
