package io.mnemo.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single invocation requested by the inference capability during generation.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        Objects.requireNonNull(name, "name must not be null");
        id = id == null ? "" : id;
        // JSON arguments may carry explicit nulls, which Map.copyOf rejects
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
