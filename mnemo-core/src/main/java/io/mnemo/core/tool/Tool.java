package io.mnemo.core.tool;

import java.io.IOException;
import java.util.Map;

public interface Tool {
    ToolOperation operation();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Executes one invocation atomically.
     *
     * @return the success payload; failures are thrown and mapped by {@link ToolGateway}
     */
    Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException;
}
