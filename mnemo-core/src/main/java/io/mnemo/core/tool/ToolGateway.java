package io.mnemo.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.session.ConversationContext;
import io.mnemo.core.store.ConstraintViolationException;
import io.mnemo.core.store.NotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for tool invocations issued mid-generation. Failures come back as structured
 * results and never abort the surrounding turn.
 */
public final class ToolGateway {
    public static final String UNABLE_TO_COMPLETE = "unable to complete";
    private static final Logger LOG = LoggerFactory.getLogger(ToolGateway.class);

    private final ToolRegistry registry;
    private final Map<String, Object> services;
    private final ObjectMapper mapper;

    public ToolGateway(ToolRegistry registry, Map<String, Object> services) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.services = services == null ? Map.of() : Map.copyOf(services);
        this.mapper = jsonMapper();
    }

    public static ObjectMapper jsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    public ToolResult invoke(String name, Map<String, Object> arguments, ConversationContext conversation) {
        Optional<ToolOperation> operation = ToolOperation.fromWireName(name);
        if (operation.isEmpty()) {
            return ToolResult.failure(null, ToolErrorCode.TOOL_NOT_FOUND, "Unknown tool: " + name);
        }
        return invoke(operation.get(), arguments, conversation);
    }

    public ToolResult invoke(ToolOperation operation, Map<String, Object> arguments, ConversationContext conversation) {
        Optional<Tool> tool = registry.find(operation);
        if (tool.isEmpty()) {
            return ToolResult.failure(operation, ToolErrorCode.TOOL_NOT_FOUND, "Unknown tool: " + operation.wireName());
        }
        ToolContext context = new ToolContext(conversation, services);
        try {
            return ToolResult.success(operation, tool.get().execute(new ToolArguments(arguments), context));
        } catch (ToolValidationException e) {
            return ToolResult.failure(operation, ToolErrorCode.TOOL_VALIDATION_ERROR, e.getMessage());
        } catch (NotFoundException e) {
            return ToolResult.failure(operation, ToolErrorCode.NOT_FOUND, e.getMessage());
        } catch (ConstraintViolationException e) {
            return ToolResult.failure(operation, ToolErrorCode.CONSTRAINT_VIOLATION, e.getMessage());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Tool {} failed", operation.wireName(), e);
            return ToolResult.failure(operation, ToolErrorCode.STORE_ERROR, UNABLE_TO_COMPLETE);
        }
    }

    public String invokeAsJson(String name, Map<String, Object> arguments, ConversationContext conversation) {
        return toJson(invoke(name, arguments, conversation));
    }

    public String toJson(ToolResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.success()) {
            body.put("success", true);
            result.payload().forEach((key, value) -> {
                if (!"success".equals(key)) {
                    body.put(key, value);
                }
            });
        } else {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("code", result.error().code().name());
            error.put("message", result.error().message());
            body.put("success", false);
            body.put("error", error);
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize result of {}", result.operation(), e);
            return "{\"success\":false,\"error\":{\"code\":\"STORE_ERROR\",\"message\":\"" + UNABLE_TO_COMPLETE + "\"}}";
        }
    }

    /**
     * Tool definitions in the function-calling shape expected by chat completion endpoints.
     */
    public List<Map<String, Object>> definitions() {
        List<Map<String, Object>> definitions = new ArrayList<>();
        for (ToolOperation operation : ToolOperation.values()) {
            registry.find(operation).ifPresent(tool -> {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", operation.wireName());
                function.put("description", tool.description());
                function.put("parameters", tool.schema());
                definitions.add(Map.of("type", "function", "function", function));
            });
        }
        return definitions;
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
