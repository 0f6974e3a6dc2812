package io.mnemo.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the raw arguments of an invocation. Type mismatches raise
 * {@link ToolValidationException}.
 */
public final class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new ToolValidationException("'" + name + "' is required");
        }
        return value;
    }

    public String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text.trim();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw new ToolValidationException("'" + name + "' must be a string");
    }

    public long requireLong(String name) {
        Long value = optionalLong(name);
        if (value == null) {
            throw new ToolValidationException("'" + name + "' is required");
        }
        return value;
    }

    public Long optionalLong(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            double raw = number.doubleValue();
            if (raw != Math.rint(raw) || Double.isInfinite(raw)) {
                throw new ToolValidationException("'" + name + "' must be an integer");
            }
            return (long) raw;
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolValidationException("'" + name + "' must be an integer");
            }
        }
        throw new ToolValidationException("'" + name + "' must be an integer");
    }

    public Integer optionalInt(String name) {
        Long value = optionalLong(name);
        if (value == null) {
            return null;
        }
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ToolValidationException("'" + name + "' is out of range");
        }
        return value.intValue();
    }

    public Double optionalDouble(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolValidationException("'" + name + "' must be a number");
            }
        }
        throw new ToolValidationException("'" + name + "' must be a number");
    }

    public List<String> optionalStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            return text.isBlank() ? List.of() : List.of(text.trim());
        }
        if (!(value instanceof List<?> list)) {
            throw new ToolValidationException("'" + name + "' must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String text)) {
                throw new ToolValidationException("'" + name + "' must be a list of strings");
            }
            if (!text.isBlank()) {
                out.add(text.trim());
            }
        }
        return out;
    }
}
