package io.docflow.core.workflow.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Typed access to an untyped node configuration map.
///
/// Every getter takes one or more alias keys (snake_case wire name first, then
/// camelCase) and returns the first one present. Values of the wrong shape raise
/// `IllegalArgumentException`, which the node factory reports as an invalid node.
final class ConfigReader {

    private final Map<String, Object> config;

    ConfigReader(Map<String, Object> config) {
        this.config = config != null ? config : Map.of();
    }

    private Object raw(String... keys) {
        for (String key : keys) {
            Object value = config.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    String string(String... keys) {
        Object value = raw(keys);
        return value != null ? value.toString() : null;
    }

    Double number(String... keys) {
        Object value = raw(keys);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(keys[0] + " must be numeric, got '" + value + "'");
        }
    }

    Boolean bool(String... keys) {
        Object value = raw(keys);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().strip();
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(keys[0] + " must be a boolean, got '" + value + "'");
    }

    /// Reads a list of strings. A single comma-separated string is accepted as well.
    List<String> stringList(String... keys) {
        Object value = raw(keys);
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().strip());
                }
            }
            return result;
        }
        if (value instanceof String text) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.strip());
                }
            }
            return result;
        }
        throw new IllegalArgumentException(keys[0] + " must be a list of strings");
    }

    /// Reads a list of nested objects.
    List<Map<String, Object>> objectList(String... keys) {
        Object value = raw(keys);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(keys[0] + " must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException(keys[0] + " entries must be objects");
            }
            result.add((Map<String, Object>) map);
        }
        return result;
    }
}
