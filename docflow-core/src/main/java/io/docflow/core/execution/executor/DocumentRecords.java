package io.docflow.core.execution.executor;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Read helpers for the loosely-typed document records passed between nodes.
final class DocumentRecords {

    private DocumentRecords() {}

    /// Reads a list of records from the inputs.
    ///
    /// @return the records, empty when the key is absent
    /// @throws IllegalArgumentException if the value is not a list of objects
    static List<Map<String, Object>> list(Map<String, Object> inputs, String key) {
        Object value = inputs.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException("Input '" + key + "' must be a list");
        }
        List<Map<String, Object>> records = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Input '" + key + "' must contain objects");
            }
            records.add((Map<String, Object>) map);
        }
        return records;
    }

    static String string(Map<String, Object> record, String key, String fallback) {
        Object value = record.get(key);
        return value != null ? value.toString() : fallback;
    }

    /// Returns a mutable copy of a nested object, empty when absent or not an object.
    static Map<String, Object> object(Map<String, Object> record, String key) {
        Object value = record.get(key);
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }

    /// Normalizes document content to bytes.
    ///
    /// @return the bytes, or null when there is no content
    /// @throws IllegalArgumentException if the content is neither bytes nor a Base64 string
    static byte[] content(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof String text) {
            return Base64.getDecoder().decode(text);
        }
        throw new IllegalArgumentException(
                "Document content must be bytes or a Base64 string, got "
                        + value.getClass().getSimpleName());
    }

    static String errorMessage(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
