package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.workflow.WorkflowDefinition;

/// Utility class for converting workflow definitions and run results to and from JSON.
///
/// Definitions are read in both shapes editors produce: the flat
/// `{"id", "type", "config"}` node and the nested `{"id", "type", "data": {"config"}}`
/// node. Run results use snake_case keys.
///
/// ### Usage
/// {@snippet :
/// WorkflowDefinition definition = WorkflowSerializer.fromJson(json);
/// String report = WorkflowSerializer.resultToJson(result);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see DocflowJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a definition to pretty-printed JSON in the flat node shape.
    ///
    /// @param definition the definition to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowDefinition definition) {
        try {
            return createMapper().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a definition from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static WorkflowDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Serializes a run result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String resultToJson(ExecutionResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution result: " + e.getMessage(), e);
        }
    }

    /// Deserializes a run result from JSON.
    ///
    /// Binary document content comes back as Base64 strings, which the node
    /// executors accept as content.
    ///
    /// @param json JSON string, not null
    /// @return deserialized result, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static ExecutionResult resultFromJson(String json) {
        try {
            return createMapper().readValue(json, ExecutionResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize execution result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Docflow serialization.
    ///
    /// Registers:
    /// - `DocflowJacksonModule` for node specs, outcomes and results
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, so editor-only keys (positions, labels) are skipped
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new DocflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
