package io.docflow.serialization;

import static io.docflow.serialization.NodeOutcomeDeserializer.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.execution.result.ExecutionSummary;
import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.execution.result.RunStatus;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads a run result written by {@link ExecutionResultSerializer}.
///
/// A missing `summary` is recomputed from the results.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class ExecutionResultDeserializer extends StdDeserializer<ExecutionResult> {

    @Serial private static final long serialVersionUID = 5528630182291179472L;

    ExecutionResultDeserializer() {
        super(ExecutionResult.class);
    }

    @Override
    public ExecutionResult deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String executionId = textOrNull(root, "execution_id");
        if (executionId == null) {
            throw ctxt.weirdStringException("null", ExecutionResult.class, "execution_id is required");
        }

        Map<String, NodeOutcome> results = new LinkedHashMap<>();
        JsonNode resultsNode = root.get("results");
        if (resultsNode != null && resultsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = resultsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                results.put(field.getKey(), mapper.treeToValue(field.getValue(), NodeOutcome.class));
            }
        }

        JsonNode summaryNode = root.get("summary");
        ExecutionSummary summary =
                summaryNode != null && summaryNode.isObject()
                        ? new ExecutionSummary(
                                summaryNode.path("total_nodes").asInt(),
                                summaryNode.path("successful_nodes").asInt(),
                                summaryNode.path("failed_nodes").asInt(),
                                summaryNode.path("success_rate").asDouble())
                        : ExecutionSummary.of(results);

        return new ExecutionResult(
                readStatus(root, ctxt),
                executionId,
                results,
                summary,
                readInstant(root, "started_at", ctxt),
                readInstant(root, "completed_at", ctxt));
    }

    private static RunStatus readStatus(JsonNode root, DeserializationContext ctxt)
            throws IOException {
        String status = textOrNull(root, "status");
        for (RunStatus candidate : RunStatus.values()) {
            if (candidate.getWireName().equals(status)) {
                return candidate;
            }
        }
        throw ctxt.weirdStringException(
                String.valueOf(status), RunStatus.class, "expected completed or failed");
    }

    private static Instant readInstant(JsonNode root, String field, DeserializationContext ctxt)
            throws IOException {
        String value = textOrNull(root, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw ctxt.weirdStringException(value, Instant.class, e.getMessage());
        }
    }
}
