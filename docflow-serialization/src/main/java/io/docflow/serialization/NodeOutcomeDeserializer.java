package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.execution.result.OutcomeStatus;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/// Reads a node outcome written by {@link NodeOutcomeSerializer}.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class NodeOutcomeDeserializer extends StdDeserializer<NodeOutcome> {

    @Serial private static final long serialVersionUID = -7359122809815531086L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    NodeOutcomeDeserializer() {
        super(NodeOutcome.class);
    }

    @Override
    public NodeOutcome deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String nodeType = textOrNull(root, "node_type");
        if (nodeType == null) {
            throw ctxt.weirdStringException("null", NodeOutcome.class, "node_type is required");
        }
        NodeOutcome.Builder builder =
                NodeOutcome.builder()
                        .status(readStatus(root, ctxt))
                        .nodeType(nodeType)
                        .error(textOrNull(root, "error"));
        JsonNode data = root.get("data");
        if (data != null && data.isObject()) {
            builder.data(mapper.convertValue(data, OBJECT_MAP));
        }
        String executedAt = textOrNull(root, "executed_at");
        if (executedAt != null) {
            try {
                builder.executedAt(Instant.parse(executedAt));
            } catch (DateTimeParseException e) {
                throw ctxt.weirdStringException(executedAt, Instant.class, e.getMessage());
            }
        }
        return builder.build();
    }

    private static OutcomeStatus readStatus(JsonNode root, DeserializationContext ctxt)
            throws IOException {
        String status = textOrNull(root, "status");
        for (OutcomeStatus candidate : OutcomeStatus.values()) {
            if (candidate.getWireName().equals(status)) {
                return candidate;
            }
        }
        throw ctxt.weirdStringException(
                String.valueOf(status), OutcomeStatus.class, "expected success or error");
    }

    static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
