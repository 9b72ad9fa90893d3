package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.docflow.core.execution.result.NodeOutcome;
import java.io.IOException;
import java.io.Serial;

/// Writes a node outcome as `{"status", "node_type", "data" | "error", "executed_at"}`.
///
/// `data` is written only for successful outcomes and `error` only for failed ones.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
/// @see NodeOutcomeDeserializer for the inverse operation
class NodeOutcomeSerializer extends StdSerializer<NodeOutcome> {

    @Serial private static final long serialVersionUID = 4410836650192847703L;

    NodeOutcomeSerializer() {
        super(NodeOutcome.class);
    }

    @Override
    public void serialize(NodeOutcome outcome, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("status", outcome.getStatus().getWireName());
        gen.writeStringField("node_type", outcome.getNodeType());
        if (outcome.getData() != null) {
            provider.defaultSerializeField("data", outcome.getData(), gen);
        }
        if (outcome.getError() != null) {
            gen.writeStringField("error", outcome.getError());
        }
        if (outcome.getExecutedAt() != null) {
            provider.defaultSerializeField("executed_at", outcome.getExecutedAt(), gen);
        }
        gen.writeEndObject();
    }
}
