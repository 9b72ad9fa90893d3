package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.docflow.core.workflow.NodeSpec;
import java.io.IOException;
import java.io.Serial;

/// Writes a node spec in the flat shape `{"id", "type", "config"}`.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
/// @see NodeSpecDeserializer for the inverse operation
class NodeSpecSerializer extends StdSerializer<NodeSpec> {

    @Serial private static final long serialVersionUID = 6190231774720561384L;

    NodeSpecSerializer() {
        super(NodeSpec.class);
    }

    @Override
    public void serialize(NodeSpec spec, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", spec.id());
        gen.writeStringField("type", spec.type());
        provider.defaultSerializeField("config", spec.config(), gen);
        gen.writeEndObject();
    }
}
