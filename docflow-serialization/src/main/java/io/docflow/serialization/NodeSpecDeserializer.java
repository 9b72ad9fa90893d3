package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.docflow.core.workflow.NodeSpec;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Reads a node spec from either shape:
///
/// ```
/// flat     {"id": "ocr", "type": "ocr-processor", "config": {...}}
/// nested   {"id": "ocr", "type": "ocr-processor", "data": {"config": {...}}}
/// ```
///
/// A top-level `config` wins over `data.config`. Missing `id` or `type` are kept as
/// null so the graph builder can report them against the node.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class NodeSpecDeserializer extends StdDeserializer<NodeSpec> {

    @Serial private static final long serialVersionUID = -1587016230443825410L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    NodeSpecDeserializer() {
        super(NodeSpec.class);
    }

    @Override
    public NodeSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode config = root.get("config");
        if (config == null || config.isNull()) {
            JsonNode data = root.get("data");
            config = data != null ? data.get("config") : null;
        }

        Map<String, Object> settings = null;
        if (config != null && config.isObject()) {
            settings = mapper.convertValue(config, OBJECT_MAP);
        } else if (config != null && !config.isNull()) {
            throw ctxt.weirdStringException(
                    config.toString(), NodeSpec.class, "node config must be an object");
        }
        return new NodeSpec(textOrNull(root, "id"), textOrNull(root, "type"), settings);
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
