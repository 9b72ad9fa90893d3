package io.docflow.core.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Declarative description of one workflow node, as supplied by the caller.
///
/// The `type` is kept as the raw wire name (`"ocr-processor"`, ...) and the `config`
/// as an untyped map. Both are interpreted by the graph builder, which turns a spec
/// into a typed {@link io.docflow.core.workflow.node.Node}.
///
/// @param id unique node identifier within one definition, may be null in malformed input
/// @param type wire name of the node type, may be null in malformed input
/// @param config node-specific settings, never null after construction (may be empty)
public record NodeSpec(String id, String type, Map<String, Object> config) {

    public NodeSpec {
        config =
                config == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /// Creates a spec with no configuration.
    public static NodeSpec of(String id, String type) {
        return new NodeSpec(id, type, Map.of());
    }
}
