package io.docflow.core.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable workflow definition: an ordered list of node specs and a list of edges.
///
/// Node order and edge order are significant. The scheduler breaks ties between ready
/// nodes by declaration order, and input gathering merges dependency outputs in edge
/// order (later edge wins on key collision).
///
/// A definition is not validated on construction. Empty node lists, unknown types and
/// dangling edges are reported by {@link io.docflow.core.workflow.graph.GraphBuilder}
/// or {@link io.docflow.core.validation.WorkflowValidator}.
///
/// @param nodes node specs in declaration order, never null after construction
/// @param edges edge specs in declaration order, never null after construction
public record WorkflowDefinition(List<NodeSpec> nodes, List<EdgeSpec> edges) {

    public WorkflowDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder, mostly used by tests and programmatic callers.
    public static final class Builder {
        private final List<NodeSpec> nodes = new ArrayList<>();
        private final List<EdgeSpec> edges = new ArrayList<>();

        private Builder() {}

        public Builder node(NodeSpec node) {
            nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        public Builder node(String id, String type) {
            return node(NodeSpec.of(id, type));
        }

        public Builder node(String id, String type, Map<String, Object> config) {
            return node(new NodeSpec(id, type, config));
        }

        public Builder edge(String source, String target) {
            edges.add(new EdgeSpec(source, target));
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(nodes, edges);
        }
    }
}
