package io.docflow.core.workflow.graph;

import io.docflow.core.workflow.node.Node;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Executable form of a workflow definition, produced by {@link GraphBuilder}.
///
/// @implNote Immutable. Owned by a single run; never shared between runs.
public final class WorkflowGraph {

    private final Map<String, Node> nodes;
    private final Map<String, List<String>> dependencies;
    private final List<String> executionOrder;

    WorkflowGraph(
            Map<String, Node> nodes,
            Map<String, List<String>> dependencies,
            List<String> executionOrder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, List<String>> deps = new LinkedHashMap<>();
        dependencies.forEach((id, sources) -> deps.put(id, List.copyOf(sources)));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.executionOrder = List.copyOf(executionOrder);
    }

    /// Returns the typed nodes by id, in declaration order.
    public Map<String, Node> getNodes() {
        return nodes;
    }

    /// Returns the dependency map: node id to the ids whose output it consumes, in edge order.
    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    /// Returns the direct dependencies of one node.
    ///
    /// @param nodeId the node id, not null
    /// @return dependency ids in edge order, empty for unknown ids
    public List<String> getDependencies(String nodeId) {
        return dependencies.getOrDefault(nodeId, List.of());
    }

    /// Returns a total order of node ids consistent with the dependencies.
    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    public Node getNode(String nodeId) {
        return nodes.get(nodeId);
    }
}
