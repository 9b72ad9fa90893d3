package io.docflow.core.workflow.node;

import java.util.Objects;

/// Base class for the typed workflow nodes.
///
/// The hierarchy is sealed: every {@link NodeType} maps to exactly one permitted
/// subclass, and each subclass carries its own validated configuration. Node
/// instances are produced by the graph builder and are immutable afterwards.
///
/// @see NodeType for the wire names
/// @see io.docflow.core.execution.executor.NodeExecutor for node behavior
public abstract sealed class Node
        permits DocumentInputNode,
                OcrProcessorNode,
                AiExtractorNode,
                DataValidatorNode,
                ExportDataNode {

    protected final String id;

    /// Creates a node with the specified identifier.
    ///
    /// @param id unique node identifier within the workflow, not null
    protected Node(String id) {
        this.id = Objects.requireNonNull(id, "Node ID required");
    }

    /// Returns the unique node identifier.
    ///
    /// @return node ID used for dependency lookup and result keys, never null
    public String getId() {
        return id;
    }

    /// Returns the node type used for executor dispatch.
    ///
    /// @return the node type, never null
    public abstract NodeType getNodeType();

    @Override
    public String toString() {
        return getNodeType().getWireName() + "[" + id + "]";
    }
}
