package io.docflow.core.exception;

import java.io.Serial;

/// Raised when one node spec cannot be turned into a typed node: missing id or type,
/// unknown type, duplicate id or invalid configuration.
public class InvalidNodeException extends GraphBuildException {
    @Serial private static final long serialVersionUID = 7720513094417260816L;

    private final String nodeId;

    public InvalidNodeException(String nodeId, String message) {
        super("Failed to create workflow node " + nodeId + ": " + message);
        this.nodeId = nodeId;
    }

    public InvalidNodeException(String nodeId, String message, Throwable cause) {
        super("Failed to create workflow node " + nodeId + ": " + message, cause);
        this.nodeId = nodeId;
    }

    /// Returns the offending node id, or `"unknown"` when the node spec had none.
    public String getNodeId() {
        return nodeId;
    }
}
