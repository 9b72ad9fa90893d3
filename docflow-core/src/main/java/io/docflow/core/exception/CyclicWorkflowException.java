package io.docflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when the dependency structure contains at least one cycle.
public class CyclicWorkflowException extends GraphBuildException {
    @Serial private static final long serialVersionUID = -1958373740951280377L;

    private final List<String> cycleNodes;

    public CyclicWorkflowException(List<String> cycleNodes) {
        super("Workflow contains a dependency cycle between nodes: " + String.join(", ", cycleNodes));
        this.cycleNodes = List.copyOf(cycleNodes);
    }

    /// Returns the nodes that could not be ordered, in declaration order.
    public List<String> getCycleNodes() {
        return cycleNodes;
    }
}
