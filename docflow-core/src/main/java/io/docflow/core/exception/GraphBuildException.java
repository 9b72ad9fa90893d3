package io.docflow.core.exception;

import java.io.Serial;

/// Raised when a workflow definition cannot be turned into an executable graph.
///
/// Always thrown before any node runs. Subclasses name the specific defect.
///
/// @see EmptyWorkflowException
/// @see InvalidNodeException
/// @see CyclicWorkflowException
public class GraphBuildException extends Exception {
    @Serial private static final long serialVersionUID = 2861903355104487623L;

    public GraphBuildException(String message) {
        super(message);
    }

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
