package io.docflow.core.exception;

import java.io.Serial;

/// Raised by a node executor when the node as a whole cannot run.
///
/// The scheduler records the message as the node's error outcome and halts the run.
/// Failures of a single document inside a node are never raised this way.
public class NodeExecutionException extends Exception {
    @Serial private static final long serialVersionUID = 5214046512383325190L;

    public NodeExecutionException(String message) {
        super(message);
    }

    public NodeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
