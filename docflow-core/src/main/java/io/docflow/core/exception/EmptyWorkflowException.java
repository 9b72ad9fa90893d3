package io.docflow.core.exception;

import java.io.Serial;

public class EmptyWorkflowException extends GraphBuildException {
    @Serial private static final long serialVersionUID = -3126440275826081395L;

    public EmptyWorkflowException() {
        super("Workflow has no nodes to execute");
    }
}
