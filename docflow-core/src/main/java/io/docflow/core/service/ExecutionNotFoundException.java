package io.docflow.core.service;

import java.io.Serial;

/// Raised when an execution id is unknown or belongs to another workflow.
public class ExecutionNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 7730952286712906461L;

    private final String executionId;

    public ExecutionNotFoundException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
