package io.docflow.core.service;

import java.io.Serial;

/// Raised when a workflow id does not name a stored workflow.
public class WorkflowNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -2871140623355398713L;

    private final String workflowId;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
