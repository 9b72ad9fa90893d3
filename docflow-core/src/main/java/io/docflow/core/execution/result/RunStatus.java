package io.docflow.core.execution.result;

/// Final status of a workflow run.
public enum RunStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
