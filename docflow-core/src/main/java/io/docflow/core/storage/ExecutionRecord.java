package io.docflow.core.storage;

import io.docflow.core.execution.result.ExecutionResult;
import java.time.Instant;
import java.util.Objects;

/// Stored record of one workflow execution.
///
/// Written as RUNNING before the engine starts and replaced once it finishes.
///
/// @param id execution identifier, not null
/// @param workflowId the executed workflow, not null
/// @param status current status, not null
/// @param inputFileCount number of uploaded documents
/// @param result engine result, null until the run finishes or when the graph failed to build
/// @param errorMessage failure description, null on success
/// @param startedAt when the execution was requested, not null
/// @param completedAt when it finished, null while running
public record ExecutionRecord(
        String id,
        String workflowId,
        ExecutionStatus status,
        int inputFileCount,
        ExecutionResult result,
        String errorMessage,
        Instant startedAt,
        Instant completedAt) {

    public ExecutionRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    /// Creates a record for an execution that is about to start.
    public static ExecutionRecord running(
            String id, String workflowId, int inputFileCount, Instant startedAt) {
        return new ExecutionRecord(
                id, workflowId, ExecutionStatus.RUNNING, inputFileCount, null, null, startedAt, null);
    }

    /// Returns a COMPLETED copy holding the result.
    public ExecutionRecord complete(ExecutionResult executionResult, Instant now) {
        return new ExecutionRecord(
                id,
                workflowId,
                ExecutionStatus.COMPLETED,
                inputFileCount,
                executionResult,
                null,
                startedAt,
                now);
    }

    /// Returns a FAILED copy.
    ///
    /// @param message failure description, not null
    /// @param executionResult engine result, null when no node ran
    /// @param now completion time, not null
    public ExecutionRecord fail(String message, ExecutionResult executionResult, Instant now) {
        return new ExecutionRecord(
                id,
                workflowId,
                ExecutionStatus.FAILED,
                inputFileCount,
                executionResult,
                message,
                startedAt,
                now);
    }
}
