package io.docflow.core.storage;

import java.util.List;
import java.util.Optional;

/// Repository for workflow execution records.
///
/// @see InMemoryExecutionRepository for in-memory implementation
public interface ExecutionRepository {

    /// Saves a record, replacing any record with the same id.
    ///
    /// @param record the record, not null
    void save(ExecutionRecord record);

    /// Finds a record by id.
    ///
    /// @param executionId the execution id, not null
    /// @return the record if found, empty otherwise
    Optional<ExecutionRecord> findById(String executionId);

    /// Lists a workflow's executions, newest first.
    ///
    /// @param workflowId the workflow id, not null
    /// @return records, never null (may be empty)
    List<ExecutionRecord> findByWorkflowId(String workflowId);

    /// Returns the number of stored records.
    int count();
}
