package io.docflow.core.workflow;

import java.util.List;
import java.util.Optional;

/// Repository for saved workflow definitions.
///
/// ### Idempotent Operations
/// The {@link #save} method is idempotent - saving a workflow with an existing ID
/// overwrites the previous record.
///
/// ### Usage
/// {@snippet :
/// repository.save(workflow);
/// Optional<StoredWorkflow> wf = repository.findById(workflowId);
/// List<StoredWorkflow> active = repository.findAll(true);
/// }
///
/// @see InMemoryWorkflowRepository for in-memory implementation
public interface WorkflowRepository {

    /// Saves a workflow (idempotent).
    ///
    /// @param workflow the workflow to persist, not null
    /// @throws NullPointerException if workflow is null
    void save(StoredWorkflow workflow);

    /// Finds a workflow by ID, active or not.
    ///
    /// @param workflowId the workflow identifier, not null
    /// @return the workflow if found, empty otherwise
    Optional<StoredWorkflow> findById(String workflowId);

    /// Lists workflows, newest first.
    ///
    /// @param activeOnly whether to leave out deleted workflows
    /// @return list of workflows, never null (may be empty)
    List<StoredWorkflow> findAll(boolean activeOnly);

    /// Removes a workflow record entirely.
    ///
    /// @param workflowId the workflow to remove, not null
    /// @return true if the workflow was removed, false if not found
    boolean delete(String workflowId);
}
