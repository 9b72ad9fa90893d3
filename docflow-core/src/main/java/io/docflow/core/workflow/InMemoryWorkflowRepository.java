package io.docflow.core.workflow;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory workflow repository (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
/// @see WorkflowRepository for contract
public final class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, StoredWorkflow> storage = new ConcurrentHashMap<>();

    @Override
    public void save(StoredWorkflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        storage.put(workflow.id(), workflow);
    }

    @Override
    public Optional<StoredWorkflow> findById(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return Optional.ofNullable(storage.get(workflowId));
    }

    @Override
    public List<StoredWorkflow> findAll(boolean activeOnly) {
        return storage.values().stream()
                .filter(w -> !activeOnly || w.active())
                .sorted(Comparator.comparing(StoredWorkflow::createdAt).reversed())
                .toList();
    }

    @Override
    public boolean delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.remove(workflowId) != null;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
