package io.docflow.core.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory execution repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, ExecutionRecord> storage = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        storage.put(record.id(), record);
    }

    @Override
    public Optional<ExecutionRecord> findById(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(storage.get(executionId));
    }

    @Override
    public List<ExecutionRecord> findByWorkflowId(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.values().stream()
                .filter(r -> r.workflowId().equals(workflowId))
                .sorted(Comparator.comparing(ExecutionRecord::startedAt).reversed())
                .toList();
    }

    @Override
    public int count() {
        return storage.size();
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
