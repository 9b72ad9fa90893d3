package io.docflow.core.workflow;

import java.time.Instant;
import java.util.Objects;

/// A saved workflow: its definition plus catalogue details.
///
/// Deleting a workflow only marks it inactive; the record stays retrievable by id.
///
/// @param id workflow identifier, not null
/// @param name display name, not null
/// @param description free text, may be null
/// @param definition nodes and edges, not null
/// @param active false once the workflow has been deleted
/// @param createdAt creation time, not null
/// @param updatedAt last modification time, not null
public record StoredWorkflow(
        String id,
        String name,
        String description,
        WorkflowDefinition definition,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {

    public StoredWorkflow {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    /// Returns a copy with the given fields replaced; null arguments keep the current value.
    public StoredWorkflow update(
            String newName, String newDescription, WorkflowDefinition newDefinition, Instant now) {
        return new StoredWorkflow(
                id,
                newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                newDefinition != null ? newDefinition : definition,
                active,
                createdAt,
                now);
    }

    /// Returns an inactive copy.
    public StoredWorkflow deactivate(Instant now) {
        return new StoredWorkflow(id, name, description, definition, false, createdAt, now);
    }
}
