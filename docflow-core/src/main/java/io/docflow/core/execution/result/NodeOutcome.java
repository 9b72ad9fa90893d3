package io.docflow.core.execution.result;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable record of running one node once.
///
/// A successful outcome carries the node's output data and no error; a failed
/// outcome carries the error string and no data.
///
/// ### Factory Methods
/// - {@link #success(String, Map)} for a node that returned normally
/// - {@link #failure(String, String)} for a node whose top-level execution raised
///
/// @implNote Immutable after construction. The data map is copied into an
/// unmodifiable view when built.
///
/// @see ExecutionContext for where outcomes are recorded
public final class NodeOutcome {

    private final OutcomeStatus status;
    private final Map<String, Object> data;
    private final String error;
    private final String nodeType;
    private final Instant executedAt;

    private NodeOutcome(Builder builder) {
        this.status = Objects.requireNonNull(builder.status, "status required");
        this.nodeType = Objects.requireNonNull(builder.nodeType, "nodeType required");
        this.data =
                builder.data != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.data))
                        : null;
        this.error = builder.error;
        this.executedAt = builder.executedAt;
    }

    /// Returns the outcome status.
    ///
    /// @return success or error, never null
    public OutcomeStatus getStatus() {
        return status;
    }

    /// Returns the node's output data.
    ///
    /// @return unmodifiable output map, or null for failed outcomes
    public Map<String, Object> getData() {
        return data;
    }

    /// Returns the error description.
    ///
    /// @return error string, or null for successful outcomes
    public String getError() {
        return error;
    }

    /// Returns the wire name of the node type, or `input` for the run's own input entry.
    public String getNodeType() {
        return nodeType;
    }

    /// Returns when the node finished.
    ///
    /// @return completion timestamp, may be null
    public Instant getExecutedAt() {
        return executedAt;
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    /// Creates a success outcome stamped with the current time.
    ///
    /// @param nodeType wire name of the node type, not null
    /// @param data node output, not null
    /// @return new success outcome, never null
    public static NodeOutcome success(String nodeType, Map<String, Object> data) {
        return builder()
                .status(OutcomeStatus.SUCCESS)
                .nodeType(nodeType)
                .data(Objects.requireNonNull(data, "data required"))
                .executedAt(Instant.now())
                .build();
    }

    /// Creates a failure outcome stamped with the current time.
    ///
    /// @param nodeType wire name of the node type, not null
    /// @param error error description, not null
    /// @return new failure outcome, never null
    public static NodeOutcome failure(String nodeType, String error) {
        return builder()
                .status(OutcomeStatus.ERROR)
                .nodeType(nodeType)
                .error(error)
                .executedAt(Instant.now())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NodeOutcome{"
                + "status="
                + status
                + ", nodeType="
                + nodeType
                + (error != null ? ", error=" + error : "")
                + '}';
    }

    /// Builder for constructing NodeOutcome instances.
    public static final class Builder {
        private OutcomeStatus status = OutcomeStatus.SUCCESS;
        private Map<String, Object> data;
        private String error;
        private String nodeType;
        private Instant executedAt;

        private Builder() {}

        public Builder status(OutcomeStatus status) {
            this.status = status;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder nodeType(String nodeType) {
            this.nodeType = nodeType;
            return this;
        }

        public Builder executedAt(Instant executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public NodeOutcome build() {
            return new NodeOutcome(this);
        }
    }
}
