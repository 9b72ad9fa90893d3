package io.docflow.core.execution.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Per-run record of node outcomes, keyed by node id.
///
/// Entries are write-once: a node id is recorded exactly once, right after the
/// node finishes, and never replaced. The reserved {@link #INPUT_KEY} entry holds
/// the run's input data.
///
/// @implNote **Not thread-safe**. Owned by a single run, which executes nodes
/// sequentially.
public final class ExecutionContext {

    /// Reserved key under which the run's input data is recorded.
    public static final String INPUT_KEY = "__input__";

    /// Node type reported for the {@link #INPUT_KEY} entry.
    public static final String INPUT_NODE_TYPE = "input";

    private final Map<String, NodeOutcome> outcomes = new LinkedHashMap<>();

    /// Records the outcome of a node.
    ///
    /// @param nodeId the node id, not null
    /// @param outcome the outcome, not null
    /// @throws IllegalStateException if an outcome is already recorded for the id
    public void record(String nodeId, NodeOutcome outcome) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (outcomes.putIfAbsent(nodeId, outcome) != null) {
            throw new IllegalStateException("Outcome already recorded for node: " + nodeId);
        }
    }

    public Optional<NodeOutcome> get(String nodeId) {
        return Optional.ofNullable(outcomes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return outcomes.containsKey(nodeId);
    }

    /// Returns all outcomes in recording order.
    ///
    /// @return unmodifiable snapshot, never null
    public Map<String, NodeOutcome> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }
}
