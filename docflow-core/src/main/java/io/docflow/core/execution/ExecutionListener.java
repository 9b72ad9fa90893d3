package io.docflow.core.execution;

import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.workflow.node.Node;

/// Listener for workflow run lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onStateChange(id, BUILDING)
/// onStateChange(id, READY)
/// onStateChange(id, RUNNING)
///   onNodeStart(node)             — inputs gathered, about to execute
///   onNodeComplete(node, outcome) — outcome recorded
///   ...
/// onStateChange(id, COMPLETED | FAILED)
/// ```
///
/// @implNote Runs execute nodes sequentially, so a listener receives callbacks for
/// one run from one thread. A listener shared by concurrent runs must be thread-safe.
/// Exceptions thrown by a listener propagate to the caller of the run.
///
/// @see WorkflowExecutor#execute(io.docflow.core.workflow.WorkflowDefinition, java.util.Map,
/// ExecutionListener)
public interface ExecutionListener {

    /// Called when the run moves to a new state.
    ///
    /// @param executionId identifier of the run, not null
    /// @param state the new state, not null
    default void onStateChange(String executionId, RunState state) {}

    /// Called when a node is about to execute.
    ///
    /// @param node the node being executed, not null
    default void onNodeStart(Node node) {}

    /// Called after a node's outcome has been recorded.
    ///
    /// @param node the node that finished, not null
    /// @param outcome the recorded outcome, not null
    default void onNodeComplete(Node node, NodeOutcome outcome) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
