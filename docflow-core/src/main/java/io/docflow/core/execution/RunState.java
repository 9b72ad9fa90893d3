package io.docflow.core.execution;

/// Lifecycle of a single workflow run.
///
/// ```
/// BUILDING -> READY -> RUNNING -> COMPLETED
///                             \-> FAILED
/// ```
///
/// A run whose graph cannot be built never leaves `BUILDING`; the build exception
/// propagates to the caller instead.
public enum RunState {

    /// Definition is being turned into a graph.
    BUILDING,

    /// Graph and execution order are known; no node has run yet.
    READY,

    /// Nodes are executing in order.
    RUNNING,

    /// Every executed node succeeded.
    COMPLETED,

    /// A node failed and the remaining nodes were skipped.
    FAILED
}
