package io.docflow.core.execution.executor;

import io.docflow.core.exception.NodeExecutorNotFound;
import io.docflow.core.workflow.node.Node;
import java.util.Optional;

/// Registry for node executors.
///
/// Provides type-safe lookup of executors by node class.
///
/// ### Example usage
/// {@snippet :
/// NodeExecutor<OcrProcessorNode> executor = registry.getExecutorOrThrow(OcrProcessorNode.class);
/// registry.register(new OcrProcessorExecutor(textExtractor));
/// }
public interface NodeExecutorRegistry {

    /// Get executor for the given node type.
    ///
    /// @param nodeType The node class
    /// @param <T> The node type
    /// @return Optional containing the executor if found
    <T extends Node> Optional<NodeExecutor<T>> getExecutor(Class<T> nodeType);

    /// Get executor for the given node type, throwing if not found.
    ///
    /// @param nodeType The node class
    /// @param <T> The node type
    /// @return The executor
    /// @throws NodeExecutorNotFound if no executor is registered
    <T extends Node> NodeExecutor<T> getExecutorOrThrow(Class<T> nodeType)
            throws NodeExecutorNotFound;

    /// Get executor for the given node instance. Convenience method that extracts the node's class.
    ///
    /// @param node The node instance
    /// @param <T> The node type
    /// @return The executor
    /// @throws NodeExecutorNotFound if no executor is registered
    default <T extends Node> NodeExecutor<T> getExecutorFor(T node) throws NodeExecutorNotFound {
        return (NodeExecutor<T>) getExecutorOrThrow(node.getClass());
    }

    /// Register a node executor, replacing any executor for the same node type.
    ///
    /// @param executor The executor to register
    /// @param <T> The node type
    <T extends Node> void register(NodeExecutor<T> executor);

    /// Check if an executor is registered for the given node type.
    ///
    /// @param nodeType The node class
    /// @return true if an executor is registered
    boolean hasExecutor(Class<? extends Node> nodeType);
}
