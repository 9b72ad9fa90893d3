package io.docflow.core.execution.executor;

import io.docflow.core.workflow.node.Node;
import java.util.Map;

/// Strategy interface for executing one kind of workflow node.
///
/// Each node type ({@link io.docflow.core.workflow.node.DocumentInputNode},
/// {@link io.docflow.core.workflow.node.OcrProcessorNode}, etc.) has exactly one
/// executor. An executor is a transformation from the node's gathered inputs to its
/// output map.
///
/// Failures of a single document are handled inside the executor and reported in
/// its output. Anything thrown from {@link #execute} fails the whole node and halts
/// the run.
///
/// ### Example implementation
/// {@snippet :
/// public class MyNodeExecutor implements NodeExecutor<MyNode> {
///     public Class<MyNode> getNodeType() {
///         return MyNode.class;
///     }
///
///     public Map<String, Object> execute(MyNode node, Map<String, Object> inputs) {
///         return Map.of("stage", "my_complete");
///     }
/// }
/// }
///
/// @param <T> The specific node type this executor handles
public interface NodeExecutor<T extends Node> {

    /// Returns the node type this executor handles. Used for type-safe registry lookups.
    ///
    /// @return the Class of the node type
    Class<T> getNodeType();

    /// Executes the node.
    ///
    /// @param node the node to execute, not null
    /// @param inputs merged outputs of the node's dependencies, not null
    /// @return the node's output data, never null
    /// @throws Exception if the node as a whole fails
    Map<String, Object> execute(T node, Map<String, Object> inputs) throws Exception;
}
