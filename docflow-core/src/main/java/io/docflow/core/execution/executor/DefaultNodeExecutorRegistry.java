package io.docflow.core.execution.executor;

import io.docflow.core.exception.NodeExecutorNotFound;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.workflow.node.Node;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of NodeExecutorRegistry.
///
/// Registers one built-in executor per node type, wired to the given collaborators.
/// Executors hold only their collaborators, so the registry can be shared by
/// concurrent runs.
public class DefaultNodeExecutorRegistry implements NodeExecutorRegistry {

    private final Map<Class<? extends Node>, NodeExecutor<?>> registry = new ConcurrentHashMap<>();

    /// Creates a registry with all built-in executors pre-registered.
    ///
    /// @param textExtractor OCR collaborator, not null
    /// @param entityExtractor extraction collaborator, not null
    /// @param exportWriters available export writers, not null
    /// @param defaultConfidence OCR confidence used when the collaborator reports none
    public DefaultNodeExecutorRegistry(
            TextExtractor textExtractor,
            EntityExtractor entityExtractor,
            Collection<? extends ExportWriter> exportWriters,
            double defaultConfidence) {
        register(new DocumentInputExecutor());
        register(new OcrProcessorExecutor(textExtractor, defaultConfidence));
        register(new AiExtractorExecutor(entityExtractor));
        register(new DataValidatorExecutor());
        register(new ExportDataExecutor(exportWriters));
    }

    public DefaultNodeExecutorRegistry(
            TextExtractor textExtractor,
            EntityExtractor entityExtractor,
            Collection<? extends ExportWriter> exportWriters) {
        this(
                textExtractor,
                entityExtractor,
                exportWriters,
                OcrProcessorExecutor.DEFAULT_CONFIDENCE);
    }

    public DefaultNodeExecutorRegistry(TextExtractor textExtractor, EntityExtractor entityExtractor) {
        this(textExtractor, entityExtractor, List.of());
    }

    @Override
    public <T extends Node> Optional<NodeExecutor<T>> getExecutor(Class<T> nodeType) {
        return Optional.ofNullable((NodeExecutor<T>) registry.get(nodeType));
    }

    @Override
    public <T extends Node> NodeExecutor<T> getExecutorOrThrow(Class<T> nodeType)
            throws NodeExecutorNotFound {
        return getExecutor(nodeType)
                .orElseThrow(
                        () ->
                                new NodeExecutorNotFound(
                                        "No executor registered for node type: "
                                                + nodeType.getSimpleName()));
    }

    @Override
    public <T extends Node> void register(NodeExecutor<T> executor) {
        registry.put(executor.getNodeType(), executor);
    }

    @Override
    public boolean hasExecutor(Class<? extends Node> nodeType) {
        return registry.containsKey(nodeType);
    }
}
