package io.docflow.core.workflow.node;

import java.util.Arrays;
import java.util.Optional;

/// Closed set of node kinds a workflow may contain.
///
/// Each constant carries the wire name used in workflow definitions and the
/// {@link Node} subclass that represents it after graph build.
public enum NodeType {
    DOCUMENT_INPUT("document-input", DocumentInputNode.class),
    OCR_PROCESSOR("ocr-processor", OcrProcessorNode.class),
    AI_EXTRACTOR("ai-extractor", AiExtractorNode.class),
    DATA_VALIDATOR("data-validator", DataValidatorNode.class),
    EXPORT_DATA("export-data", ExportDataNode.class);

    private final String wireName;
    private final Class<? extends Node> nodeClass;

    NodeType(String wireName, Class<? extends Node> nodeClass) {
        this.wireName = wireName;
        this.nodeClass = nodeClass;
    }

    /// Returns the name used in workflow definitions, e.g. `"ocr-processor"`.
    public String getWireName() {
        return wireName;
    }

    /// Returns the typed node class for this kind.
    public Class<? extends Node> getNodeClass() {
        return nodeClass;
    }

    /// Looks up a node type by its wire name.
    ///
    /// @param wireName the name from a workflow definition, may be null
    /// @return the matching type, or empty for null and unknown names
    public static Optional<NodeType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
