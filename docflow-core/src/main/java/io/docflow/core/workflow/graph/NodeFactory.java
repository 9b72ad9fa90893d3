package io.docflow.core.workflow.graph;

import io.docflow.core.exception.InvalidNodeException;
import io.docflow.core.workflow.NodeSpec;
import io.docflow.core.workflow.node.AiExtractorNode;
import io.docflow.core.workflow.node.DataValidatorNode;
import io.docflow.core.workflow.node.DocumentInputNode;
import io.docflow.core.workflow.node.ExportDataNode;
import io.docflow.core.workflow.node.ExportFormat;
import io.docflow.core.workflow.node.Node;
import io.docflow.core.workflow.node.NodeType;
import io.docflow.core.workflow.node.OcrProcessorNode;
import io.docflow.core.workflow.node.RuleType;
import io.docflow.core.workflow.node.ValidationRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Turns untyped {@link NodeSpec}s into typed {@link Node}s.
///
/// All configuration is parsed and validated here, so executors only ever see
/// well-formed settings.
public final class NodeFactory {

    static final String UNKNOWN_ID = "unknown";

    /// Creates the typed node for a spec.
    ///
    /// @param spec the node spec, not null
    /// @return the typed node, never null
    /// @throws InvalidNodeException if id or type is missing, the type is unknown, or the
    /// configuration is malformed
    public Node create(NodeSpec spec) throws InvalidNodeException {
        String id = spec.id();
        if (id == null || id.isBlank()) {
            throw new InvalidNodeException(UNKNOWN_ID, "node id is required");
        }
        if (spec.type() == null || spec.type().isBlank()) {
            throw new InvalidNodeException(id, "node type is required");
        }
        NodeType type =
                NodeType.fromWireName(spec.type())
                        .orElseThrow(
                                () ->
                                        new InvalidNodeException(
                                                id, "Unknown node type: " + spec.type()));

        ConfigReader config = new ConfigReader(spec.config());
        try {
            return switch (type) {
                case DOCUMENT_INPUT -> new DocumentInputNode(id);
                case OCR_PROCESSOR -> createOcrProcessor(id, config);
                case AI_EXTRACTOR -> createAiExtractor(id, config);
                case DATA_VALIDATOR -> createDataValidator(id, config);
                case EXPORT_DATA -> createExportData(id, config);
            };
        } catch (IllegalArgumentException e) {
            throw new InvalidNodeException(id, e.getMessage(), e);
        }
    }

    private OcrProcessorNode createOcrProcessor(String id, ConfigReader config) {
        OcrProcessorNode.Builder builder =
                OcrProcessorNode.builder().id(id).language(config.string("language"));
        Double threshold = config.number("confidence_threshold", "confidenceThreshold");
        if (threshold != null) {
            builder.confidenceThreshold(threshold);
        }
        return builder.build();
    }

    private AiExtractorNode createAiExtractor(String id, ConfigReader config) {
        return AiExtractorNode.builder()
                .id(id)
                .extractionFields(config.stringList("extraction_fields", "extractionFields"))
                .model(config.string("model"))
                .description(config.string("description"))
                .build();
    }

    private DataValidatorNode createDataValidator(String id, ConfigReader config) {
        List<ValidationRule> rules = new ArrayList<>();
        for (Map<String, Object> raw : config.objectList("validation_rules", "validationRules")) {
            rules.add(parseRule(new ConfigReader(raw), raw));
        }
        return DataValidatorNode.builder().id(id).validationRules(rules).build();
    }

    private ValidationRule parseRule(ConfigReader rule, Map<String, Object> raw) {
        String typeName = rule.string("type");
        RuleType type =
                RuleType.fromWireName(typeName)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unknown validation rule type: " + typeName));
        Boolean required = rule.bool("required");
        return new ValidationRule(
                rule.string("field"), type, raw.get("value"), required == null || required);
    }

    private ExportDataNode createExportData(String id, ConfigReader config) {
        String formatName = config.string("format");
        ExportFormat format =
                formatName == null
                        ? ExportFormat.JSON
                        : ExportFormat.fromName(formatName)
                                .orElseThrow(
                                        () ->
                                                new IllegalArgumentException(
                                                        "Unsupported export format: "
                                                                + formatName));
        Boolean includeMetadata = config.bool("include_metadata", "includeMetadata");
        return ExportDataNode.builder()
                .id(id)
                .format(format)
                .exportPath(config.string("export_path", "exportPath"))
                .includeMetadata(includeMetadata != null && includeMetadata)
                .build();
    }
}
