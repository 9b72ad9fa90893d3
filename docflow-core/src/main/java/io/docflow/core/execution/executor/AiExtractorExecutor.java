package io.docflow.core.execution.executor;

import io.docflow.core.extraction.EntityExtractionException;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.ExtractedFields;
import io.docflow.core.workflow.node.AiExtractorNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs structured field extraction over OCR output.
///
/// Documents that failed OCR or carry no text are not sent to the collaborator;
/// they become error records carrying the upstream error. A failed extraction is
/// recorded on that document only.
///
/// ### Output
/// `extracted_data`, `successful_count`, `failed_count`, `stage=extraction_complete`
public class AiExtractorExecutor implements NodeExecutor<AiExtractorNode> {

    private static final Logger logger = Logger.getLogger(AiExtractorExecutor.class.getName());

    static final String NO_TEXT_ERROR = "No text available for extraction";

    private final EntityExtractor entityExtractor;

    public AiExtractorExecutor(EntityExtractor entityExtractor) {
        this.entityExtractor = Objects.requireNonNull(entityExtractor, "entityExtractor required");
    }

    @Override
    public Class<AiExtractorNode> getNodeType() {
        return AiExtractorNode.class;
    }

    @Override
    public Map<String, Object> execute(AiExtractorNode node, Map<String, Object> inputs) {
        List<Map<String, Object>> documents = DocumentRecords.list(inputs, "processed_documents");
        logger.info(
                "Running AI extraction on "
                        + documents.size()
                        + " documents using model "
                        + node.getModel());

        List<Map<String, Object>> extracted = new ArrayList<>(documents.size());
        int successful = 0;
        int failed = 0;
        for (Map<String, Object> document : documents) {
            String documentId = DocumentRecords.string(document, "document_id", null);
            String filename = DocumentRecords.string(document, "filename", null);
            String text = DocumentRecords.string(document, "extracted_text", "");

            if (document.containsKey("error") || text.isEmpty()) {
                String upstream = DocumentRecords.string(document, "error", NO_TEXT_ERROR);
                extracted.add(errorRecord(documentId, filename, upstream));
                failed++;
                continue;
            }

            try {
                ExtractedFields fields =
                        entityExtractor.extractFields(
                                text,
                                node.effectiveFields(),
                                node.getModel(),
                                node.effectiveDescription());
                extracted.add(successRecord(node, document, documentId, filename, fields));
                successful++;
            } catch (EntityExtractionException | RuntimeException e) {
                String message = DocumentRecords.errorMessage(e);
                logger.warning("AI extraction failed for document " + documentId + ": " + message);
                extracted.add(errorRecord(documentId, filename, message));
                failed++;
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("extracted_data", extracted);
        output.put("successful_count", successful);
        output.put("failed_count", failed);
        output.put("stage", "extraction_complete");
        return output;
    }

    private static Map<String, Object> successRecord(
            AiExtractorNode node,
            Map<String, Object> document,
            String documentId,
            String filename,
            ExtractedFields fields) {
        Map<String, Object> metadata = DocumentRecords.object(document, "metadata");
        metadata.put("extraction_completed_at", Instant.now().toString());
        metadata.put("model_used", node.getModel());
        metadata.put("extraction_fields", node.getExtractionFields());

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("document_id", documentId);
        record.put("filename", filename);
        record.put("extracted_data", new LinkedHashMap<>(fields.values()));
        record.put("confidence_scores", new LinkedHashMap<>(fields.confidence()));
        record.put("metadata", metadata);
        record.put("processing_stage", "extraction_complete");
        return record;
    }

    private static Map<String, Object> errorRecord(
            String documentId, String filename, String error) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("document_id", documentId);
        record.put("filename", filename);
        record.put("extracted_data", new LinkedHashMap<String, Object>());
        record.put("error", error);
        record.put("processing_stage", "extraction_error");
        return record;
    }
}
