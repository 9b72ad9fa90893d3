package io.docflow.core.execution.executor;

import io.docflow.core.extraction.TextExtraction;
import io.docflow.core.extraction.TextExtractionException;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.workflow.node.OcrProcessorNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs text extraction over each input document.
///
/// Documents without content are skipped. A failed extraction becomes an error
/// record (`processing_stage=ocr_error`) and does not stop the remaining documents.
/// A confidence below the node's threshold is logged, not rejected.
///
/// ### Output
/// `processed_documents`, `successful_count`, `failed_count`, `stage=ocr_complete`
public class OcrProcessorExecutor implements NodeExecutor<OcrProcessorNode> {

    private static final Logger logger = Logger.getLogger(OcrProcessorExecutor.class.getName());

    /// Confidence assumed when the collaborator reports none.
    public static final double DEFAULT_CONFIDENCE = 0.95;

    private final TextExtractor textExtractor;
    private final double defaultConfidence;

    public OcrProcessorExecutor(TextExtractor textExtractor) {
        this(textExtractor, DEFAULT_CONFIDENCE);
    }

    public OcrProcessorExecutor(TextExtractor textExtractor, double defaultConfidence) {
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor required");
        this.defaultConfidence = defaultConfidence;
    }

    @Override
    public Class<OcrProcessorNode> getNodeType() {
        return OcrProcessorNode.class;
    }

    @Override
    public Map<String, Object> execute(OcrProcessorNode node, Map<String, Object> inputs) {
        List<Map<String, Object>> documents = DocumentRecords.list(inputs, "documents");
        logger.info(
                "Processing OCR for "
                        + documents.size()
                        + " documents with language="
                        + node.getLanguage()
                        + ", threshold="
                        + node.getConfidenceThreshold());

        List<Map<String, Object>> processed = new ArrayList<>();
        int successful = 0;
        int failed = 0;
        for (int i = 0; i < documents.size(); i++) {
            Map<String, Object> document = documents.get(i);
            String documentId = DocumentRecords.string(document, "id", "doc_" + i);
            String filename = DocumentRecords.string(document, "filename", "document.pdf");
            try {
                byte[] content = DocumentRecords.content(document.get("content"));
                if (content == null || content.length == 0) {
                    continue;
                }
                TextExtraction extraction = textExtractor.extractText(content, filename);
                processed.add(successRecord(node, document, documentId, filename, extraction));
                successful++;
            } catch (TextExtractionException | RuntimeException e) {
                logger.warning(
                        "OCR processing failed for document "
                                + documentId
                                + ": "
                                + DocumentRecords.errorMessage(e));
                processed.add(errorRecord(documentId, filename, e));
                failed++;
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("processed_documents", processed);
        output.put("successful_count", successful);
        output.put("failed_count", failed);
        output.put("stage", "ocr_complete");
        return output;
    }

    private Map<String, Object> successRecord(
            OcrProcessorNode node,
            Map<String, Object> document,
            String documentId,
            String filename,
            TextExtraction extraction) {
        String text = extraction.text();
        double confidence =
                extraction.confidence() != null ? extraction.confidence() : defaultConfidence;
        if (confidence < node.getConfidenceThreshold()) {
            logger.warning(
                    "OCR confidence "
                            + confidence
                            + " below threshold "
                            + node.getConfidenceThreshold()
                            + " for "
                            + documentId);
        }

        Map<String, Object> metadata = DocumentRecords.object(document, "metadata");
        metadata.put("ocr_completed_at", Instant.now().toString());
        metadata.put("text_length", text.length());
        metadata.put("page_count", extraction.pageCount());
        metadata.put("language", node.getLanguage());
        metadata.put("confidence_threshold", node.getConfidenceThreshold());

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("document_id", documentId);
        record.put("filename", filename);
        record.put("extracted_text", text);
        record.put("confidence_score", confidence);
        record.put("text_length", text.length());
        record.put("metadata", metadata);
        record.put("processing_stage", "ocr_complete");
        return record;
    }

    private static Map<String, Object> errorRecord(
            String documentId, String filename, Exception error) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("document_id", documentId);
        record.put("filename", filename);
        record.put("extracted_text", "");
        record.put("error", DocumentRecords.errorMessage(error));
        record.put("processing_stage", "ocr_error");
        return record;
    }
}
