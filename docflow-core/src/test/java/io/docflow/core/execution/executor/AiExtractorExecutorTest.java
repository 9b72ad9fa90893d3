package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.docflow.core.extraction.EntityExtractionException;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.ExtractedFields;
import io.docflow.core.workflow.node.AiExtractorNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AiExtractorExecutorTest {

    @Mock private EntityExtractor entityExtractor;

    private static Map<String, Object> ocrDoc(String id, String text) {
        return Map.of(
                "document_id", id,
                "filename", id + ".pdf",
                "extracted_text", text,
                "metadata", Map.of("page_count", 1),
                "processing_stage", "ocr_complete");
    }

    @Test
    void shouldUseInvoiceDefaultsWhenNoFieldsConfigured() throws Exception {
        when(entityExtractor.extractFields(
                        "Invoice INV-7",
                        AiExtractorNode.DEFAULT_INVOICE_FIELDS,
                        "gpt-4o",
                        AiExtractorNode.DEFAULT_INVOICE_DESCRIPTION))
                .thenReturn(
                        new ExtractedFields(
                                Map.of("invoice_number", "INV-7"), Map.of("invoice_number", 0.97)));
        var node = AiExtractorNode.builder().id("x").build();

        Map<String, Object> output =
                new AiExtractorExecutor(entityExtractor)
                        .execute(
                                node,
                                Map.of("processed_documents", List.of(ocrDoc("d1", "Invoice INV-7"))));

        assertThat(output)
                .containsEntry("successful_count", 1)
                .containsEntry("failed_count", 0)
                .containsEntry("stage", "extraction_complete");
        var record = ((List<Map<String, Object>>) output.get("extracted_data")).get(0);
        assertThat(record)
                .containsEntry("document_id", "d1")
                .containsEntry("extracted_data", Map.of("invoice_number", "INV-7"))
                .containsEntry("confidence_scores", Map.of("invoice_number", 0.97))
                .containsEntry("processing_stage", "extraction_complete");
        assertThat((Map<String, Object>) record.get("metadata"))
                .containsEntry("page_count", 1)
                .containsEntry("model_used", "gpt-4o")
                .containsEntry("extraction_fields", List.of())
                .containsKey("extraction_completed_at");
    }

    @Test
    void shouldPassConfiguredFieldsAndGeneratedDescription() throws Exception {
        when(entityExtractor.extractFields(anyString(), anyList(), anyString(), anyString()))
                .thenReturn(new ExtractedFields(Map.of(), Map.of()));
        var node =
                AiExtractorNode.builder()
                        .id("x")
                        .extractionFields(List.of("po", "total"))
                        .model("claude-3-haiku")
                        .build();

        new AiExtractorExecutor(entityExtractor)
                .execute(node, Map.of("processed_documents", List.of(ocrDoc("d1", "PO 5"))));

        verify(entityExtractor)
                .extractFields(
                        "PO 5",
                        List.of("po", "total"),
                        "claude-3-haiku",
                        "Extract the following fields: po, total");
    }

    @Test
    void shouldNotSendFailedOrEmptyDocumentsToCollaborator() throws Exception {
        var failed =
                Map.<String, Object>of(
                        "document_id", "d1",
                        "filename", "d1.pdf",
                        "extracted_text", "",
                        "error", "Mistral OCR failed: 500",
                        "processing_stage", "ocr_error");
        var node = AiExtractorNode.builder().id("x").build();

        Map<String, Object> output =
                new AiExtractorExecutor(entityExtractor)
                        .execute(
                                node,
                                Map.of("processed_documents", List.of(failed, ocrDoc("d2", ""))));

        var records = (List<Map<String, Object>>) output.get("extracted_data");
        assertThat(records.get(0))
                .containsEntry("error", "Mistral OCR failed: 500")
                .containsEntry("extracted_data", Map.of())
                .containsEntry("processing_stage", "extraction_error");
        assertThat(records.get(1)).containsEntry("error", "No text available for extraction");
        assertThat(output).containsEntry("failed_count", 2).containsEntry("successful_count", 0);
        verifyNoInteractions(entityExtractor);
    }

    @Test
    void shouldRecordExtractionFailureOnDocument() throws Exception {
        when(entityExtractor.extractFields(eq("text"), anyList(), anyString(), any()))
                .thenThrow(new EntityExtractionException("model returned no JSON"));
        var node = AiExtractorNode.builder().id("x").build();

        Map<String, Object> output =
                new AiExtractorExecutor(entityExtractor)
                        .execute(node, Map.of("processed_documents", List.of(ocrDoc("d1", "text"))));

        var record = ((List<Map<String, Object>>) output.get("extracted_data")).get(0);
        assertThat(record)
                .containsEntry("error", "model returned no JSON")
                .containsEntry("processing_stage", "extraction_error");
        assertThat(output).containsEntry("failed_count", 1);
    }
}
