package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.docflow.core.extraction.TextExtraction;
import io.docflow.core.extraction.TextExtractionException;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.workflow.node.OcrProcessorNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OcrProcessorExecutorTest {

    @Mock private TextExtractor textExtractor;

    private final OcrProcessorNode node =
            OcrProcessorNode.builder().id("ocr").language("en").confidenceThreshold(0.9).build();

    private static Map<String, Object> doc(String id, String filename, byte[] content) {
        return Map.of(
                "id", id, "filename", filename, "content", content, "metadata", Map.of("source", "upload"));
    }

    @Test
    void shouldRecordExtractedTextWithMetadata() throws Exception {
        when(textExtractor.extractText(any(), eq("a.pdf")))
                .thenReturn(new TextExtraction("Total: 12.50", 0.8, 2));

        Map<String, Object> output =
                new OcrProcessorExecutor(textExtractor)
                        .execute(node, Map.of("documents", List.of(doc("d1", "a.pdf", new byte[] {1}))));

        assertThat(output)
                .containsEntry("successful_count", 1)
                .containsEntry("failed_count", 0)
                .containsEntry("stage", "ocr_complete");
        var record = ((List<Map<String, Object>>) output.get("processed_documents")).get(0);
        assertThat(record)
                .containsEntry("document_id", "d1")
                .containsEntry("filename", "a.pdf")
                .containsEntry("extracted_text", "Total: 12.50")
                .containsEntry("confidence_score", 0.95)
                .containsEntry("text_length", 12)
                .containsEntry("processing_stage", "ocr_complete");
        var metadata = (Map<String, Object>) record.get("metadata");
        assertThat(metadata)
                .containsEntry("source", "upload")
                .containsEntry("page_count", 2)
                .containsEntry("language", "en")
                .containsEntry("confidence_threshold", 0.9)
                .containsKey("ocr_completed_at");
    }

    @Test
    void shouldPreferCollaboratorConfidenceEvenBelowThreshold() throws Exception {
        when(textExtractor.extractText(any(), anyString()))
                .thenReturn(new TextExtraction("blurry", 0.1, 1, 0.4));

        Map<String, Object> output =
                new OcrProcessorExecutor(textExtractor, 0.5)
                        .execute(node, Map.of("documents", List.of(doc("d1", "a.png", new byte[] {1}))));

        var record = ((List<Map<String, Object>>) output.get("processed_documents")).get(0);
        assertThat(record).containsEntry("confidence_score", 0.4);
        assertThat(output).containsEntry("successful_count", 1);
    }

    @Test
    void shouldRecordPerDocumentFailureAndContinue() throws Exception {
        when(textExtractor.extractText(any(), eq("bad.pdf")))
                .thenThrow(new TextExtractionException(408, "OCR request timed out"));
        when(textExtractor.extractText(any(), eq("good.pdf")))
                .thenReturn(new TextExtraction("ok", 0.1, 1));

        Map<String, Object> output =
                new OcrProcessorExecutor(textExtractor)
                        .execute(
                                node,
                                Map.of(
                                        "documents",
                                        List.of(
                                                doc("d1", "bad.pdf", new byte[] {1}),
                                                doc("d2", "good.pdf", new byte[] {2}))));

        assertThat(output).containsEntry("successful_count", 1).containsEntry("failed_count", 1);
        var failed = ((List<Map<String, Object>>) output.get("processed_documents")).get(0);
        assertThat(failed)
                .containsEntry("document_id", "d1")
                .containsEntry("extracted_text", "")
                .containsEntry("error", "OCR request timed out")
                .containsEntry("processing_stage", "ocr_error");
    }

    @Test
    void shouldSkipDocumentsWithoutContent() throws Exception {
        Map<String, Object> output =
                new OcrProcessorExecutor(textExtractor)
                        .execute(
                                node,
                                Map.of(
                                        "documents",
                                        List.of(doc("d1", "empty.pdf", new byte[0]), Map.of("id", "d2"))));

        assertThat(output)
                .containsEntry("processed_documents", List.of())
                .containsEntry("successful_count", 0)
                .containsEntry("failed_count", 0);
        verify(textExtractor, never()).extractText(any(), any());
    }
}
