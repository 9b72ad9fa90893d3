package io.docflow.serialization.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.DocflowFactory;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.ExtractedFields;
import io.docflow.core.extraction.TextExtraction;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.service.DocumentUpload;
import io.docflow.core.storage.ExecutionRecord;
import io.docflow.core.storage.ExecutionStatus;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.serialization.WorkflowSerializer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExportPipelineTest {

    @Mock private TextExtractor textExtractor;
    @Mock private EntityExtractor entityExtractor;

    @TempDir Path tempDir;

    @Test
    void shouldRunInvoicePipelineEndToEnd() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("invoice_number", "INV-9");
        values.put("total_amount", 42);
        when(textExtractor.extractText(any(), anyString()))
                .thenReturn(new TextExtraction("Invoice INV-9 total 42", 0.3, 1));
        when(entityExtractor.extractFields(anyString(), anyList(), anyString(), anyString()))
                .thenReturn(
                        new ExtractedFields(values, Map.of("invoice_number", 0.9)));

        var service =
                DocflowFactory.builder()
                        .textExtractor(textExtractor)
                        .entityExtractor(entityExtractor)
                        .exportWriters(List.of(new JsonExportWriter(), new CsvExportWriter()))
                        .build()
                        .getWorkflowService();

        String json =
                """
                {"nodes": [
                   {"id": "in", "type": "document-input"},
                   {"id": "ocr", "type": "ocr-processor"},
                   {"id": "ai", "type": "ai-extractor"},
                   {"id": "check", "type": "data-validator",
                    "data": {"config": {"validation_rules": [
                       {"field": "invoice_number", "type": "required"},
                       {"field": "total_amount", "type": "min_value", "value": 0}]}}},
                   {"id": "out", "type": "export-data",
                    "config": {"format": "csv", "export_path": "%s"}}],
                 "edges": [
                   {"source": "in", "target": "ocr"},
                   {"source": "ocr", "target": "ai"},
                   {"source": "ai", "target": "check"},
                   {"source": "check", "target": "out"}]}
                """
                        .formatted(tempDir.toString().replace("\\", "\\\\"));
        WorkflowDefinition definition = WorkflowSerializer.fromJson(json);
        var workflow = service.createWorkflow("Invoices", "", definition);

        ExecutionRecord record =
                service.executeWorkflow(
                        workflow.id(),
                        List.of(
                                new DocumentUpload(
                                        "inv.pdf",
                                        "application/pdf",
                                        "%PDF".getBytes(StandardCharsets.US_ASCII))));

        assertThat(record.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(record.result().summary().successfulNodes()).isEqualTo(5);
        assertThat(Files.readAllLines(tempDir.resolve("inv.pdf_0.csv")))
                .containsExactly("invoice_number,total_amount", "INV-9,42");

        JsonNode report = new ObjectMapper().readTree(WorkflowSerializer.resultToJson(record.result()));
        assertThat(report.get("status").asText()).isEqualTo("completed");
        assertThat(report.at("/results/check/data/valid_count").asInt()).isEqualTo(1);
        assertThat(report.at("/results/out/data/export_summary/exported_count").asInt()).isEqualTo(1);
    }
}
