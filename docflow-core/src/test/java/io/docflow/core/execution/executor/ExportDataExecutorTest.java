package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.docflow.core.exception.NodeExecutionException;
import io.docflow.core.export.ExportRecord;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.workflow.node.ExportDataNode;
import io.docflow.core.workflow.node.ExportFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExportDataExecutorTest {

    @Mock private ExportWriter jsonWriter;

    @TempDir Path tempDir;

    private static Map<String, Object> validated(String id) {
        return Map.of(
                "document_id", id,
                "filename", id + ".pdf",
                "extracted_data", Map.of("total_amount", 10),
                "validation_results", List.of(Map.of("field", "total_amount", "is_valid", true)),
                "is_valid", true,
                "metadata", Map.of("model_used", "gpt-4o"));
    }

    @Test
    void shouldWriteOneFilePerDocument() throws Exception {
        when(jsonWriter.format()).thenReturn(ExportFormat.JSON);
        Path exportDir = tempDir.resolve("nested/exports");
        var node = ExportDataNode.builder().id("e").exportPath(exportDir.toString()).build();

        Map<String, Object> output =
                new ExportDataExecutor(List.of(jsonWriter))
                        .execute(node, Map.of("validated_data", List.of(validated("d1"))));

        assertThat(Files.isDirectory(exportDir)).isTrue();
        ArgumentCaptor<ExportRecord> record = ArgumentCaptor.forClass(ExportRecord.class);
        verify(jsonWriter).write(eq(exportDir.resolve("d1.json")), record.capture());
        assertThat(record.getValue().documentId()).isEqualTo("d1");
        assertThat(record.getValue().valid()).isTrue();
        assertThat(record.getValue().metadata()).isNull();
        assertThat(record.getValue().validationResults()).hasSize(1);

        assertThat(output).containsEntry("stage", "export_complete");
        assertThat((Map<String, Object>) output.get("export_summary"))
                .containsEntry("total_documents", 1)
                .containsEntry("exported_count", 1)
                .containsEntry("failed_count", 0)
                .containsEntry("export_format", "json");
        var files = (List<Map<String, Object>>) output.get("exported_files");
        assertThat(files.get(0))
                .containsEntry("document_id", "d1")
                .containsEntry("filename", "d1.pdf")
                .containsEntry("export_path", exportDir.resolve("d1.json").toString())
                .containsEntry("export_format", "json");
    }

    @Test
    void shouldIncludeMetadataWhenRequested() throws Exception {
        when(jsonWriter.format()).thenReturn(ExportFormat.JSON);
        var node =
                ExportDataNode.builder()
                        .id("e")
                        .exportPath(tempDir.toString())
                        .includeMetadata(true)
                        .build();

        new ExportDataExecutor(List.of(jsonWriter))
                .execute(node, Map.of("validated_data", List.of(validated("d1"))));

        ArgumentCaptor<ExportRecord> record = ArgumentCaptor.forClass(ExportRecord.class);
        verify(jsonWriter).write(any(), record.capture());
        assertThat(record.getValue().metadata()).containsEntry("model_used", "gpt-4o");
    }

    @Test
    void shouldCountFailedWritesAndContinue() throws Exception {
        when(jsonWriter.format()).thenReturn(ExportFormat.JSON);
        doThrow(new IOException("disk full"))
                .when(jsonWriter)
                .write(eq(tempDir.resolve("d1.json")), any());
        var node = ExportDataNode.builder().id("e").exportPath(tempDir.toString()).build();

        Map<String, Object> output =
                new ExportDataExecutor(List.of(jsonWriter))
                        .execute(
                                node,
                                Map.of("validated_data", List.of(validated("d1"), validated("d2"))));

        assertThat((Map<String, Object>) output.get("export_summary"))
                .containsEntry("exported_count", 1)
                .containsEntry("failed_count", 1);
        assertThat((List<Map<String, Object>>) output.get("exported_files"))
                .extracting(f -> f.get("document_id"))
                .containsExactly("d2");
    }

    @Test
    void shouldNotWriteOutsideExportDirectory() throws Exception {
        when(jsonWriter.format()).thenReturn(ExportFormat.JSON);
        Path exportDir = tempDir.resolve("exports");
        var node = ExportDataNode.builder().id("e").exportPath(exportDir.toString()).build();

        Map<String, Object> output =
                new ExportDataExecutor(List.of(jsonWriter))
                        .execute(
                                node,
                                Map.of(
                                        "validated_data",
                                        List.of(validated("../escaped"), validated("d1"))));

        verify(jsonWriter).write(eq(exportDir.resolve("d1.json")), any());
        verify(jsonWriter, never()).write(eq(exportDir.resolve("../escaped.json")), any());
        assertThat((Map<String, Object>) output.get("export_summary"))
                .containsEntry("exported_count", 1)
                .containsEntry("failed_count", 1);
        assertThat((List<Map<String, Object>>) output.get("exported_files"))
                .extracting(f -> f.get("document_id"))
                .containsExactly("d1");
    }

    @Test
    void shouldFailNodeWhenNoWriterForFormat() {
        when(jsonWriter.format()).thenReturn(ExportFormat.JSON);
        var node =
                ExportDataNode.builder()
                        .id("e")
                        .format(ExportFormat.CSV)
                        .exportPath(tempDir.toString())
                        .build();

        assertThatThrownBy(
                        () ->
                                new ExportDataExecutor(List.of(jsonWriter))
                                        .execute(node, Map.of("validated_data", List.of())))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessage("No export writer available for format: csv");
    }
}
