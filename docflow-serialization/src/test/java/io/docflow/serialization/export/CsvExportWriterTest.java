package io.docflow.serialization.export;

import static org.assertj.core.api.Assertions.assertThat;

import io.docflow.core.export.ExportRecord;
import io.docflow.core.workflow.node.ExportFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvExportWriterTest {

    @TempDir Path tempDir;

    private final CsvExportWriter writer = new CsvExportWriter();

    private static ExportRecord record(Map<String, Object> data) {
        return new ExportRecord(
                "d1", "invoice.pdf", data, List.of(), true, Instant.parse("2024-05-01T10:00:00Z"), null);
    }

    @Test
    void shouldWriteHeaderAndOneFlattenedRow() throws Exception {
        Map<String, Object> vendor = new LinkedHashMap<>();
        vendor.put("name", "Acme");
        vendor.put("city", "Oslo");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("invoice_number", "INV-1");
        data.put("vendor", vendor);
        data.put("total_amount", 120.5);
        Path target = tempDir.resolve("d1.csv");

        writer.write(target, record(data));

        List<String> lines = Files.readAllLines(target);
        assertThat(lines)
                .containsExactly(
                        "invoice_number,vendor_name,vendor_city,total_amount",
                        "INV-1,Acme,Oslo,120.5");
    }

    @Test
    void shouldWriteEmptyFileWithoutData() throws Exception {
        Path target = tempDir.resolve("d1.csv");

        writer.write(target, record(Map.of()));

        assertThat(target).exists();
        assertThat(Files.size(target)).isZero();
    }

    @Test
    void shouldRenderNullsAsEmptyAndListsAsText() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("due_date", null);
        data.put("items", List.of("a", "b"));

        assertThat(CsvExportWriter.flatten(data))
                .containsExactly(Map.entry("due_date", ""), Map.entry("items", "[a, b]"));
    }

    @Test
    void shouldReportCsvFormat() {
        assertThat(writer.format()).isEqualTo(ExportFormat.CSV);
    }
}
