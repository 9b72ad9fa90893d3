package io.docflow.serialization.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.export.ExportRecord;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.workflow.node.ExportFormat;
import io.docflow.serialization.WorkflowSerializer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Writes each exported document as one pretty-printed JSON object.
///
/// Keys: `document_id`, `filename`, `extracted_data`, `validation_results`, `is_valid`,
/// `exported_at`, and `metadata` when the record carries it.
public class JsonExportWriter implements ExportWriter {

    private final ObjectMapper mapper;

    public JsonExportWriter() {
        this(WorkflowSerializer.createMapper());
    }

    public JsonExportWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public void write(Path target, ExportRecord record) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("document_id", record.documentId());
        document.put("filename", record.filename());
        document.put("extracted_data", record.extractedData());
        document.put("validation_results", record.validationResults());
        document.put("is_valid", record.valid());
        document.put("exported_at", record.exportedAt());
        if (record.metadata() != null) {
            document.put("metadata", record.metadata());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
    }
}
