package io.docflow.core.execution.executor;

import io.docflow.core.exception.NodeExecutionException;
import io.docflow.core.export.ExportRecord;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.workflow.node.ExportDataNode;
import io.docflow.core.workflow.node.ExportFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Writes each validated document to `<export_path>/<document_id>.<format>`.
///
/// A failed write is counted in the summary and does not stop the remaining
/// documents. Missing writers and an uncreatable export directory fail the node.
///
/// ### Output
/// `exported_files`, `export_summary`, `stage=export_complete`
public class ExportDataExecutor implements NodeExecutor<ExportDataNode> {

    private static final Logger logger = Logger.getLogger(ExportDataExecutor.class.getName());

    private final Map<ExportFormat, ExportWriter> writers = new EnumMap<>(ExportFormat.class);

    public ExportDataExecutor(Collection<? extends ExportWriter> exportWriters) {
        for (ExportWriter writer : exportWriters) {
            writers.put(writer.format(), writer);
        }
    }

    @Override
    public Class<ExportDataNode> getNodeType() {
        return ExportDataNode.class;
    }

    @Override
    public Map<String, Object> execute(ExportDataNode node, Map<String, Object> inputs)
            throws NodeExecutionException, IOException {
        List<Map<String, Object>> items = DocumentRecords.list(inputs, "validated_data");
        ExportFormat format = node.getFormat();
        logger.info(
                "Exporting "
                        + items.size()
                        + " documents to "
                        + format
                        + " (metadata: "
                        + node.isIncludeMetadata()
                        + ")");

        ExportWriter writer = writers.get(format);
        if (writer == null) {
            throw new NodeExecutionException("No export writer available for format: " + format);
        }

        Path directory = Path.of(node.getExportPath());
        Files.createDirectories(directory);

        List<Map<String, Object>> exportedFiles = new ArrayList<>();
        int failed = 0;
        for (Map<String, Object> item : items) {
            String documentId = DocumentRecords.string(item, "document_id", null);
            try {
                if (documentId == null) {
                    throw new IOException("document_id is missing");
                }
                Path target = directory.resolve(documentId + "." + format.getExtension());
                if (!target.normalize().startsWith(directory.normalize())) {
                    throw new IOException("export target escapes the export directory: " + target);
                }
                writer.write(target, toRecord(node, item, documentId));

                Map<String, Object> file = new LinkedHashMap<>();
                file.put("document_id", documentId);
                file.put("filename", item.get("filename"));
                file.put("export_path", target.toString());
                file.put("export_format", format.getExtension());
                exportedFiles.add(file);
            } catch (IOException | RuntimeException e) {
                logger.warning(
                        "Export failed for document "
                                + documentId
                                + ": "
                                + DocumentRecords.errorMessage(e));
                failed++;
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_documents", items.size());
        summary.put("exported_count", exportedFiles.size());
        summary.put("failed_count", failed);
        summary.put("export_format", format.getExtension());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("exported_files", exportedFiles);
        output.put("export_summary", summary);
        output.put("stage", "export_complete");
        return output;
    }

    private static ExportRecord toRecord(
            ExportDataNode node, Map<String, Object> item, String documentId) {
        List<Map<String, Object>> validationResults = new ArrayList<>();
        if (item.get("validation_results") instanceof List<?> results) {
            for (Object result : results) {
                if (result instanceof Map<?, ?> map) {
                    validationResults.add((Map<String, Object>) map);
                }
            }
        }
        return new ExportRecord(
                documentId,
                DocumentRecords.string(item, "filename", null),
                DocumentRecords.object(item, "extracted_data"),
                validationResults,
                Boolean.TRUE.equals(item.get("is_valid")),
                Instant.now(),
                node.isIncludeMetadata() ? DocumentRecords.object(item, "metadata") : null);
    }
}
