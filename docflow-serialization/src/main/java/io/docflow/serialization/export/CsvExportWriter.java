package io.docflow.serialization.export;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.docflow.core.export.ExportRecord;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.workflow.node.ExportFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Writes the extracted data of each document as a CSV header plus one row.
///
/// Nested objects are flattened with `_` between key segments
/// (`{"vendor": {"name": "Acme"}}` becomes column `vendor_name`). Lists and other
/// non-scalar values are written in their string form. A document with no extracted
/// data produces an empty file.
///
/// Only `extracted_data` is written; validation results and metadata are left to the
/// JSON format.
public class CsvExportWriter implements ExportWriter {

    private static final String SEPARATOR = "_";

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public void write(Path target, ExportRecord record) throws IOException {
        Map<String, String> row = flatten(record.extractedData());
        if (row.isEmpty()) {
            Files.write(target, new byte[0]);
            return;
        }

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : row.keySet()) {
            schema.addColumn(column);
        }
        mapper.writer(schema.build()).writeValue(target.toFile(), row);
    }

    /// Flattens nested maps into `parent_child` keys, keeping insertion order.
    static Map<String, String> flatten(Map<String, Object> data) {
        Map<String, String> flat = new LinkedHashMap<>();
        flattenInto(flat, "", data);
        return flat;
    }

    private static void flattenInto(Map<String, String> flat, String prefix, Map<?, ?> data) {
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key =
                    prefix.isEmpty()
                            ? String.valueOf(entry.getKey())
                            : prefix + SEPARATOR + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flattenInto(flat, key, nested);
            } else {
                flat.put(key, value != null ? value.toString() : "");
            }
        }
    }
}
