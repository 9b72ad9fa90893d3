package io.docflow.core.export;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// One validated document as handed to an {@link ExportWriter}.
///
/// @param documentId document id, used as the file name
/// @param filename original upload filename
/// @param extractedData extracted field values, never null
/// @param validationResults per-rule results, never null
/// @param valid whether every rule passed
/// @param exportedAt export timestamp
/// @param metadata accumulated processing metadata, null unless metadata is requested
public record ExportRecord(
        String documentId,
        String filename,
        Map<String, Object> extractedData,
        List<Map<String, Object>> validationResults,
        boolean valid,
        Instant exportedAt,
        Map<String, Object> metadata) {

    public ExportRecord {
        extractedData =
                extractedData == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
        validationResults = validationResults == null ? List.of() : List.copyOf(validationResults);
        metadata =
                metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
