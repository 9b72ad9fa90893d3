package io.docflow.core.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Field values returned by an {@link EntityExtractor}.
///
/// Values may be null when the model could not find a field.
///
/// @param values extracted values keyed by field name, never null
/// @param confidence confidence per field in [0, 1], never null
public record ExtractedFields(Map<String, Object> values, Map<String, Double> confidence) {

    public ExtractedFields {
        values =
                values == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        confidence =
                confidence == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(confidence));
    }
}
