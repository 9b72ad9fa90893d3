package io.docflow.core.extraction;

import java.util.List;

/// Entity-extraction collaborator used by the AI extractor node.
public interface EntityExtractor {

    /// Extracts named fields from document text.
    ///
    /// @param text the document text, not null
    /// @param fields field names to extract, not empty
    /// @param model model identifier, e.g. `gpt-4o`, not null
    /// @param description what the fields mean, not null
    /// @return extracted values and per-field confidence, never null
    /// @throws EntityExtractionException if the model call fails or its answer is unusable
    ExtractedFields extractFields(String text, List<String> fields, String model, String description)
            throws EntityExtractionException;
}
