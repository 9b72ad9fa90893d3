package io.docflow.core.extraction;

/// Text-extraction collaborator used by the OCR processor node.
///
/// Implementations call an external OCR service; the engine never inspects how.
///
/// @see TextExtraction
public interface TextExtractor {

    /// Extracts text from one document.
    ///
    /// @param content raw document bytes, not null
    /// @param filename original filename, used to pick the document kind, not null
    /// @return the extracted text and metadata, never null
    /// @throws TextExtractionException if the service rejects the document or cannot be reached
    TextExtraction extractText(byte[] content, String filename) throws TextExtractionException;
}
