package io.docflow.core.extraction;

/// Result of a text extraction call.
///
/// @param text extracted text, never null
/// @param processingTimeSeconds wall time of the service call
/// @param pageCount number of pages the service reported
/// @param confidence service-reported confidence, null when the service reports none
public record TextExtraction(
        String text, double processingTimeSeconds, int pageCount, Double confidence) {

    public TextExtraction {
        text = text != null ? text : "";
    }

    public TextExtraction(String text, double processingTimeSeconds, int pageCount) {
        this(text, processingTimeSeconds, pageCount, null);
    }
}
