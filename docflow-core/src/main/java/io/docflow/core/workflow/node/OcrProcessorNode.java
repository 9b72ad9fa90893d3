package io.docflow.core.workflow.node;

/// Node that sends each input document to the text-extraction collaborator.
///
/// ### Settings
/// - **language** - language hint recorded on each result (default `"auto"`)
/// - **confidenceThreshold** - results below it are logged, not dropped (default `0.8`)
public final class OcrProcessorNode extends Node {

    public static final String DEFAULT_LANGUAGE = "auto";
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.8;

    private final String language;
    private final double confidenceThreshold;

    private OcrProcessorNode(Builder builder) {
        super(builder.id);
        this.language = builder.language;
        this.confidenceThreshold = builder.confidenceThreshold;
    }

    public String getLanguage() {
        return language;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.OCR_PROCESSOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String language = DEFAULT_LANGUAGE;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder language(String language) {
            this.language = language != null ? language : DEFAULT_LANGUAGE;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        /// Builds the node.
        ///
        /// @return new node, never null
        /// @throws IllegalArgumentException if the threshold is outside `[0, 1]`
        public OcrProcessorNode build() {
            if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
                throw new IllegalArgumentException(
                        "confidence_threshold must be between 0 and 1, got "
                                + confidenceThreshold);
            }
            return new OcrProcessorNode(this);
        }
    }
}
