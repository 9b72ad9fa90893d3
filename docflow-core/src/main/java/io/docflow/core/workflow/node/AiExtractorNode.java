package io.docflow.core.workflow.node;

import java.util.List;

/// Node that runs structured field extraction over OCR text.
///
/// ### Settings
/// - **extractionFields** - field names to extract; empty selects the default invoice fields
/// - **model** - model identifier handed to the extraction collaborator (default `"gpt-4o"`)
/// - **description** - free-text extraction instructions (default empty)
public final class AiExtractorNode extends Node {

    public static final String DEFAULT_MODEL = "gpt-4o";

    /// Fields extracted when a node configures none.
    public static final List<String> DEFAULT_INVOICE_FIELDS =
            List.of("invoice_number", "vendor_name", "total_amount", "due_date");

    public static final String DEFAULT_INVOICE_DESCRIPTION =
            "Extract key invoice information including vendor details, amounts, and dates";

    private final List<String> extractionFields;
    private final String model;
    private final String description;

    private AiExtractorNode(Builder builder) {
        super(builder.id);
        this.extractionFields = List.copyOf(builder.extractionFields);
        this.model = builder.model;
        this.description = builder.description;
    }

    /// Returns the configured field names, possibly empty.
    public List<String> getExtractionFields() {
        return extractionFields;
    }

    public String getModel() {
        return model;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the fields actually requested from the extraction collaborator.
    ///
    /// @return configured fields, or {@link #DEFAULT_INVOICE_FIELDS} when none are configured
    public List<String> effectiveFields() {
        return extractionFields.isEmpty() ? DEFAULT_INVOICE_FIELDS : extractionFields;
    }

    /// Returns the instructions actually handed to the extraction collaborator.
    public String effectiveDescription() {
        if (!description.isBlank()) {
            return description;
        }
        if (extractionFields.isEmpty()) {
            return DEFAULT_INVOICE_DESCRIPTION;
        }
        return "Extract the following fields: " + String.join(", ", extractionFields);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.AI_EXTRACTOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private List<String> extractionFields = List.of();
        private String model = DEFAULT_MODEL;
        private String description = "";

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder extractionFields(List<String> extractionFields) {
            this.extractionFields = extractionFields != null ? extractionFields : List.of();
            return this;
        }

        public Builder model(String model) {
            this.model = model != null && !model.isBlank() ? model : DEFAULT_MODEL;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        /// Builds the node.
        ///
        /// @return new node, never null
        /// @throws IllegalArgumentException if a field name is blank
        public AiExtractorNode build() {
            for (String field : extractionFields) {
                if (field == null || field.isBlank()) {
                    throw new IllegalArgumentException("extraction_fields must not contain blanks");
                }
            }
            return new AiExtractorNode(this);
        }
    }
}
