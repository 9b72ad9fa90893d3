package io.docflow.core.service;

import java.util.Objects;

/// A document file handed to {@link WorkflowService#executeWorkflow}.
///
/// @param filename original filename, may be null
/// @param contentType MIME type, may be null
/// @param content file bytes, not null
public record DocumentUpload(String filename, String contentType, byte[] content) {

    public DocumentUpload {
        Objects.requireNonNull(content, "content must not be null");
    }

    public long size() {
        return content.length;
    }
}
