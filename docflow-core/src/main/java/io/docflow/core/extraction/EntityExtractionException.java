package io.docflow.core.extraction;

import java.io.Serial;

/// Raised by an {@link EntityExtractor} when extraction fails.
public class EntityExtractionException extends Exception {

    @Serial private static final long serialVersionUID = -6021978431375521907L;

    public EntityExtractionException(String message) {
        super(message);
    }

    public EntityExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
