package io.docflow.core.extraction;

import java.io.Serial;

/// Raised by a {@link TextExtractor} when extraction fails.
///
/// Carries an HTTP-style status code: the service's own status for rejected
/// requests, 408 for timeouts, 503 when the service cannot be reached.
public class TextExtractionException extends Exception {

    @Serial private static final long serialVersionUID = 3817264450919128365L;

    private final int statusCode;

    public TextExtractionException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public TextExtractionException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
