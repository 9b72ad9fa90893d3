package io.docflow.core.service;

import java.io.Serial;

/// Raised when an upload exceeds the configured size limit.
public class DocumentTooLargeException extends Exception {
    @Serial private static final long serialVersionUID = -4407398813290154213L;

    private final String filename;
    private final long size;
    private final long limit;

    public DocumentTooLargeException(String filename, long size, long limit) {
        super("File " + filename + " is " + size + " bytes; the limit is " + limit + " bytes");
        this.filename = filename;
        this.size = size;
        this.limit = limit;
    }

    public String getFilename() {
        return filename;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
