package io.docflow.core.service;

import java.io.Serial;

/// Raised when a workflow with a document input node is executed without uploads.
public class MissingDocumentsException extends Exception {
    @Serial private static final long serialVersionUID = 1482209563145002176L;

    public MissingDocumentsException() {
        super("This workflow requires document files to be uploaded");
    }
}
