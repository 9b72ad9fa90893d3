package io.docflow.core.exception;

import java.io.Serial;

public class NodeExecutorNotFound extends NodeExecutionException {
    @Serial private static final long serialVersionUID = 4569044560797025331L;

    public NodeExecutorNotFound(String message) {
        super(message);
    }
}
