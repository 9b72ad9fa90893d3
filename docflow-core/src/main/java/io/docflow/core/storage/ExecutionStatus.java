package io.docflow.core.storage;

import java.util.Locale;

/// Status of a stored execution record.
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
