package io.docflow.core.workflow.node;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/// File formats an export node can write.
public enum ExportFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    /// Returns the file extension and wire name, e.g. `"json"`.
    public String getExtension() {
        return extension;
    }

    public static Optional<ExportFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.extension.equals(normalized)).findFirst();
    }

    @Override
    public String toString() {
        return extension;
    }
}
