package io.docflow.core.workflow.node;

import java.util.Objects;

/// Node that writes one file per validated item.
///
/// ### Settings
/// - **format** - {@link ExportFormat} (default JSON)
/// - **exportPath** - target directory, created if missing (default `"exports"`)
/// - **includeMetadata** - copy item metadata into JSON exports (default `false`)
public final class ExportDataNode extends Node {

    public static final String DEFAULT_EXPORT_PATH = "exports";

    private final ExportFormat format;
    private final String exportPath;
    private final boolean includeMetadata;

    private ExportDataNode(Builder builder) {
        super(builder.id);
        this.format = Objects.requireNonNull(builder.format, "format must not be null");
        this.exportPath = builder.exportPath;
        this.includeMetadata = builder.includeMetadata;
    }

    public ExportFormat getFormat() {
        return format;
    }

    public String getExportPath() {
        return exportPath;
    }

    public boolean isIncludeMetadata() {
        return includeMetadata;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXPORT_DATA;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ExportFormat format = ExportFormat.JSON;
        private String exportPath = DEFAULT_EXPORT_PATH;
        private boolean includeMetadata;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder format(ExportFormat format) {
            this.format = format;
            return this;
        }

        public Builder exportPath(String exportPath) {
            this.exportPath =
                    exportPath != null && !exportPath.isBlank() ? exportPath : DEFAULT_EXPORT_PATH;
            return this;
        }

        public Builder includeMetadata(boolean includeMetadata) {
            this.includeMetadata = includeMetadata;
            return this;
        }

        public ExportDataNode build() {
            return new ExportDataNode(this);
        }
    }
}
