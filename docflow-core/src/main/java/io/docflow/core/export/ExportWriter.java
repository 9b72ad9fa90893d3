package io.docflow.core.export;

import io.docflow.core.workflow.node.ExportFormat;
import java.io.IOException;
import java.nio.file.Path;

/// Writes one validated document to a file in a specific format.
///
/// The export node picks a writer by {@link #format()} and calls it once per
/// document. Implementations must close every handle before returning.
public interface ExportWriter {

    /// Returns the format this writer produces.
    ExportFormat format();

    /// Writes the record, replacing any existing file.
    ///
    /// @param target file to write, parent directory exists, not null
    /// @param record the document to write, not null
    /// @throws IOException if the file cannot be written
    void write(Path target, ExportRecord record) throws IOException;
}
