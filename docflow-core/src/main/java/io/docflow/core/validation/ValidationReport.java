package io.docflow.core.validation;

import java.util.List;

/// Result of checking a workflow definition without running it.
///
/// @param valid true when there are no errors; warnings do not affect validity
/// @param errors problems that would stop the workflow from running
/// @param warnings suspicious but runnable constructs
/// @param nodeCount number of declared nodes
/// @param edgeCount number of declared edges
public record ValidationReport(
        boolean valid, List<String> errors, List<String> warnings, int nodeCount, int edgeCount) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
