package io.docflow.core.execution.result;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Result of one workflow run.
///
/// `results` holds one outcome per executed node (plus the input entry, when input
/// data was supplied); nodes skipped after a failure are absent.
///
/// @param status completed if no node failed, failed otherwise
/// @param executionId random identifier of the run
/// @param results outcomes keyed by node id, in execution order
/// @param summary counts derived from results
/// @param startedAt when the run started
/// @param completedAt when the run finished
public record ExecutionResult(
        RunStatus status,
        String executionId,
        Map<String, NodeOutcome> results,
        ExecutionSummary summary,
        Instant startedAt,
        Instant completedAt) {

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        results =
                results == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
