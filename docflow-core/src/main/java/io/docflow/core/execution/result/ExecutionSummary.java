package io.docflow.core.execution.result;

import java.util.Map;

/// Counts derived once from the final execution context.
///
/// The {@link ExecutionContext#INPUT_KEY} entry is not a node and is excluded from
/// every count. `successRate` is a fraction in [0, 1], zero when nothing ran.
///
/// @param totalNodes number of nodes that produced an outcome
/// @param successfulNodes outcomes with status success
/// @param failedNodes outcomes with status error
/// @param successRate successfulNodes / totalNodes
public record ExecutionSummary(
        int totalNodes, int successfulNodes, int failedNodes, double successRate) {

    /// Computes the summary of recorded outcomes.
    ///
    /// @param outcomes outcomes keyed by node id, not null
    /// @return the summary, never null
    public static ExecutionSummary of(Map<String, NodeOutcome> outcomes) {
        int total = 0;
        int successful = 0;
        int failed = 0;
        for (Map.Entry<String, NodeOutcome> entry : outcomes.entrySet()) {
            if (ExecutionContext.INPUT_KEY.equals(entry.getKey())) {
                continue;
            }
            total++;
            if (entry.getValue().isSuccess()) {
                successful++;
            } else {
                failed++;
            }
        }
        double rate = total > 0 ? (double) successful / total : 0.0;
        return new ExecutionSummary(total, successful, failed, rate);
    }
}
