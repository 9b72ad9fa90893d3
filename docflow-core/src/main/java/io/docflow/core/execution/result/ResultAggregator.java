package io.docflow.core.execution.result;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds a node's input map from outcomes already recorded in the run.
///
/// Starts from the successful {@link ExecutionContext#INPUT_KEY} data, then merges
/// each successful dependency's data in dependency order; later keys overwrite
/// earlier ones. Failed or absent dependencies contribute nothing.
public final class ResultAggregator {

    private ResultAggregator() {}

    /// Gathers the input map for a node.
    ///
    /// @param dependencies ids of the node's direct dependencies, in edge order, not null
    /// @param context outcomes recorded so far, not null
    /// @return a fresh mutable input map, never null
    public static Map<String, Object> gatherInputs(
            List<String> dependencies, ExecutionContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        context.get(ExecutionContext.INPUT_KEY)
                .filter(NodeOutcome::isSuccess)
                .ifPresent(input -> inputs.putAll(input.getData()));

        for (String dependency : dependencies) {
            context.get(dependency)
                    .filter(NodeOutcome::isSuccess)
                    .ifPresent(outcome -> inputs.putAll(outcome.getData()));
        }
        return inputs;
    }
}
