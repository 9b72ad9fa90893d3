package io.docflow.core.execution;

import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.workflow.node.Node;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Listener that writes run and node events to `java.util.logging`.
///
/// State changes and node completions are logged at INFO, node starts at FINE,
/// and failed nodes at SEVERE.
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onStateChange(String executionId, RunState state) {
        logger.info("Execution " + executionId + " -> " + state);
    }

    @Override
    public void onNodeStart(Node node) {
        logger.fine("Starting node " + node);
    }

    @Override
    public void onNodeComplete(Node node, NodeOutcome outcome) {
        if (outcome.isSuccess()) {
            logger.info("Node " + node + " completed");
        } else {
            logger.log(Level.SEVERE, "Node " + node + " failed: " + outcome.getError());
        }
    }
}
