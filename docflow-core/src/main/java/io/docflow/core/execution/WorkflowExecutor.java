package io.docflow.core.execution;

import io.docflow.core.exception.GraphBuildException;
import io.docflow.core.execution.executor.NodeExecutor;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.execution.result.ExecutionContext;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.execution.result.ExecutionSummary;
import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.execution.result.ResultAggregator;
import io.docflow.core.execution.result.RunStatus;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.core.workflow.graph.GraphBuilder;
import io.docflow.core.workflow.graph.WorkflowGraph;
import io.docflow.core.workflow.node.Node;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Main execution engine for document-processing workflows.
///
/// Builds the graph, then executes nodes one at a time in topological order:
/// - Inputs are gathered from the run input and successful dependencies
/// - The node runs via its type-specific executor
/// - The outcome is recorded before the next node starts
///
/// The first node that throws halts the run. Its outcome records the error and
/// every later node is left out of the results.
///
/// ### Contracts
/// - **Precondition**: the definition has at least one node and no cycles
/// - **Postcondition**: returns `completed` or `failed`, never null
/// - **Invariant**: each node id is recorded at most once per run
///
/// @implNote Thread-safe. All run state lives in locals, so one instance can serve
/// concurrent runs as long as the registry's executors are thread-safe.
///
/// @see NodeExecutorRegistry for node type dispatch
/// @see GraphBuilder for definition parsing
public class WorkflowExecutor {

    private static final Logger logger = Logger.getLogger(WorkflowExecutor.class.getName());

    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final GraphBuilder graphBuilder;

    /// Creates an executor with the default graph builder.
    ///
    /// @param nodeExecutorRegistry registry for node-type-specific executors, not null
    public WorkflowExecutor(NodeExecutorRegistry nodeExecutorRegistry) {
        this(nodeExecutorRegistry, new GraphBuilder());
    }

    /// Creates an executor.
    ///
    /// @param nodeExecutorRegistry registry for node-type-specific executors, not null
    /// @param graphBuilder builder turning definitions into graphs, not null
    public WorkflowExecutor(NodeExecutorRegistry nodeExecutorRegistry, GraphBuilder graphBuilder) {
        this.nodeExecutorRegistry =
                Objects.requireNonNull(nodeExecutorRegistry, "nodeExecutorRegistry required");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder required");
    }

    /// Executes a workflow without observability listener.
    ///
    /// @param definition the workflow definition, not null
    /// @param inputData run input, may be null
    /// @return the run result, never null
    /// @throws GraphBuildException if the definition is empty, invalid or cyclic
    public ExecutionResult execute(WorkflowDefinition definition, Map<String, Object> inputData)
            throws GraphBuildException {
        return execute(definition, inputData, ExecutionListener.NOOP);
    }

    /// Executes a workflow with an observability listener.
    ///
    /// ### Performance
    /// - Time: O(n + e) scheduling overhead plus the sum of node execution times
    /// - Space: O(n) outcomes, holding every executed node's output
    ///
    /// @apiNote **Side effects**:
    /// - Invokes the OCR, extraction and export collaborators through node executors
    /// - Logs run progress at INFO, node failures at SEVERE
    ///
    /// @param definition the workflow definition, not null
    /// @param inputData run input, recorded under `__input__` when not empty, may be null
    /// @param listener listener for state and node events, not null
    /// @return the run result, never null
    /// @throws GraphBuildException if the definition is empty, invalid or cyclic; no node runs
    public ExecutionResult execute(
            WorkflowDefinition definition,
            Map<String, Object> inputData,
            ExecutionListener listener)
            throws GraphBuildException {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        String executionId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        logger.info("Starting workflow execution " + executionId);

        listener.onStateChange(executionId, RunState.BUILDING);
        WorkflowGraph graph = graphBuilder.build(definition);
        listener.onStateChange(executionId, RunState.READY);

        ExecutionContext context = new ExecutionContext();
        if (inputData != null && !inputData.isEmpty()) {
            context.record(
                    ExecutionContext.INPUT_KEY,
                    NodeOutcome.builder()
                            .nodeType(ExecutionContext.INPUT_NODE_TYPE)
                            .data(inputData)
                            .executedAt(startedAt)
                            .build());
        }

        listener.onStateChange(executionId, RunState.RUNNING);
        for (String nodeId : graph.getExecutionOrder()) {
            Node node = graph.getNode(nodeId);
            Map<String, Object> inputs =
                    ResultAggregator.gatherInputs(graph.getDependencies(nodeId), context);

            listener.onNodeStart(node);
            NodeOutcome outcome = executeNode(node, inputs);
            context.record(nodeId, outcome);
            listener.onNodeComplete(node, outcome);

            if (!outcome.isSuccess()) {
                break;
            }
        }

        Map<String, NodeOutcome> results = context.snapshot();
        ExecutionSummary summary = ExecutionSummary.of(results);
        RunStatus status = summary.failedNodes() == 0 ? RunStatus.COMPLETED : RunStatus.FAILED;
        listener.onStateChange(
                executionId, status == RunStatus.COMPLETED ? RunState.COMPLETED : RunState.FAILED);

        logger.info(
                "Workflow execution "
                        + executionId
                        + " "
                        + status.getWireName()
                        + ": "
                        + summary.successfulNodes()
                        + "/"
                        + summary.totalNodes()
                        + " nodes succeeded");
        return new ExecutionResult(
                status, executionId, results, summary, startedAt, Instant.now());
    }

    private NodeOutcome executeNode(Node node, Map<String, Object> inputs) {
        String nodeType = node.getNodeType().getWireName();
        logger.info("Executing node: " + node.getId());
        try {
            NodeExecutor<Node> executor = nodeExecutorRegistry.getExecutorFor(node);
            Map<String, Object> output = executor.execute(node, inputs);
            if (output == null) {
                throw new IllegalStateException("Executor returned no output for " + node);
            }
            logger.info("Node " + node.getId() + " executed successfully");
            return NodeOutcome.success(nodeType, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.SEVERE, "Node " + node.getId() + " interrupted", e);
            return NodeOutcome.failure(nodeType, errorMessage(e));
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Node " + node.getId() + " execution failed", e);
            return NodeOutcome.failure(nodeType, errorMessage(e));
        }
    }

    private static String errorMessage(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
