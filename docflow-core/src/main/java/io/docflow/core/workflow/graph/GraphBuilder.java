package io.docflow.core.workflow.graph;

import io.docflow.core.exception.EmptyWorkflowException;
import io.docflow.core.exception.GraphBuildException;
import io.docflow.core.exception.InvalidNodeException;
import io.docflow.core.execution.result.ExecutionContext;
import io.docflow.core.workflow.EdgeSpec;
import io.docflow.core.workflow.NodeSpec;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Builds a {@link WorkflowGraph} from a {@link WorkflowDefinition}.
///
/// ### Steps
/// 1. Reject empty definitions.
/// 2. Create one typed node per spec; the first invalid spec aborts the whole build.
///    The run input id `__input__` cannot be used as a node id.
/// 3. Invert the edges into a dependency map (`target -> [source, ...]`, edge order).
/// 4. Compute the execution order, rejecting cycles.
///
/// ### Dangling edges
/// An edge whose target is not declared is dropped. An edge whose source is not
/// declared is kept in the dependency map, where it never contributes input and is
/// ignored for ordering. Both cases are logged at WARNING.
///
/// @implNote Stateless and thread-safe.
public class GraphBuilder {

    private static final Logger logger = Logger.getLogger(GraphBuilder.class.getName());

    private final NodeFactory nodeFactory;

    public GraphBuilder() {
        this(new NodeFactory());
    }

    public GraphBuilder(NodeFactory nodeFactory) {
        this.nodeFactory = nodeFactory;
    }

    /// Builds the executable graph.
    ///
    /// @param definition the workflow definition, not null
    /// @return the graph with nodes, dependencies and execution order, never null
    /// @throws EmptyWorkflowException if the definition has no nodes
    /// @throws InvalidNodeException if any node spec is invalid, ids repeat or a node uses the reserved input id
    /// @throws io.docflow.core.exception.CyclicWorkflowException if dependencies form a cycle
    public WorkflowGraph build(WorkflowDefinition definition) throws GraphBuildException {
        logger.info(
                "Building workflow graph: nodes="
                        + definition.nodes().size()
                        + ", edges="
                        + definition.edges().size());

        if (definition.nodes().isEmpty()) {
            throw new EmptyWorkflowException();
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (NodeSpec spec : definition.nodes()) {
            Node node = nodeFactory.create(spec);
            if (ExecutionContext.INPUT_KEY.equals(node.getId())) {
                throw new InvalidNodeException(
                        node.getId(), "node id " + ExecutionContext.INPUT_KEY + " is reserved");
            }
            if (nodes.containsKey(node.getId())) {
                throw new InvalidNodeException(node.getId(), "duplicate node id");
            }
            nodes.put(node.getId(), node);
        }

        Map<String, List<String>> dependencies = buildDependencies(definition.edges(), nodes);
        List<String> order =
                TopologicalSorter.sort(new ArrayList<>(nodes.keySet()), dependencies);

        logger.fine("Execution order: " + order);
        return new WorkflowGraph(nodes, dependencies, order);
    }

    private Map<String, List<String>> buildDependencies(
            List<EdgeSpec> edges, Map<String, Node> nodes) {
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            dependencies.put(id, new ArrayList<>());
        }

        for (EdgeSpec edge : edges) {
            if (edge.source() == null || edge.target() == null) {
                logger.warning("Ignoring edge with missing endpoint: " + edge);
                continue;
            }
            List<String> sources = dependencies.get(edge.target());
            if (sources == null) {
                logger.warning(
                        "Ignoring edge "
                                + edge.source()
                                + " -> "
                                + edge.target()
                                + ": target node is not declared");
                continue;
            }
            if (!nodes.containsKey(edge.source())) {
                logger.warning(
                        "Edge "
                                + edge.source()
                                + " -> "
                                + edge.target()
                                + " names an undeclared source; it will contribute no input");
            }
            sources.add(edge.source());
        }
        return dependencies;
    }
}
