package io.docflow.core.validation;

import io.docflow.core.exception.GraphBuildException;
import io.docflow.core.exception.InvalidNodeException;
import io.docflow.core.execution.result.ExecutionContext;
import io.docflow.core.workflow.EdgeSpec;
import io.docflow.core.workflow.NodeSpec;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.core.workflow.graph.GraphBuilder;
import io.docflow.core.workflow.graph.NodeFactory;
import io.docflow.core.workflow.node.NodeType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Checks a workflow definition and reports every problem found, without running it.
///
/// ### Errors
/// - no nodes
/// - unknown node types
/// - invalid node configuration or missing ids
/// - duplicate node ids
/// - nodes using the reserved `__input__` id
/// - dependency cycles (checked only when everything else is valid)
///
/// ### Warnings
/// - isolated nodes, when the workflow has more than one node
/// - edges naming undeclared nodes
///
/// @implNote Stateless and thread-safe.
public class WorkflowValidator {

    private final NodeFactory nodeFactory;
    private final GraphBuilder graphBuilder;

    public WorkflowValidator() {
        this(new NodeFactory());
    }

    public WorkflowValidator(NodeFactory nodeFactory) {
        this.nodeFactory = nodeFactory;
        this.graphBuilder = new GraphBuilder(nodeFactory);
    }

    /// Validates the definition.
    ///
    /// @param definition the definition, not null
    /// @return the report, never null
    public ValidationReport validate(WorkflowDefinition definition) {
        List<NodeSpec> nodes = definition.nodes();
        List<EdgeSpec> edges = definition.edges();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (nodes.isEmpty()) {
            errors.add("Workflow must have at least one node");
        }

        Set<String> declared = new HashSet<>();
        Set<String> unknownTypes = new LinkedHashSet<>();
        for (NodeSpec spec : nodes) {
            if (spec.type() != null && NodeType.fromWireName(spec.type()).isEmpty()) {
                unknownTypes.add(spec.type());
            } else {
                try {
                    nodeFactory.create(spec);
                } catch (InvalidNodeException e) {
                    errors.add(e.getMessage());
                }
            }
            if (ExecutionContext.INPUT_KEY.equals(spec.id())) {
                errors.add(
                        new InvalidNodeException(
                                        spec.id(),
                                        "node id " + ExecutionContext.INPUT_KEY + " is reserved")
                                .getMessage());
            }
            if (spec.id() != null && !declared.add(spec.id())) {
                errors.add("Duplicate node id: " + spec.id());
            }
        }
        if (!unknownTypes.isEmpty()) {
            errors.add("Unknown node types: " + String.join(", ", unknownTypes));
        }

        Set<String> connected = new HashSet<>();
        for (EdgeSpec edge : edges) {
            connected.add(edge.source());
            connected.add(edge.target());
            if (!declared.contains(edge.source()) || !declared.contains(edge.target())) {
                warnings.add(
                        "Edge "
                                + edge.source()
                                + " -> "
                                + edge.target()
                                + " references an undeclared node");
            }
        }

        if (nodes.size() > 1) {
            List<String> isolated = new ArrayList<>();
            for (NodeSpec spec : nodes) {
                if (spec.id() != null && !connected.contains(spec.id())) {
                    isolated.add(spec.id());
                }
            }
            if (!isolated.isEmpty()) {
                warnings.add("Isolated nodes found: " + String.join(", ", isolated));
            }
        }

        if (errors.isEmpty()) {
            try {
                graphBuilder.build(definition);
            } catch (GraphBuildException e) {
                errors.add(e.getMessage());
            }
        }

        return new ValidationReport(errors.isEmpty(), errors, warnings, nodes.size(), edges.size());
    }
}
