package io.docflow.core;

import io.docflow.core.execution.WorkflowExecutor;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.service.WorkflowService;
import io.docflow.core.storage.ExecutionRepository;
import io.docflow.core.validation.WorkflowValidator;
import io.docflow.core.workflow.WorkflowRepository;
import java.util.Map;

/// Container holding the wired Docflow components.
///
/// ### Contracts
/// - **Postcondition**: All getters return the same instances passed to constructor
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link DocflowFactory.Builder} rather than direct
/// construction.
///
/// @see DocflowFactory#builder()
public final class DocflowEnvironment {

    private final DocflowConfig config;
    private final Map<String, String> credentials;
    private final WorkflowExecutor workflowExecutor;
    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final WorkflowValidator workflowValidator;
    private final WorkflowService workflowService;

    public DocflowEnvironment(
            DocflowConfig config,
            Map<String, String> credentials,
            WorkflowExecutor workflowExecutor,
            NodeExecutorRegistry nodeExecutorRegistry,
            WorkflowRepository workflowRepository,
            ExecutionRepository executionRepository,
            WorkflowValidator workflowValidator,
            WorkflowService workflowService) {
        this.config = config;
        this.credentials = Map.copyOf(credentials);
        this.workflowExecutor = workflowExecutor;
        this.nodeExecutorRegistry = nodeExecutorRegistry;
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.workflowValidator = workflowValidator;
        this.workflowService = workflowService;
    }

    public DocflowConfig getConfig() {
        return config;
    }

    /// Returns the credentials the environment was built with.
    ///
    /// @return unmodifiable credential map, never null
    public Map<String, String> getCredentials() {
        return credentials;
    }

    /// Returns the engine executing workflow definitions.
    public WorkflowExecutor getWorkflowExecutor() {
        return workflowExecutor;
    }

    public NodeExecutorRegistry getNodeExecutorRegistry() {
        return nodeExecutorRegistry;
    }

    public WorkflowRepository getWorkflowRepository() {
        return workflowRepository;
    }

    public ExecutionRepository getExecutionRepository() {
        return executionRepository;
    }

    public WorkflowValidator getWorkflowValidator() {
        return workflowValidator;
    }

    /// Returns the caller-side service over stored workflows and executions.
    public WorkflowService getWorkflowService() {
        return workflowService;
    }
}
