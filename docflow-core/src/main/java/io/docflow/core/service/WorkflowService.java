package io.docflow.core.service;

import io.docflow.core.DocflowConfig;
import io.docflow.core.exception.GraphBuildException;
import io.docflow.core.execution.ExecutionListener;
import io.docflow.core.execution.WorkflowExecutor;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.storage.ExecutionRecord;
import io.docflow.core.storage.ExecutionRepository;
import io.docflow.core.validation.ValidationReport;
import io.docflow.core.validation.WorkflowValidator;
import io.docflow.core.workflow.StoredWorkflow;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.core.workflow.WorkflowRepository;
import io.docflow.core.workflow.node.NodeType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Caller-side operations over stored workflows and their executions.
///
/// Owns persistence around the engine: the engine itself never touches a
/// repository. An execution is recorded as RUNNING before the engine starts and
/// replaced with the final status once it returns.
///
/// ### Usage
/// {@snippet :
/// StoredWorkflow wf = service.createWorkflow("Invoices", "", definition);
/// ExecutionRecord run = service.executeWorkflow(wf.id(), uploads);
/// }
///
/// @implNote Thread-safe when the repositories are; concurrent executions share
/// no state.
public class WorkflowService {

    private static final Logger logger = Logger.getLogger(WorkflowService.class.getName());

    static final String SERVICE_NAME = "workflow_service";

    private final WorkflowExecutor workflowExecutor;
    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final WorkflowValidator workflowValidator;
    private final DocflowConfig config;
    private final ExecutionListener listener;

    public WorkflowService(
            WorkflowExecutor workflowExecutor,
            WorkflowRepository workflowRepository,
            ExecutionRepository executionRepository,
            WorkflowValidator workflowValidator,
            DocflowConfig config,
            ExecutionListener listener) {
        this.workflowExecutor = Objects.requireNonNull(workflowExecutor, "workflowExecutor");
        this.workflowRepository = Objects.requireNonNull(workflowRepository, "workflowRepository");
        this.executionRepository =
                Objects.requireNonNull(executionRepository, "executionRepository");
        this.workflowValidator = Objects.requireNonNull(workflowValidator, "workflowValidator");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
    }

    /// Stores a new, active workflow.
    ///
    /// @param name display name, not blank
    /// @param description free text, may be null
    /// @param definition nodes and edges, not null
    /// @return the stored workflow, never null
    /// @throws IllegalArgumentException if the name is blank
    public StoredWorkflow createWorkflow(
            String name, String description, WorkflowDefinition definition) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name is required");
        }
        Objects.requireNonNull(definition, "definition must not be null");
        Instant now = Instant.now();
        StoredWorkflow workflow =
                new StoredWorkflow(
                        UUID.randomUUID().toString(),
                        name,
                        description != null ? description : "",
                        definition,
                        true,
                        now,
                        now);
        workflowRepository.save(workflow);
        logger.info("Created workflow: " + workflow.id() + " - " + name);
        return workflow;
    }

    /// Lists active workflows, newest first.
    public List<StoredWorkflow> listWorkflows() {
        return workflowRepository.findAll(true);
    }

    /// Returns a workflow by id, including deleted ones.
    ///
    /// @throws WorkflowNotFoundException if no workflow has the id
    public StoredWorkflow getWorkflow(String workflowId) throws WorkflowNotFoundException {
        return workflowRepository
                .findById(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    /// Replaces the given fields of a workflow; null arguments keep the stored value.
    ///
    /// @return the updated workflow, never null
    /// @throws WorkflowNotFoundException if no workflow has the id
    public StoredWorkflow updateWorkflow(
            String workflowId, String name, String description, WorkflowDefinition definition)
            throws WorkflowNotFoundException {
        StoredWorkflow updated =
                getWorkflow(workflowId).update(name, description, definition, Instant.now());
        workflowRepository.save(updated);
        logger.info("Updated workflow: " + workflowId);
        return updated;
    }

    /// Marks a workflow inactive. It disappears from {@link #listWorkflows()} but stays
    /// retrievable and executable by id.
    ///
    /// @throws WorkflowNotFoundException if no workflow has the id
    public StoredWorkflow deleteWorkflow(String workflowId) throws WorkflowNotFoundException {
        StoredWorkflow deleted = getWorkflow(workflowId).deactivate(Instant.now());
        workflowRepository.save(deleted);
        logger.info("Deleted workflow: " + workflowId);
        return deleted;
    }

    /// Executes a stored workflow over uploaded documents.
    ///
    /// Uploads become `documents` input records with ids `<filename>_<index>`. A run
    /// that finishes with failed nodes is not an exception: the returned record is
    /// FAILED and its result holds the failing node's error.
    ///
    /// @param workflowId the workflow to run, not null
    /// @param uploads uploaded documents, may be empty
    /// @return the final execution record, never null
    /// @throws WorkflowNotFoundException if no workflow has the id
    /// @throws MissingDocumentsException if the workflow reads documents and none were uploaded
    /// @throws DocumentTooLargeException if an upload exceeds the configured limit
    /// @throws GraphBuildException if the stored definition cannot be built; the record is
    /// marked FAILED first
    public ExecutionRecord executeWorkflow(String workflowId, List<DocumentUpload> uploads)
            throws WorkflowNotFoundException,
                    MissingDocumentsException,
                    DocumentTooLargeException,
                    GraphBuildException {
        StoredWorkflow workflow = getWorkflow(workflowId);
        List<DocumentUpload> files = uploads != null ? uploads : List.of();

        boolean readsDocuments =
                workflow.definition().nodes().stream()
                        .anyMatch(n -> NodeType.DOCUMENT_INPUT.getWireName().equals(n.type()));
        if (readsDocuments && files.isEmpty()) {
            throw new MissingDocumentsException();
        }
        long limit = config.getMaxFileSizeBytes();
        for (DocumentUpload file : files) {
            if (file.size() > limit) {
                throw new DocumentTooLargeException(file.filename(), file.size(), limit);
            }
        }

        ExecutionRecord record =
                ExecutionRecord.running(
                        UUID.randomUUID().toString(), workflowId, files.size(), Instant.now());
        executionRepository.save(record);

        Map<String, Object> inputData = new LinkedHashMap<>();
        inputData.put("documents", toDocuments(files));
        logger.info(
                "Starting execution of workflow "
                        + workflowId
                        + " with "
                        + files.size()
                        + " documents");

        ExecutionResult result;
        try {
            result = workflowExecutor.execute(workflow.definition(), inputData, listener);
        } catch (GraphBuildException e) {
            logger.log(Level.SEVERE, "Workflow execution error for " + workflowId, e);
            executionRepository.save(record.fail(e.getMessage(), null, Instant.now()));
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Workflow execution aborted for " + workflowId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            executionRepository.save(record.fail(message, null, Instant.now()));
            throw e;
        }

        ExecutionRecord finished =
                result.isCompleted()
                        ? record.complete(result, Instant.now())
                        : record.fail(
                                "Workflow execution failed. "
                                        + result.summary().failedNodes()
                                        + " nodes failed.",
                                result,
                                Instant.now());
        executionRepository.save(finished);
        logger.info(
                "Workflow execution "
                        + finished.id()
                        + " completed with status: "
                        + finished.status().getWireName());
        return finished;
    }

    /// Lists a workflow's executions, newest first.
    public List<ExecutionRecord> listExecutions(String workflowId) {
        return executionRepository.findByWorkflowId(workflowId);
    }

    /// Returns one execution of a workflow.
    ///
    /// @throws ExecutionNotFoundException if the id is unknown or belongs to another workflow
    public ExecutionRecord getExecution(String workflowId, String executionId)
            throws ExecutionNotFoundException {
        ExecutionRecord record =
                executionRepository
                        .findById(executionId)
                        .orElseThrow(
                                () ->
                                        new ExecutionNotFoundException(
                                                executionId, "Execution not found"));
        if (!record.workflowId().equals(workflowId)) {
            throw new ExecutionNotFoundException(
                    executionId, "Execution not found for this workflow");
        }
        return record;
    }

    /// Checks a definition without running it.
    public ValidationReport validate(WorkflowDefinition definition) {
        return workflowValidator.validate(definition);
    }

    /// Reports the service status and repository sizes.
    public WorkflowHealth health() {
        return new WorkflowHealth(
                "healthy",
                SERVICE_NAME,
                workflowRepository.findAll(true).size(),
                executionRepository.count());
    }

    private static List<Map<String, Object>> toDocuments(List<DocumentUpload> files) {
        List<Map<String, Object>> documents = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            DocumentUpload file = files.get(i);
            boolean named = file.filename() != null && !file.filename().isBlank();
            String filename = named ? file.filename() : "document_" + i;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("filename", file.filename());
            metadata.put("size", file.content().length);
            metadata.put("uploaded_at", Instant.now().toString());

            Map<String, Object> document = new LinkedHashMap<>();
            document.put("id", named ? file.filename() + "_" + i : "document_" + i);
            document.put("filename", filename);
            document.put("content", file.content());
            document.put(
                    "content_type",
                    file.contentType() != null ? file.contentType() : "application/octet-stream");
            document.put("metadata", metadata);
            documents.add(document);
        }
        return documents;
    }
}
