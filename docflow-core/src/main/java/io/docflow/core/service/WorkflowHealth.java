package io.docflow.core.service;

/// Health snapshot of the workflow service.
///
/// @param status `healthy` when the repositories answered
/// @param service service name
/// @param workflowsCount number of active workflows
/// @param executionsCount number of stored executions
public record WorkflowHealth(
        String status, String service, int workflowsCount, int executionsCount) {}
