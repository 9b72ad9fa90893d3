package io.docflow.core.workflow;

/// Directed dependency: the target node consumes the output of the source node.
///
/// @param source id of the producing node
/// @param target id of the consuming node
public record EdgeSpec(String source, String target) {}
