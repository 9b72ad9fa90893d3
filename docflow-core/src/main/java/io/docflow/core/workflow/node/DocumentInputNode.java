package io.docflow.core.workflow.node;

/// Entry node that normalizes the caller's document records. Has no settings.
public final class DocumentInputNode extends Node {

    public DocumentInputNode(String id) {
        super(id);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DOCUMENT_INPUT;
    }
}
