package io.docflow.core.execution.executor;

import io.docflow.core.workflow.node.DocumentInputNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Normalizes the uploaded `documents` into records the OCR processor consumes.
///
/// Missing fields get defaults (`doc_<i>`, `document_<i>`,
/// `application/octet-stream`, empty metadata). Content may arrive as bytes or as
/// a Base64 string and is always passed on as bytes.
public class DocumentInputExecutor implements NodeExecutor<DocumentInputNode> {

    private static final Logger logger = Logger.getLogger(DocumentInputExecutor.class.getName());

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    @Override
    public Class<DocumentInputNode> getNodeType() {
        return DocumentInputNode.class;
    }

    @Override
    public Map<String, Object> execute(DocumentInputNode node, Map<String, Object> inputs) {
        List<Map<String, Object>> documents = DocumentRecords.list(inputs, "documents");
        logger.info("Processing " + documents.size() + " documents in input node " + node.getId());

        List<Map<String, Object>> normalized = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            Map<String, Object> document = documents.get(i);
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("id", DocumentRecords.string(document, "id", "doc_" + i));
            record.put("filename", DocumentRecords.string(document, "filename", "document_" + i));
            record.put("content", DocumentRecords.content(document.get("content")));
            record.put(
                    "content_type",
                    DocumentRecords.string(document, "content_type", DEFAULT_CONTENT_TYPE));
            record.put("metadata", DocumentRecords.object(document, "metadata"));
            record.put("processing_stage", "input");
            normalized.add(record);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("documents", normalized);
        output.put("count", normalized.size());
        output.put("stage", "document_input_complete");
        return output;
    }
}
