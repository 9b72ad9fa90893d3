package io.docflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.workflow.NodeSpec;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Docflow serialization configuration in one place.
///
/// Custom serializer/deserializer pairs:
/// - `NodeSpec` - `NodeSpecSerializer` / `NodeSpecDeserializer` (flat and nested config shapes)
/// - `NodeOutcome` - `NodeOutcomeSerializer` / `NodeOutcomeDeserializer`
/// - `ExecutionResult` - `ExecutionResultSerializer` / `ExecutionResultDeserializer`
///
/// `WorkflowDefinition` and `EdgeSpec` are records and bind through their canonical
/// constructors.
///
/// @see WorkflowSerializer for the convenience factory API
public class DocflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3021795584130967218L;

    public DocflowJacksonModule() {
        super("DocflowJacksonModule");

        addSerializer(NodeSpec.class, new NodeSpecSerializer());
        addDeserializer(NodeSpec.class, new NodeSpecDeserializer());

        addSerializer(NodeOutcome.class, new NodeOutcomeSerializer());
        addDeserializer(NodeOutcome.class, new NodeOutcomeDeserializer());

        addSerializer(ExecutionResult.class, new ExecutionResultSerializer());
        addDeserializer(ExecutionResult.class, new ExecutionResultDeserializer());
    }
}
