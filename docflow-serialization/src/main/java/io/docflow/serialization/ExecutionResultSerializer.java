package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.execution.result.ExecutionSummary;
import io.docflow.core.execution.result.NodeOutcome;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a run result with snake_case keys.
///
/// ```
/// {
///   "status": "completed",
///   "execution_id": "...",
///   "results": { "<node id>": { outcome }, ... },
///   "summary": { "total_nodes", "successful_nodes", "failed_nodes", "success_rate" },
///   "started_at": "...",
///   "completed_at": "..."
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class ExecutionResultSerializer extends StdSerializer<ExecutionResult> {

    @Serial private static final long serialVersionUID = -2669208714419953301L;

    ExecutionResultSerializer() {
        super(ExecutionResult.class);
    }

    @Override
    public void serialize(ExecutionResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("status", result.status().getWireName());
        gen.writeStringField("execution_id", result.executionId());

        gen.writeObjectFieldStart("results");
        for (Map.Entry<String, NodeOutcome> entry : result.results().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();

        ExecutionSummary summary = result.summary();
        gen.writeObjectFieldStart("summary");
        gen.writeNumberField("total_nodes", summary.totalNodes());
        gen.writeNumberField("successful_nodes", summary.successfulNodes());
        gen.writeNumberField("failed_nodes", summary.failedNodes());
        gen.writeNumberField("success_rate", summary.successRate());
        gen.writeEndObject();

        if (result.startedAt() != null) {
            provider.defaultSerializeField("started_at", result.startedAt(), gen);
        }
        if (result.completedAt() != null) {
            provider.defaultSerializeField("completed_at", result.completedAt(), gen);
        }
        gen.writeEndObject();
    }
}
