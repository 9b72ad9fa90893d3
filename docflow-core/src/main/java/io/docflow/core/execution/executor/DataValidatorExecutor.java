package io.docflow.core.execution.executor;

import io.docflow.core.validation.RuleEvaluator;
import io.docflow.core.validation.RuleResult;
import io.docflow.core.workflow.node.DataValidatorNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Applies the node's validation rules to each extracted document.
///
/// Items that already carry an error pass through as invalid with
/// `processing_stage=validation_skipped`.
///
/// ### Output
/// `validated_data`, `valid_count`, `invalid_count`, `stage=validation_complete`
public class DataValidatorExecutor implements NodeExecutor<DataValidatorNode> {

    private static final Logger logger = Logger.getLogger(DataValidatorExecutor.class.getName());

    @Override
    public Class<DataValidatorNode> getNodeType() {
        return DataValidatorNode.class;
    }

    @Override
    public Map<String, Object> execute(DataValidatorNode node, Map<String, Object> inputs) {
        List<Map<String, Object>> items = DocumentRecords.list(inputs, "extracted_data");
        logger.info(
                "Validating "
                        + items.size()
                        + " documents against "
                        + node.getValidationRules().size()
                        + " rules");

        List<Map<String, Object>> validated = new ArrayList<>(items.size());
        int validCount = 0;
        for (Map<String, Object> item : items) {
            Map<String, Object> record = new LinkedHashMap<>(item);
            if (item.containsKey("error")) {
                record.put("validation_results", List.of());
                record.put("is_valid", false);
                record.put("processing_stage", "validation_skipped");
                validated.add(record);
                continue;
            }

            List<RuleResult> results =
                    RuleEvaluator.evaluateAll(
                            DocumentRecords.object(item, "extracted_data"),
                            node.getValidationRules());
            boolean valid = results.stream().allMatch(RuleResult::valid);
            List<Map<String, Object>> resultMaps = new ArrayList<>(results.size());
            for (RuleResult result : results) {
                resultMaps.add(result.toMap());
            }

            Map<String, Object> metadata = DocumentRecords.object(item, "metadata");
            metadata.put("validation_completed_at", Instant.now().toString());

            record.put("validation_results", resultMaps);
            record.put("is_valid", valid);
            record.put("metadata", metadata);
            record.put("processing_stage", "validation_complete");
            validated.add(record);
            if (valid) {
                validCount++;
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("validated_data", validated);
        output.put("valid_count", validCount);
        output.put("invalid_count", validated.size() - validCount);
        output.put("stage", "validation_complete");
        return output;
    }
}
