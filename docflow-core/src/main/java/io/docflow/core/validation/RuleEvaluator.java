package io.docflow.core.validation;

import io.docflow.core.workflow.node.ValidationRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Applies {@link ValidationRule}s to extracted field values.
///
/// ### Rule semantics
/// - missing field: valid only when the rule is not required
/// - `required`: value is non-null and not blank
/// - `min_value` / `max_value`: numeric comparison; non-numeric values are invalid
/// - `regex`: the pattern must match at the start of the value's string form
///
/// @implNote Stateless and thread-safe.
public final class RuleEvaluator {

    private RuleEvaluator() {}

    /// Applies every rule to the data, in rule order.
    ///
    /// @param data extracted values keyed by field, not null
    /// @param rules rules to apply, not null
    /// @return one result per rule, never null
    public static List<RuleResult> evaluateAll(Map<String, Object> data, List<ValidationRule> rules) {
        List<RuleResult> results = new ArrayList<>(rules.size());
        for (ValidationRule rule : rules) {
            results.add(evaluate(data, rule));
        }
        return results;
    }

    /// Applies one rule to the data.
    ///
    /// @param data extracted values keyed by field, not null
    /// @param rule the rule, not null
    /// @return the result, never null
    public static RuleResult evaluate(Map<String, Object> data, ValidationRule rule) {
        String field = rule.field();
        String ruleName = rule.type().getWireName();

        if (!data.containsKey(field)) {
            return new RuleResult(field, ruleName, !rule.required(), "Field " + field + " is missing");
        }

        Object value = data.get(field);
        return switch (rule.type()) {
            case REQUIRED -> {
                boolean valid = value != null && !value.toString().isBlank();
                yield result(field, ruleName, valid, "Field is required");
            }
            case MIN_VALUE -> {
                Double number = ValidationRule.toNumber(value);
                if (number == null) {
                    yield new RuleResult(field, ruleName, false, "Value is not numeric");
                }
                yield result(
                        field,
                        ruleName,
                        number >= rule.numericValue(),
                        "Value must be >= " + rule.value());
            }
            case MAX_VALUE -> {
                Double number = ValidationRule.toNumber(value);
                if (number == null) {
                    yield new RuleResult(field, ruleName, false, "Value is not numeric");
                }
                yield result(
                        field,
                        ruleName,
                        number <= rule.numericValue(),
                        "Value must be <= " + rule.value());
            }
            case REGEX -> {
                String pattern = (String) rule.value();
                try {
                    boolean valid =
                            Pattern.compile(pattern).matcher(String.valueOf(value)).lookingAt();
                    yield result(field, ruleName, valid, "Value does not match pattern " + pattern);
                } catch (PatternSyntaxException e) {
                    yield new RuleResult(field, ruleName, false, "Invalid regex pattern");
                }
            }
        };
    }

    private static RuleResult result(
            String field, String rule, boolean valid, String failureMessage) {
        return new RuleResult(field, rule, valid, valid ? RuleResult.VALID : failureMessage);
    }
}
