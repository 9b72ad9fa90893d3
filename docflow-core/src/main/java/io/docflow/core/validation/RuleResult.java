package io.docflow.core.validation;

import java.util.LinkedHashMap;
import java.util.Map;

/// Outcome of applying one validation rule to one document.
///
/// @param field the checked field
/// @param rule wire name of the rule type
/// @param valid whether the check passed
/// @param message `Valid` or the reason the check failed
public record RuleResult(String field, String rule, boolean valid, String message) {

    static final String VALID = "Valid";

    /// Returns the wire shape `{field, rule, is_valid, message}`.
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", field);
        map.put("rule", rule);
        map.put("is_valid", valid);
        map.put("message", message);
        return map;
    }
}
