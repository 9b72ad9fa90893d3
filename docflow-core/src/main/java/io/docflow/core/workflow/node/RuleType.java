package io.docflow.core.workflow.node;

import java.util.Arrays;
import java.util.Optional;

/// Kinds of checks a {@link ValidationRule} can apply to one extracted field.
public enum RuleType {

    /// Field value must be a non-blank string.
    REQUIRED("required"),

    /// Field value must be numeric and `>=` the rule value.
    MIN_VALUE("min_value"),

    /// Field value must be numeric and `<=` the rule value.
    MAX_VALUE("max_value"),

    /// Field value, as a string, must match the rule pattern from its first character.
    REGEX("regex");

    private final String wireName;

    RuleType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<RuleType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
