package io.docflow.core.workflow.node;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// One validation check configured on a data-validator node.
///
/// Numeric bounds are checked at construction, so a malformed rule fails the graph
/// build. Regex patterns are compiled at evaluation time; an invalid pattern makes
/// the rule evaluate to invalid for every item.
///
/// @param field name of the extracted field to check, not blank
/// @param type the check to apply, not null
/// @param value rule argument: a bound for min/max, a pattern for regex, ignored for required
/// @param required whether a missing field fails the rule (default `true`)
public record ValidationRule(String field, RuleType type, Object value, boolean required) {

    private static final String DIGITS = "\\d+(?:_\\d+)*";
    private static final Pattern DECIMAL =
            Pattern.compile(
                    "[+-]?(?:"
                            + DIGITS
                            + "(?:\\."
                            + "(?:"
                            + DIGITS
                            + ")?)?|\\."
                            + DIGITS
                            + ")(?:[eE][+-]?"
                            + DIGITS
                            + ")?");
    private static final Pattern SPECIAL =
            Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    public ValidationRule {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Validation rule requires a field");
        }
        Objects.requireNonNull(type, "Validation rule requires a type");
        switch (type) {
            case MIN_VALUE, MAX_VALUE -> {
                if (toNumber(value) == null) {
                    throw new IllegalArgumentException(
                            "Rule " + type + " on field " + field + " needs a numeric value");
                }
            }
            case REGEX -> {
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException(
                            "Rule regex on field " + field + " needs a string pattern");
                }
            }
            case REQUIRED -> {}
        }
    }

    public static ValidationRule required(String field) {
        return new ValidationRule(field, RuleType.REQUIRED, null, true);
    }

    public static ValidationRule minValue(String field, Number min) {
        return new ValidationRule(field, RuleType.MIN_VALUE, min, true);
    }

    public static ValidationRule maxValue(String field, Number max) {
        return new ValidationRule(field, RuleType.MAX_VALUE, max, true);
    }

    public static ValidationRule regex(String field, String pattern) {
        return new ValidationRule(field, RuleType.REGEX, pattern, true);
    }

    /// Returns a copy of this rule that tolerates a missing field.
    public ValidationRule optional() {
        return new ValidationRule(field, type, value, false);
    }

    /// Returns the numeric rule argument for min/max rules.
    ///
    /// @return the bound as a double
    /// @throws IllegalStateException if the rule carries no numeric value
    public double numericValue() {
        Double number = toNumber(value);
        if (number == null) {
            throw new IllegalStateException("Rule " + type + " has no numeric value");
        }
        return number;
    }

    /// Converts numbers, booleans and numeric strings to a double.
    ///
    /// Strings are decimal literals with an optional sign, fraction, exponent and
    /// `_` digit separators, or `inf`, `infinity` and `nan` in any case. Java-only
    /// forms such as `1d`, `2f` or hex floats are not numeric.
    ///
    /// @param value candidate value, may be null
    /// @return the numeric value, or null when the value is not numeric
    public static Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof String text) {
            String candidate = text.strip();
            if (DECIMAL.matcher(candidate).matches()) {
                return Double.parseDouble(candidate.replace("_", ""));
            }
            Matcher special = SPECIAL.matcher(candidate);
            if (special.matches()) {
                boolean negative = "-".equals(special.group(1));
                if (special.group(2).equalsIgnoreCase("nan")) {
                    return Double.NaN;
                }
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
        }
        return null;
    }
}
