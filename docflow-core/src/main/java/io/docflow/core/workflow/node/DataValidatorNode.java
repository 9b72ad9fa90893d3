package io.docflow.core.workflow.node;

import java.util.ArrayList;
import java.util.List;

/// Node that applies {@link ValidationRule}s to every successfully extracted item.
public final class DataValidatorNode extends Node {

    private final List<ValidationRule> validationRules;

    private DataValidatorNode(Builder builder) {
        super(builder.id);
        this.validationRules = List.copyOf(builder.validationRules);
    }

    /// Returns the rules in configuration order.
    public List<ValidationRule> getValidationRules() {
        return validationRules;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DATA_VALIDATOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private final List<ValidationRule> validationRules = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder validationRules(List<ValidationRule> rules) {
            this.validationRules.clear();
            if (rules != null) {
                this.validationRules.addAll(rules);
            }
            return this;
        }

        public Builder rule(ValidationRule rule) {
            this.validationRules.add(rule);
            return this;
        }

        public DataValidatorNode build() {
            return new DataValidatorNode(this);
        }
    }
}
