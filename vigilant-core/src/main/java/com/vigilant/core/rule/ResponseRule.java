package com.vigilant.core.rule;

import java.util.List;

/**
 * Policy unit of the automated response: when every condition holds for a threat,
 * the actions run in declared order.
 */
public class ResponseRule {

    private final String id;
    private final String name;
    private final String description;
    private final List<RuleCondition<ThreatField>> conditions;
    private final List<RuleAction> actions;
    private final int priority; // lower runs first
    private final boolean enabled;
    private final boolean autoExecute;

    private ResponseRule(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.description = builder.description;
        this.conditions = builder.conditions != null ? List.copyOf(builder.conditions) : List.of();
        this.actions = builder.actions != null ? List.copyOf(builder.actions) : List.of();
        this.priority = builder.priority;
        this.enabled = builder.enabled;
        this.autoExecute = builder.autoExecute;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<RuleCondition<ThreatField>> getConditions() {
        return conditions;
    }

    public List<RuleAction> getActions() {
        return actions;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isAutoExecute() {
        return autoExecute;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .conditions(conditions)
                .actions(actions)
                .priority(priority)
                .enabled(enabled)
                .autoExecute(autoExecute);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private List<RuleCondition<ThreatField>> conditions;
        private List<RuleAction> actions;
        private int priority = 5;
        private boolean enabled = true;
        private boolean autoExecute = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder conditions(List<RuleCondition<ThreatField>> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder actions(List<RuleAction> actions) {
            this.actions = actions;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder autoExecute(boolean autoExecute) {
            this.autoExecute = autoExecute;
            return this;
        }

        public ResponseRule build() {
            return new ResponseRule(this);
        }
    }

    @Override
    public String toString() {
        return "ResponseRule{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", conditions=" + conditions +
                ", actions=" + actions +
                '}';
    }
}
