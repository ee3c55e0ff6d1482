package com.vigilant.core.rule;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Declarative multi-event pattern: events matching the conditions, grouped by the
 * {@code SAME} fields, counted and bounded in time.
 */
public class CorrelationRule {

    private final String id;
    private final String name;
    private final String description;
    private final Duration timeWindow;
    private final int minEvents;
    private final int maxEvents;
    private final List<RuleCondition<EventField>> conditions;
    private final double riskMultiplier;
    private final int confidence;
    private final int priority;
    private final boolean enabled;

    private CorrelationRule(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.description = builder.description;
        this.timeWindow = builder.timeWindow;
        this.minEvents = builder.minEvents;
        this.maxEvents = builder.maxEvents;
        this.conditions = builder.conditions != null ? List.copyOf(builder.conditions) : List.of();
        this.riskMultiplier = builder.riskMultiplier;
        this.confidence = builder.confidence;
        this.priority = builder.priority;
        this.enabled = builder.enabled;
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

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public int getMinEvents() {
        return minEvents;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public List<RuleCondition<EventField>> getConditions() {
        return conditions;
    }

    public double getRiskMultiplier() {
        return riskMultiplier;
    }

    public int getConfidence() {
        return confidence;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Conditions tested on every event independently. */
    public List<RuleCondition<EventField>> eventConditions() {
        return conditions.stream().filter(c -> !c.isSame()).collect(Collectors.toList());
    }

    /** Fields whose values form the correlation key, in declaration order, without duplicates. */
    public List<EventField> correlationFields() {
        return conditions.stream()
                .filter(RuleCondition::isGroupingCondition)
                .map(RuleCondition::getField)
                .distinct()
                .collect(Collectors.toList());
    }

    /** Fields that must take more than one value inside a group. */
    public List<EventField> distinctFields() {
        return conditions.stream()
                .filter(RuleCondition::isDistinctCondition)
                .map(RuleCondition::getField)
                .distinct()
                .collect(Collectors.toList());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .timeWindow(timeWindow)
                .minEvents(minEvents)
                .maxEvents(maxEvents)
                .conditions(conditions)
                .riskMultiplier(riskMultiplier)
                .confidence(confidence)
                .priority(priority)
                .enabled(enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Duration timeWindow;
        private int minEvents;
        private int maxEvents;
        private List<RuleCondition<EventField>> conditions;
        private double riskMultiplier = 1.0;
        private int confidence = 50;
        private int priority = 5;
        private boolean enabled = true;

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

        public Builder timeWindow(Duration timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder minEvents(int minEvents) {
            this.minEvents = minEvents;
            return this;
        }

        public Builder maxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
            return this;
        }

        public Builder conditions(List<RuleCondition<EventField>> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder riskMultiplier(double riskMultiplier) {
            this.riskMultiplier = riskMultiplier;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
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

        public CorrelationRule build() {
            return new CorrelationRule(this);
        }
    }

    @Override
    public String toString() {
        return "CorrelationRule{" +
                "id='" + id + '\'' +
                ", window=" + timeWindow +
                ", events=[" + minEvents + ".." + maxEvents + "]" +
                ", conditions=" + conditions +
                ", enabled=" + enabled +
                '}';
    }
}
