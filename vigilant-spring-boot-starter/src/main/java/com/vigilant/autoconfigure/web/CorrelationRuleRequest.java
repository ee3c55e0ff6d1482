package com.vigilant.autoconfigure.web;

import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.rule.CorrelationRule;
import com.vigilant.core.rule.EventField;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wire form of a correlation rule. Unset optional fields take the rule defaults.
 */
public class CorrelationRuleRequest {

    private String id;
    private String name;
    private String description;
    private long timeWindowSeconds;
    private int minEvents;
    private int maxEvents;
    private List<ConditionRequest> conditions = new ArrayList<>();
    private Double riskMultiplier;
    private Integer confidence;
    private Integer priority;
    private Boolean enabled;

    public static CorrelationRuleRequest from(CorrelationRule rule) {
        CorrelationRuleRequest request = new CorrelationRuleRequest();
        request.setId(rule.getId());
        request.setName(rule.getName());
        request.setDescription(rule.getDescription());
        request.setTimeWindowSeconds(rule.getTimeWindow().toSeconds());
        request.setMinEvents(rule.getMinEvents());
        request.setMaxEvents(rule.getMaxEvents());
        request.setConditions(rule.getConditions().stream().map(ConditionRequest::from).collect(Collectors.toList()));
        request.setRiskMultiplier(rule.getRiskMultiplier());
        request.setConfidence(rule.getConfidence());
        request.setPriority(rule.getPriority());
        request.setEnabled(rule.isEnabled());
        return request;
    }

    CorrelationRule toRule() {
        if (id == null || id.isBlank()) {
            throw new InvalidConfigurationException("Rule id is required");
        }
        CorrelationRule.Builder builder = CorrelationRule.builder()
                .id(id)
                .name(name != null ? name : id)
                .description(description)
                .timeWindow(Duration.ofSeconds(timeWindowSeconds))
                .minEvents(minEvents)
                .maxEvents(maxEvents)
                .conditions(conditions.stream()
                        .map(c -> c.<EventField>toCondition(EventField::fromName))
                        .collect(Collectors.toList()));
        if (riskMultiplier != null) {
            builder.riskMultiplier(riskMultiplier);
        }
        if (confidence != null) {
            builder.confidence(confidence);
        }
        if (priority != null) {
            builder.priority(priority);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        return builder.build();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public long getTimeWindowSeconds() {
        return timeWindowSeconds;
    }

    public void setTimeWindowSeconds(long timeWindowSeconds) {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    public int getMinEvents() {
        return minEvents;
    }

    public void setMinEvents(int minEvents) {
        this.minEvents = minEvents;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }

    public List<ConditionRequest> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionRequest> conditions) {
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }

    public Double getRiskMultiplier() {
        return riskMultiplier;
    }

    public void setRiskMultiplier(Double riskMultiplier) {
        this.riskMultiplier = riskMultiplier;
    }

    public Integer getConfidence() {
        return confidence;
    }

    public void setConfidence(Integer confidence) {
        this.confidence = confidence;
    }

    public Integer getPriority() {
        return priority;
    }

    public void setPriority(Integer priority) {
        this.priority = priority;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }
}
