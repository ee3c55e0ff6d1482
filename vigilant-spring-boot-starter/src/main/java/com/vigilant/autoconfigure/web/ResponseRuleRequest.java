package com.vigilant.autoconfigure.web;

import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.model.ActionType;
import com.vigilant.core.rule.ResponseRule;
import com.vigilant.core.rule.RuleAction;
import com.vigilant.core.rule.ThreatField;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wire form of a response rule.
 */
public class ResponseRuleRequest {

    private String id;
    private String name;
    private String description;
    private List<ConditionRequest> conditions = new ArrayList<>();
    private List<ActionRequest> actions = new ArrayList<>();
    private Integer priority;
    private Boolean enabled;
    private Boolean autoExecute;

    public static ResponseRuleRequest from(ResponseRule rule) {
        ResponseRuleRequest request = new ResponseRuleRequest();
        request.setId(rule.getId());
        request.setName(rule.getName());
        request.setDescription(rule.getDescription());
        request.setConditions(rule.getConditions().stream().map(ConditionRequest::from).collect(Collectors.toList()));
        request.setActions(rule.getActions().stream()
                .map(a -> new ActionRequest(a.getType().wireName(), a.getParameters()))
                .collect(Collectors.toList()));
        request.setPriority(rule.getPriority());
        request.setEnabled(rule.isEnabled());
        request.setAutoExecute(rule.isAutoExecute());
        return request;
    }

    ResponseRule toRule() {
        if (id == null || id.isBlank()) {
            throw new InvalidConfigurationException("Rule id is required");
        }
        ResponseRule.Builder builder = ResponseRule.builder()
                .id(id)
                .name(name != null ? name : id)
                .description(description)
                .conditions(conditions.stream()
                        .map(c -> c.<ThreatField>toCondition(ThreatField::fromName))
                        .collect(Collectors.toList()))
                .actions(actions.stream().map(ActionRequest::toAction).collect(Collectors.toList()));
        if (priority != null) {
            builder.priority(priority);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        if (autoExecute != null) {
            builder.autoExecute(autoExecute);
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

    public List<ConditionRequest> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionRequest> conditions) {
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }

    public List<ActionRequest> getActions() {
        return actions;
    }

    public void setActions(List<ActionRequest> actions) {
        this.actions = actions != null ? actions : new ArrayList<>();
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

    public Boolean getAutoExecute() {
        return autoExecute;
    }

    public void setAutoExecute(Boolean autoExecute) {
        this.autoExecute = autoExecute;
    }

    public static class ActionRequest {
        private String type;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        public ActionRequest() {
        }

        public ActionRequest(String type, Map<String, Object> parameters) {
            this.type = type;
            this.parameters = new LinkedHashMap<>(parameters);
        }

        RuleAction toAction() {
            try {
                return RuleAction.of(ActionType.fromName(type), parameters);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Unknown action type '" + type + "'");
            }
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Object> parameters) {
            this.parameters = parameters != null ? parameters : new LinkedHashMap<>();
        }
    }
}
