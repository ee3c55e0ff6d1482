package com.vigilant.core.rule;

public class RuleNotFoundException extends RuntimeException {

    private final String ruleId;

    public RuleNotFoundException(String ruleId) {
        super("No rule with id '" + ruleId + "'");
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
