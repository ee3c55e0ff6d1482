package com.vigilant.core.rule;

import java.util.List;

public class CorrelationRuleStore extends RuleStore<CorrelationRule> {

    public CorrelationRuleStore(List<CorrelationRule> initialRules) {
        super("correlation", initialRules);
    }

    @Override
    protected String idOf(CorrelationRule rule) {
        return rule.getId();
    }

    @Override
    protected void validate(CorrelationRule rule) {
        RuleValidator.validate(rule);
    }
}
