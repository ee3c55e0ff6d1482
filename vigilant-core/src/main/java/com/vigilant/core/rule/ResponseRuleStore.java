package com.vigilant.core.rule;

import java.util.List;

public class ResponseRuleStore extends RuleStore<ResponseRule> {

    public ResponseRuleStore(List<ResponseRule> initialRules) {
        super("response", initialRules);
    }

    @Override
    protected String idOf(ResponseRule rule) {
        return rule.getId();
    }

    @Override
    protected void validate(ResponseRule rule) {
        RuleValidator.validate(rule);
    }
}
