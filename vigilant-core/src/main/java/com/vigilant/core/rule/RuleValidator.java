package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;

/**
 * Load-time checks for rules. Condition value shapes are already enforced by
 * {@link RuleCondition}; this covers the rule-level invariants.
 */
public final class RuleValidator {

    private RuleValidator() {
    }

    public static void validate(CorrelationRule rule) {
        requireId(rule.getId());
        String ref = "Correlation rule '" + rule.getId() + "': ";
        if (rule.getConditions().isEmpty()) {
            throw new InvalidConfigurationException(ref + "at least one condition is required");
        }
        if (rule.getTimeWindow() == null || rule.getTimeWindow().isZero() || rule.getTimeWindow().isNegative()) {
            throw new InvalidConfigurationException(ref + "timeWindow must be positive");
        }
        if (rule.getMinEvents() <= 0) {
            throw new InvalidConfigurationException(ref + "minEvents must be positive");
        }
        if (rule.getMaxEvents() < rule.getMinEvents()) {
            throw new InvalidConfigurationException(ref + "maxEvents must be >= minEvents");
        }
        if (rule.getRiskMultiplier() <= 0) {
            throw new InvalidConfigurationException(ref + "riskMultiplier must be positive");
        }
        requirePercent(ref + "confidence", rule.getConfidence());
    }

    public static void validate(ResponseRule rule) {
        requireId(rule.getId());
        String ref = "Response rule '" + rule.getId() + "': ";
        if (rule.getActions().isEmpty()) {
            throw new InvalidConfigurationException(ref + "at least one action is required");
        }
        for (RuleCondition<ThreatField> condition : rule.getConditions()) {
            if (condition.isSame()) {
                throw new InvalidConfigurationException(ref + "SAME is not valid in a response condition");
            }
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidConfigurationException("Rule id is required");
        }
    }

    private static void requirePercent(String what, int value) {
        if (value < 0 || value > 100) {
            throw new InvalidConfigurationException(what + " must be within 0..100");
        }
    }
}
