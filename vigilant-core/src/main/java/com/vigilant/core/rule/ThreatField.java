package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.model.ThreatIntelligence;

import java.util.function.Function;

/**
 * Fields of a {@link ThreatIntelligence} record that response conditions can test.
 */
public enum ThreatField implements RuleField {

    THREAT_TYPE("threatType", false, ThreatIntelligence::getThreatType),
    RISK_SCORE("riskScore", true, ThreatIntelligence::getRiskScore),
    CONFIDENCE("confidence", true, ThreatIntelligence::getConfidence),
    STATUS("status", false, t -> t.getStatus().wireName()),
    SOURCE("source", false, t -> t.getSource().name().toLowerCase()),
    AFFECTED_RESOURCES("affectedResources", false, ThreatIntelligence::getAffectedResources),
    INDICATOR_COUNT("indicatorCount", true, t -> t.getIndicators().size()),
    RESOURCE_COUNT("resourceCount", true, t -> t.getAffectedResources().size()),
    TIMELINE_COUNT("timelineCount", true, t -> t.getTimeline().size());

    private final String wireName;
    private final boolean numeric;
    private final Function<ThreatIntelligence, Object> accessor;

    ThreatField(String wireName, boolean numeric, Function<ThreatIntelligence, Object> accessor) {
        this.wireName = wireName;
        this.numeric = numeric;
        this.accessor = accessor;
    }

    public Object valueOf(ThreatIntelligence threat) {
        return accessor.apply(threat);
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public boolean isNumeric() {
        return numeric;
    }

    public static ThreatField fromName(String name) {
        for (ThreatField field : values()) {
            if (field.wireName.equals(name) || field.name().equalsIgnoreCase(name)) {
                return field;
            }
        }
        throw new InvalidConfigurationException("Unknown threat field '" + name + "'");
    }
}
