package com.vigilant.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A group of events that together matched a correlation rule.
 * Derived and ephemeral: the engine recomputes correlations on every pass.
 */
public class EventCorrelation {

    private final String id;
    private final String ruleId;
    private final String ruleName;
    private final String description;
    private final List<SecurityEvent> events; // sorted by timestamp
    private final String correlationKey;
    private final CorrelationPattern pattern;
    private final double riskScore;
    private final int confidence;
    private final int priority;
    private final List<ThreatIndicator> indicators;
    private final List<String> affectedResources;
    private final Duration timeWindow;
    private final Instant detectedAt;

    public EventCorrelation(String id, String ruleId, String ruleName, String description,
            List<SecurityEvent> events, String correlationKey, CorrelationPattern pattern,
            double riskScore, int confidence, int priority, List<ThreatIndicator> indicators,
            List<String> affectedResources, Duration timeWindow, Instant detectedAt) {
        this.id = id;
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.description = description;
        this.events = List.copyOf(events);
        this.correlationKey = correlationKey;
        this.pattern = pattern;
        this.riskScore = riskScore;
        this.confidence = confidence;
        this.priority = priority;
        this.indicators = List.copyOf(indicators);
        this.affectedResources = List.copyOf(affectedResources);
        this.timeWindow = timeWindow;
        this.detectedAt = detectedAt;
    }

    public String getId() {
        return id;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getDescription() {
        return description;
    }

    public List<SecurityEvent> getEvents() {
        return events;
    }

    public String getCorrelationKey() {
        return correlationKey;
    }

    public CorrelationPattern getPattern() {
        return pattern;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public int getConfidence() {
        return confidence;
    }

    public int getPriority() {
        return priority;
    }

    public List<ThreatIndicator> getIndicators() {
        return indicators;
    }

    public List<String> getAffectedResources() {
        return affectedResources;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public SecurityEvent firstEvent() {
        return events.get(0);
    }

    @Override
    public String toString() {
        return "EventCorrelation{" +
                "rule='" + ruleId + '\'' +
                ", key='" + correlationKey + '\'' +
                ", risk=" + riskScore +
                ", " + pattern +
                '}';
    }
}
