package com.vigilant.core.model;

import java.time.Duration;

/**
 * Shape of a correlated event group.
 */
public class CorrelationPattern {

    private final String ruleId;
    private final int eventCount;
    private final Duration timeSpan;
    private final double frequency; // events per minute
    private final int uniqueIps;
    private final int uniqueActors;
    private final int uniqueTenants;
    private final int uniqueActions;

    public CorrelationPattern(String ruleId, int eventCount, Duration timeSpan, double frequency,
            int uniqueIps, int uniqueActors, int uniqueTenants, int uniqueActions) {
        this.ruleId = ruleId;
        this.eventCount = eventCount;
        this.timeSpan = timeSpan;
        this.frequency = frequency;
        this.uniqueIps = uniqueIps;
        this.uniqueActors = uniqueActors;
        this.uniqueTenants = uniqueTenants;
        this.uniqueActions = uniqueActions;
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getEventCount() {
        return eventCount;
    }

    public Duration getTimeSpan() {
        return timeSpan;
    }

    public double getFrequency() {
        return frequency;
    }

    public int getUniqueIps() {
        return uniqueIps;
    }

    public int getUniqueActors() {
        return uniqueActors;
    }

    public int getUniqueTenants() {
        return uniqueTenants;
    }

    public int getUniqueActions() {
        return uniqueActions;
    }

    @Override
    public String toString() {
        return "CorrelationPattern{" +
                "eventCount=" + eventCount +
                ", timeSpan=" + timeSpan +
                ", uniqueIps=" + uniqueIps +
                ", uniqueActors=" + uniqueActors +
                '}';
    }
}
