package com.vigilant.core.model;

import java.time.Instant;

public class Evidence {

    private final String type;
    private final String value;
    private final Instant timestamp;
    private final int confidence;

    public Evidence(String type, String value, Instant timestamp, int confidence) {
        this.type = type;
        this.value = value;
        this.timestamp = timestamp;
        this.confidence = confidence;
    }

    public static Evidence fromIndicator(ThreatIndicator indicator) {
        return new Evidence(indicator.getType().wireName(), indicator.getValue(),
                indicator.getFirstSeen(), indicator.getConfidence());
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getConfidence() {
        return confidence;
    }
}
