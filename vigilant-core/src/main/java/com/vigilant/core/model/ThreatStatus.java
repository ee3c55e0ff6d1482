package com.vigilant.core.model;

public enum ThreatStatus {
    ACTIVE,
    INVESTIGATING,
    CONTAINED,
    RESOLVED,
    FALSE_POSITIVE;

    public String wireName() {
        return name().toLowerCase();
    }
}
