package com.vigilant.core.model;

/** Which detector produced a {@link ThreatIntelligence} record. */
public enum ThreatSource {
    CLASSIFIER,
    CORRELATION
}
