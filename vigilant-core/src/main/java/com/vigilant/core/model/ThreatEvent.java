package com.vigilant.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry on a threat or incident timeline.
 */
public class ThreatEvent {

    private final Instant timestamp;
    private final String description;
    private final Severity severity;
    private final Map<String, Object> details;

    public ThreatEvent(Instant timestamp, String description, Severity severity, Map<String, Object> details) {
        this.timestamp = timestamp;
        this.description = description;
        this.severity = severity;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
