package com.vigilant.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SecurityAlert {

    private final String id;
    private final String threatId;
    private final String incidentId;
    private final Severity level;
    private final String title;
    private final String message;
    private final boolean actionRequired;
    private final boolean escalated;
    private final Instant createdAt;
    private final Map<String, Object> details;

    public SecurityAlert(String id, String threatId, String incidentId, Severity level, String title,
            String message, boolean actionRequired, boolean escalated, Instant createdAt,
            Map<String, Object> details) {
        this.id = id;
        this.threatId = threatId;
        this.incidentId = incidentId;
        this.level = level;
        this.title = title;
        this.message = message;
        this.actionRequired = actionRequired;
        this.escalated = escalated;
        this.createdAt = createdAt;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getThreatId() {
        return threatId;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public Severity getLevel() {
        return level;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public boolean isActionRequired() {
        return actionRequired;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "SecurityAlert{" + level + " '" + title + "', threat=" + threatId + '}';
    }
}
