package com.vigilant.core.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line in the response audit trail, such as {@code AUTOMATED_IP_BLOCK} or
 * {@code AUTOMATED_RESPONSE_EXECUTED}.
 */
public class AuditEntry {

    private final String kind;
    private final String threatId;
    private final String incidentId;
    private final Instant timestamp;
    private final Map<String, Object> details;

    public AuditEntry(String kind, String threatId, String incidentId, Instant timestamp,
            Map<String, Object> details) {
        this.kind = kind;
        this.threatId = threatId;
        this.incidentId = incidentId;
        this.timestamp = timestamp;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public String getKind() {
        return kind;
    }

    public String getThreatId() {
        return threatId;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "AuditEntry{" + kind + ", threat=" + threatId + ", incident=" + incidentId + '}';
    }
}
