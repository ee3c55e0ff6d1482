package com.vigilant.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Durable record of one detected problem. Immutable; sinks store a new copy for
 * every transition.
 */
public class SecurityIncident {

    private final String id;
    private final String threatId;
    private final Severity severity;
    private final IncidentStatus status;
    private final String title;
    private final String description;
    private final List<String> affectedResources;
    private final boolean escalated;
    private final String assignedTo;
    private final List<ThreatEvent> timeline;
    private final List<Evidence> evidence;
    private final List<ResponseAction> responseActions;
    private final String resolution;
    private final Instant createdAt;
    private final Instant updatedAt;

    private SecurityIncident(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.threatId = Objects.requireNonNull(builder.threatId, "threatId");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.status = builder.status != null ? builder.status : IncidentStatus.OPEN;
        this.title = builder.title;
        this.description = builder.description;
        this.affectedResources = builder.affectedResources != null ? List.copyOf(builder.affectedResources) : List.of();
        this.escalated = builder.escalated;
        this.assignedTo = builder.assignedTo;
        this.timeline = builder.timeline != null ? List.copyOf(builder.timeline) : List.of();
        this.evidence = builder.evidence != null ? List.copyOf(builder.evidence) : List.of();
        this.responseActions = builder.responseActions != null ? List.copyOf(builder.responseActions) : List.of();
        this.resolution = builder.resolution;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getThreatId() {
        return threatId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public IncidentStatus getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAffectedResources() {
        return affectedResources;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public List<ThreatEvent> getTimeline() {
        return timeline;
    }

    public List<Evidence> getEvidence() {
        return evidence;
    }

    public List<ResponseAction> getResponseActions() {
        return responseActions;
    }

    public String getResolution() {
        return resolution;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .threatId(threatId)
                .severity(severity)
                .status(status)
                .title(title)
                .description(description)
                .affectedResources(affectedResources)
                .escalated(escalated)
                .assignedTo(assignedTo)
                .timeline(timeline)
                .evidence(evidence)
                .responseActions(responseActions)
                .resolution(resolution)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String threatId;
        private Severity severity;
        private IncidentStatus status;
        private String title;
        private String description;
        private List<String> affectedResources;
        private boolean escalated;
        private String assignedTo;
        private List<ThreatEvent> timeline;
        private List<Evidence> evidence;
        private List<ResponseAction> responseActions;
        private String resolution;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder threatId(String threatId) {
            this.threatId = threatId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(IncidentStatus status) {
            this.status = status;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder affectedResources(List<String> affectedResources) {
            this.affectedResources = affectedResources;
            return this;
        }

        public Builder escalated(boolean escalated) {
            this.escalated = escalated;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder timeline(List<ThreatEvent> timeline) {
            this.timeline = timeline;
            return this;
        }

        public Builder evidence(List<Evidence> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder responseActions(List<ResponseAction> responseActions) {
            this.responseActions = responseActions;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public SecurityIncident build() {
            return new SecurityIncident(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityIncident{" +
                "id='" + id + '\'' +
                ", threatId='" + threatId + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                '}';
    }
}
