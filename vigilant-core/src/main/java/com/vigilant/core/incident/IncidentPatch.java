package com.vigilant.core.incident;

import com.vigilant.core.model.IncidentStatus;
import com.vigilant.core.model.ResponseAction;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial update of an incident. Null fields are left as they are; list fields
 * are appended.
 */
public class IncidentPatch {

    private final IncidentStatus status;
    private final String assignedTo;
    private final String resolution;
    private final List<ResponseAction> responseActions;
    private final List<ThreatEvent> timeline;

    private IncidentPatch(Builder builder) {
        this.status = builder.status;
        this.assignedTo = builder.assignedTo;
        this.resolution = builder.resolution;
        this.responseActions = List.copyOf(builder.responseActions);
        this.timeline = List.copyOf(builder.timeline);
    }

    public IncidentStatus getStatus() {
        return status;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public String getResolution() {
        return resolution;
    }

    public List<ResponseAction> getResponseActions() {
        return responseActions;
    }

    public List<ThreatEvent> getTimeline() {
        return timeline;
    }

    /**
     * Applies this patch to {@code incident}, stamping {@code updatedAt}.
     */
    public SecurityIncident applyTo(SecurityIncident incident, Instant updatedAt) {
        SecurityIncident.Builder builder = incident.toBuilder().updatedAt(updatedAt);
        if (status != null) {
            builder.status(status);
        }
        if (assignedTo != null) {
            builder.assignedTo(assignedTo);
        }
        if (resolution != null) {
            builder.resolution(resolution);
        }
        if (!responseActions.isEmpty()) {
            List<ResponseAction> merged = new ArrayList<>(incident.getResponseActions());
            merged.addAll(responseActions);
            builder.responseActions(merged);
        }
        if (!timeline.isEmpty()) {
            List<ThreatEvent> merged = new ArrayList<>(incident.getTimeline());
            merged.addAll(timeline);
            builder.timeline(merged);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IncidentStatus status;
        private String assignedTo;
        private String resolution;
        private final List<ResponseAction> responseActions = new ArrayList<>();
        private final List<ThreatEvent> timeline = new ArrayList<>();

        public Builder status(IncidentStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder responseActions(List<ResponseAction> actions) {
            this.responseActions.addAll(actions);
            return this;
        }

        public Builder timelineEntry(ThreatEvent entry) {
            this.timeline.add(entry);
            return this;
        }

        public IncidentPatch build() {
            return new IncidentPatch(this);
        }
    }
}
