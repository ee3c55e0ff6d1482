package com.vigilant.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Unified threat record, produced by the classifier for a single event or
 * derived from an {@link EventCorrelation}.
 */
public class ThreatIntelligence {

    private final String threatId;
    private final String threatType;
    private final ThreatSource source;
    private final String description;
    private final int riskScore; // 0-100
    private final int confidence; // 0-100
    private final List<ThreatIndicator> indicators;
    private final List<String> affectedResources;
    private final List<ThreatEvent> timeline;
    private final ThreatStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private ThreatIntelligence(Builder builder) {
        this.threatId = Objects.requireNonNull(builder.threatId, "threatId");
        this.threatType = Objects.requireNonNull(builder.threatType, "threatType");
        this.source = builder.source != null ? builder.source : ThreatSource.CLASSIFIER;
        this.description = builder.description;
        this.riskScore = clamp(builder.riskScore);
        this.confidence = clamp(builder.confidence);
        this.indicators = builder.indicators != null ? List.copyOf(builder.indicators) : List.of();
        this.affectedResources = builder.affectedResources != null ? List.copyOf(builder.affectedResources) : List.of();
        this.timeline = builder.timeline != null ? List.copyOf(builder.timeline) : List.of();
        this.status = builder.status != null ? builder.status : ThreatStatus.ACTIVE;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    public String getThreatId() {
        return threatId;
    }

    public String getThreatType() {
        return threatType;
    }

    public ThreatSource getSource() {
        return source;
    }

    public String getDescription() {
        return description;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public int getConfidence() {
        return confidence;
    }

    public List<ThreatIndicator> getIndicators() {
        return indicators;
    }

    public List<String> getAffectedResources() {
        return affectedResources;
    }

    public List<ThreatEvent> getTimeline() {
        return timeline;
    }

    public ThreatStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /** First indicator of the given type, or null. */
    public ThreatIndicator firstIndicator(IndicatorType type) {
        for (ThreatIndicator indicator : indicators) {
            if (indicator.getType() == type) {
                return indicator;
            }
        }
        return null;
    }

    /**
     * Value of the first affected resource with the given prefix, with the prefix
     * stripped. {@code resourceValue("user_")} on {@code [user_42]} returns "42".
     */
    public String resourceValue(String prefix) {
        for (String resource : affectedResources) {
            if (resource.startsWith(prefix)) {
                return resource.substring(prefix.length());
            }
        }
        return null;
    }

    public Builder toBuilder() {
        return new Builder()
                .threatId(threatId)
                .threatType(threatType)
                .source(source)
                .description(description)
                .riskScore(riskScore)
                .confidence(confidence)
                .indicators(indicators)
                .affectedResources(affectedResources)
                .timeline(timeline)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String threatId;
        private String threatType;
        private ThreatSource source;
        private String description;
        private int riskScore;
        private int confidence;
        private List<ThreatIndicator> indicators;
        private List<String> affectedResources;
        private List<ThreatEvent> timeline;
        private ThreatStatus status;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder threatId(String threatId) {
            this.threatId = threatId;
            return this;
        }

        public Builder threatType(String threatType) {
            this.threatType = threatType;
            return this;
        }

        public Builder source(ThreatSource source) {
            this.source = source;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder riskScore(int riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder indicators(List<ThreatIndicator> indicators) {
            this.indicators = indicators;
            return this;
        }

        public Builder affectedResources(List<String> affectedResources) {
            this.affectedResources = affectedResources;
            return this;
        }

        public Builder timeline(List<ThreatEvent> timeline) {
            this.timeline = timeline;
            return this;
        }

        public Builder status(ThreatStatus status) {
            this.status = status;
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

        public ThreatIntelligence build() {
            return new ThreatIntelligence(this);
        }
    }

    @Override
    public String toString() {
        return "ThreatIntelligence{" +
                "threatId='" + threatId + '\'' +
                ", type='" + threatType + '\'' +
                ", risk=" + riskScore +
                ", confidence=" + confidence +
                ", status=" + status +
                '}';
    }
}
