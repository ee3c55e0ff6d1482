package com.vigilant.autoconfigure.web;

import com.vigilant.core.config.MonitoringConfig;

import java.time.Duration;

/**
 * Partial monitoring configuration change. Null fields keep their current value.
 */
public class MonitoringConfigUpdate {

    private Long ingestionIntervalSeconds;
    private Long threatDetectionIntervalSeconds;
    private Long correlationIntervalSeconds;
    private Long correlationWindowMinutes;
    private Integer maxEventsPerBatch;
    private Integer maxCorrelationEvents;
    private Boolean autoResponseEnabled;
    private Integer maxAutoResponsesPerHour;
    private Integer autoResponseMinRiskScore;
    private Integer correlationRiskThreshold;
    private Integer reportingThreshold;
    private Boolean enableThreatIntelligence;
    private Long responseActionTimeoutMillis;

    MonitoringConfig applyTo(MonitoringConfig current) {
        MonitoringConfig.Builder builder = current.toBuilder();
        if (ingestionIntervalSeconds != null) {
            builder.ingestionInterval(Duration.ofSeconds(ingestionIntervalSeconds));
        }
        if (threatDetectionIntervalSeconds != null) {
            builder.threatDetectionInterval(Duration.ofSeconds(threatDetectionIntervalSeconds));
        }
        if (correlationIntervalSeconds != null) {
            builder.correlationInterval(Duration.ofSeconds(correlationIntervalSeconds));
        }
        if (correlationWindowMinutes != null) {
            builder.correlationWindow(Duration.ofMinutes(correlationWindowMinutes));
        }
        if (maxEventsPerBatch != null) {
            builder.maxEventsPerBatch(maxEventsPerBatch);
        }
        if (maxCorrelationEvents != null) {
            builder.maxCorrelationEvents(maxCorrelationEvents);
        }
        if (autoResponseEnabled != null) {
            builder.autoResponseEnabled(autoResponseEnabled);
        }
        if (maxAutoResponsesPerHour != null) {
            builder.maxAutoResponsesPerHour(maxAutoResponsesPerHour);
        }
        if (autoResponseMinRiskScore != null) {
            builder.autoResponseMinRiskScore(autoResponseMinRiskScore);
        }
        if (correlationRiskThreshold != null) {
            builder.correlationRiskThreshold(correlationRiskThreshold);
        }
        if (reportingThreshold != null) {
            builder.reportingThreshold(reportingThreshold);
        }
        if (enableThreatIntelligence != null) {
            builder.enableThreatIntelligence(enableThreatIntelligence);
        }
        if (responseActionTimeoutMillis != null) {
            builder.responseActionTimeout(Duration.ofMillis(responseActionTimeoutMillis));
        }
        return builder.build();
    }

    public Long getIngestionIntervalSeconds() {
        return ingestionIntervalSeconds;
    }

    public void setIngestionIntervalSeconds(Long ingestionIntervalSeconds) {
        this.ingestionIntervalSeconds = ingestionIntervalSeconds;
    }

    public Long getThreatDetectionIntervalSeconds() {
        return threatDetectionIntervalSeconds;
    }

    public void setThreatDetectionIntervalSeconds(Long threatDetectionIntervalSeconds) {
        this.threatDetectionIntervalSeconds = threatDetectionIntervalSeconds;
    }

    public Long getCorrelationIntervalSeconds() {
        return correlationIntervalSeconds;
    }

    public void setCorrelationIntervalSeconds(Long correlationIntervalSeconds) {
        this.correlationIntervalSeconds = correlationIntervalSeconds;
    }

    public Long getCorrelationWindowMinutes() {
        return correlationWindowMinutes;
    }

    public void setCorrelationWindowMinutes(Long correlationWindowMinutes) {
        this.correlationWindowMinutes = correlationWindowMinutes;
    }

    public Integer getMaxEventsPerBatch() {
        return maxEventsPerBatch;
    }

    public void setMaxEventsPerBatch(Integer maxEventsPerBatch) {
        this.maxEventsPerBatch = maxEventsPerBatch;
    }

    public Integer getMaxCorrelationEvents() {
        return maxCorrelationEvents;
    }

    public void setMaxCorrelationEvents(Integer maxCorrelationEvents) {
        this.maxCorrelationEvents = maxCorrelationEvents;
    }

    public Boolean getAutoResponseEnabled() {
        return autoResponseEnabled;
    }

    public void setAutoResponseEnabled(Boolean autoResponseEnabled) {
        this.autoResponseEnabled = autoResponseEnabled;
    }

    public Integer getMaxAutoResponsesPerHour() {
        return maxAutoResponsesPerHour;
    }

    public void setMaxAutoResponsesPerHour(Integer maxAutoResponsesPerHour) {
        this.maxAutoResponsesPerHour = maxAutoResponsesPerHour;
    }

    public Integer getAutoResponseMinRiskScore() {
        return autoResponseMinRiskScore;
    }

    public void setAutoResponseMinRiskScore(Integer autoResponseMinRiskScore) {
        this.autoResponseMinRiskScore = autoResponseMinRiskScore;
    }

    public Integer getCorrelationRiskThreshold() {
        return correlationRiskThreshold;
    }

    public void setCorrelationRiskThreshold(Integer correlationRiskThreshold) {
        this.correlationRiskThreshold = correlationRiskThreshold;
    }

    public Integer getReportingThreshold() {
        return reportingThreshold;
    }

    public void setReportingThreshold(Integer reportingThreshold) {
        this.reportingThreshold = reportingThreshold;
    }

    public Boolean getEnableThreatIntelligence() {
        return enableThreatIntelligence;
    }

    public void setEnableThreatIntelligence(Boolean enableThreatIntelligence) {
        this.enableThreatIntelligence = enableThreatIntelligence;
    }

    public Long getResponseActionTimeoutMillis() {
        return responseActionTimeoutMillis;
    }

    public void setResponseActionTimeoutMillis(Long responseActionTimeoutMillis) {
        this.responseActionTimeoutMillis = responseActionTimeoutMillis;
    }
}
