package com.vigilant.core.config;

import com.vigilant.core.model.Severity;

import java.time.Duration;

/**
 * Immutable runtime settings of the security monitor. Build one from
 * {@link VigilantProperties} at startup and swap it at runtime through
 * {@code SecurityMonitor.updateConfig}.
 */
public final class MonitoringConfig {

    private final Duration ingestionInterval;
    private final Duration threatDetectionInterval;
    private final Duration correlationInterval;
    private final Duration correlationWindow;
    private final int maxEventsPerBatch;
    private final int maxCorrelationEvents;
    private final int maxCorrelations;
    private final boolean autoResponseEnabled;
    private final int maxAutoResponsesPerHour;
    private final int autoResponseMinRiskScore;
    private final int correlationRiskThreshold;
    private final int reportingThreshold;
    private final int criticalThreshold;
    private final int highThreshold;
    private final int mediumThreshold;
    private final boolean enableThreatIntelligence;
    private final boolean startFromLatest;
    private final Duration responseActionTimeout;
    private final Duration shutdownGracePeriod;

    private MonitoringConfig(Builder builder) {
        this.ingestionInterval = builder.ingestionInterval;
        this.threatDetectionInterval = builder.threatDetectionInterval;
        this.correlationInterval = builder.correlationInterval;
        this.correlationWindow = builder.correlationWindow;
        this.maxEventsPerBatch = builder.maxEventsPerBatch;
        this.maxCorrelationEvents = builder.maxCorrelationEvents;
        this.maxCorrelations = builder.maxCorrelations;
        this.autoResponseEnabled = builder.autoResponseEnabled;
        this.maxAutoResponsesPerHour = builder.maxAutoResponsesPerHour;
        this.autoResponseMinRiskScore = builder.autoResponseMinRiskScore;
        this.correlationRiskThreshold = builder.correlationRiskThreshold;
        this.reportingThreshold = builder.reportingThreshold;
        this.criticalThreshold = builder.criticalThreshold;
        this.highThreshold = builder.highThreshold;
        this.mediumThreshold = builder.mediumThreshold;
        this.enableThreatIntelligence = builder.enableThreatIntelligence;
        this.startFromLatest = builder.startFromLatest;
        this.responseActionTimeout = builder.responseActionTimeout;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
    }

    public static MonitoringConfig defaults() {
        return builder().build();
    }

    public static MonitoringConfig from(VigilantProperties properties) {
        VigilantProperties.MonitorProperties monitor = properties.getMonitor();
        return builder()
                .ingestionInterval(monitor.getIngestionInterval())
                .threatDetectionInterval(monitor.getThreatDetectionInterval())
                .correlationInterval(monitor.getCorrelationInterval())
                .correlationWindow(monitor.getCorrelationWindow())
                .maxEventsPerBatch(monitor.getMaxEventsPerBatch())
                .maxCorrelationEvents(monitor.getMaxCorrelationEvents())
                .maxCorrelations(monitor.getMaxCorrelations())
                .autoResponseEnabled(monitor.isAutoResponseEnabled())
                .maxAutoResponsesPerHour(monitor.getMaxAutoResponsesPerHour())
                .autoResponseMinRiskScore(monitor.getAutoResponseMinRiskScore())
                .correlationRiskThreshold(monitor.getCorrelationRiskThreshold())
                .reportingThreshold(monitor.getReportingThreshold())
                .criticalThreshold(monitor.getCriticalThreshold())
                .highThreshold(monitor.getHighThreshold())
                .mediumThreshold(monitor.getMediumThreshold())
                .enableThreatIntelligence(monitor.isEnableThreatIntelligence())
                .startFromLatest(monitor.isStartFromLatest())
                .responseActionTimeout(monitor.getResponseActionTimeout())
                .shutdownGracePeriod(monitor.getShutdownGracePeriod())
                .build();
    }

    /**
     * @throws InvalidConfigurationException on the first invalid setting
     */
    public MonitoringConfig validate() {
        requirePositive("ingestionInterval", ingestionInterval);
        requirePositive("threatDetectionInterval", threatDetectionInterval);
        requirePositive("correlationInterval", correlationInterval);
        requirePositive("correlationWindow", correlationWindow);
        requirePositive("responseActionTimeout", responseActionTimeout);
        if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
            throw new InvalidConfigurationException("shutdownGracePeriod must not be negative");
        }
        requirePositive("maxEventsPerBatch", maxEventsPerBatch);
        requirePositive("maxCorrelationEvents", maxCorrelationEvents);
        requirePositive("maxCorrelations", maxCorrelations);
        if (maxAutoResponsesPerHour < 0) {
            throw new InvalidConfigurationException("maxAutoResponsesPerHour must not be negative");
        }
        requireScore("autoResponseMinRiskScore", autoResponseMinRiskScore);
        requireScore("correlationRiskThreshold", correlationRiskThreshold);
        requireScore("reportingThreshold", reportingThreshold);
        requireScore("criticalThreshold", criticalThreshold);
        requireScore("highThreshold", highThreshold);
        requireScore("mediumThreshold", mediumThreshold);
        if (!(mediumThreshold <= highThreshold && highThreshold <= criticalThreshold)) {
            throw new InvalidConfigurationException(
                    "Severity thresholds must satisfy medium <= high <= critical");
        }
        return this;
    }

    /** Severity bucket for a risk score. */
    public Severity severityFor(int riskScore) {
        if (riskScore >= criticalThreshold) {
            return Severity.CRITICAL;
        }
        if (riskScore >= highThreshold) {
            return Severity.HIGH;
        }
        if (riskScore >= mediumThreshold) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException(name + " must be a positive duration");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireScore(String name, int value) {
        if (value < 0 || value > 100) {
            throw new InvalidConfigurationException(name + " must be within 0-100, got " + value);
        }
    }

    public Duration getIngestionInterval() {
        return ingestionInterval;
    }

    public Duration getThreatDetectionInterval() {
        return threatDetectionInterval;
    }

    public Duration getCorrelationInterval() {
        return correlationInterval;
    }

    public Duration getCorrelationWindow() {
        return correlationWindow;
    }

    public int getMaxEventsPerBatch() {
        return maxEventsPerBatch;
    }

    public int getMaxCorrelationEvents() {
        return maxCorrelationEvents;
    }

    public int getMaxCorrelations() {
        return maxCorrelations;
    }

    public boolean isAutoResponseEnabled() {
        return autoResponseEnabled;
    }

    public int getMaxAutoResponsesPerHour() {
        return maxAutoResponsesPerHour;
    }

    public int getAutoResponseMinRiskScore() {
        return autoResponseMinRiskScore;
    }

    public int getCorrelationRiskThreshold() {
        return correlationRiskThreshold;
    }

    public int getReportingThreshold() {
        return reportingThreshold;
    }

    public int getCriticalThreshold() {
        return criticalThreshold;
    }

    public int getHighThreshold() {
        return highThreshold;
    }

    public int getMediumThreshold() {
        return mediumThreshold;
    }

    public boolean isEnableThreatIntelligence() {
        return enableThreatIntelligence;
    }

    public boolean isStartFromLatest() {
        return startFromLatest;
    }

    public Duration getResponseActionTimeout() {
        return responseActionTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public Builder toBuilder() {
        return new Builder()
                .ingestionInterval(ingestionInterval)
                .threatDetectionInterval(threatDetectionInterval)
                .correlationInterval(correlationInterval)
                .correlationWindow(correlationWindow)
                .maxEventsPerBatch(maxEventsPerBatch)
                .maxCorrelationEvents(maxCorrelationEvents)
                .maxCorrelations(maxCorrelations)
                .autoResponseEnabled(autoResponseEnabled)
                .maxAutoResponsesPerHour(maxAutoResponsesPerHour)
                .autoResponseMinRiskScore(autoResponseMinRiskScore)
                .correlationRiskThreshold(correlationRiskThreshold)
                .reportingThreshold(reportingThreshold)
                .criticalThreshold(criticalThreshold)
                .highThreshold(highThreshold)
                .mediumThreshold(mediumThreshold)
                .enableThreatIntelligence(enableThreatIntelligence)
                .startFromLatest(startFromLatest)
                .responseActionTimeout(responseActionTimeout)
                .shutdownGracePeriod(shutdownGracePeriod);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MonitoringConfig{ingestion=" + ingestionInterval
                + ", detection=" + threatDetectionInterval
                + ", correlation=" + correlationInterval
                + ", window=" + correlationWindow
                + ", autoResponse=" + autoResponseEnabled
                + ", maxAutoResponsesPerHour=" + maxAutoResponsesPerHour + '}';
    }

    public static class Builder {
        private Duration ingestionInterval = Duration.ofSeconds(5);
        private Duration threatDetectionInterval = Duration.ofSeconds(10);
        private Duration correlationInterval = Duration.ofSeconds(15);
        private Duration correlationWindow = Duration.ofMinutes(60);
        private int maxEventsPerBatch = 100;
        private int maxCorrelationEvents = 1000;
        private int maxCorrelations = 20;
        private boolean autoResponseEnabled = true;
        private int maxAutoResponsesPerHour = 50;
        private int autoResponseMinRiskScore = 60;
        private int correlationRiskThreshold = 70;
        private int reportingThreshold = 25;
        private int criticalThreshold = 90;
        private int highThreshold = 75;
        private int mediumThreshold = 50;
        private boolean enableThreatIntelligence = true;
        private boolean startFromLatest = false;
        private Duration responseActionTimeout = Duration.ofSeconds(5);
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);

        public Builder ingestionInterval(Duration ingestionInterval) {
            this.ingestionInterval = ingestionInterval;
            return this;
        }

        public Builder threatDetectionInterval(Duration threatDetectionInterval) {
            this.threatDetectionInterval = threatDetectionInterval;
            return this;
        }

        public Builder correlationInterval(Duration correlationInterval) {
            this.correlationInterval = correlationInterval;
            return this;
        }

        public Builder correlationWindow(Duration correlationWindow) {
            this.correlationWindow = correlationWindow;
            return this;
        }

        public Builder maxEventsPerBatch(int maxEventsPerBatch) {
            this.maxEventsPerBatch = maxEventsPerBatch;
            return this;
        }

        public Builder maxCorrelationEvents(int maxCorrelationEvents) {
            this.maxCorrelationEvents = maxCorrelationEvents;
            return this;
        }

        public Builder maxCorrelations(int maxCorrelations) {
            this.maxCorrelations = maxCorrelations;
            return this;
        }

        public Builder autoResponseEnabled(boolean autoResponseEnabled) {
            this.autoResponseEnabled = autoResponseEnabled;
            return this;
        }

        public Builder maxAutoResponsesPerHour(int maxAutoResponsesPerHour) {
            this.maxAutoResponsesPerHour = maxAutoResponsesPerHour;
            return this;
        }

        public Builder autoResponseMinRiskScore(int autoResponseMinRiskScore) {
            this.autoResponseMinRiskScore = autoResponseMinRiskScore;
            return this;
        }

        public Builder correlationRiskThreshold(int correlationRiskThreshold) {
            this.correlationRiskThreshold = correlationRiskThreshold;
            return this;
        }

        public Builder reportingThreshold(int reportingThreshold) {
            this.reportingThreshold = reportingThreshold;
            return this;
        }

        public Builder criticalThreshold(int criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
            return this;
        }

        public Builder highThreshold(int highThreshold) {
            this.highThreshold = highThreshold;
            return this;
        }

        public Builder mediumThreshold(int mediumThreshold) {
            this.mediumThreshold = mediumThreshold;
            return this;
        }

        public Builder enableThreatIntelligence(boolean enableThreatIntelligence) {
            this.enableThreatIntelligence = enableThreatIntelligence;
            return this;
        }

        public Builder startFromLatest(boolean startFromLatest) {
            this.startFromLatest = startFromLatest;
            return this;
        }

        public Builder responseActionTimeout(Duration responseActionTimeout) {
            this.responseActionTimeout = responseActionTimeout;
            return this;
        }

        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        public MonitoringConfig build() {
            return new MonitoringConfig(this);
        }
    }
}
