package com.vigilant.core.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Vigilant.
 * These map directly to the `vigilant.*` properties in your application.yml.
 */
public class VigilantProperties {

    private boolean enabled = true;

    /**
     * Request header carrying the tenant id, checked against tenant-access blocks.
     */
    private String tenantHeader = "X-Tenant-Id";

    private MonitorProperties monitor = new MonitorProperties();
    private AuditProperties audit = new AuditProperties();
    private RulesProperties rules = new RulesProperties();
    private Map<String, HandlerProperties> handlers = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTenantHeader() {
        return tenantHeader;
    }

    public void setTenantHeader(String tenantHeader) {
        this.tenantHeader = tenantHeader;
    }

    public MonitorProperties getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorProperties monitor) {
        this.monitor = monitor;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public RulesProperties getRules() {
        return rules;
    }

    public void setRules(RulesProperties rules) {
        this.rules = rules;
    }

    public Map<String, HandlerProperties> getHandlers() {
        return handlers;
    }

    public void setHandlers(Map<String, HandlerProperties> handlers) {
        this.handlers = handlers;
    }

    /**
     * Whether the response handler for an action type (block, lock, ...) is on.
     * Handlers are enabled unless explicitly turned off.
     */
    public boolean isHandlerEnabled(String actionType) {
        HandlerProperties props = handlers.get(actionType);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    /**
     * Handler-specific settings, e.g. {@code vigilant.handlers.block.config.default-duration}.
     */
    public Map<String, Object> getHandlerConfig(String actionType) {
        HandlerProperties props = handlers.get(actionType);
        if (props == null)
            return Map.of();
        return props.getConfig();
    }

    public static class MonitorProperties {
        private boolean autoStart = true;
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

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getIngestionInterval() {
            return ingestionInterval;
        }

        public void setIngestionInterval(Duration ingestionInterval) {
            this.ingestionInterval = ingestionInterval;
        }

        public Duration getThreatDetectionInterval() {
            return threatDetectionInterval;
        }

        public void setThreatDetectionInterval(Duration threatDetectionInterval) {
            this.threatDetectionInterval = threatDetectionInterval;
        }

        public Duration getCorrelationInterval() {
            return correlationInterval;
        }

        public void setCorrelationInterval(Duration correlationInterval) {
            this.correlationInterval = correlationInterval;
        }

        public Duration getCorrelationWindow() {
            return correlationWindow;
        }

        public void setCorrelationWindow(Duration correlationWindow) {
            this.correlationWindow = correlationWindow;
        }

        public int getMaxEventsPerBatch() {
            return maxEventsPerBatch;
        }

        public void setMaxEventsPerBatch(int maxEventsPerBatch) {
            this.maxEventsPerBatch = maxEventsPerBatch;
        }

        public int getMaxCorrelationEvents() {
            return maxCorrelationEvents;
        }

        public void setMaxCorrelationEvents(int maxCorrelationEvents) {
            this.maxCorrelationEvents = maxCorrelationEvents;
        }

        public int getMaxCorrelations() {
            return maxCorrelations;
        }

        public void setMaxCorrelations(int maxCorrelations) {
            this.maxCorrelations = maxCorrelations;
        }

        public boolean isAutoResponseEnabled() {
            return autoResponseEnabled;
        }

        public void setAutoResponseEnabled(boolean autoResponseEnabled) {
            this.autoResponseEnabled = autoResponseEnabled;
        }

        public int getMaxAutoResponsesPerHour() {
            return maxAutoResponsesPerHour;
        }

        public void setMaxAutoResponsesPerHour(int maxAutoResponsesPerHour) {
            this.maxAutoResponsesPerHour = maxAutoResponsesPerHour;
        }

        public int getAutoResponseMinRiskScore() {
            return autoResponseMinRiskScore;
        }

        public void setAutoResponseMinRiskScore(int autoResponseMinRiskScore) {
            this.autoResponseMinRiskScore = autoResponseMinRiskScore;
        }

        public int getCorrelationRiskThreshold() {
            return correlationRiskThreshold;
        }

        public void setCorrelationRiskThreshold(int correlationRiskThreshold) {
            this.correlationRiskThreshold = correlationRiskThreshold;
        }

        public int getReportingThreshold() {
            return reportingThreshold;
        }

        public void setReportingThreshold(int reportingThreshold) {
            this.reportingThreshold = reportingThreshold;
        }

        public int getCriticalThreshold() {
            return criticalThreshold;
        }

        public void setCriticalThreshold(int criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
        }

        public int getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(int highThreshold) {
            this.highThreshold = highThreshold;
        }

        public int getMediumThreshold() {
            return mediumThreshold;
        }

        public void setMediumThreshold(int mediumThreshold) {
            this.mediumThreshold = mediumThreshold;
        }

        public boolean isEnableThreatIntelligence() {
            return enableThreatIntelligence;
        }

        public void setEnableThreatIntelligence(boolean enableThreatIntelligence) {
            this.enableThreatIntelligence = enableThreatIntelligence;
        }

        public boolean isStartFromLatest() {
            return startFromLatest;
        }

        public void setStartFromLatest(boolean startFromLatest) {
            this.startFromLatest = startFromLatest;
        }

        public Duration getResponseActionTimeout() {
            return responseActionTimeout;
        }

        public void setResponseActionTimeout(Duration responseActionTimeout) {
            this.responseActionTimeout = responseActionTimeout;
        }

        public Duration getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }
    }

    public static class AuditProperties {
        /** JSON-lines file for response audit entries. Unset keeps them in memory. */
        private String logFile;

        public String getLogFile() {
            return logFile;
        }

        public void setLogFile(String logFile) {
            this.logFile = logFile;
        }
    }

    public static class RulesProperties {
        private boolean loadDefaults = true;

        public boolean isLoadDefaults() {
            return loadDefaults;
        }

        public void setLoadDefaults(boolean loadDefaults) {
            this.loadDefaults = loadDefaults;
        }
    }

    public static class HandlerProperties {
        private boolean enabled = true;
        private Map<String, Object> config = new HashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }
    }
}
