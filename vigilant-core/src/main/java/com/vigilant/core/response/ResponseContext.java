package com.vigilant.core.response;

import com.vigilant.core.alert.AlertDispatcher;
import com.vigilant.core.audit.AuditEntry;
import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.config.VigilantProperties;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.store.DecisionStore;

import java.time.Clock;
import java.util.Map;

/**
 * Shared context passed to each ActionHandler.
 * Provides access to enforcement state, alerting, the audit trail and configuration.
 */
public class ResponseContext {

    private final DecisionStore decisionStore;
    private final AlertDispatcher alertDispatcher;
    private final ResponseAuditLog auditLog;
    private final VigilantProperties properties;
    private final Clock clock;

    public ResponseContext(DecisionStore decisionStore, AlertDispatcher alertDispatcher,
            ResponseAuditLog auditLog, VigilantProperties properties, Clock clock) {
        this.decisionStore = decisionStore;
        this.alertDispatcher = alertDispatcher;
        this.auditLog = auditLog;
        this.properties = properties;
        this.clock = clock;
    }

    /** Blocks, locks, restrictions. */
    public DecisionStore getDecisionStore() {
        return decisionStore;
    }

    public AlertDispatcher getAlertDispatcher() {
        return alertDispatcher;
    }

    public ResponseAuditLog getAuditLog() {
        return auditLog;
    }

    public VigilantProperties getProperties() {
        return properties;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Appends an audit entry for an action taken against {@code threat}.
     */
    public void audit(String kind, ThreatIntelligence threat, SecurityIncident incident,
            Map<String, Object> details) {
        auditLog.append(new AuditEntry(kind, threat.getThreatId(), incident != null ? incident.getId() : null,
                clock.instant(), details));
    }

    /**
     * Handler setting from {@code vigilant.handlers.{type}.config}, as seconds.
     */
    public long handlerSeconds(String actionType, String key, long defaultValue) {
        Object value = properties.getHandlerConfig(actionType).get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return value != null ? Long.parseLong(value.toString().trim()) : defaultValue;
    }
}
