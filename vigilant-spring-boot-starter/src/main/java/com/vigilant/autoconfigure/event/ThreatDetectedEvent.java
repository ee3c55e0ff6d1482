package com.vigilant.autoconfigure.event;

import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the monitor opens an incident for a threat.
 */
public class ThreatDetectedEvent extends ApplicationEvent {

    private final ThreatIntelligence threat;
    private final SecurityIncident incident;

    public ThreatDetectedEvent(Object source, ThreatIntelligence threat, SecurityIncident incident) {
        super(source);
        this.threat = threat;
        this.incident = incident;
    }

    public ThreatIntelligence getThreat() {
        return threat;
    }

    public SecurityIncident getIncident() {
        return incident;
    }
}
