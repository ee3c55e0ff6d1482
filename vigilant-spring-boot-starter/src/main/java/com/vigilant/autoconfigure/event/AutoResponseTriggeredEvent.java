package com.vigilant.autoconfigure.event;

import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import org.springframework.context.ApplicationEvent;

/**
 * Published after the response engine ran for a threat, whether or not any
 * action succeeded.
 */
public class AutoResponseTriggeredEvent extends ApplicationEvent {

    private final ThreatIntelligence threat;
    private final SecurityIncident incident;
    private final AutomatedResponseResult result;

    public AutoResponseTriggeredEvent(Object source, ThreatIntelligence threat, SecurityIncident incident,
            AutomatedResponseResult result) {
        super(source);
        this.threat = threat;
        this.incident = incident;
        this.result = result;
    }

    public ThreatIntelligence getThreat() {
        return threat;
    }

    public SecurityIncident getIncident() {
        return incident;
    }

    public AutomatedResponseResult getResult() {
        return result;
    }
}
