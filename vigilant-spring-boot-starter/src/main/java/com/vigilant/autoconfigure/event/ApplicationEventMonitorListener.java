package com.vigilant.autoconfigure.event;

import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.monitor.MonitorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes monitor callbacks as Spring application events, so applications
 * can react with {@code @EventListener} methods.
 */
public class ApplicationEventMonitorListener implements MonitorListener {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventMonitorListener.class);

    private final ApplicationEventPublisher publisher;

    public ApplicationEventMonitorListener(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void threatDetected(ThreatIntelligence threat, SecurityIncident incident) {
        log.debug("[Vigilant] Publishing ThreatDetectedEvent for {}", threat.getThreatId());
        publisher.publishEvent(new ThreatDetectedEvent(this, threat, incident));
    }

    @Override
    public void autoResponseTriggered(ThreatIntelligence threat, SecurityIncident incident,
            AutomatedResponseResult result) {
        log.debug("[Vigilant] Publishing AutoResponseTriggeredEvent for {}", threat.getThreatId());
        publisher.publishEvent(new AutoResponseTriggeredEvent(this, threat, incident, result));
    }
}
