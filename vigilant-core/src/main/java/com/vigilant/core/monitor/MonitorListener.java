package com.vigilant.core.monitor;

import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;

/**
 * Callback for what the monitor finds and does. Listeners run on the tick thread,
 * so they should hand slow work off. A listener that throws is logged and skipped.
 */
public interface MonitorListener {

    /** A reported threat opened a new incident. */
    default void threatDetected(ThreatIntelligence threat, SecurityIncident incident) {
    }

    /** The response engine ran for a threat. */
    default void autoResponseTriggered(ThreatIntelligence threat, SecurityIncident incident,
            AutomatedResponseResult result) {
    }
}
