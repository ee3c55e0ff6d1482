package com.vigilant.core.response;

import com.vigilant.core.model.AffectedResources;
import com.vigilant.core.model.IndicatorType;
import com.vigilant.core.model.ThreatIndicator;
import com.vigilant.core.model.ThreatIntelligence;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Who or what a response acts on, read from a threat's indicators and affected
 * resources.
 */
public final class ThreatTargets {

    private ThreatTargets() {
    }

    /** Every distinct IP indicator, in indicator order. */
    public static List<String> ips(ThreatIntelligence threat) {
        return threat.getIndicators().stream()
                .filter(i -> i.getType() == IndicatorType.IP)
                .map(ThreatIndicator::getValue)
                .distinct()
                .collect(Collectors.toList());
    }

    /** The acting user: the first affected user resource, else the first USER indicator. */
    public static String actor(ThreatIntelligence threat) {
        String actor = threat.resourceValue(AffectedResources.USER_PREFIX);
        if (actor != null) {
            return actor;
        }
        ThreatIndicator indicator = threat.firstIndicator(IndicatorType.USER);
        return indicator != null ? indicator.getValue() : null;
    }

    public static String tenant(ThreatIntelligence threat) {
        String tenant = threat.resourceValue(AffectedResources.TENANT_PREFIX);
        if (tenant != null) {
            return tenant;
        }
        ThreatIndicator indicator = threat.firstIndicator(IndicatorType.TENANT);
        return indicator != null ? indicator.getValue() : null;
    }

    public static String reason(ThreatIntelligence threat) {
        return "Automated response to " + threat.getThreatType() + " (" + threat.getThreatId() + ")";
    }
}
