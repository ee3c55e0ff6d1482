package com.vigilant.module.notification;

import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.response.ActionHandler;
import com.vigilant.core.response.ActionOutcome;
import com.vigilant.core.response.ResponseContext;
import com.vigilant.core.rule.RuleAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Records the threat in the audit trail. {@code detailed=true} adds the
 * indicators and affected resources; any other rule parameters are kept as
 * flags on the entry.
 */
@Component
public class LogActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(LogActionHandler.class);

    @Override
    public ActionType getType() {
        return ActionType.LOG;
    }

    @Override
    public String getName() {
        return "Audit Log";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        Map<String, Object> details = new LinkedHashMap<>(action.getParameters());
        details.put("threatType", threat.getThreatType());
        details.put("riskScore", threat.getRiskScore());
        details.put("confidence", threat.getConfidence());
        if (action.booleanParam("detailed")) {
            details.put("indicators", threat.getIndicators().stream()
                    .map(i -> i.getType().wireName() + ":" + i.getValue())
                    .collect(Collectors.toList()));
            details.put("affectedResources", threat.getAffectedResources());
        }
        context.audit(ResponseAuditLog.SECURITY_RESPONSE, threat, incident, details);
        log.info("[Vigilant] [log] Recorded {} for threat {}", ResponseAuditLog.SECURITY_RESPONSE,
                threat.getThreatId());
        return ActionOutcome.success("Logged security response");
    }
}
