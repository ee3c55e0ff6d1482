package com.vigilant.module.notification;

import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.SecurityAlert;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.Severity;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.response.ActionHandler;
import com.vigilant.core.response.ActionOutcome;
import com.vigilant.core.response.ResponseContext;
import com.vigilant.core.rule.RuleAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Notifies people on explicitly listed channels, {@code email} unless the rule
 * says otherwise. {@code escalate=true} marks the notification as escalated.
 */
@Component
public class NotifyActionHandler implements ActionHandler {

    @Override
    public ActionType getType() {
        return ActionType.NOTIFY;
    }

    @Override
    public String getName() {
        return "Notify";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        List<AlertChannel> channels = action.stringListParam("channels", List.of("email")).stream()
                .map(AlertChannel::fromName)
                .collect(Collectors.toList());
        boolean escalate = action.booleanParam("escalate");
        Severity level = incident != null ? incident.getSeverity() : Severity.MEDIUM;

        SecurityAlert notification = new SecurityAlert(UUID.randomUUID().toString(), threat.getThreatId(),
                incident != null ? incident.getId() : null, level,
                "Security notification: " + threat.getThreatType(), threat.getDescription(),
                true, escalate, context.getClock().instant(),
                Map.of("riskScore", threat.getRiskScore(), "escalate", escalate));

        if (!context.getAlertDispatcher().send(notification, channels)) {
            return ActionOutcome.failure("Notification was not delivered on " + Notifications.names(channels));
        }
        return ActionOutcome.success("Notified via " + Notifications.names(channels),
                Map.of("channels", Notifications.names(channels), "escalated", escalate));
    }
}
