package com.vigilant.module.notification;

import com.vigilant.core.alert.AlertRouting;
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
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Raises an alert at the level the rule asks for, on the channels that level
 * routes to.
 */
@Component
public class AlertActionHandler implements ActionHandler {

    @Override
    public ActionType getType() {
        return ActionType.ALERT;
    }

    @Override
    public String getName() {
        return "Alert";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        Severity level = Severity.valueOf(action.stringParam("level", "medium").toUpperCase(Locale.ROOT));
        boolean immediate = action.booleanParam("immediate");
        List<AlertChannel> channels = AlertRouting.channelsFor(level);

        SecurityAlert alert = new SecurityAlert(UUID.randomUUID().toString(), threat.getThreatId(),
                incident != null ? incident.getId() : null, level,
                "Automated response: " + threat.getThreatType(), threat.getDescription(),
                immediate, level == Severity.CRITICAL, context.getClock().instant(),
                Map.of("riskScore", threat.getRiskScore(), "immediate", immediate));

        if (!context.getAlertDispatcher().send(alert, channels)) {
            return ActionOutcome.failure("Alert was not delivered on " + channels);
        }
        return ActionOutcome.success("Alert sent at level " + level.wireName(),
                Map.of("alertId", alert.getId(), "channels", Notifications.names(channels)));
    }
}
