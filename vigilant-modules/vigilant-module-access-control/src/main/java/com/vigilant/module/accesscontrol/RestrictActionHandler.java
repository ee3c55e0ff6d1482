package com.vigilant.module.accesscontrol;

import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.response.ActionHandler;
import com.vigilant.core.response.ActionOutcome;
import com.vigilant.core.response.ResponseContext;
import com.vigilant.core.response.ThreatTargets;
import com.vigilant.core.rule.RuleAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Narrows what an actor may do without locking them out. The restriction is
 * stored under {@code restrict:{target}:{actor}}. The starter's web filter
 * rejects writes for {@code read-only} and every request for {@code denied}, and
 * passes a session limit on to the application.
 */
@Component
public class RestrictActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestrictActionHandler.class);

    static final long DEFAULT_DURATION_SECONDS = 3600;
    static final String KEY_PREFIX = "restrict:";

    @Override
    public ActionType getType() {
        return ActionType.RESTRICT;
    }

    @Override
    public String getName() {
        return "Restriction";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        String target = action.stringParam("target", "permissions");
        String value;
        switch (target) {
            case "permissions":
                value = "read-only";
                break;
            case "data_access":
                value = "denied";
                break;
            case "concurrent_sessions":
                value = String.valueOf(action.longParam("limit", 1));
                break;
            default:
                return ActionOutcome.failure("Unknown restriction target '" + target + "'");
        }

        String actor = ThreatTargets.actor(threat);
        if (actor == null) {
            return ActionOutcome.skipped("No actor to restrict");
        }
        Duration duration = Duration.ofSeconds(action.longParam("duration",
                context.handlerSeconds(getType().wireName(), "default-duration", DEFAULT_DURATION_SECONDS)));
        String key = KEY_PREFIX + target + ":" + actor;
        context.getDecisionStore().put(key, value, duration);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actorId", actor);
        details.put("restriction", target);
        details.put("value", value);
        details.put("durationSeconds", duration.toSeconds());
        context.audit(ResponseAuditLog.RESTRICTION, threat, incident, details);
        log.warn("[Vigilant] [restrict] {} = {} for {}", key, value, duration);
        return ActionOutcome.success("Restricted " + target + " for " + actor, details);
    }
}
