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
 * Locks the account behind a threat for a limited time.
 */
@Component
public class LockActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(LockActionHandler.class);

    static final long DEFAULT_DURATION_SECONDS = 1800;
    static final String ACCOUNT_PREFIX = "account:";

    @Override
    public ActionType getType() {
        return ActionType.LOCK;
    }

    @Override
    public String getName() {
        return "Account Lock";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        String target = action.stringParam("target", "account");
        if (!"account".equals(target)) {
            return ActionOutcome.failure("Unknown lock target '" + target + "'");
        }
        String actor = ThreatTargets.actor(threat);
        if (actor == null) {
            return ActionOutcome.skipped("No account to lock");
        }
        Duration duration = Duration.ofSeconds(action.longParam("duration",
                context.handlerSeconds(getType().wireName(), "default-duration", DEFAULT_DURATION_SECONDS)));

        context.getDecisionStore().block(ACCOUNT_PREFIX + actor, ThreatTargets.reason(threat), duration);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actorId", actor);
        details.put("durationSeconds", duration.toSeconds());
        context.audit(ResponseAuditLog.ACCOUNT_LOCK, threat, incident, details);
        log.warn("[Vigilant] [lock] Locked account {} for {}", actor, duration);
        return ActionOutcome.success("Locked account " + actor, details);
    }
}
