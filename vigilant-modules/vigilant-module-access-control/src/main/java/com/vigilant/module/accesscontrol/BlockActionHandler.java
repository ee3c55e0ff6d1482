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
import java.util.List;
import java.util.Map;

/**
 * Blocks the source of a threat in the decision store.
 *
 * <p>
 * Targets: {@code ip} (every IP indicator), {@code actor}, {@code user_session}
 * and {@code tenant_access} (the actor's access to one tenant).
 * </p>
 */
@Component
public class BlockActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(BlockActionHandler.class);

    static final long DEFAULT_DURATION_SECONDS = 3600;

    static final String IP_PREFIX = "ip:";
    static final String ACTOR_PREFIX = "user:";
    static final String SESSION_PREFIX = "session:";
    static final String TENANT_ACCESS_PREFIX = "tenant-access:";

    @Override
    public ActionType getType() {
        return ActionType.BLOCK;
    }

    @Override
    public String getName() {
        return "Block";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) {
        String target = action.stringParam("target", "ip");
        Duration duration = Duration.ofSeconds(action.longParam("duration",
                context.handlerSeconds(getType().wireName(), "default-duration", DEFAULT_DURATION_SECONDS)));

        switch (target) {
            case "ip":
                return blockIps(threat, incident, context, duration);
            case "actor":
                return blockActor(threat, incident, context, duration, ACTOR_PREFIX, ResponseAuditLog.ACTOR_BLOCK);
            case "user_session":
                return blockActor(threat, incident, context, duration, SESSION_PREFIX, ResponseAuditLog.SESSION_BLOCK);
            case "tenant_access":
                return blockTenantAccess(threat, incident, context, duration);
            default:
                return ActionOutcome.failure("Unknown block target '" + target + "'");
        }
    }

    private ActionOutcome blockIps(ThreatIntelligence threat, SecurityIncident incident, ResponseContext context,
            Duration duration) {
        List<String> ips = ThreatTargets.ips(threat);
        if (ips.isEmpty()) {
            return ActionOutcome.skipped("No IP indicator to block");
        }
        for (String ip : ips) {
            context.getDecisionStore().block(IP_PREFIX + ip, ThreatTargets.reason(threat), duration);
            context.audit(ResponseAuditLog.IP_BLOCK, threat, incident, details("ipAddress", ip, duration));
        }
        log.warn("[Vigilant] [block] Blocked {} IPs for {}: {}", ips.size(), duration, ips);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("blockedIps", ips);
        details.put("durationSeconds", duration.toSeconds());
        return ActionOutcome.success("Blocked " + ips.size() + " IP address(es)", details);
    }

    private ActionOutcome blockActor(ThreatIntelligence threat, SecurityIncident incident, ResponseContext context,
            Duration duration, String prefix, String auditKind) {
        String actor = ThreatTargets.actor(threat);
        if (actor == null) {
            return ActionOutcome.skipped("No actor to block");
        }
        context.getDecisionStore().block(prefix + actor, ThreatTargets.reason(threat), duration);
        context.audit(auditKind, threat, incident, details("actorId", actor, duration));
        log.warn("[Vigilant] [block] Blocked {}{} for {}", prefix, actor, duration);
        return ActionOutcome.success("Blocked " + prefix + actor, details("actorId", actor, duration));
    }

    private ActionOutcome blockTenantAccess(ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context, Duration duration) {
        String actor = ThreatTargets.actor(threat);
        String tenant = ThreatTargets.tenant(threat);
        if (actor == null || tenant == null) {
            return ActionOutcome.skipped("Tenant access block needs both an actor and a tenant");
        }
        String key = TENANT_ACCESS_PREFIX + tenant + ":" + actor;
        context.getDecisionStore().block(key, ThreatTargets.reason(threat), duration);
        Map<String, Object> details = details("actorId", actor, duration);
        details.put("tenantId", tenant);
        context.audit(ResponseAuditLog.TENANT_ACCESS_BLOCK, threat, incident, details);
        log.warn("[Vigilant] [block] Blocked access of user {} to tenant {} for {}", actor, tenant, duration);
        return ActionOutcome.success("Blocked tenant access " + key, details);
    }

    private static Map<String, Object> details(String key, String value, Duration duration) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(key, value);
        details.put("durationSeconds", duration.toSeconds());
        return details;
    }
}
