package com.vigilant.core.response;

import com.vigilant.core.audit.AuditEntry;
import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.ResponseAction;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.rule.ResponseRule;
import com.vigilant.core.rule.ResponseRuleStore;
import com.vigilant.core.rule.RuleAction;
import com.vigilant.core.rule.RuleCondition;
import com.vigilant.core.rule.ThreatField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Answers a threat with the actions of every response rule it matches.
 *
 * <p>
 * Rules run in priority order and their actions in declared order. Each action
 * runs on the worker executor under a timeout. A failing, hanging or unhandled
 * action is recorded as failed and the remaining actions still run.
 * </p>
 */
public class AutomatedResponseEngine {

    private static final Logger log = LoggerFactory.getLogger(AutomatedResponseEngine.class);

    static final String NO_MATCHING_RULES = "No matching response rules";

    private final ResponseRuleStore rules;
    private final ActionHandlerRegistry registry;
    private final ResponseContext context;
    private final ExecutorService workers;
    private volatile Duration actionTimeout;

    public AutomatedResponseEngine(ResponseRuleStore rules, ActionHandlerRegistry registry,
            ResponseContext context, ExecutorService workers, Duration actionTimeout) {
        this.rules = rules;
        this.registry = registry;
        this.context = context;
        this.workers = workers;
        this.actionTimeout = actionTimeout;
    }

    public Duration getActionTimeout() {
        return actionTimeout;
    }

    public void setActionTimeout(Duration actionTimeout) {
        this.actionTimeout = actionTimeout;
    }

    /**
     * Enabled auto-execute rules whose conditions all hold, by priority.
     */
    public List<ResponseRule> matchingRules(ThreatIntelligence threat) {
        return rules.list().stream()
                .filter(ResponseRule::isEnabled)
                .filter(ResponseRule::isAutoExecute)
                .filter(rule -> matches(rule, threat))
                .sorted(Comparator.comparingInt(ResponseRule::getPriority))
                .collect(Collectors.toList());
    }

    /**
     * @param incident the incident opened for the threat, may be null
     */
    public AutomatedResponseResult execute(ThreatIntelligence threat, SecurityIncident incident) {
        long started = System.nanoTime();
        List<ResponseRule> matched = matchingRules(threat);
        List<ResponseAction> executed = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (ResponseRule rule : matched) {
            for (RuleAction action : rule.getActions()) {
                ResponseAction result = executeAction(rule, action, threat, incident);
                executed.add(result);
                if (!result.isSuccess()) {
                    errors.add(rule.getId() + "/" + action.getType().wireName() + ": " + result.getMessage());
                }
            }
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        List<String> ruleIds = matched.stream().map(ResponseRule::getId).collect(Collectors.toList());
        String message;
        if (matched.isEmpty()) {
            message = NO_MATCHING_RULES;
        } else if (errors.isEmpty()) {
            message = "Executed " + executed.size() + " actions from " + matched.size() + " rules";
        } else {
            message = errors.size() + " of " + executed.size() + " actions failed";
        }
        AutomatedResponseResult result = new AutomatedResponseResult(errors.isEmpty(), message, ruleIds,
                executed, elapsedMillis, errors);

        if (errors.isEmpty()) {
            log.info("[Vigilant] Response for threat {}: {}", threat.getThreatId(), message);
        } else {
            log.warn("[Vigilant] Response for threat {}: {} {}", threat.getThreatId(), message, errors);
        }
        audit(threat, incident, result);
        return result;
    }

    private boolean matches(ResponseRule rule, ThreatIntelligence threat) {
        for (RuleCondition<ThreatField> condition : rule.getConditions()) {
            if (!condition.test(condition.getField().valueOf(threat))) {
                return false;
            }
        }
        return true;
    }

    private ResponseAction executeAction(ResponseRule rule, RuleAction action, ThreatIntelligence threat,
            SecurityIncident incident) {
        Instant executedAt = context.getClock().instant();
        long started = System.nanoTime();

        Optional<ActionHandler> handler = registry.find(action.getType(), context);
        if (handler.isEmpty()) {
            return record(rule, action, executedAt, started,
                    ActionOutcome.failure("No enabled handler for action '" + action.getType().wireName() + "'"));
        }

        ActionOutcome outcome;
        Future<ActionOutcome> future = null;
        try {
            future = workers.submit(() -> handler.get().execute(action, threat, incident, context));
            outcome = future.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                outcome = ActionOutcome.failure("Handler returned no outcome");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            outcome = ActionOutcome.failure("Timed out after " + actionTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Vigilant] Handler '{}' failed on rule '{}': {}",
                    handler.get().getName(), rule.getId(), cause.getMessage());
            outcome = ActionOutcome.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            outcome = ActionOutcome.failure("Interrupted");
        } catch (RejectedExecutionException e) {
            outcome = ActionOutcome.failure("Worker pool rejected the action: " + e.getMessage());
        }
        return record(rule, action, executedAt, started, outcome);
    }

    private ResponseAction record(ResponseRule rule, RuleAction action, Instant executedAt, long startedNanos,
            ActionOutcome outcome) {
        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        return new ResponseAction(rule.getId(), action.getType(), action.getParameters(), executedAt,
                durationMillis, outcome.isSuccess(), outcome.getMessage(), outcome.getDetails());
    }

    private void audit(ThreatIntelligence threat, SecurityIncident incident, AutomatedResponseResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("success", result.isSuccess());
        details.put("message", result.getMessage());
        details.put("matchedRules", result.getMatchedRuleIds());
        details.put("actionsExecuted", result.getActionsExecuted().size());
        details.put("actionsFailed", result.failedActionCount());
        details.put("executionTimeMillis", result.getExecutionTimeMillis());
        details.put("riskScore", threat.getRiskScore());
        try {
            context.getAuditLog().append(new AuditEntry(ResponseAuditLog.RESPONSE_EXECUTED, threat.getThreatId(),
                    incident != null ? incident.getId() : null, context.getClock().instant(), details));
        } catch (RuntimeException e) {
            log.error("[Vigilant] Could not write response audit entry for threat {}: {}",
                    threat.getThreatId(), e.getMessage());
        }
    }
}
