package com.vigilant.core.response;

import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.rule.RuleAction;

/**
 * Carries out one type of mitigating action declared by response rules.
 *
 * <p>
 * Handlers are discovered through Spring's component scanning: annotate the
 * implementation with {@code @Component}. A handler registered for a type that
 * already has one replaces it when its {@link #getOrder()} is lower.
 * </p>
 *
 * <p>
 * {@link #execute} runs on a worker thread under a timeout. It may block on I/O
 * but should return promptly when interrupted.
 * </p>
 */
public interface ActionHandler {

    /**
     * The action type this handler executes. Also the configuration key:
     * {@code vigilant.handlers.{type}.enabled}
     */
    ActionType getType();

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Lower wins when two handlers claim the same type.
     */
    default int getOrder() {
        return 500;
    }

    /**
     * @param action   the declared action with its parameters
     * @param threat   the threat being answered
     * @param incident the incident opened for it, may be null
     * @return the outcome. Throwing counts as a failed action.
     */
    ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
            ResponseContext context) throws Exception;

    /**
     * Whether this handler is enabled. Checked against configuration.
     */
    default boolean isEnabled(ResponseContext context) {
        return context.getProperties().isHandlerEnabled(getType().wireName());
    }
}
