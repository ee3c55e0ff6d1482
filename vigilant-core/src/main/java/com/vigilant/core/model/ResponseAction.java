package com.vigilant.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one attempted mitigating action.
 */
public class ResponseAction {

    private final String ruleId;
    private final ActionType type;
    private final Map<String, Object> parameters;
    private final Instant executedAt;
    private final long durationMillis;
    private final boolean success;
    private final String message;
    private final Map<String, Object> details;

    public ResponseAction(String ruleId, ActionType type, Map<String, Object> parameters,
            Instant executedAt, long durationMillis, boolean success, String message,
            Map<String, Object> details) {
        this.ruleId = ruleId;
        this.type = type;
        this.parameters = parameters != null ? parameters : Map.of();
        this.executedAt = executedAt;
        this.durationMillis = durationMillis;
        this.success = success;
        this.message = message;
        this.details = details != null ? details : Map.of();
    }

    public String getRuleId() {
        return ruleId;
    }

    public ActionType getType() {
        return type;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "ResponseAction{" + ruleId + "/" + type.wireName() + ", success=" + success
                + ", message='" + message + "'}";
    }
}
