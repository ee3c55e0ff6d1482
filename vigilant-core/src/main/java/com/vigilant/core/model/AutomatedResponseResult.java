package com.vigilant.core.model;

import java.util.List;

/**
 * Auditable result of one automated response invocation.
 */
public class AutomatedResponseResult {

    private final boolean success;
    private final String message;
    private final List<String> matchedRuleIds;
    private final List<ResponseAction> actionsExecuted;
    private final long executionTimeMillis;
    private final List<String> errors;

    public AutomatedResponseResult(boolean success, String message, List<String> matchedRuleIds,
            List<ResponseAction> actionsExecuted, long executionTimeMillis, List<String> errors) {
        this.success = success;
        this.message = message;
        this.matchedRuleIds = List.copyOf(matchedRuleIds);
        this.actionsExecuted = List.copyOf(actionsExecuted);
        this.executionTimeMillis = executionTimeMillis;
        this.errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getMatchedRuleIds() {
        return matchedRuleIds;
    }

    public List<ResponseAction> getActionsExecuted() {
        return actionsExecuted;
    }

    public long getExecutionTimeMillis() {
        return executionTimeMillis;
    }

    public List<String> getErrors() {
        return errors;
    }

    public long failedActionCount() {
        return actionsExecuted.stream().filter(a -> !a.isSuccess()).count();
    }

    @Override
    public String toString() {
        return "AutomatedResponseResult{" +
                "success=" + success +
                ", rules=" + matchedRuleIds +
                ", actions=" + actionsExecuted.size() +
                ", failed=" + failedActionCount() +
                ", timeMs=" + executionTimeMillis +
                '}';
    }
}
