package com.vigilant.core.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an {@link ActionHandler} reports back for one action.
 */
public class ActionOutcome {

    private final boolean success;
    private final String message;
    private final Map<String, Object> details;

    private ActionOutcome(boolean success, String message, Map<String, Object> details) {
        this.success = success;
        this.message = message;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static ActionOutcome success(String message, Map<String, Object> details) {
        return new ActionOutcome(true, message, details);
    }

    public static ActionOutcome success(String message) {
        return new ActionOutcome(true, message, null);
    }

    /** Nothing was done because the threat did not carry what the action needs. */
    public static ActionOutcome skipped(String reason) {
        return new ActionOutcome(true, reason, Map.of("skipped", true));
    }

    public static ActionOutcome failure(String message) {
        return new ActionOutcome(false, message, null);
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
}
