package com.vigilant.core.model;

import java.util.Locale;

/**
 * Mitigating action types a response rule can declare.
 */
public enum ActionType {
    BLOCK,
    LOCK,
    RESTRICT,
    ALERT,
    NOTIFY,
    LOG;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static ActionType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        return ActionType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
