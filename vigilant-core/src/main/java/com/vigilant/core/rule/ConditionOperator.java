package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;

public enum ConditionOperator {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    IN("in"),
    NOT_IN("not_in"),
    REGEX("regex"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    public static ConditionOperator fromName(String name) {
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(name) || operator.name().equalsIgnoreCase(name)) {
                return operator;
            }
        }
        throw new InvalidConfigurationException("Unknown condition operator '" + name + "'");
    }
}
