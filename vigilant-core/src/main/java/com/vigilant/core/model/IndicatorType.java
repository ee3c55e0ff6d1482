package com.vigilant.core.model;

/**
 * Kinds of indicators of compromise the pipeline extracts or looks up.
 */
public enum IndicatorType {
    IP,
    USER,
    TENANT,
    DEVICE,
    PATTERN,
    BEHAVIOR;

    public String wireName() {
        return name().toLowerCase();
    }
}
