package com.vigilant.core.model;

import java.util.Locale;

/**
 * Delivery channels. Opaque to the pipeline; the dispatcher decides what each means.
 */
public enum AlertChannel {
    EMAIL,
    SMS,
    PUSH,
    DASHBOARD,
    WEBHOOK,
    SLACK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertChannel fromName(String name) {
        return AlertChannel.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
