package com.vigilant.core.model;

/**
 * Severity levels shared by events, threats, incidents and alerts.
 */
public enum Severity {

    /** Informational, no action needed. */
    INFO,

    /** Slightly suspicious. Shown on the dashboard only. */
    LOW,

    /** Suspicious pattern. Worth a look by an operator. */
    MEDIUM,

    /** Likely malicious. Operators are notified. */
    HIGH,

    /** Confirmed or severe. Every channel is used and the incident is escalated. */
    CRITICAL;

    public String wireName() {
        return name().toLowerCase();
    }
}
