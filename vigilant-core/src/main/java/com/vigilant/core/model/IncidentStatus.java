package com.vigilant.core.model;

/**
 * Incident lifecycle. Incidents are never deleted, only moved to CLOSED.
 */
public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    CONTAINED,
    RESOLVED,
    CLOSED
}
