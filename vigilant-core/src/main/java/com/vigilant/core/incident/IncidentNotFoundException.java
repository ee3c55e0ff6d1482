package com.vigilant.core.incident;

public class IncidentNotFoundException extends RuntimeException {

    private final String incidentId;

    public IncidentNotFoundException(String incidentId) {
        super("No incident with id '" + incidentId + "'");
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
