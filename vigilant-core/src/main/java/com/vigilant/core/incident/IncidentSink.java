package com.vigilant.core.incident;

import com.vigilant.core.model.SecurityIncident;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for incidents. Incidents are never deleted; at most one exists
 * per threat id.
 */
public interface IncidentSink {

    /**
     * Stores a new incident. If one already exists for the same threat id, nothing
     * is stored and the existing incident's id is returned.
     *
     * @return the id of the stored incident
     */
    String createIncident(SecurityIncident incident);

    /**
     * @return the updated incident
     * @throws IncidentNotFoundException if no incident has that id
     */
    SecurityIncident updateIncident(String incidentId, IncidentPatch patch);

    Optional<SecurityIncident> findById(String incidentId);

    Optional<SecurityIncident> findByThreatId(String threatId);

    /** Most recent first. */
    List<SecurityIncident> listRecent(int limit);
}
