package com.vigilant.core.incident;

import com.vigilant.core.model.SecurityIncident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Incident sink held in memory, in creation order.
 */
public class InMemoryIncidentSink implements IncidentSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIncidentSink.class);

    private final Clock clock;
    private final Map<String, SecurityIncident> byId = new LinkedHashMap<>();
    private final Map<String, String> idByThreat = new LinkedHashMap<>();

    public InMemoryIncidentSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String createIncident(SecurityIncident incident) {
        String existing = idByThreat.get(incident.getThreatId());
        if (existing != null) {
            log.debug("[Vigilant] Incident for threat {} already exists: {}", incident.getThreatId(), existing);
            return existing;
        }
        byId.put(incident.getId(), incident);
        idByThreat.put(incident.getThreatId(), incident.getId());
        return incident.getId();
    }

    @Override
    public synchronized SecurityIncident updateIncident(String incidentId, IncidentPatch patch) {
        SecurityIncident current = byId.get(incidentId);
        if (current == null) {
            throw new IncidentNotFoundException(incidentId);
        }
        SecurityIncident updated = patch.applyTo(current, clock.instant());
        byId.put(incidentId, updated);
        return updated;
    }

    @Override
    public synchronized Optional<SecurityIncident> findById(String incidentId) {
        return Optional.ofNullable(byId.get(incidentId));
    }

    @Override
    public synchronized Optional<SecurityIncident> findByThreatId(String threatId) {
        String id = idByThreat.get(threatId);
        return id != null ? Optional.ofNullable(byId.get(id)) : Optional.empty();
    }

    @Override
    public synchronized List<SecurityIncident> listRecent(int limit) {
        List<SecurityIncident> all = new ArrayList<>(byId.values());
        Collections.reverse(all);
        return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    }

    public synchronized int size() {
        return byId.size();
    }
}
