package com.vigilant.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resource identifiers touched by a set of events: {@code user_<actor>},
 * {@code tenant_<tenant>} and {@code <resource>_<resourceId>}.
 */
public final class AffectedResources {

    public static final String USER_PREFIX = "user_";
    public static final String TENANT_PREFIX = "tenant_";

    private AffectedResources() {
    }

    public static List<String> of(Collection<SecurityEvent> events) {
        Set<String> resources = new LinkedHashSet<>();
        for (SecurityEvent event : events) {
            if (event.getActorId() != null) {
                resources.add(USER_PREFIX + event.getActorId());
            }
            if (event.getTenantId() != null) {
                resources.add(TENANT_PREFIX + event.getTenantId());
            }
            if (event.getResourceId() != null) {
                String resource = event.getResource() != null ? event.getResource() : "resource";
                resources.add(resource + "_" + event.getResourceId());
            }
        }
        return new ArrayList<>(resources);
    }
}
