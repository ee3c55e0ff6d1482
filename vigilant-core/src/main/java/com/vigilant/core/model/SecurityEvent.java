package com.vigilant.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An audit record in the uniform shape the pipeline works on.
 * Created by the audit log, never mutated.
 */
public class SecurityEvent {

    private final long id;
    private final Instant timestamp;
    private final String actorId; // null for anonymous/system actions
    private final String tenantId; // property or business unit
    private final String action;
    private final String resource;
    private final String resourceId;
    private final String ipAddress;
    private final String userAgent;
    private final Map<String, Object> details;

    private SecurityEvent(Builder builder) {
        this.id = builder.id;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.EPOCH;
        this.actorId = builder.actorId;
        this.tenantId = builder.tenantId;
        this.action = builder.action;
        this.resource = builder.resource;
        this.resourceId = builder.resourceId;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
        this.details = builder.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.details))
                : Map.of();
    }

    public long getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getActorId() {
        return actorId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getAction() {
        return action;
    }

    public String getResource() {
        return resource;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .timestamp(timestamp)
                .actorId(actorId)
                .tenantId(tenantId)
                .action(action)
                .resource(resource)
                .resourceId(resourceId)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .details(details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private Instant timestamp;
        private String actorId;
        private String tenantId;
        private String action;
        private String resource;
        private String resourceId;
        private String ipAddress;
        private String userAgent;
        private Map<String, Object> details;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "id=" + id +
                ", action='" + action + '\'' +
                ", actorId='" + actorId + '\'' +
                ", ipAddress='" + ipAddress + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
