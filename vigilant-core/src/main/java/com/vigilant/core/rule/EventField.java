package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.model.SecurityEvent;

import java.util.function.Function;

/**
 * Fields of a {@link SecurityEvent} that correlation conditions can test or group by.
 */
public enum EventField implements RuleField {

    ACTION("action", SecurityEvent::getAction),
    ACTOR_ID("actorId", SecurityEvent::getActorId),
    TENANT_ID("tenantId", SecurityEvent::getTenantId),
    IP_ADDRESS("ipAddress", SecurityEvent::getIpAddress),
    RESOURCE("resource", SecurityEvent::getResource),
    RESOURCE_ID("resourceId", SecurityEvent::getResourceId),
    USER_AGENT("userAgent", SecurityEvent::getUserAgent);

    private final String wireName;
    private final Function<SecurityEvent, String> accessor;

    EventField(String wireName, Function<SecurityEvent, String> accessor) {
        this.wireName = wireName;
        this.accessor = accessor;
    }

    public String valueOf(SecurityEvent event) {
        return accessor.apply(event);
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    /**
     * Resolves a field by its wire name. {@code userId} and {@code propertyId} are
     * accepted as aliases of {@code actorId} and {@code tenantId}.
     */
    public static EventField fromName(String name) {
        if (name != null) {
            switch (name) {
                case "userId":
                    return ACTOR_ID;
                case "propertyId":
                    return TENANT_ID;
                default:
                    for (EventField field : values()) {
                        if (field.wireName.equals(name) || field.name().equalsIgnoreCase(name)) {
                            return field;
                        }
                    }
            }
        }
        throw new InvalidConfigurationException("Unknown event field '" + name + "'");
    }
}
