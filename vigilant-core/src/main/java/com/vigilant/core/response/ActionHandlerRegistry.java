package com.vigilant.core.response;

import com.vigilant.core.model.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Holds the registered ActionHandlers, one per action type.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final List<ActionHandler> handlers;
    private final Map<ActionType, ActionHandler> handlersByType = new EnumMap<>(ActionType.class);

    public ActionHandlerRegistry(List<ActionHandler> handlers) {
        List<ActionHandler> sorted = new ArrayList<>(handlers);
        sorted.sort(Comparator.comparingInt(ActionHandler::getOrder));
        for (ActionHandler handler : sorted) {
            ActionHandler existing = handlersByType.putIfAbsent(handler.getType(), handler);
            if (existing != null) {
                log.warn("[Vigilant] Ignoring handler '{}' for '{}': '{}' has precedence",
                        handler.getName(), handler.getType().wireName(), existing.getName());
            }
        }
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlersByType.values()));

        log.info("[Vigilant] Registered {} response handlers: {}",
                this.handlers.size(),
                this.handlers.stream().map(h -> h.getType().wireName() + "(" + h.getName() + ")")
                        .collect(Collectors.joining(", ")));
    }

    public List<ActionHandler> getHandlers() {
        return handlers;
    }

    /**
     * The handler for a type, if one is registered and enabled.
     */
    public Optional<ActionHandler> find(ActionType type, ResponseContext context) {
        ActionHandler handler = handlersByType.get(type);
        if (handler == null || !handler.isEnabled(context)) {
            return Optional.empty();
        }
        return Optional.of(handler);
    }

    public boolean hasHandler(ActionType type) {
        return handlersByType.containsKey(type);
    }
}
