package com.vigilant.core.rule;

import com.vigilant.core.model.ActionType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A typed action declared by a response rule, with free-form parameters such as
 * {@code target} or {@code duration}.
 */
public class RuleAction {

    private final ActionType type;
    private final Map<String, Object> parameters;

    public RuleAction(ActionType type, Map<String, Object> parameters) {
        this.type = Objects.requireNonNull(type, "type");
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public static RuleAction of(ActionType type, Map<String, Object> parameters) {
        return new RuleAction(type, parameters);
    }

    public ActionType getType() {
        return type;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String stringParam(String name, String defaultValue) {
        Object val = parameters.get(name);
        return val != null ? val.toString() : defaultValue;
    }

    public long longParam(String name, long defaultValue) {
        Object val = parameters.get(name);
        if (val instanceof Number) {
            return ((Number) val).longValue();
        }
        return val != null ? Long.parseLong(val.toString()) : defaultValue;
    }

    public boolean booleanParam(String name) {
        Object val = parameters.get(name);
        return val != null && Boolean.parseBoolean(val.toString());
    }

    public List<String> stringListParam(String name, List<String> defaultValue) {
        Object val = parameters.get(name);
        if (val instanceof Collection) {
            return ((Collection<?>) val).stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (val != null) {
            return List.of(val.toString());
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return type.wireName() + parameters;
    }
}
