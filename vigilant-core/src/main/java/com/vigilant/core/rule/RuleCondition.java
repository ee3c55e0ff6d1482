package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * One {@code field operator value} test of a rule.
 *
 * <p>
 * The value shape is checked on construction: {@code in}/{@code not_in} take a
 * collection, {@code greater_than}/{@code less_than} a number on a numeric field,
 * {@code regex} a valid pattern. The special value {@link #SAME} is only allowed
 * with {@code equals} (group by this field) and {@code not_equals} (the group must
 * span several values of this field).
 * </p>
 *
 * @param <F> the field type, {@link EventField} or {@link ThreatField}
 */
public class RuleCondition<F extends RuleField> {

    public static final String SAME = "SAME";

    private final F field;
    private final ConditionOperator operator;
    private final Object value;
    private final Pattern pattern;

    public RuleCondition(F field, ConditionOperator operator, Object value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = normalize(value);
        this.pattern = operator == ConditionOperator.REGEX ? compile(this.value) : null;
        checkShape();
    }

    public static <F extends RuleField> RuleCondition<F> of(F field, ConditionOperator operator, Object value) {
        return new RuleCondition<>(field, operator, value);
    }

    public static RuleCondition<EventField> same(EventField field) {
        return new RuleCondition<>(field, ConditionOperator.EQUALS, SAME);
    }

    public static RuleCondition<EventField> distinct(EventField field) {
        return new RuleCondition<>(field, ConditionOperator.NOT_EQUALS, SAME);
    }

    public F getField() {
        return field;
    }

    public ConditionOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    public boolean isSame() {
        return SAME.equals(value);
    }

    /** {@code equals SAME}: the field is part of the correlation key. */
    public boolean isGroupingCondition() {
        return isSame() && operator == ConditionOperator.EQUALS;
    }

    /** {@code not_equals SAME}: the group must contain more than one value of the field. */
    public boolean isDistinctCondition() {
        return isSame() && operator == ConditionOperator.NOT_EQUALS;
    }

    /** Evaluates the condition against a concrete field value. */
    public boolean test(Object actual) {
        switch (operator) {
            case EQUALS:
                return actual != null && valueEquals(actual, value);
            case NOT_EQUALS:
                return actual == null || !valueEquals(actual, value);
            case CONTAINS:
                if (actual instanceof Collection) {
                    return ((Collection<?>) actual).stream().anyMatch(e -> valueEquals(e, value));
                }
                return actual != null && actual.toString().contains(value.toString());
            case IN:
                return actual != null && ((Collection<?>) value).stream().anyMatch(e -> valueEquals(actual, e));
            case NOT_IN:
                return actual == null || ((Collection<?>) value).stream().noneMatch(e -> valueEquals(actual, e));
            case REGEX:
                return actual != null && pattern.matcher(actual.toString()).find();
            case GREATER_THAN:
                return actual instanceof Number && ((Number) actual).doubleValue() > ((Number) value).doubleValue();
            case LESS_THAN:
                return actual instanceof Number && ((Number) actual).doubleValue() < ((Number) value).doubleValue();
            default:
                return false;
        }
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return actual.toString().equals(expected.toString());
    }

    private static Object normalize(Object value) {
        if (value instanceof Collection) {
            return List.copyOf(((Collection<?>) value).stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList()));
        }
        return value;
    }

    private Pattern compile(Object regex) {
        if (!(regex instanceof String)) {
            throw invalid("regex value must be a string");
        }
        try {
            return Pattern.compile((String) regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidConfigurationException(
                    "Invalid regex on field '" + field.wireName() + "': " + e.getDescription(), e);
        }
    }

    private void checkShape() {
        if (value == null) {
            throw invalid("value is required");
        }
        if (isSame() && operator != ConditionOperator.EQUALS && operator != ConditionOperator.NOT_EQUALS) {
            throw invalid("SAME is only valid with equals or not_equals");
        }
        if (operator.isMembership() && !(value instanceof Collection)) {
            throw invalid(operator.wireName() + " requires a list value");
        }
        if (!operator.isMembership() && value instanceof Collection) {
            throw invalid(operator.wireName() + " does not accept a list value");
        }
        if (operator.isNumeric()) {
            if (!field.isNumeric()) {
                throw invalid(operator.wireName() + " requires a numeric field");
            }
            if (!(value instanceof Number)) {
                throw invalid(operator.wireName() + " requires a numeric value");
            }
        }
    }

    private InvalidConfigurationException invalid(String reason) {
        return new InvalidConfigurationException(
                "Invalid condition on field '" + field.wireName() + "': " + reason);
    }

    @Override
    public String toString() {
        return field.wireName() + " " + operator.wireName() + " " + value;
    }
}
