package com.vigilant.autoconfigure.web;

import com.vigilant.core.rule.ConditionOperator;
import com.vigilant.core.rule.RuleCondition;
import com.vigilant.core.rule.RuleField;

import java.util.function.Function;

/**
 * Wire form of a rule condition: {@code {"field":"ipAddress","operator":"equals","value":"SAME"}}.
 */
public class ConditionRequest {

    private String field;
    private String operator;
    private Object value;

    public ConditionRequest() {
    }

    public ConditionRequest(String field, String operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public static ConditionRequest from(RuleCondition<?> condition) {
        return new ConditionRequest(condition.getField().wireName(), condition.getOperator().wireName(),
                condition.getValue());
    }

    <F extends RuleField> RuleCondition<F> toCondition(Function<String, F> fields) {
        return RuleCondition.of(fields.apply(field), ConditionOperator.fromName(operator), value);
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }
}
