package com.vigilant.core.rule;

/**
 * A field a rule condition can reference. Implemented by closed enums so that an
 * unknown field is rejected when the rule is loaded.
 */
public interface RuleField {

    String wireName();

    /** Whether {@code greater_than} / {@code less_than} make sense on this field. */
    boolean isNumeric();
}
