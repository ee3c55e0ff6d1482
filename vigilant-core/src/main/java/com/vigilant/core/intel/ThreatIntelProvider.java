package com.vigilant.core.intel;

import com.vigilant.core.model.IndicatorType;
import com.vigilant.core.model.ThreatIndicator;

import java.util.Optional;

/**
 * Threat-intel feed consulted by the classifier to boost confidence in a threat.
 * Optional: the classifier works without one, and a failing lookup is treated as
 * a miss.
 */
public interface ThreatIntelProvider {

    /**
     * Look up a known indicator of compromise.
     *
     * @return the known indicator, or empty if the value is not listed
     */
    Optional<ThreatIndicator> lookup(IndicatorType type, String value);

    /**
     * Called once when the monitor starts. Throwing here puts the monitor into its
     * error state.
     */
    default void initialize() {
    }

    /** Whether lookups are currently worth making. */
    default boolean isAvailable() {
        return true;
    }
}
