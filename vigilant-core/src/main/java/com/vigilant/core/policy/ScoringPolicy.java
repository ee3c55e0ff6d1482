package com.vigilant.core.policy;

import com.vigilant.core.model.Severity;

import java.time.Duration;

/**
 * Every heuristic scoring constant of the pipeline, in one place.
 *
 * <p>
 * Scores are deterministic and explainable on purpose; nothing here is a trained
 * model. Correlation base score = count density + time density + action
 * diversity, each bounded, then multiplied by the rule's multiplier and capped
 * at 100.
 * </p>
 */
public final class ScoringPolicy {

    /** Upper bound of any risk score. */
    public static final double MAX_RISK = 100.0;

    /** Count density: points per multiple of {@code minEvents}. */
    public static final double COUNT_DENSITY_WEIGHT = 25.0;
    public static final double COUNT_DENSITY_CAP = 50.0;

    /** Time density: one point per event per minute, full marks for a zero span. */
    public static final double TIME_DENSITY_CAP = 30.0;

    /** Action diversity: points per distinct action type. */
    public static final double ACTION_DIVERSITY_WEIGHT = 4.0;
    public static final double ACTION_DIVERSITY_CAP = 20.0;

    /** Indicator confidence per occurrence, and the ceiling for derived indicators. */
    public static final int IP_CONFIDENCE_PER_OCCURRENCE = 10;
    public static final int ACTOR_CONFIDENCE_PER_OCCURRENCE = 15;
    public static final int INDICATOR_CONFIDENCE_CAP = 95;
    public static final int PATTERN_INDICATOR_CONFIDENCE = 80;

    /** Confidence given to indicators taken straight from a single classified event. */
    public static final int SINGLE_EVENT_INDICATOR_CONFIDENCE = 50;

    /** Classifier confidence before any enrichment. */
    public static final int CLASSIFIER_BASE_CONFIDENCE = 60;

    /** Enrichment: a hit adds up to this many points, weighted by the hit's confidence. */
    public static final double ENRICHMENT_POINTS_PER_HIT = 20.0;
    public static final double ENRICHMENT_CAP = 50.0;

    private ScoringPolicy() {
    }

    /** Risk score the classifier assigns to a severity. */
    public static int riskForSeverity(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return 90;
            case HIGH:
                return 75;
            case MEDIUM:
                return 50;
            case LOW:
                return 20;
            default:
                return 5;
        }
    }

    public static double countDensityScore(int eventCount, int minEvents) {
        return Math.min(COUNT_DENSITY_CAP, ((double) eventCount / minEvents) * COUNT_DENSITY_WEIGHT);
    }

    public static double timeDensityScore(int eventCount, Duration timeSpan) {
        long millis = timeSpan.toMillis();
        if (millis <= 0) {
            return TIME_DENSITY_CAP;
        }
        return Math.min(TIME_DENSITY_CAP, eventsPerMinute(eventCount, timeSpan));
    }

    public static double actionDiversityScore(int uniqueActions) {
        return Math.min(ACTION_DIVERSITY_CAP, uniqueActions * ACTION_DIVERSITY_WEIGHT);
    }

    public static double baseScore(int eventCount, int minEvents, Duration timeSpan, int uniqueActions) {
        return countDensityScore(eventCount, minEvents)
                + timeDensityScore(eventCount, timeSpan)
                + actionDiversityScore(uniqueActions);
    }

    public static double correlationRisk(double baseScore, double riskMultiplier) {
        return Math.min(MAX_RISK, baseScore * riskMultiplier);
    }

    /** Events per minute over the span; the event count itself when the span is zero. */
    public static double eventsPerMinute(int eventCount, Duration timeSpan) {
        long millis = timeSpan.toMillis();
        if (millis <= 0) {
            return eventCount;
        }
        return eventCount * 60_000.0 / millis;
    }

    public static int ipIndicatorConfidence(int occurrences) {
        return Math.min(INDICATOR_CONFIDENCE_CAP, occurrences * IP_CONFIDENCE_PER_OCCURRENCE);
    }

    public static int actorIndicatorConfidence(int occurrences) {
        return Math.min(INDICATOR_CONFIDENCE_CAP, occurrences * ACTOR_CONFIDENCE_PER_OCCURRENCE);
    }

    /** Risk points added for one threat-intel hit of the given confidence. */
    public static double enrichmentIncrease(int hitConfidence) {
        return ENRICHMENT_POINTS_PER_HIT * hitConfidence / 100.0;
    }
}
