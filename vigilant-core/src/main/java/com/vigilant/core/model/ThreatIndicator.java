package com.vigilant.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A concrete artifact (IP, actor, pattern) associated with suspicious activity.
 */
public class ThreatIndicator {

    private final IndicatorType type;
    private final String value;
    private final int confidence;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final int occurrences;

    public ThreatIndicator(IndicatorType type, String value, int confidence,
            Instant firstSeen, Instant lastSeen, int occurrences) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
        this.confidence = confidence;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
        this.occurrences = occurrences;
    }

    public IndicatorType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getConfidence() {
        return confidence;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public int getOccurrences() {
        return occurrences;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThreatIndicator))
            return false;
        ThreatIndicator that = (ThreatIndicator) o;
        return confidence == that.confidence && occurrences == that.occurrences
                && type == that.type && value.equals(that.value)
                && Objects.equals(firstSeen, that.firstSeen) && Objects.equals(lastSeen, that.lastSeen);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, confidence, firstSeen, lastSeen, occurrences);
    }

    @Override
    public String toString() {
        return "ThreatIndicator{" + type.wireName() + "=" + value + ", confidence=" + confidence
                + ", occurrences=" + occurrences + '}';
    }
}
