package com.vigilant.core.classify;

import com.vigilant.core.intel.ThreatIntelProvider;
import com.vigilant.core.model.AffectedResources;
import com.vigilant.core.model.IndicatorType;
import com.vigilant.core.model.SecurityEvent;
import com.vigilant.core.model.ThreatEvent;
import com.vigilant.core.model.ThreatIndicator;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.model.ThreatSource;
import com.vigilant.core.policy.ScoringPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a single security event into a threat assessment.
 *
 * <p>
 * Benign actions (logins, reads, ordinary writes) produce no threat. Unknown
 * actions are treated as low-severity unusual activity so that nothing with a
 * new action verb goes entirely unseen. When a {@link ThreatIntelProvider} is
 * configured, known-bad IPs and actors raise risk and confidence.
 * </p>
 */
public class ThreatClassifier {

    private static final Logger log = LoggerFactory.getLogger(ThreatClassifier.class);

    static final String THREAT_ID_PREFIX = "event-";

    private final Clock clock;
    private final ThreatIntelProvider intelProvider;

    public ThreatClassifier(Clock clock) {
        this(clock, null);
    }

    public ThreatClassifier(Clock clock, ThreatIntelProvider intelProvider) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intelProvider = intelProvider;
    }

    /**
     * @return the threat, or null when the event has no security relevance
     */
    public ThreatIntelligence classify(SecurityEvent event) {
        ActionCatalog.Classification classification = ActionCatalog.classify(event.getAction());
        if (classification == null) {
            return null;
        }

        String threatType = classification.getThreatType();
        int riskScore = ScoringPolicy.riskForSeverity(classification.getSeverity());
        int confidence = ScoringPolicy.CLASSIFIER_BASE_CONFIDENCE;

        List<ThreatIndicator> indicators = new ArrayList<>();
        if (event.getIpAddress() != null) {
            indicators.add(singleEventIndicator(IndicatorType.IP, event.getIpAddress(), event));
        }
        if (event.getActorId() != null) {
            indicators.add(singleEventIndicator(IndicatorType.USER, event.getActorId(), event));
        }

        double enrichment = 0;
        for (ThreatIndicator indicator : List.copyOf(indicators)) {
            Optional<ThreatIndicator> hit = lookup(indicator.getType(), indicator.getValue());
            if (hit.isPresent()) {
                ThreatIndicator known = hit.get();
                enrichment += ScoringPolicy.enrichmentIncrease(known.getConfidence());
                confidence = Math.max(confidence, known.getConfidence());
                indicators.remove(indicator);
                indicators.add(known);
            }
        }
        if (enrichment > 0) {
            riskScore += (int) Math.round(Math.min(ScoringPolicy.ENRICHMENT_CAP, enrichment));
            log.debug("[Vigilant] Event {} matched threat intel, risk raised to {}", event.getId(), riskScore);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", event.getId());
        details.put("action", event.getAction());
        details.put("ipAddress", event.getIpAddress());
        ThreatEvent timelineEntry = new ThreatEvent(event.getTimestamp(), ActionCatalog.describe(event),
                classification.getSeverity(), details);

        return ThreatIntelligence.builder()
                .threatId(THREAT_ID_PREFIX + event.getId() + "-" + threatType)
                .threatType(threatType)
                .source(ThreatSource.CLASSIFIER)
                .description(ActionCatalog.describe(event))
                .riskScore(riskScore)
                .confidence(confidence)
                .indicators(indicators)
                .affectedResources(AffectedResources.of(List.of(event)))
                .timeline(List.of(timelineEntry))
                .createdAt(clock.instant())
                .build();
    }

    private ThreatIndicator singleEventIndicator(IndicatorType type, String value, SecurityEvent event) {
        return new ThreatIndicator(type, value, ScoringPolicy.SINGLE_EVENT_INDICATOR_CONFIDENCE,
                event.getTimestamp(), event.getTimestamp(), 1);
    }

    private Optional<ThreatIndicator> lookup(IndicatorType type, String value) {
        if (intelProvider == null || !intelProvider.isAvailable()) {
            return Optional.empty();
        }
        try {
            return intelProvider.lookup(type, value);
        } catch (Exception e) {
            log.warn("[Vigilant] Threat intel lookup failed for {} {}: {}", type.wireName(), value, e.getMessage());
            return Optional.empty();
        }
    }
}
