package com.vigilant.core.correlation;

import com.vigilant.core.model.AffectedResources;
import com.vigilant.core.model.CorrelationPattern;
import com.vigilant.core.model.EventCorrelation;
import com.vigilant.core.model.IndicatorType;
import com.vigilant.core.model.SecurityEvent;
import com.vigilant.core.model.ThreatIndicator;
import com.vigilant.core.policy.ScoringPolicy;
import com.vigilant.core.rule.CorrelationRule;
import com.vigilant.core.rule.EventField;
import com.vigilant.core.rule.RuleCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies correlation rules to a batch of events and returns the scored groups.
 *
 * <p>
 * {@link #correlate} keeps no state between calls: the same events and rules
 * (and the same clock reading) always give the same correlations, so a batch
 * can be replayed exactly.
 * </p>
 *
 * <p>
 * Events with no value for a grouping field all land in one
 * {@value #UNKNOWN_KEY} bucket. That can merge unrelated anonymous actors into one
 * group, or split one actor whose events are only partly attributed.
 * </p>
 */
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    public static final String UNKNOWN_KEY = "unknown";
    public static final int DEFAULT_MAX_RESULTS = 20;

    private static final Comparator<EventCorrelation> BY_RISK_THEN_PRIORITY = Comparator
            .comparingDouble(EventCorrelation::getRiskScore).reversed()
            .thenComparingInt(EventCorrelation::getPriority);

    private final Clock clock;
    private final int maxResults;

    public CorrelationEngine(Clock clock) {
        this(clock, DEFAULT_MAX_RESULTS);
    }

    public CorrelationEngine(Clock clock, int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxResults = maxResults;
    }

    public int getMaxResults() {
        return maxResults;
    }

    /**
     * Runs every enabled rule over the events.
     *
     * @return correlations by descending risk (ties: higher rule priority first),
     *         at most {@code maxResults} of them
     */
    public List<EventCorrelation> correlate(List<SecurityEvent> events, List<CorrelationRule> rules) {
        Instant detectedAt = clock.instant();
        List<EventCorrelation> correlations = new ArrayList<>();

        for (CorrelationRule rule : rules) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                correlations.addAll(applyRule(rule, events, detectedAt));
            } catch (Exception e) {
                // One broken rule must not hide what the others find
                log.error("[Vigilant] Correlation rule '{}' failed: {}", rule.getId(), e.getMessage(), e);
            }
        }

        correlations.sort(BY_RISK_THEN_PRIORITY);
        if (correlations.size() > maxResults) {
            return List.copyOf(correlations.subList(0, maxResults));
        }
        return List.copyOf(correlations);
    }

    List<EventCorrelation> applyRule(CorrelationRule rule, List<SecurityEvent> events, Instant detectedAt) {
        List<RuleCondition<EventField>> eventConditions = rule.eventConditions();
        List<SecurityEvent> matching = events.stream()
                .filter(event -> matchesAll(event, eventConditions))
                .collect(Collectors.toList());

        if (matching.size() < rule.getMinEvents()) {
            return List.of();
        }

        List<EventField> keyFields = rule.correlationFields();
        Map<String, List<SecurityEvent>> groups = new LinkedHashMap<>();
        for (SecurityEvent event : matching) {
            groups.computeIfAbsent(correlationKey(event, keyFields), k -> new ArrayList<>()).add(event);
        }

        List<EventCorrelation> correlations = new ArrayList<>();
        for (Map.Entry<String, List<SecurityEvent>> group : groups.entrySet()) {
            List<SecurityEvent> groupEvents = group.getValue();
            if (groupEvents.size() < rule.getMinEvents() || groupEvents.size() > rule.getMaxEvents()) {
                continue;
            }
            EventCorrelation correlation = createCorrelation(rule, groupEvents, group.getKey(), detectedAt);
            if (correlation != null) {
                correlations.add(correlation);
            }
        }

        if (!correlations.isEmpty()) {
            log.debug("[Vigilant] Rule '{}' produced {} correlation(s) from {} matching events",
                    rule.getId(), correlations.size(), matching.size());
        }
        return correlations;
    }

    private static boolean matchesAll(SecurityEvent event, List<RuleCondition<EventField>> conditions) {
        for (RuleCondition<EventField> condition : conditions) {
            if (!condition.test(condition.getField().valueOf(event))) {
                return false;
            }
        }
        return true;
    }

    static String correlationKey(SecurityEvent event, List<EventField> keyFields) {
        return keyFields.stream()
                .map(field -> {
                    String value = field.valueOf(event);
                    return value != null ? value : UNKNOWN_KEY;
                })
                .collect(Collectors.joining("|"));
    }

    private EventCorrelation createCorrelation(CorrelationRule rule, List<SecurityEvent> groupEvents,
            String key, Instant detectedAt) {
        List<SecurityEvent> sorted = new ArrayList<>(groupEvents);
        sorted.sort(Comparator.comparing(SecurityEvent::getTimestamp).thenComparingLong(SecurityEvent::getId));

        SecurityEvent first = sorted.get(0);
        SecurityEvent last = sorted.get(sorted.size() - 1);
        Duration timeSpan = Duration.between(first.getTimestamp(), last.getTimestamp());
        if (timeSpan.compareTo(rule.getTimeWindow()) > 0) {
            return null;
        }

        for (EventField field : rule.distinctFields()) {
            if (countDistinct(sorted, field::valueOf) < 2) {
                return null;
            }
        }

        int uniqueActions = countDistinct(sorted, SecurityEvent::getAction);
        double baseScore = ScoringPolicy.baseScore(sorted.size(), rule.getMinEvents(), timeSpan, uniqueActions);
        double riskScore = ScoringPolicy.correlationRisk(baseScore, rule.getRiskMultiplier());

        CorrelationPattern pattern = new CorrelationPattern(
                rule.getId(),
                sorted.size(),
                timeSpan,
                ScoringPolicy.eventsPerMinute(sorted.size(), timeSpan),
                countDistinct(sorted, SecurityEvent::getIpAddress),
                countDistinct(sorted, SecurityEvent::getActorId),
                countDistinct(sorted, SecurityEvent::getTenantId),
                uniqueActions);

        return new EventCorrelation(
                rule.getId() + ":" + key + ":" + first.getId(),
                rule.getId(),
                rule.getName(),
                rule.getDescription(),
                sorted,
                key,
                pattern,
                riskScore,
                rule.getConfidence(),
                rule.getPriority(),
                extractIndicators(sorted, uniqueActions),
                AffectedResources.of(sorted),
                rule.getTimeWindow(),
                detectedAt);
    }

    private static int countDistinct(List<SecurityEvent> events, Function<SecurityEvent, String> accessor) {
        return (int) events.stream().map(accessor).filter(Objects::nonNull).distinct().count();
    }

    /** Events must already be sorted by timestamp. */
    static List<ThreatIndicator> extractIndicators(List<SecurityEvent> sorted, int uniqueActions) {
        List<ThreatIndicator> indicators = new ArrayList<>();
        indicators.addAll(indicatorsFor(sorted, SecurityEvent::getIpAddress, IndicatorType.IP));
        indicators.addAll(indicatorsFor(sorted, SecurityEvent::getActorId, IndicatorType.USER));

        if (uniqueActions > 1) {
            indicators.add(new ThreatIndicator(
                    IndicatorType.PATTERN,
                    "multi_action_" + uniqueActions,
                    ScoringPolicy.PATTERN_INDICATOR_CONFIDENCE,
                    sorted.get(0).getTimestamp(),
                    sorted.get(sorted.size() - 1).getTimestamp(),
                    sorted.size()));
        }
        return indicators;
    }

    private static List<ThreatIndicator> indicatorsFor(List<SecurityEvent> sorted,
            Function<SecurityEvent, String> accessor, IndicatorType type) {
        Map<String, List<SecurityEvent>> byValue = new LinkedHashMap<>();
        for (SecurityEvent event : sorted) {
            String value = accessor.apply(event);
            if (value != null) {
                byValue.computeIfAbsent(value, v -> new ArrayList<>()).add(event);
            }
        }

        List<ThreatIndicator> indicators = new ArrayList<>();
        for (Map.Entry<String, List<SecurityEvent>> entry : byValue.entrySet()) {
            List<SecurityEvent> occurrences = entry.getValue();
            int count = occurrences.size();
            int confidence = type == IndicatorType.IP
                    ? ScoringPolicy.ipIndicatorConfidence(count)
                    : ScoringPolicy.actorIndicatorConfidence(count);
            indicators.add(new ThreatIndicator(type, entry.getKey(), confidence,
                    occurrences.get(0).getTimestamp(),
                    occurrences.get(count - 1).getTimestamp(),
                    count));
        }
        return indicators;
    }
}
