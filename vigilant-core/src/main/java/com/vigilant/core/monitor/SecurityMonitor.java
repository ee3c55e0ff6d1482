package com.vigilant.core.monitor;

import com.vigilant.core.alert.AlertDispatcher;
import com.vigilant.core.alert.AlertRouting;
import com.vigilant.core.classify.ActionCatalog;
import com.vigilant.core.classify.ThreatClassifier;
import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.config.MonitoringConfig;
import com.vigilant.core.correlation.CorrelationEngine;
import com.vigilant.core.incident.IncidentPatch;
import com.vigilant.core.incident.IncidentSink;
import com.vigilant.core.intel.ThreatIntelProvider;
import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.EventCorrelation;
import com.vigilant.core.model.Evidence;
import com.vigilant.core.model.IncidentStatus;
import com.vigilant.core.model.SecurityAlert;
import com.vigilant.core.model.SecurityEvent;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.Severity;
import com.vigilant.core.model.ThreatEvent;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.model.ThreatSource;
import com.vigilant.core.model.ThreatTypes;
import com.vigilant.core.response.AutomatedResponseEngine;
import com.vigilant.core.rule.CorrelationRuleStore;
import com.vigilant.core.source.SecurityEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives the pipeline: pulls events from the source, classifies and correlates
 * them, opens incidents, triggers automated responses and sends alerts.
 *
 * <p>
 * Three ticks run on the scheduler with a fixed delay:
 * </p>
 * <ol>
 * <li>ingestion, which reads new events after the cursor and classifies them;</li>
 * <li>deep detection, which re-classifies the recent window;</li>
 * <li>correlation, which runs the correlation rules over the correlation window.</li>
 * </ol>
 *
 * <p>
 * A tick never overlaps itself and a failing tick never affects the others.
 * Threat ids are deterministic, so a threat seen by more than one tick opens a
 * single incident.
 * </p>
 */
public class SecurityMonitor {

    private static final Logger log = LoggerFactory.getLogger(SecurityMonitor.class);

    static final String CORRELATION_THREAT_PREFIX = "corr-";
    private static final long SHUTDOWN_POLL_MILLIS = 25;

    enum Tick {
        INGESTION(MonitoringConfig::getIngestionInterval),
        DEEP_DETECTION(MonitoringConfig::getThreatDetectionInterval),
        CORRELATION(MonitoringConfig::getCorrelationInterval);

        private final Function<MonitoringConfig, Duration> interval;

        Tick(Function<MonitoringConfig, Duration> interval) {
            this.interval = interval;
        }

        Duration intervalOf(MonitoringConfig config) {
            return interval.apply(config);
        }
    }

    private final SecurityEventSource source;
    private final CorrelationRuleStore correlationRules;
    private final AutomatedResponseEngine responseEngine;
    private final IncidentSink incidentSink;
    private final AlertDispatcher alertDispatcher;
    private final ThreatIntelProvider intelProvider;
    private final List<MonitorListener> listeners;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Clock clock;

    private volatile MonitoringConfig config;
    private volatile ThreatClassifier classifier;
    private volatile CorrelationEngine correlationEngine;
    private final AutoResponseThrottle throttle;

    private volatile MonitorStatus status = MonitorStatus.STOPPED;
    private final Map<Tick, ScheduledFuture<?>> scheduled = new EnumMap<>(Tick.class);
    private final Map<Tick, AtomicBoolean> inFlight = new EnumMap<>(Tick.class);

    private final AtomicLong cursor = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong threatsDetected = new AtomicLong();
    private final AtomicLong incidentsCreated = new AtomicLong();
    private final AtomicLong autoResponsesTriggered = new AtomicLong();
    private final AtomicLong autoResponsesSuppressed = new AtomicLong();
    private final AtomicLong alertsSent = new AtomicLong();
    private final AtomicLong alertsFailed = new AtomicLong();
    private final AtomicLong tickFailures = new AtomicLong();
    private final AtomicLong lastTickDurationMillis = new AtomicLong();
    private volatile Instant lastCheck;
    private volatile Instant startedAt;

    private SecurityMonitor(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source");
        this.correlationRules = Objects.requireNonNull(builder.correlationRules, "correlationRules");
        this.responseEngine = Objects.requireNonNull(builder.responseEngine, "responseEngine");
        this.incidentSink = Objects.requireNonNull(builder.incidentSink, "incidentSink");
        this.alertDispatcher = Objects.requireNonNull(builder.alertDispatcher, "alertDispatcher");
        this.intelProvider = builder.intelProvider;
        this.listeners = List.copyOf(builder.listeners);
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.workers = Objects.requireNonNull(builder.workers, "workers");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.config = (builder.config != null ? builder.config : MonitoringConfig.defaults()).validate();
        this.throttle = new AutoResponseThrottle(config.getMaxAutoResponsesPerHour(), clock);
        for (Tick tick : Tick.values()) {
            inFlight.put(tick, new AtomicBoolean());
        }
        applyConfig(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Lifecycle ---

    /**
     * Initializes collaborators and schedules the ticks. No-op when already
     * running.
     *
     * @throws MonitorStartupException if initialization fails
     */
    public synchronized void start() {
        if (status == MonitorStatus.RUNNING) {
            log.debug("[Vigilant] Monitor already running");
            return;
        }
        status = MonitorStatus.STARTING;
        MonitoringConfig current = config;
        try {
            if (current.isEnableThreatIntelligence() && intelProvider != null) {
                intelProvider.initialize();
            }
            if (current.isStartFromLatest()) {
                long latest = source.latestEventId();
                cursor.accumulateAndGet(latest, Math::max);
            }
        } catch (Exception e) {
            status = MonitorStatus.ERROR;
            log.error("[Vigilant] Monitor failed to start: {}", e.getMessage());
            throw new MonitorStartupException("Security monitor failed to start: " + e.getMessage(), e);
        }

        for (Tick tick : Tick.values()) {
            schedule(tick, current);
        }
        startedAt = clock.instant();
        status = MonitorStatus.RUNNING;
        log.info("[Vigilant] Monitor started (ingestion every {}, detection every {}, correlation every {}, cursor={})",
                current.getIngestionInterval(), current.getThreatDetectionInterval(),
                current.getCorrelationInterval(), cursor.get());
    }

    /**
     * Cancels the schedules and waits up to the grace period for running ticks.
     */
    public synchronized void stop() {
        if (status == MonitorStatus.ERROR) {
            status = MonitorStatus.STOPPED;
            return;
        }
        if (status != MonitorStatus.RUNNING) {
            return;
        }
        status = MonitorStatus.STOPPING;
        for (ScheduledFuture<?> future : scheduled.values()) {
            if (future != null) {
                future.cancel(false);
            }
        }
        scheduled.clear();

        long deadline = System.nanoTime() + config.getShutdownGracePeriod().toNanos();
        while (anyInFlight() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(SHUTDOWN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (anyInFlight()) {
            log.warn("[Vigilant] Monitor stopped with ticks still running after {}", config.getShutdownGracePeriod());
        }
        status = MonitorStatus.STOPPED;
        log.info("[Vigilant] Monitor stopped. {}", getStats());
    }

    public boolean isRunning() {
        return status == MonitorStatus.RUNNING;
    }

    public MonitorStatus getStatus() {
        return status;
    }

    public MonitoringConfig getConfig() {
        return config;
    }

    /** Id of the last event taken by the ingestion tick. */
    public long getCursor() {
        return cursor.get();
    }

    /**
     * Runs the three ticks once on the calling thread. A tick that is already
     * running on the scheduler is skipped.
     */
    public MonitoringStats forceCheck() {
        log.info("[Vigilant] Forced check requested");
        runTick(Tick.INGESTION);
        runTick(Tick.DEEP_DETECTION);
        runTick(Tick.CORRELATION);
        return getStats();
    }

    /**
     * Validates and applies a new configuration. While running, only the ticks
     * whose interval changed are rescheduled.
     *
     * @throws InvalidConfigurationException if the configuration is invalid; the
     *                                       current one is kept
     */
    public synchronized void updateConfig(MonitoringConfig newConfig) {
        newConfig.validate();
        MonitoringConfig previous = this.config;
        this.config = newConfig;
        applyConfig(newConfig);

        if (status == MonitorStatus.RUNNING) {
            for (Tick tick : Tick.values()) {
                if (!tick.intervalOf(previous).equals(tick.intervalOf(newConfig))) {
                    ScheduledFuture<?> old = scheduled.remove(tick);
                    if (old != null) {
                        old.cancel(false);
                    }
                    schedule(tick, newConfig);
                    log.info("[Vigilant] Rescheduled {} tick every {}", tick, tick.intervalOf(newConfig));
                }
            }
        }
        log.info("[Vigilant] Monitoring configuration updated: {}", newConfig);
    }

    public MonitoringStats getStats() {
        Instant started = startedAt;
        Duration uptime = started != null && status == MonitorStatus.RUNNING
                ? Duration.between(started, clock.instant())
                : Duration.ZERO;
        return new MonitoringStats(status, eventsProcessed.get(), threatsDetected.get(), incidentsCreated.get(),
                autoResponsesTriggered.get(), autoResponsesSuppressed.get(), alertsSent.get(), alertsFailed.get(),
                tickFailures.get(), cursor.get(), started, lastCheck, lastTickDurationMillis.get(), uptime);
    }

    private void applyConfig(MonitoringConfig newConfig) {
        this.classifier = new ThreatClassifier(clock, newConfig.isEnableThreatIntelligence() ? intelProvider : null);
        this.correlationEngine = new CorrelationEngine(clock, newConfig.getMaxCorrelations());
        throttle.setLimit(newConfig.getMaxAutoResponsesPerHour());
        responseEngine.setActionTimeout(newConfig.getResponseActionTimeout());
    }

    private void schedule(Tick tick, MonitoringConfig current) {
        long delayMillis = tick.intervalOf(current).toMillis();
        scheduled.put(tick, scheduler.scheduleWithFixedDelay(() -> runTick(tick), delayMillis, delayMillis,
                TimeUnit.MILLISECONDS));
    }

    private boolean anyInFlight() {
        return inFlight.values().stream().anyMatch(AtomicBoolean::get);
    }

    // --- Ticks ---

    void runTick(Tick tick) {
        AtomicBoolean guard = inFlight.get(tick);
        if (!guard.compareAndSet(false, true)) {
            log.debug("[Vigilant] {} tick still running, skipping", tick);
            return;
        }
        long started = System.nanoTime();
        try {
            switch (tick) {
                case INGESTION:
                    ingest();
                    break;
                case DEEP_DETECTION:
                    detect();
                    break;
                case CORRELATION:
                    correlate();
                    break;
                default:
                    throw new IllegalStateException("Unknown tick " + tick);
            }
        } catch (Exception e) {
            tickFailures.incrementAndGet();
            log.error("[Vigilant] {} tick failed: {}", tick, e.getMessage());
        } finally {
            lastTickDurationMillis.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            lastCheck = clock.instant();
            guard.set(false);
        }
    }

    private void ingest() throws Exception {
        MonitoringConfig current = config;
        long since = cursor.get();
        List<SecurityEvent> events = readWithTimeout(
                () -> source.readEvents(since, current.getMaxEventsPerBatch()), current.getIngestionInterval());

        long maxId = since;
        for (SecurityEvent event : events) {
            eventsProcessed.incrementAndGet();
            classifyAndHandle(event);
            maxId = Math.max(maxId, event.getId());
        }
        cursor.accumulateAndGet(maxId, Math::max);
        if (!events.isEmpty()) {
            log.debug("[Vigilant] Ingested {} events, cursor at {}", events.size(), cursor.get());
        }
    }

    private void detect() throws Exception {
        MonitoringConfig current = config;
        Duration window = current.getThreatDetectionInterval().multipliedBy(2);
        List<SecurityEvent> events = readWithTimeout(
                () -> source.readRecent(window, current.getMaxEventsPerBatch()), current.getThreatDetectionInterval());
        for (SecurityEvent event : events) {
            classifyAndHandle(event);
        }
    }

    private void correlate() throws Exception {
        MonitoringConfig current = config;
        List<SecurityEvent> events = readWithTimeout(
                () -> source.readRecent(current.getCorrelationWindow(), current.getMaxCorrelationEvents()),
                current.getCorrelationInterval());
        if (events.isEmpty()) {
            return;
        }
        List<EventCorrelation> correlations = correlationEngine.correlate(events, correlationRules.list());
        for (EventCorrelation correlation : correlations) {
            if (correlation.getRiskScore() < current.getCorrelationRiskThreshold()) {
                continue;
            }
            try {
                handleThreat(toThreat(correlation));
            } catch (Exception e) {
                log.error("[Vigilant] Failed to handle correlation {}: {}", correlation.getId(), e.getMessage());
            }
        }
    }

    private void classifyAndHandle(SecurityEvent event) {
        try {
            ThreatIntelligence threat = classifier.classify(event);
            if (threat != null) {
                handleThreat(threat);
            }
        } catch (Exception e) {
            log.error("[Vigilant] Failed to process event {}: {}", event.getId(), e.getMessage());
        }
    }

    private List<SecurityEvent> readWithTimeout(Callable<List<SecurityEvent>> read, Duration timeout)
            throws Exception {
        Future<List<SecurityEvent>> future = workers.submit(read);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Event source did not answer within " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof Exception ? (Exception) cause : e;
        }
    }

    // --- Threat handling ---

    void handleThreat(ThreatIntelligence threat) {
        MonitoringConfig current = config;
        if (threat.getRiskScore() < current.getReportingThreshold()) {
            return;
        }
        if (incidentSink.findByThreatId(threat.getThreatId()).isPresent()) {
            return;
        }
        threatsDetected.incrementAndGet();

        Severity severity = current.severityFor(threat.getRiskScore());
        SecurityIncident incident = newIncident(threat, severity);
        String incidentId = incidentSink.createIncident(incident);
        if (!incidentId.equals(incident.getId())) {
            // Another tick got there first
            return;
        }
        incidentsCreated.incrementAndGet();
        log.warn("[Vigilant] Threat detected: {} (risk={}, severity={}) -> incident {}",
                threat.getThreatType(), threat.getRiskScore(), severity.wireName(), incidentId);
        notifyListeners("threatDetected", listener -> listener.threatDetected(threat, incident));

        AutomatedResponseResult response = null;
        if (current.isAutoResponseEnabled() && threat.getRiskScore() >= current.getAutoResponseMinRiskScore()) {
            if (throttle.tryAcquire()) {
                autoResponsesTriggered.incrementAndGet();
                response = respond(threat, incident);
                if (response != null) {
                    AutomatedResponseResult result = response;
                    notifyListeners("autoResponseTriggered",
                            listener -> listener.autoResponseTriggered(threat, incident, result));
                }
            } else {
                autoResponsesSuppressed.incrementAndGet();
                log.warn("[Vigilant] Automated response suppressed for threat {}: {} responses in the last hour",
                        threat.getThreatId(), throttle.getLimit());
            }
        }

        sendAlert(threat, incidentId, severity, response);
    }

    private void notifyListeners(String callback, Consumer<MonitorListener> call) {
        for (MonitorListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.error("[Vigilant] Listener {} failed in {}: {}", listener.getClass().getSimpleName(), callback,
                        e.getMessage());
            }
        }
    }

    private AutomatedResponseResult respond(ThreatIntelligence threat, SecurityIncident incident) {
        try {
            AutomatedResponseResult result = responseEngine.execute(threat, incident);
            if (!result.getActionsExecuted().isEmpty()) {
                IncidentPatch.Builder patch = IncidentPatch.builder()
                        .responseActions(result.getActionsExecuted())
                        .timelineEntry(new ThreatEvent(clock.instant(), "Automated response: " + result.getMessage(),
                                result.isSuccess() ? Severity.INFO : Severity.MEDIUM, Map.of(
                                        "matchedRules", result.getMatchedRuleIds(),
                                        "success", result.isSuccess())));
                if (result.isSuccess()) {
                    patch.status(IncidentStatus.CONTAINED);
                }
                incidentSink.updateIncident(incident.getId(), patch.build());
            }
            return result;
        } catch (Exception e) {
            log.error("[Vigilant] Automated response for threat {} failed: {}", threat.getThreatId(), e.getMessage());
            return null;
        }
    }

    private SecurityIncident newIncident(ThreatIntelligence threat, Severity severity) {
        Instant now = clock.instant();
        return SecurityIncident.builder()
                .id(UUID.randomUUID().toString())
                .threatId(threat.getThreatId())
                .severity(severity)
                .status(IncidentStatus.OPEN)
                .title("Security Incident: " + threat.getThreatType().toUpperCase(Locale.ROOT))
                .description(threat.getDescription())
                .affectedResources(threat.getAffectedResources())
                .escalated(severity == Severity.CRITICAL)
                .timeline(threat.getTimeline())
                .evidence(threat.getIndicators().stream().map(Evidence::fromIndicator).collect(Collectors.toList()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void sendAlert(ThreatIntelligence threat, String incidentId, Severity severity,
            AutomatedResponseResult response) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("threatType", threat.getThreatType());
        details.put("riskScore", threat.getRiskScore());
        details.put("confidence", threat.getConfidence());
        details.put("affectedResources", threat.getAffectedResources());
        if (response != null) {
            details.put("automatedResponse", response.getMessage());
        }
        SecurityAlert alert = new SecurityAlert(UUID.randomUUID().toString(), threat.getThreatId(), incidentId,
                severity, "Security Threat Detected: " + threat.getThreatType().toUpperCase(Locale.ROOT),
                threat.getDescription(), severity.compareTo(Severity.HIGH) >= 0, severity == Severity.CRITICAL,
                clock.instant(), details);
        List<AlertChannel> channels = AlertRouting.channelsFor(severity);
        try {
            if (alertDispatcher.send(alert, channels)) {
                alertsSent.incrementAndGet();
            } else {
                alertsFailed.incrementAndGet();
                log.warn("[Vigilant] Alert for incident {} was not delivered", incidentId);
            }
        } catch (Exception e) {
            alertsFailed.incrementAndGet();
            log.error("[Vigilant] Alert dispatch for incident {} failed: {}", incidentId, e.getMessage());
        }
    }

    static ThreatIntelligence toThreat(EventCorrelation correlation) {
        List<ThreatEvent> timeline = new ArrayList<>();
        for (SecurityEvent event : correlation.getEvents()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("eventId", event.getId());
            details.put("action", event.getAction());
            details.put("ipAddress", event.getIpAddress());
            details.put("ruleId", correlation.getRuleId());
            timeline.add(new ThreatEvent(event.getTimestamp(), ActionCatalog.describe(event),
                    ActionCatalog.severityOf(event.getAction()), details));
        }
        return ThreatIntelligence.builder()
                .threatId(CORRELATION_THREAT_PREFIX + correlation.getRuleId() + "-" + correlation.getCorrelationKey()
                        + "-" + correlation.firstEvent().getId())
                .threatType(ThreatTypes.COORDINATED_ATTACK)
                .source(ThreatSource.CORRELATION)
                .description(correlation.getDescription())
                .riskScore((int) Math.round(correlation.getRiskScore()))
                .confidence(correlation.getConfidence())
                .indicators(correlation.getIndicators())
                .affectedResources(correlation.getAffectedResources())
                .timeline(timeline)
                .createdAt(correlation.getDetectedAt())
                .build();
    }

    public static class Builder {
        private SecurityEventSource source;
        private CorrelationRuleStore correlationRules;
        private AutomatedResponseEngine responseEngine;
        private IncidentSink incidentSink;
        private AlertDispatcher alertDispatcher;
        private ThreatIntelProvider intelProvider;
        private final List<MonitorListener> listeners = new ArrayList<>();
        private ScheduledExecutorService scheduler;
        private ExecutorService workers;
        private MonitoringConfig config;
        private Clock clock;

        public Builder source(SecurityEventSource source) {
            this.source = source;
            return this;
        }

        public Builder correlationRules(CorrelationRuleStore correlationRules) {
            this.correlationRules = correlationRules;
            return this;
        }

        public Builder responseEngine(AutomatedResponseEngine responseEngine) {
            this.responseEngine = responseEngine;
            return this;
        }

        public Builder incidentSink(IncidentSink incidentSink) {
            this.incidentSink = incidentSink;
            return this;
        }

        public Builder alertDispatcher(AlertDispatcher alertDispatcher) {
            this.alertDispatcher = alertDispatcher;
            return this;
        }

        /** Optional. */
        public Builder intelProvider(ThreatIntelProvider intelProvider) {
            this.intelProvider = intelProvider;
            return this;
        }

        public Builder listener(MonitorListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder listeners(List<? extends MonitorListener> listeners) {
            listeners.forEach(this::listener);
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Runs source reads under their timeout. */
        public Builder workers(ExecutorService workers) {
            this.workers = workers;
            return this;
        }

        public Builder config(MonitoringConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SecurityMonitor build() {
            return new SecurityMonitor(this);
        }
    }
}
