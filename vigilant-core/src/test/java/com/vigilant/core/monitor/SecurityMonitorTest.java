package com.vigilant.core.monitor;

import com.vigilant.core.MutableClock;
import com.vigilant.core.alert.AlertDispatcher;
import com.vigilant.core.audit.InMemoryResponseAuditLog;
import com.vigilant.core.config.InvalidConfigurationException;
import com.vigilant.core.config.MonitoringConfig;
import com.vigilant.core.config.VigilantProperties;
import com.vigilant.core.incident.InMemoryIncidentSink;
import com.vigilant.core.intel.ThreatIntelProvider;
import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.IncidentStatus;
import com.vigilant.core.model.SecurityAlert;
import com.vigilant.core.model.SecurityEvent;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.Severity;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.model.ThreatTypes;
import com.vigilant.core.response.ActionHandler;
import com.vigilant.core.response.ActionHandlerRegistry;
import com.vigilant.core.response.ActionOutcome;
import com.vigilant.core.response.AutomatedResponseEngine;
import com.vigilant.core.response.ResponseContext;
import com.vigilant.core.rule.ConditionOperator;
import com.vigilant.core.rule.CorrelationRuleStore;
import com.vigilant.core.rule.DefaultRules;
import com.vigilant.core.rule.ResponseRule;
import com.vigilant.core.rule.ResponseRuleStore;
import com.vigilant.core.rule.RuleAction;
import com.vigilant.core.rule.RuleCondition;
import com.vigilant.core.rule.ThreatField;
import com.vigilant.core.source.InMemorySecurityEventSource;
import com.vigilant.core.store.InMemoryDecisionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SecurityMonitor")
class SecurityMonitorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemorySecurityEventSource source;
    private InMemoryIncidentSink incidents;
    private AlertDispatcher alerts;
    private ActionHandler logHandler;
    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private List<MonitorListener> listeners;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(T0);
        source = new InMemorySecurityEventSource(clock);
        incidents = new InMemoryIncidentSink(clock);
        alerts = mock(AlertDispatcher.class);
        when(alerts.send(any(), any())).thenReturn(true);

        logHandler = mock(ActionHandler.class);
        when(logHandler.getType()).thenReturn(ActionType.LOG);
        when(logHandler.getName()).thenReturn("test-log");
        when(logHandler.isEnabled(any())).thenReturn(true);
        when(logHandler.execute(any(), any(), any(), any())).thenReturn(ActionOutcome.success("logged"));

        scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        workers = Executors.newFixedThreadPool(2);
        listeners = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private SecurityMonitor monitor(MonitoringConfig config) {
        return monitor(config, null);
    }

    private SecurityMonitor monitor(MonitoringConfig config, ThreatIntelProvider intel) {
        ResponseRule logEverything = ResponseRule.builder()
                .id("log_high_risk")
                .name("Log high risk")
                .conditions(List.of(RuleCondition.of(ThreatField.RISK_SCORE, ConditionOperator.GREATER_THAN, 59)))
                .actions(List.of(RuleAction.of(ActionType.LOG, Map.of("detailed", true))))
                .build();
        ResponseContext context = new ResponseContext(new InMemoryDecisionStore(clock), alerts,
                new InMemoryResponseAuditLog(), new VigilantProperties(), clock);
        AutomatedResponseEngine engine = new AutomatedResponseEngine(new ResponseRuleStore(List.of(logEverything)),
                new ActionHandlerRegistry(List.of(logHandler)), context, workers, Duration.ofSeconds(1));
        return SecurityMonitor.builder()
                .source(source)
                .correlationRules(new CorrelationRuleStore(DefaultRules.correlationRules()))
                .responseEngine(engine)
                .incidentSink(incidents)
                .alertDispatcher(alerts)
                .intelProvider(intel)
                .listeners(listeners)
                .scheduler(scheduler)
                .workers(workers)
                .config(config)
                .clock(clock)
                .build();
    }

    private SecurityEvent append(String action, String actor, String ip, Instant at) {
        return source.append(SecurityEvent.builder()
                .timestamp(at)
                .action(action)
                .actorId(actor)
                .tenantId("tenant-1")
                .ipAddress(ip)
                .build());
    }

    private static ThreatIntelligence threat(String id, int risk) {
        return ThreatIntelligence.builder()
                .threatId(id)
                .threatType(ThreatTypes.PRIVILEGE_ESCALATION)
                .riskScore(risk)
                .confidence(70)
                .createdAt(T0)
                .build();
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingestion {

        @Test
        @DisplayName("Should advance the cursor to the newest event and never move it back")
        void shouldAdvanceCursor() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());
            append("LOGIN", "alice", "10.0.0.1", T0);
            append("VIEW", "alice", "10.0.0.1", T0);
            append("LOGOUT", "alice", "10.0.0.1", T0);

            monitor.runTick(SecurityMonitor.Tick.INGESTION);
            assertThat(monitor.getCursor()).isEqualTo(3);

            monitor.runTick(SecurityMonitor.Tick.INGESTION);
            assertThat(monitor.getCursor()).isEqualTo(3);
            assertThat(monitor.getStats().getEventsProcessed()).isEqualTo(3);
            assertThat(monitor.getStats().getThreatsDetected()).isZero();
        }

        @Test
        @DisplayName("Should read at most maxEventsPerBatch events per tick")
        void shouldBoundBatch() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder().maxEventsPerBatch(2).build());
            for (int i = 0; i < 5; i++) {
                append("VIEW", "alice", "10.0.0.1", T0);
            }

            monitor.runTick(SecurityMonitor.Tick.INGESTION);

            assertThat(monitor.getCursor()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should open one incident and alert on its severity channels")
        void shouldOpenIncidentForThreat() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());
            append("FAILED_LOGIN", "alice", "10.0.0.1", T0);

            monitor.runTick(SecurityMonitor.Tick.INGESTION);

            assertThat(incidents.findByThreatId("event-1-credential_attack")).get().satisfies(incident -> {
                assertThat(incident.getSeverity()).isEqualTo(Severity.MEDIUM);
                assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
                assertThat(incident.getTitle()).isEqualTo("Security Incident: CREDENTIAL_ATTACK");
                assertThat(incident.isEscalated()).isFalse();
            });
            ArgumentCaptor<SecurityAlert> alert = ArgumentCaptor.forClass(SecurityAlert.class);
            verify(alerts).send(alert.capture(), eq(List.of(AlertChannel.DASHBOARD, AlertChannel.WEBHOOK)));
            assertThat(alert.getValue().isActionRequired()).isFalse();
            assertThat(monitor.getStats().getAlertsSent()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not open a second incident when detection sees the same event again")
        void shouldDeduplicateAcrossTicks() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());
            append("PERMISSION_CHANGE", "alice", "10.0.0.1", T0);

            monitor.runTick(SecurityMonitor.Tick.INGESTION);
            monitor.runTick(SecurityMonitor.Tick.DEEP_DETECTION);

            assertThat(incidents.size()).isEqualTo(1);
            assertThat(monitor.getStats().getIncidentsCreated()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should count a failing source read and keep the cursor")
        void shouldSurviveSourceFailure() throws Exception {
            InMemorySecurityEventSource failing = mock(InMemorySecurityEventSource.class);
            when(failing.readEvents(anyLong(), anyInt()))
                    .thenThrow(new IllegalStateException("database unavailable"));
            source = failing;
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.runTick(SecurityMonitor.Tick.INGESTION);

            assertThat(monitor.getStats().getTickFailures()).isEqualTo(1);
            assertThat(monitor.getCursor()).isZero();
        }
    }

    @Nested
    @DisplayName("Correlation")
    class Correlation {

        @Test
        @DisplayName("Should open a coordinated attack incident for a distributed brute force")
        void shouldReportCorrelation() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder().autoResponseEnabled(false).build());
            for (int i = 0; i < 5; i++) {
                append("FAILED_LOGIN", "alice", "10.0.0." + (i % 3), T0.minusSeconds(60L * (5 - i)));
            }

            monitor.runTick(SecurityMonitor.Tick.CORRELATION);

            assertThat(incidents.listRecent(10))
                    .extracting(SecurityIncident::getThreatId)
                    .singleElement().asString()
                    .startsWith("corr-coordinated_brute_force-alice-");
        }

        @Test
        @DisplayName("Should ignore correlations below the risk threshold")
        void shouldApplyRiskThreshold() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder()
                    .correlationRiskThreshold(100).build());
            for (int i = 0; i < 5; i++) {
                append("FAILED_LOGIN", "alice", "10.0.0." + (i % 3), T0.minusSeconds(60L * (5 - i)));
            }

            monitor.runTick(SecurityMonitor.Tick.CORRELATION);

            assertThat(incidents.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Automated response")
    class AutomatedResponse {

        @Test
        @DisplayName("Should contain the incident after a successful response")
        void shouldContainIncident() throws Exception {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.handleThreat(threat("t-1", 95));

            SecurityIncident incident = incidents.findByThreatId("t-1").orElseThrow();
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.CONTAINED);
            assertThat(incident.isEscalated()).isTrue();
            assertThat(incident.getResponseActions()).hasSize(1);
            verify(logHandler).execute(any(), any(), any(), any());
            verify(alerts).send(any(), eq(List.of(AlertChannel.EMAIL, AlertChannel.SMS, AlertChannel.PUSH,
                    AlertChannel.DASHBOARD, AlertChannel.WEBHOOK, AlertChannel.SLACK)));
        }

        @Test
        @DisplayName("Should suppress responses beyond the hourly cap and still alert")
        void shouldCapResponsesPerHour() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder()
                    .maxAutoResponsesPerHour(2).build());

            monitor.handleThreat(threat("t-1", 80));
            monitor.handleThreat(threat("t-2", 80));
            monitor.handleThreat(threat("t-3", 80));

            MonitoringStats stats = monitor.getStats();
            assertThat(stats.getAutoResponsesTriggered()).isEqualTo(2);
            assertThat(stats.getAutoResponsesSuppressed()).isEqualTo(1);
            assertThat(stats.getAlertsSent()).isEqualTo(3);
            assertThat(incidents.findByThreatId("t-3")).get()
                    .extracting(SecurityIncident::getStatus).isEqualTo(IncidentStatus.OPEN);
        }

        @Test
        @DisplayName("Should allow responses again once the hour has passed")
        void shouldRefillAfterWindow() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder()
                    .maxAutoResponsesPerHour(1).build());

            monitor.handleThreat(threat("t-1", 80));
            clock.advance(Duration.ofMinutes(61));
            monitor.handleThreat(threat("t-2", 80));

            assertThat(monitor.getStats().getAutoResponsesTriggered()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should not respond below the minimum risk score")
        void shouldRespectMinimumRisk() throws Exception {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.handleThreat(threat("t-1", 55));

            verify(logHandler, never()).execute(any(), any(), any(), any());
            assertThat(incidents.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not report threats below the reporting threshold")
        void shouldRespectReportingThreshold() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.handleThreat(threat("t-1", 10));

            assertThat(incidents.size()).isZero();
            verify(alerts, never()).send(any(), any());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        @DisplayName("Should tell listeners about new incidents and triggered responses")
        void shouldNotifyListeners() {
            MonitorListener listener = mock(MonitorListener.class);
            listeners.add(listener);
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.handleThreat(threat("t-1", 95));
            monitor.handleThreat(threat("t-2", 40));

            ArgumentCaptor<SecurityIncident> incident = ArgumentCaptor.forClass(SecurityIncident.class);
            verify(listener, times(2)).threatDetected(any(ThreatIntelligence.class), incident.capture());
            assertThat(incident.getAllValues()).extracting(SecurityIncident::getThreatId).containsExactly("t-1", "t-2");
            ArgumentCaptor<AutomatedResponseResult> result = ArgumentCaptor.forClass(AutomatedResponseResult.class);
            verify(listener).autoResponseTriggered(any(ThreatIntelligence.class), any(SecurityIncident.class),
                    result.capture());
            assertThat(result.getValue().getMatchedRuleIds()).containsExactly("log_high_risk");
        }

        @Test
        @DisplayName("Should keep handling the threat when a listener throws")
        void shouldIsolateFailingListener() {
            MonitorListener failing = mock(MonitorListener.class);
            doThrow(new IllegalStateException("listener down")).when(failing).threatDetected(any(), any());
            MonitorListener healthy = mock(MonitorListener.class);
            listeners.add(failing);
            listeners.add(healthy);
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.handleThreat(threat("t-1", 95));

            verify(healthy).threatDetected(any(), any());
            assertThat(incidents.findByThreatId("t-1")).get()
                    .extracting(SecurityIncident::getStatus).isEqualTo(IncidentStatus.CONTAINED);
            assertThat(monitor.getStats().getAlertsSent()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should schedule three ticks on start and cancel them on stop")
        void shouldStartAndStop() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());

            monitor.start();
            monitor.start();

            assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.RUNNING);
            verify(scheduler, times(3))
                    .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

            monitor.stop();
            assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.STOPPED);
        }

        @Test
        @DisplayName("Should enter the error state when initialization fails and recover on retry")
        void shouldReportStartupFailure() {
            ThreatIntelProvider intel = mock(ThreatIntelProvider.class);
            doThrow(new IllegalStateException("feed unreachable")).doNothing().when(intel).initialize();
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults(), intel);

            assertThatThrownBy(monitor::start)
                    .isInstanceOf(MonitorStartupException.class)
                    .hasMessageContaining("feed unreachable");
            assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.ERROR);

            monitor.start();
            assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.RUNNING);
        }

        @Test
        @DisplayName("Should start from the newest event when configured to")
        void shouldStartFromLatest() {
            append("VIEW", "alice", "10.0.0.1", T0);
            append("VIEW", "alice", "10.0.0.1", T0);
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults().toBuilder().startFromLatest(true).build());

            monitor.start();

            assertThat(monitor.getCursor()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reschedule only the tick whose interval changed")
        void shouldRescheduleChangedTick() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());
            monitor.start();

            monitor.updateConfig(monitor.getConfig().toBuilder()
                    .correlationInterval(Duration.ofSeconds(30))
                    .maxAutoResponsesPerHour(5)
                    .build());

            verify(scheduler, times(4))
                    .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
            verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(30_000L), eq(30_000L),
                    eq(TimeUnit.MILLISECONDS));
            assertThat(monitor.getConfig().getMaxAutoResponsesPerHour()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should keep the current configuration when the new one is invalid")
        void shouldRejectInvalidConfig() {
            SecurityMonitor monitor = monitor(MonitoringConfig.defaults());
            MonitoringConfig before = monitor.getConfig();

            assertThatThrownBy(() -> monitor.updateConfig(before.toBuilder().maxEventsPerBatch(0).build()))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThat(monitor.getConfig()).isSameAs(before);
        }
    }
}
