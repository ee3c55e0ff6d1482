package com.vigilant.core.response;

import com.vigilant.core.alert.AlertDispatcher;
import com.vigilant.core.audit.AuditEntry;
import com.vigilant.core.audit.InMemoryResponseAuditLog;
import com.vigilant.core.audit.ResponseAuditLog;
import com.vigilant.core.config.VigilantProperties;
import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.AutomatedResponseResult;
import com.vigilant.core.model.ResponseAction;
import com.vigilant.core.model.SecurityIncident;
import com.vigilant.core.model.ThreatIntelligence;
import com.vigilant.core.model.ThreatTypes;
import com.vigilant.core.rule.ConditionOperator;
import com.vigilant.core.rule.ResponseRule;
import com.vigilant.core.rule.ResponseRuleStore;
import com.vigilant.core.rule.RuleAction;
import com.vigilant.core.rule.RuleCondition;
import com.vigilant.core.rule.ThreatField;
import com.vigilant.core.store.InMemoryDecisionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("AutomatedResponseEngine")
class AutomatedResponseEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ExecutorService workers;
    private InMemoryResponseAuditLog auditLog;
    private ResponseContext context;
    private List<String> calls;

    /** Handler whose behavior is a plain lambda. */
    private interface Behavior {
        ActionOutcome run(RuleAction action) throws Exception;
    }

    private final class StubHandler implements ActionHandler {
        private final ActionType type;
        private final Behavior behavior;

        StubHandler(ActionType type, Behavior behavior) {
            this.type = type;
            this.behavior = behavior;
        }

        @Override
        public ActionType getType() {
            return type;
        }

        @Override
        public String getName() {
            return "stub-" + type.wireName();
        }

        @Override
        public ActionOutcome execute(RuleAction action, ThreatIntelligence threat, SecurityIncident incident,
                ResponseContext ctx) throws Exception {
            calls.add(type.wireName() + ":" + action.stringParam("tag", ""));
            return behavior.run(action);
        }
    }

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(2);
        auditLog = new InMemoryResponseAuditLog();
        context = new ResponseContext(new InMemoryDecisionStore(), mock(AlertDispatcher.class), auditLog,
                new VigilantProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        calls = Collections.synchronizedList(new ArrayList<>());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private static ThreatIntelligence threat(String type, int risk) {
        return ThreatIntelligence.builder()
                .threatId("event-1-" + type)
                .threatType(type)
                .riskScore(risk)
                .confidence(80)
                .createdAt(NOW)
                .build();
    }

    private static ResponseRule rule(String id, int priority, String threatType, RuleAction... actions) {
        return ResponseRule.builder()
                .id(id)
                .name(id)
                .conditions(List.of(RuleCondition.of(ThreatField.THREAT_TYPE, ConditionOperator.EQUALS, threatType)))
                .actions(List.of(actions))
                .priority(priority)
                .build();
    }

    private static RuleAction action(ActionType type, String tag) {
        return RuleAction.of(type, Map.of("tag", tag));
    }

    private AutomatedResponseEngine engine(List<ResponseRule> rules, ActionHandler... handlers) {
        return new AutomatedResponseEngine(new ResponseRuleStore(rules), new ActionHandlerRegistry(List.of(handlers)),
                context, workers, Duration.ofMillis(500));
    }

    @Nested
    @DisplayName("Rule matching")
    class Matching {

        @Test
        @DisplayName("Should report success with no actions when nothing matches")
        void shouldHandleNoMatch() {
            AutomatedResponseEngine engine = engine(
                    List.of(rule("r1", 1, ThreatTypes.DATA_EXFILTRATION, action(ActionType.LOG, "x"))),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo(AutomatedResponseEngine.NO_MATCHING_RULES);
            assertThat(result.getActionsExecuted()).isEmpty();
            assertThat(calls).isEmpty();
        }

        @Test
        @DisplayName("Should run rules by priority and actions in declared order")
        void shouldOrderByPriority() {
            AutomatedResponseEngine engine = engine(List.of(
                    rule("late", 5, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.LOG, "late")),
                    rule("early", 1, ThreatTypes.CREDENTIAL_ATTACK,
                            action(ActionType.BLOCK, "first"), action(ActionType.LOG, "second"))),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")),
                    new StubHandler(ActionType.BLOCK, a -> ActionOutcome.success("blocked")));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.getMatchedRuleIds()).containsExactly("early", "late");
            assertThat(calls).containsExactly("block:first", "log:second", "log:late");
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("Executed 3 actions from 2 rules");
        }

        @Test
        @DisplayName("Should skip disabled and manual rules")
        void shouldSkipDisabledAndManualRules() {
            ResponseRule disabled = rule("disabled", 1, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.LOG, "d"))
                    .toBuilder().enabled(false).build();
            ResponseRule manual = rule("manual", 1, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.LOG, "m"))
                    .toBuilder().autoExecute(false).build();
            AutomatedResponseEngine engine = engine(List.of(disabled, manual),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));

            assertThat(engine.matchingRules(threat(ThreatTypes.CREDENTIAL_ATTACK, 90))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class Isolation {

        @Test
        @DisplayName("Should keep going after a handler throws")
        void shouldContinueAfterFailure() {
            AutomatedResponseEngine engine = engine(List.of(
                    rule("r1", 1, ThreatTypes.CREDENTIAL_ATTACK,
                            action(ActionType.BLOCK, "boom"), action(ActionType.LOG, "after"))),
                    new StubHandler(ActionType.BLOCK, a -> {
                        throw new IllegalStateException("firewall unreachable");
                    }),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getActionsExecuted()).extracting(ResponseAction::isSuccess).containsExactly(false, true);
            assertThat(result.getErrors()).singleElement().asString()
                    .startsWith("r1/block:")
                    .contains("firewall unreachable");
            assertThat(result.getMessage()).isEqualTo("1 of 2 actions failed");
        }

        @Test
        @DisplayName("Should record a hanging handler as timed out")
        void shouldTimeOutHangingHandler() {
            CountDownLatch never = new CountDownLatch(1);
            AutomatedResponseEngine engine = engine(List.of(
                    rule("r1", 1, ThreatTypes.CREDENTIAL_ATTACK,
                            action(ActionType.NOTIFY, "slow"), action(ActionType.LOG, "after"))),
                    new StubHandler(ActionType.NOTIFY, a -> {
                        never.await(10, TimeUnit.SECONDS);
                        return ActionOutcome.success("late");
                    }),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));
            engine.setActionTimeout(Duration.ofMillis(100));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.getActionsExecuted().get(0).isSuccess()).isFalse();
            assertThat(result.getActionsExecuted().get(0).getMessage()).contains("Timed out");
            assertThat(result.getActionsExecuted().get(1).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("Should record an action without a handler as failed")
        void shouldFailMissingHandler() {
            AutomatedResponseEngine engine = engine(List.of(
                    rule("r1", 1, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.RESTRICT, "none"))));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getActionsExecuted()).singleElement()
                    .extracting(ResponseAction::getMessage).asString().contains("No enabled handler");
        }

        @Test
        @DisplayName("Should treat a handler disabled in configuration as missing")
        void shouldRespectDisabledHandler() {
            VigilantProperties.HandlerProperties off = new VigilantProperties.HandlerProperties();
            off.setEnabled(false);
            context.getProperties().getHandlers().put("log", off);
            AutomatedResponseEngine engine = engine(
                    List.of(rule("r1", 1, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.LOG, "x"))),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));

            AutomatedResponseResult result = engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            assertThat(result.isSuccess()).isFalse();
            assertThat(calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("Audit trail")
    class Audit {

        @Test
        @DisplayName("Should append one audit entry per invocation")
        void shouldAuditExecution() {
            AutomatedResponseEngine engine = engine(
                    List.of(rule("r1", 1, ThreatTypes.CREDENTIAL_ATTACK, action(ActionType.LOG, "x"))),
                    new StubHandler(ActionType.LOG, a -> ActionOutcome.success("logged")));

            engine.execute(threat(ThreatTypes.CREDENTIAL_ATTACK, 90), null);

            List<AuditEntry> entries = auditLog.recent(10);
            assertThat(entries).singleElement().satisfies(entry -> {
                assertThat(entry.getKind()).isEqualTo(ResponseAuditLog.RESPONSE_EXECUTED);
                assertThat(entry.getThreatId()).isEqualTo("event-1-credential_attack");
                assertThat(entry.getDetails()).containsEntry("success", true).containsEntry("actionsExecuted", 1);
            });
        }
    }
}
