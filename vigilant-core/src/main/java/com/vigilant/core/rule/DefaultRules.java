package com.vigilant.core.rule;

import com.vigilant.core.model.ActionType;
import com.vigilant.core.model.ThreatTypes;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.vigilant.core.rule.ConditionOperator.CONTAINS;
import static com.vigilant.core.rule.ConditionOperator.EQUALS;
import static com.vigilant.core.rule.ConditionOperator.GREATER_THAN;
import static com.vigilant.core.rule.ConditionOperator.IN;

/**
 * Built-in rule sets loaded at startup unless disabled in configuration.
 */
public final class DefaultRules {

    private DefaultRules() {
    }

    public static List<CorrelationRule> correlationRules() {
        return List.of(
                CorrelationRule.builder()
                        .id("coordinated_brute_force")
                        .name("Coordinated Brute Force Attack")
                        .description("Multiple failed logins from different IPs targeting same user")
                        .timeWindow(Duration.ofMinutes(15))
                        .minEvents(5)
                        .maxEvents(100)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, EQUALS, "FAILED_LOGIN"),
                                RuleCondition.same(EventField.ACTOR_ID),
                                RuleCondition.distinct(EventField.IP_ADDRESS)))
                        .riskMultiplier(2.5)
                        .confidence(85)
                        .priority(1)
                        .build(),
                CorrelationRule.builder()
                        .id("privilege_escalation_chain")
                        .name("Privilege Escalation Chain")
                        .description("Sequential permission changes leading to higher privileges")
                        .timeWindow(Duration.ofMinutes(30))
                        .minEvents(3)
                        .maxEvents(10)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, CONTAINS, "PERMISSION"),
                                RuleCondition.same(EventField.ACTOR_ID)))
                        .riskMultiplier(3.0)
                        .confidence(90)
                        .priority(1)
                        .build(),
                CorrelationRule.builder()
                        .id("data_exfiltration_pattern")
                        .name("Data Exfiltration Pattern")
                        .description("Multiple data exports/downloads in short timeframe")
                        .timeWindow(Duration.ofHours(1))
                        .minEvents(10)
                        .maxEvents(50)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, IN, List.of("EXPORT", "DOWNLOAD")),
                                RuleCondition.same(EventField.ACTOR_ID)))
                        .riskMultiplier(2.0)
                        .confidence(80)
                        .priority(2)
                        .build(),
                CorrelationRule.builder()
                        .id("lateral_movement")
                        .name("Lateral Movement")
                        .description("Access to multiple properties in sequence")
                        .timeWindow(Duration.ofMinutes(30))
                        .minEvents(5)
                        .maxEvents(20)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, CONTAINS, "ACCESS"),
                                RuleCondition.same(EventField.ACTOR_ID),
                                RuleCondition.distinct(EventField.TENANT_ID)))
                        .riskMultiplier(1.8)
                        .confidence(75)
                        .priority(3)
                        .build(),
                CorrelationRule.builder()
                        .id("reconnaissance_activity")
                        .name("Reconnaissance Activity")
                        .description("Systematic probing of system features and data")
                        .timeWindow(Duration.ofMinutes(45))
                        .minEvents(15)
                        .maxEvents(100)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, IN, List.of("VIEW", "LIST", "SEARCH")),
                                RuleCondition.same(EventField.ACTOR_ID)))
                        .riskMultiplier(1.5)
                        .confidence(70)
                        .priority(4)
                        .build(),
                CorrelationRule.builder()
                        .id("session_manipulation")
                        .name("Session Manipulation")
                        .description("Unusual session creation/destruction patterns")
                        .timeWindow(Duration.ofMinutes(20))
                        .minEvents(8)
                        .maxEvents(30)
                        .conditions(List.of(
                                RuleCondition.of(EventField.ACTION, IN, List.of("LOGIN", "LOGOUT", "SESSION")),
                                RuleCondition.same(EventField.ACTOR_ID)))
                        .riskMultiplier(1.7)
                        .confidence(65)
                        .priority(4)
                        .build());
    }

    public static List<ResponseRule> responseRules() {
        return List.of(
                ResponseRule.builder()
                        .id("critical_brute_force")
                        .name("Critical Brute Force Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, IN,
                                        List.of(ThreatTypes.CREDENTIAL_ATTACK, ThreatTypes.BRUTE_FORCE_ADVANCED)),
                                RuleCondition.of(ThreatField.RISK_SCORE, GREATER_THAN, 85)))
                        .actions(List.of(
                                RuleAction.of(ActionType.BLOCK, Map.of("target", "ip", "duration", 3600)),
                                RuleAction.of(ActionType.LOCK, Map.of("target", "account", "duration", 1800)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "critical", "immediate", true)),
                                RuleAction.of(ActionType.NOTIFY, Map.of("channels", List.of("email", "sms"), "escalate", true))))
                        .priority(1)
                        .build(),
                ResponseRule.builder()
                        .id("high_privilege_escalation")
                        .name("High Privilege Escalation Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, IN,
                                        List.of(ThreatTypes.PRIVILEGE_ESCALATION, ThreatTypes.PRIVILEGE_PROBING)),
                                RuleCondition.of(ThreatField.RISK_SCORE, GREATER_THAN, 70)))
                        .actions(List.of(
                                RuleAction.of(ActionType.RESTRICT, Map.of("target", "permissions", "immediate", true)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "high", "immediate", true)),
                                RuleAction.of(ActionType.LOG, Map.of("detailed", true, "preserve", true)),
                                RuleAction.of(ActionType.NOTIFY, Map.of("channels", List.of("email"), "escalate", false))))
                        .priority(2)
                        .build(),
                ResponseRule.builder()
                        .id("data_exfiltration_response")
                        .name("Data Exfiltration Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, IN,
                                        List.of(ThreatTypes.DATA_EXFILTRATION, ThreatTypes.UNAUTHORIZED_EXPORT))))
                        .actions(List.of(
                                RuleAction.of(ActionType.RESTRICT, Map.of("target", "data_access", "immediate", true)),
                                RuleAction.of(ActionType.BLOCK, Map.of("target", "user_session", "duration", 1800)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "high", "immediate", true)),
                                RuleAction.of(ActionType.LOG, Map.of("detailed", true, "forensic", true))))
                        .priority(1)
                        .build(),
                ResponseRule.builder()
                        .id("tenant_access_violation")
                        .name("Tenant Access Violation Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, EQUALS, ThreatTypes.TENANT_ACCESS_VIOLATION)))
                        .actions(List.of(
                                RuleAction.of(ActionType.BLOCK, Map.of("target", "tenant_access", "duration", 600)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "medium", "immediate", false)),
                                RuleAction.of(ActionType.LOG, Map.of("detailed", true))))
                        .priority(3)
                        .build(),
                ResponseRule.builder()
                        .id("session_anomaly_response")
                        .name("Session Anomaly Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, EQUALS, ThreatTypes.SESSION_HIJACKING),
                                RuleCondition.of(ThreatField.RISK_SCORE, GREATER_THAN, 50)))
                        .actions(List.of(
                                RuleAction.of(ActionType.RESTRICT, Map.of("target", "concurrent_sessions", "limit", 1)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "medium")),
                                RuleAction.of(ActionType.LOG, Map.of("session_details", true))))
                        .priority(4)
                        .build(),
                ResponseRule.builder()
                        .id("coordinated_attack_response")
                        .name("Coordinated Attack Response")
                        .conditions(List.of(
                                RuleCondition.of(ThreatField.THREAT_TYPE, EQUALS, ThreatTypes.COORDINATED_ATTACK),
                                RuleCondition.of(ThreatField.RISK_SCORE, GREATER_THAN, 80)))
                        .actions(List.of(
                                RuleAction.of(ActionType.BLOCK, Map.of("target", "ip", "duration", 3600)),
                                RuleAction.of(ActionType.ALERT, Map.of("level", "high", "immediate", true)),
                                RuleAction.of(ActionType.LOG, Map.of("detailed", true))))
                        .priority(2)
                        .build());
    }
}
