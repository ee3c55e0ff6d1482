package com.vigilant.core.classify;

import com.vigilant.core.model.SecurityEvent;
import com.vigilant.core.model.Severity;
import com.vigilant.core.model.ThreatTypes;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fixed lookups from audit action verbs to threat type, severity and a human
 * description.
 */
public final class ActionCatalog {

    /** Threat type and severity for an action with security relevance. */
    public static final class Classification {
        private final String threatType;
        private final Severity severity;

        Classification(String threatType, Severity severity) {
            this.threatType = threatType;
            this.severity = severity;
        }

        public String getThreatType() {
            return threatType;
        }

        public Severity getSeverity() {
            return severity;
        }
    }

    private static final Classification UNKNOWN = new Classification(ThreatTypes.UNUSUAL_ACTIVITY, Severity.LOW);

    private static final Map<String, Classification> CLASSIFICATIONS = Map.ofEntries(
            Map.entry("FAILED_LOGIN", new Classification(ThreatTypes.CREDENTIAL_ATTACK, Severity.MEDIUM)),
            Map.entry("LOGIN_FAILED", new Classification(ThreatTypes.CREDENTIAL_ATTACK, Severity.MEDIUM)),
            Map.entry("ACCOUNT_LOCKED", new Classification(ThreatTypes.BRUTE_FORCE_ADVANCED, Severity.HIGH)),
            Map.entry("UNAUTHORIZED_ACCESS", new Classification(ThreatTypes.PRIVILEGE_PROBING, Severity.HIGH)),
            Map.entry("PERMISSION_DENIED", new Classification(ThreatTypes.PRIVILEGE_PROBING, Severity.MEDIUM)),
            Map.entry("PERMISSION_CHANGE", new Classification(ThreatTypes.PRIVILEGE_ESCALATION, Severity.HIGH)),
            Map.entry("ROLE_CHANGE", new Classification(ThreatTypes.PRIVILEGE_ESCALATION, Severity.HIGH)),
            Map.entry("SECURITY_THREAT", new Classification(ThreatTypes.MALICIOUS_ACTIVITY, Severity.HIGH)),
            Map.entry("SUSPICIOUS_ACTIVITY", new Classification(ThreatTypes.UNUSUAL_ACTIVITY, Severity.MEDIUM)),
            Map.entry("EXPORT", new Classification(ThreatTypes.UNAUTHORIZED_EXPORT, Severity.MEDIUM)),
            Map.entry("DOWNLOAD", new Classification(ThreatTypes.DATA_EXFILTRATION, Severity.LOW)),
            Map.entry("CROSS_TENANT_ACCESS", new Classification(ThreatTypes.TENANT_ACCESS_VIOLATION, Severity.HIGH)),
            Map.entry("PROPERTY_ACCESS_DENIED", new Classification(ThreatTypes.TENANT_ACCESS_VIOLATION, Severity.MEDIUM)),
            Map.entry("SESSION_HIJACK", new Classification(ThreatTypes.SESSION_HIJACKING, Severity.HIGH)),
            Map.entry("SESSION_ANOMALY", new Classification(ThreatTypes.SESSION_HIJACKING, Severity.MEDIUM)));

    private static final Set<String> BENIGN = Set.of(
            "LOGIN", "LOGIN_SUCCESS", "LOGOUT", "SESSION", "VIEW", "LIST", "SEARCH",
            "ACCESS", "CREATE", "UPDATE", "DELETE");

    // Entries written by our own response handlers
    private static final String AUTOMATED_PREFIX = "AUTOMATED_";

    private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
            Map.entry("LOGIN", "User login"),
            Map.entry("LOGOUT", "User logout"),
            Map.entry("FAILED_LOGIN", "Failed login attempt"),
            Map.entry("UNAUTHORIZED_ACCESS", "Unauthorized access attempt"),
            Map.entry("PERMISSION_DENIED", "Permission denied"),
            Map.entry("PERMISSION_CHANGE", "Permission change"),
            Map.entry("EXPORT", "Data export"),
            Map.entry("DOWNLOAD", "File download"),
            Map.entry("ACCESS", "Resource access"),
            Map.entry("VIEW", "Resource view"),
            Map.entry("LIST", "Resource listing"),
            Map.entry("SEARCH", "Search operation"));

    private ActionCatalog() {
    }

    /**
     * @return the classification, or null when the action has no security relevance
     */
    public static Classification classify(String action) {
        if (action == null) {
            return null;
        }
        String normalized = normalize(action);
        if (BENIGN.contains(normalized) || normalized.startsWith(AUTOMATED_PREFIX)) {
            return null;
        }
        return CLASSIFICATIONS.getOrDefault(normalized, UNKNOWN);
    }

    /** Severity used on timelines: INFO for benign actions, LOW for unknown ones. */
    public static Severity severityOf(String action) {
        if (action == null) {
            return Severity.LOW;
        }
        Classification classification = classify(action);
        return classification != null ? classification.getSeverity() : Severity.INFO;
    }

    public static String describe(SecurityEvent event) {
        String action = event.getAction() != null ? event.getAction() : "UNKNOWN";
        StringBuilder sb = new StringBuilder(DESCRIPTIONS.getOrDefault(normalize(action), action));
        if (event.getActorId() != null) {
            sb.append(" by user ").append(event.getActorId());
        }
        if (event.getTenantId() != null) {
            sb.append(" on tenant ").append(event.getTenantId());
        }
        return sb.toString();
    }

    private static String normalize(String action) {
        return action.trim().toUpperCase(Locale.ROOT);
    }
}
