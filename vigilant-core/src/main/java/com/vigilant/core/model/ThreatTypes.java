package com.vigilant.core.model;

/**
 * Threat type identifiers. Response rules match on these strings, so they are
 * part of the configuration surface and must stay stable.
 */
public final class ThreatTypes {

    public static final String CREDENTIAL_ATTACK = "credential_attack";
    public static final String BRUTE_FORCE_ADVANCED = "brute_force_advanced";
    public static final String PRIVILEGE_PROBING = "privilege_probing";
    public static final String PRIVILEGE_ESCALATION = "privilege_escalation";
    public static final String UNAUTHORIZED_EXPORT = "unauthorized_export";
    public static final String DATA_EXFILTRATION = "financial_data_exfiltration";
    public static final String TENANT_ACCESS_VIOLATION = "tenant_access_violation";
    public static final String SESSION_HIJACKING = "session_hijacking";
    public static final String MALICIOUS_ACTIVITY = "malicious_activity";
    public static final String UNUSUAL_ACTIVITY = "unusual_activity";
    public static final String COORDINATED_ATTACK = "coordinated_attack";

    private ThreatTypes() {
    }
}
