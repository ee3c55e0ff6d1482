package com.vigilant.core.audit;

import java.util.List;

/**
 * Append-only trail of everything the response engine did.
 */
public interface ResponseAuditLog {

    String RESPONSE_EXECUTED = "AUTOMATED_RESPONSE_EXECUTED";
    String IP_BLOCK = "AUTOMATED_IP_BLOCK";
    String ACTOR_BLOCK = "AUTOMATED_ACTOR_BLOCK";
    String SESSION_BLOCK = "AUTOMATED_SESSION_BLOCK";
    String TENANT_ACCESS_BLOCK = "AUTOMATED_TENANT_ACCESS_BLOCK";
    String ACCOUNT_LOCK = "AUTOMATED_ACCOUNT_LOCK";
    String RESTRICTION = "AUTOMATED_RESTRICTION";
    String SECURITY_RESPONSE = "AUTOMATED_SECURITY_RESPONSE";

    void append(AuditEntry entry);

    /** Latest entries, oldest first. */
    List<AuditEntry> recent(int limit);
}
