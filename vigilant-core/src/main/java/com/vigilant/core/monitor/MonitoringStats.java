package com.vigilant.core.monitor;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time snapshot of the monitor's counters.
 */
public class MonitoringStats {

    private final MonitorStatus status;
    private final long eventsProcessed;
    private final long threatsDetected;
    private final long incidentsCreated;
    private final long autoResponsesTriggered;
    private final long autoResponsesSuppressed;
    private final long alertsSent;
    private final long alertsFailed;
    private final long tickFailures;
    private final long cursor;
    private final Instant startedAt;
    private final Instant lastCheck;
    private final long lastTickDurationMillis;
    private final Duration uptime;

    MonitoringStats(MonitorStatus status, long eventsProcessed, long threatsDetected, long incidentsCreated,
            long autoResponsesTriggered, long autoResponsesSuppressed, long alertsSent, long alertsFailed,
            long tickFailures, long cursor, Instant startedAt, Instant lastCheck, long lastTickDurationMillis,
            Duration uptime) {
        this.status = status;
        this.eventsProcessed = eventsProcessed;
        this.threatsDetected = threatsDetected;
        this.incidentsCreated = incidentsCreated;
        this.autoResponsesTriggered = autoResponsesTriggered;
        this.autoResponsesSuppressed = autoResponsesSuppressed;
        this.alertsSent = alertsSent;
        this.alertsFailed = alertsFailed;
        this.tickFailures = tickFailures;
        this.cursor = cursor;
        this.startedAt = startedAt;
        this.lastCheck = lastCheck;
        this.lastTickDurationMillis = lastTickDurationMillis;
        this.uptime = uptime;
    }

    public MonitorStatus getStatus() {
        return status;
    }

    public long getEventsProcessed() {
        return eventsProcessed;
    }

    public long getThreatsDetected() {
        return threatsDetected;
    }

    public long getIncidentsCreated() {
        return incidentsCreated;
    }

    public long getAutoResponsesTriggered() {
        return autoResponsesTriggered;
    }

    public long getAutoResponsesSuppressed() {
        return autoResponsesSuppressed;
    }

    public long getAlertsSent() {
        return alertsSent;
    }

    public long getAlertsFailed() {
        return alertsFailed;
    }

    public long getTickFailures() {
        return tickFailures;
    }

    public long getCursor() {
        return cursor;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getLastCheck() {
        return lastCheck;
    }

    public long getLastTickDurationMillis() {
        return lastTickDurationMillis;
    }

    public Duration getUptime() {
        return uptime;
    }

    @Override
    public String toString() {
        return "MonitoringStats{" + status
                + ", events=" + eventsProcessed
                + ", threats=" + threatsDetected
                + ", incidents=" + incidentsCreated
                + ", responses=" + autoResponsesTriggered + "/" + autoResponsesSuppressed + " suppressed"
                + ", cursor=" + cursor + '}';
    }
}
