package com.vigilant.core.monitor;

public enum MonitorStatus {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    /** Startup failed. {@code start()} may be retried. */
    ERROR
}
